package org.janelia.saalfeldlab.usid.reshape;

import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionOrder;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;

import java.util.Map;

/**
 * Outcome of {@link DensityClassifier#classify}: whether a selection forms a complete grid over the index values
 * that remain per dimension, and what those values are.
 */
public class Density {

	private final boolean dense;

	private final Map<Dimension, long[]> remainingValues;

	Density(final boolean dense, final Map<Dimension, long[]> remainingValues) {

		this.dense = dense;
		this.remainingValues = remainingValues;
	}

	public boolean isDense() {

		return dense;
	}

	/**
	 * @return ascending index values of {@code dimension} that occur in the selection
	 */
	public long[] remainingValues(final Dimension dimension) {

		return remainingValues.get(dimension).clone();
	}

	public int remainingSize(final Dimension dimension) {

		return remainingValues.get(dimension).length;
	}

	/**
	 * @return number of remaining values per dimension of {@code group}, in {@code order}
	 */
	public long[] shape(final DimensionRegistry registry, final AxisGroup group, final DimensionOrder order) {

		return registry.dimensions(group, order).stream().mapToLong(this::remainingSize).toArray();
	}
}
