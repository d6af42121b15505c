package org.janelia.saalfeldlab.usid.reshape;

import gnu.trove.set.hash.TLongHashSet;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.janelia.saalfeldlab.usid.selection.PosSpecIndices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether a selection of rows and columns of the main dataset can be reshaped into a rectangular
 * N-dimensional grid. Combinations are unique per axis group, so a selection is dense iff the number of selected
 * combinations equals the product of the number of remaining values per dimension, for both groups.
 */
public class DensityClassifier {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final DimensionRegistry registry;

	public DensityClassifier(final DimensionRegistry registry) {

		this.registry = registry;
	}

	public Density classify(final PosSpecIndices indices) {

		final Map<Dimension, long[]> remaining = new LinkedHashMap<>();
		boolean dense = true;
		for (final AxisGroup group : AxisGroup.values()) {
			final long[] combinations = indices.indices(group);
			long gridSize = 1;
			for (final Dimension dimension : registry.dimensions(group)) {
				final long[] values = distinctValues(dimension, combinations);
				remaining.put(dimension, values);
				gridSize = multiplySaturated(gridSize, values.length);
			}
			final boolean groupIsDense = gridSize == combinations.length;
			LOG.debug("{} selection of {} combinations spans a grid of {} cells: dense? {}", group, combinations.length, gridSize, groupIsDense);
			dense &= groupIsDense;
		}
		return new Density(dense, remaining);
	}

	private static long[] distinctValues(final Dimension dimension, final long[] combinations) {

		final TLongHashSet values = new TLongHashSet();
		for (final long combination : combinations)
			values.add(dimension.index(combination));
		final long[] sorted = values.toArray();
		Arrays.sort(sorted);
		return sorted;
	}

	private static long multiplySaturated(final long a, final long b) {

		final long product = a * b;
		return b != 0 && product / b != a ? Long.MAX_VALUE : product;
	}
}
