package org.janelia.saalfeldlab.usid.reshape;

import net.imglib2.util.IntervalIndexer;
import net.imglib2.util.Intervals;
import org.janelia.saalfeldlab.usid.dimension.Dimension;

import java.util.Arrays;
import java.util.List;

/**
 * Maps grid positions of one axis group onto combination indices (rows or columns) of the main dataset.
 * Grid positions are linearized with the first grid axis running fastest.
 */
public class AxisMapping {

	private final long[] dimensions;

	private final long[] combinations;

	private AxisMapping(final long[] dimensions, final long[] combinations) {

		assert Intervals.numElements(dimensions) == combinations.length;
		this.dimensions = dimensions;
		this.combinations = combinations;
	}

	/**
	 * Single grid axis that lists {@code combinations} in the given order.
	 */
	public static AxisMapping flat(final long[] combinations) {

		return new AxisMapping(new long[]{combinations.length}, combinations.clone());
	}

	/**
	 * One grid axis per entry of {@code dimensions}. The grid coordinate of a combination along a dimension is the
	 * rank of its index value among the remaining values of that dimension.
	 *
	 * @param combinations dense selection of combinations
	 * @param dimensions   dimensions of one axis group in grid axis order
	 * @param density      dense classification of the selection
	 */
	public static AxisMapping grid(final long[] combinations, final List<Dimension> dimensions, final Density density) {

		if (!density.isDense())
			throw new IllegalArgumentException("Cannot map a sparse selection onto a grid.");

		final long[] gridDimensions = dimensions.stream().mapToLong(density::remainingSize).toArray();
		final long[][] remaining = dimensions.stream().map(density::remainingValues).toArray(long[][]::new);
		final long[] mapping = new long[combinations.length];
		Arrays.fill(mapping, -1);

		final long[] position = new long[gridDimensions.length];
		for (final long combination : combinations) {
			for (int d = 0; d < position.length; ++d)
				position[d] = Arrays.binarySearch(remaining[d], dimensions.get(d).index(combination));
			final int linearIndex = (int)IntervalIndexer.positionToIndex(position, gridDimensions);
			if (mapping[linearIndex] != -1)
				throw new IllegalStateException(String.format("Combinations %d and %d share grid position %s", mapping[linearIndex], combination, Arrays.toString(position)));
			mapping[linearIndex] = combination;
		}
		return new AxisMapping(gridDimensions, mapping);
	}

	public int numDimensions() {

		return dimensions.length;
	}

	public long dimension(final int d) {

		return dimensions[d];
	}

	public long combination(final long[] position) {

		return combinations[(int)IntervalIndexer.positionToIndex(position, dimensions)];
	}
}
