package org.janelia.saalfeldlab.usid.dimension;

import java.util.Arrays;

/**
 * A named dimension of a USID dataset together with its index and value entries for every combination along its
 * {@link AxisGroup}.
 */
public class Dimension {

	private final String name;

	private final AxisGroup group;

	private final int offset;

	private final String units;

	private final long[] indices;

	private final double[] values;

	private final long size;

	private final long changeCount;

	/**
	 * @param name    unique dimension name
	 * @param group   axis group the dimension belongs to
	 * @param offset  column (position) or row (spectroscopic) of this dimension in the ancillary tables
	 * @param units   physical units, may be {@code null}
	 * @param indices grid index of this dimension for each combination in store order
	 * @param values  physical value of this dimension for each combination in store order
	 */
	public Dimension(
			final String name,
			final AxisGroup group,
			final int offset,
			final String units,
			final long[] indices,
			final double[] values) {

		assert indices.length == values.length;
		this.name = name;
		this.group = group;
		this.offset = offset;
		this.units = units;
		this.indices = indices;
		this.values = values;
		this.size = Arrays.stream(indices).max().orElse(-1) + 1;
		this.changeCount = countChanges(indices);
	}

	public String getName() {

		return name;
	}

	public AxisGroup getGroup() {

		return group;
	}

	public int getOffset() {

		return offset;
	}

	public String getUnits() {

		return units;
	}

	/**
	 * @return number of distinct grid indices, i.e. {@code max(index) + 1}
	 */
	public long getSize() {

		return size;
	}

	/**
	 * @return number of adjacent combinations in store order at which the index of this dimension changes.
	 */
	public long getChangeCount() {

		return changeCount;
	}

	public int numCombinations() {

		return indices.length;
	}

	public long index(final long combination) {

		return indices[(int)combination];
	}

	public double value(final long combination) {

		return values[(int)combination];
	}

	public long[] getIndices() {

		return indices.clone();
	}

	public double[] getValues() {

		return values.clone();
	}

	/**
	 * @return physical value for each grid index {@code 0 .. size - 1}, taken from the first combination that has
	 * that index.
	 */
	public double[] getUnitValues() {

		final double[] unitValues = new double[(int)size];
		final boolean[] seen = new boolean[(int)size];
		for (int i = 0; i < indices.length; ++i) {
			final int index = (int)indices[i];
			if (!seen[index]) {
				seen[index] = true;
				unitValues[index] = values[i];
			}
		}
		return unitValues;
	}

	@Override
	public String toString() {

		return String.format("%s - size: %d", name, size);
	}

	private static long countChanges(final long[] indices) {

		long count = 0;
		for (int i = 1; i < indices.length; ++i)
			if (indices[i] != indices[i - 1])
				++count;
		return count;
	}
}
