package org.janelia.saalfeldlab.usid.reshape;

import net.imglib2.AbstractInterval;
import net.imglib2.Interval;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;

import java.util.List;

/**
 * Read-only view of the two dimensional main dataset in which every axis is an axis of the position or the
 * spectroscopic {@link AxisMapping}. Axes of the mappings that are not exposed by the view stay at grid position 0.
 * No data is read until {@link RandomAccess#get()} is called.
 *
 * @param <T> pixel type of the main dataset
 */
public class IndexMappedRandomAccessibleInterval<T> extends AbstractInterval implements RandomAccessibleInterval<T> {

	private final RandomAccessibleInterval<T> source;

	private final AxisMapping positions;

	private final AxisMapping spectroscopic;

	private final AxisGroup[] axisGroups;

	private final int[] mappingAxes;

	private final List<String> axisLabels;

	/**
	 * @param source        main dataset, position combinations along dimension 0, spectroscopic along dimension 1
	 * @param positions     grid of position combinations
	 * @param spectroscopic grid of spectroscopic combinations
	 * @param axisGroups    group of each axis of this view
	 * @param mappingAxes   axis of the group's mapping exposed as each axis of this view
	 * @param axisLabels    name of each axis of this view
	 */
	public IndexMappedRandomAccessibleInterval(
			final RandomAccessibleInterval<T> source,
			final AxisMapping positions,
			final AxisMapping spectroscopic,
			final AxisGroup[] axisGroups,
			final int[] mappingAxes,
			final List<String> axisLabels) {

		super(dimensions(positions, spectroscopic, axisGroups, mappingAxes));
		this.source = source;
		this.positions = positions;
		this.spectroscopic = spectroscopic;
		this.axisGroups = axisGroups.clone();
		this.mappingAxes = mappingAxes.clone();
		this.axisLabels = List.copyOf(axisLabels);
	}

	private static long[] dimensions(
			final AxisMapping positions,
			final AxisMapping spectroscopic,
			final AxisGroup[] axisGroups,
			final int[] mappingAxes) {

		final long[] dimensions = new long[axisGroups.length];
		for (int d = 0; d < dimensions.length; ++d)
			dimensions[d] = (axisGroups[d] == AxisGroup.POSITION ? positions : spectroscopic).dimension(mappingAxes[d]);
		return dimensions;
	}

	public List<String> getAxisLabels() {

		return axisLabels;
	}

	public RandomAccessibleInterval<T> getSource() {

		return source;
	}

	@Override
	public MappedRandomAccess randomAccess() {

		return new MappedRandomAccess();
	}

	@Override
	public MappedRandomAccess randomAccess(final Interval interval) {

		return randomAccess();
	}

	public class MappedRandomAccess extends Point implements RandomAccess<T> {

		private final RandomAccess<T> sourceAccess;

		private final long[] positionGrid = new long[positions.numDimensions()];

		private final long[] spectroscopicGrid = new long[spectroscopic.numDimensions()];

		private MappedRandomAccess() {

			super(IndexMappedRandomAccessibleInterval.this.numDimensions());
			this.sourceAccess = source.randomAccess();
		}

		private MappedRandomAccess(final MappedRandomAccess other) {

			this();
			setPosition(other);
		}

		@Override
		public T get() {

			for (int d = 0; d < n; ++d) {
				if (axisGroups[d] == AxisGroup.POSITION)
					positionGrid[mappingAxes[d]] = position[d];
				else
					spectroscopicGrid[mappingAxes[d]] = position[d];
			}
			sourceAccess.setPosition(positions.combination(positionGrid), 0);
			sourceAccess.setPosition(spectroscopic.combination(spectroscopicGrid), 1);
			return sourceAccess.get();
		}

		@Override
		public MappedRandomAccess copy() {

			return copyRandomAccess();
		}

		@Override
		public MappedRandomAccess copyRandomAccess() {

			return new MappedRandomAccess(this);
		}
	}
}
