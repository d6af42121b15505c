package org.janelia.saalfeldlab.usid.reshape;

import net.imglib2.RandomAccessibleInterval;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionOrder;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.janelia.saalfeldlab.usid.selection.PosSpecIndices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds flat and N-dimensional views of selections of the main dataset.
 * <p>
 * The N-dimensional form has one axis per dimension: position dimensions first, then spectroscopic dimensions,
 * each group in the requested {@link DimensionOrder}. The flat form has two axes, the selected rows and the
 * selected columns, in store order.
 */
public class ReshapeEngine {

	public static final String FLAT_POSITION_LABEL = "Positions";

	public static final String FLAT_SPECTROSCOPIC_LABEL = "Spectroscopic";

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final DimensionRegistry registry;

	public ReshapeEngine(final DimensionRegistry registry) {

		this.registry = registry;
	}

	public <T> IndexMappedRandomAccessibleInterval<T> flat(final RandomAccessibleInterval<T> main, final PosSpecIndices indices) {

		return new IndexMappedRandomAccessibleInterval<>(
				main,
				AxisMapping.flat(indices.getPositionIndices()),
				AxisMapping.flat(indices.getSpectroscopicIndices()),
				new AxisGroup[]{AxisGroup.POSITION, AxisGroup.SPECTROSCOPIC},
				new int[]{0, 0},
				List.of(FLAT_POSITION_LABEL, FLAT_SPECTROSCOPIC_LABEL));
	}

	/**
	 * @param main    main dataset
	 * @param indices selected rows and columns
	 * @param density classification of {@code indices}, must be dense
	 * @param order   order of dimensions within each axis group
	 * @param squeeze drop axes of length 1; if all axes have length 1, a single axis remains
	 * @throws IllegalArgumentException if {@code density} is not dense
	 */
	public <T> IndexMappedRandomAccessibleInterval<T> nDim(
			final RandomAccessibleInterval<T> main,
			final PosSpecIndices indices,
			final Density density,
			final DimensionOrder order,
			final boolean squeeze) {

		if (!density.isDense())
			throw new IllegalArgumentException("Selection is not dense and cannot be reshaped: " + indices);

		final List<Dimension> positionDimensions = registry.dimensions(AxisGroup.POSITION, order);
		final List<Dimension> spectroscopicDimensions = registry.dimensions(AxisGroup.SPECTROSCOPIC, order);
		final AxisMapping positions = AxisMapping.grid(indices.getPositionIndices(), positionDimensions, density);
		final AxisMapping spectroscopic = AxisMapping.grid(indices.getSpectroscopicIndices(), spectroscopicDimensions, density);

		final List<AxisGroup> axisGroups = new ArrayList<>();
		final List<Integer> mappingAxes = new ArrayList<>();
		final List<String> labels = new ArrayList<>();
		addAxes(AxisGroup.POSITION, positionDimensions, positions, squeeze, axisGroups, mappingAxes, labels);
		addAxes(AxisGroup.SPECTROSCOPIC, spectroscopicDimensions, spectroscopic, squeeze, axisGroups, mappingAxes, labels);

		if (axisGroups.isEmpty()) {
			final AxisGroup group = positionDimensions.isEmpty() ? AxisGroup.SPECTROSCOPIC : AxisGroup.POSITION;
			final List<Dimension> dimensions = group == AxisGroup.POSITION ? positionDimensions : spectroscopicDimensions;
			axisGroups.add(group);
			mappingAxes.add(0);
			labels.add(dimensions.get(0).getName());
		}

		LOG.debug("Reshaped selection to axes {} in {} order", labels, order);
		return new IndexMappedRandomAccessibleInterval<>(
				main,
				positions,
				spectroscopic,
				axisGroups.toArray(AxisGroup[]::new),
				mappingAxes.stream().mapToInt(Integer::intValue).toArray(),
				labels);
	}

	private static void addAxes(
			final AxisGroup group,
			final List<Dimension> dimensions,
			final AxisMapping mapping,
			final boolean squeeze,
			final List<AxisGroup> axisGroups,
			final List<Integer> mappingAxes,
			final List<String> labels) {

		for (int d = 0; d < dimensions.size(); ++d) {
			if (squeeze && mapping.dimension(d) == 1)
				continue;
			axisGroups.add(group);
			mappingAxes.add(d);
			labels.add(dimensions.get(d).getName());
		}
	}

	/**
	 * @return shape of the N-dimensional form of the whole dataset in {@code order}, without squeezing
	 */
	public long[] nDimShape(final DimensionOrder order) {

		final long[] positionSizes = registry.sizes(AxisGroup.POSITION, order);
		final long[] spectroscopicSizes = registry.sizes(AxisGroup.SPECTROSCOPIC, order);
		final long[] shape = Arrays.copyOf(positionSizes, positionSizes.length + spectroscopicSizes.length);
		System.arraycopy(spectroscopicSizes, 0, shape, positionSizes.length, spectroscopicSizes.length);
		return shape;
	}
}
