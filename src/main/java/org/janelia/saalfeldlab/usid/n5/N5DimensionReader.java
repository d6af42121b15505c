package org.janelia.saalfeldlab.usid.n5;

import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.exception.InconsistentUsidSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Reads the {@link Dimension}s of one {@link AxisGroup} from the ancillary index and value tables of a main dataset
 * and checks that the tables describe a valid grid.
 */
public class N5DimensionReader {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	/**
	 * Attribute keys that cannot name the table offset of a dimension.
	 */
	private static final Set<String> RESERVED_KEYS = Set.of(
			UsidN5Helpers.LABELS_KEY,
			UsidN5Helpers.UNITS_KEY,
			"dimensions",
			"blockSize",
			"dataType",
			"compression");

	private final N5Reader n5;

	private final String mainDataset;

	public N5DimensionReader(final N5Reader n5, final String mainDataset) {

		this.n5 = n5;
		this.mainDataset = mainDataset;
	}

	/**
	 * @param group           axis group to read
	 * @param numCombinations length of the main dataset along {@link AxisGroup#mainAxis()} of {@code group}
	 * @return dimensions of {@code group} in the order of the {@code labels} attribute
	 * @throws IOException            if any N5 operation throws {@link IOException}
	 * @throws InconsistentUsidSchema if the ancillary tables are missing or do not describe a valid grid
	 */
	public List<Dimension> readDimensions(final AxisGroup group, final long numCombinations) throws IOException, InconsistentUsidSchema {

		final String indicesDataset = UsidN5Helpers.indicesDataset(n5, mainDataset, group);
		final String valuesDataset = UsidN5Helpers.valuesDataset(n5, mainDataset, group);
		final DatasetAttributes indicesAttributes = requireTable(indicesDataset);
		final DatasetAttributes valuesAttributes = requireTable(valuesDataset);

		if (!N5Types.isIntegerType(indicesAttributes.getDataType()))
			throw inconsistent(String.format("%s must have an integer data type but has %s", indicesDataset, indicesAttributes.getDataType()));
		if (!N5Types.isRealType(valuesAttributes.getDataType()))
			throw inconsistent(String.format("%s must have a numeric data type but has %s", valuesDataset, valuesAttributes.getDataType()));

		final long[] shape = indicesAttributes.getDimensions();
		final int combinationAxis = group.mainAxis();
		if (shape[combinationAxis] != numCombinations)
			throw inconsistent(String.format(
					"%s has %d combinations but %s has %d along axis %d",
					indicesDataset, shape[combinationAxis], mainDataset, numCombinations, combinationAxis));
		if (!Arrays.equals(shape, valuesAttributes.getDimensions()))
			throw inconsistent(String.format(
					"%s has shape %s but %s has shape %s",
					valuesDataset, Arrays.toString(valuesAttributes.getDimensions()), indicesDataset, Arrays.toString(shape)));

		final int numTableDimensions = (int)shape[group.dimensionAxis()];
		final String[] labels = n5.getAttribute(indicesDataset, UsidN5Helpers.LABELS_KEY, String[].class);
		if (labels == null)
			throw inconsistent(String.format("%s has no %s attribute", indicesDataset, UsidN5Helpers.LABELS_KEY));
		if (labels.length != numTableDimensions)
			throw inconsistent(String.format("%s has %d labels for %d dimensions", indicesDataset, labels.length, numTableDimensions));
		if (labels.length == 0)
			throw inconsistent(String.format("%s has no dimensions", indicesDataset));
		final String[] units = n5.getAttribute(indicesDataset, UsidN5Helpers.UNITS_KEY, String[].class);
		if (units != null && units.length != labels.length)
			throw inconsistent(String.format("%s has %d units for %d labels", indicesDataset, units.length, labels.length));

		final double[][] indexTable = UsidN5Helpers.readTable(n5, indicesDataset, group.dimensionAxis());
		final double[][] valueTable = UsidN5Helpers.readTable(n5, valuesDataset, group.dimensionAxis());

		final List<Dimension> dimensions = new ArrayList<>();
		for (int d = 0; d < labels.length; ++d) {
			final String name = labels[d];
			if (name == null || name.isBlank())
				throw inconsistent(String.format("%s has an empty label at position %d", indicesDataset, d));
			final int offset = offset(indicesDataset, name, d);
			if (offset < 0 || offset >= numTableDimensions)
				throw inconsistent(String.format("Dimension %s refers to %d but %s has %d dimensions", name, offset, indicesDataset, numTableDimensions));
			final long[] indices = toIndices(name, indexTable[offset]);
			final Dimension dimension = new Dimension(name, group, offset, units == null ? null : units[d], indices, valueTable[offset]);
			LOG.debug("Read {} dimension {} (change count {})", group, dimension, dimension.getChangeCount());
			dimensions.add(dimension);
		}
		checkUniqueCombinations(group, dimensions);
		return dimensions;
	}

	private DatasetAttributes requireTable(final String dataset) throws IOException, InconsistentUsidSchema {

		if (!n5.datasetExists(dataset))
			throw inconsistent(String.format("Ancillary dataset %s does not exist", dataset));
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		if (attributes.getNumDimensions() != 2)
			throw inconsistent(String.format("Ancillary dataset %s must be two dimensional but has %d dimensions", dataset, attributes.getNumDimensions()));
		return attributes;
	}

	private int offset(final String indicesDataset, final String name, final int position) throws IOException {

		if (RESERVED_KEYS.contains(name))
			return position;
		final Integer offset = n5.getAttribute(indicesDataset, name, Integer.class);
		return offset == null ? position : offset;
	}

	private long[] toIndices(final String name, final double[] column) throws InconsistentUsidSchema {

		final long[] indices = new long[column.length];
		for (int i = 0; i < column.length; ++i) {
			final double value = column[i];
			if (value < 0 || value != Math.rint(value))
				throw inconsistent(String.format("Dimension %s has invalid index %s at combination %d", name, value, i));
			indices[i] = (long)value;
		}
		final long size = Arrays.stream(indices).max().orElse(-1) + 1;
		final long numDistinct = Arrays.stream(indices).distinct().count();
		if (numDistinct != size)
			throw inconsistent(String.format("Dimension %s uses %d distinct indices but its maximum index is %d", name, numDistinct, size - 1));
		return indices;
	}

	private void checkUniqueCombinations(final AxisGroup group, final List<Dimension> dimensions) throws InconsistentUsidSchema {

		final int numCombinations = dimensions.get(0).numCombinations();
		final Comparator<Integer> lexicographic = (a, b) -> {
			for (final Dimension dimension : dimensions) {
				final int comparison = Long.compare(dimension.index(a), dimension.index(b));
				if (comparison != 0)
					return comparison;
			}
			return 0;
		};
		final Integer[] sorted = IntStream.range(0, numCombinations).boxed().toArray(Integer[]::new);
		Arrays.sort(sorted, lexicographic);
		for (int i = 1; i < sorted.length; ++i)
			if (lexicographic.compare(sorted[i - 1], sorted[i]) == 0)
				throw inconsistent(String.format("%s combinations %d and %d are identical", group, sorted[i - 1], sorted[i]));
	}

	private InconsistentUsidSchema inconsistent(final String message) {

		return new InconsistentUsidSchema(mainDataset, message);
	}
}
