package org.janelia.saalfeldlab.usid.n5;

import net.imglib2.img.cell.CellGrid;
import net.imglib2.util.Intervals;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.util.Grids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.Optional;

public class UsidN5Helpers {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public static final String QUANTITY_KEY = "quantity";

	public static final String UNITS_KEY = "units";

	public static final String LABELS_KEY = "labels";

	private UsidN5Helpers() {

	}

	/**
	 * @return {@code path} without leading, trailing and repeated {@code "/"}
	 */
	public static String normalize(final String path) {

		return String.join("/", path.replaceAll("/+", "/").replaceAll("^/|/$", "").split("/"));
	}

	/**
	 * @return parent group of {@code dataset}, {@code ""} for the root group
	 */
	public static String parent(final String dataset) {

		final String normalized = normalize(dataset);
		final int index = normalized.lastIndexOf('/');
		return index < 0 ? "" : normalized.substring(0, index);
	}

	/**
	 * Resolve {@code reference} as referenced from {@code dataset}: absolute if it starts with {@code "/"}, relative to
	 * the parent group of {@code dataset} otherwise.
	 */
	public static String resolveReference(final String dataset, final String reference) {

		if (reference.startsWith("/"))
			return normalize(reference);
		final String parent = parent(dataset);
		return normalize(parent.isEmpty() ? reference : parent + "/" + reference);
	}

	/**
	 * Look up the ancillary dataset named {@code key} for {@code mainDataset}. The attribute {@code key} of
	 * {@code mainDataset} holds the reference; without that attribute the ancillary dataset is expected to be a
	 * sibling of {@code mainDataset} called {@code key}.
	 *
	 * @throws IOException if any N5 operation throws {@link IOException}
	 */
	public static String ancillaryDataset(final N5Reader n5, final String mainDataset, final String key) throws IOException {

		final String reference = Optional.ofNullable(n5.getAttribute(mainDataset, key, String.class)).orElse(key);
		final String resolved = resolveReference(mainDataset, reference);
		LOG.debug("Ancillary dataset {} of {} resolved to {}", key, mainDataset, resolved);
		return resolved;
	}

	public static String indicesDataset(final N5Reader n5, final String mainDataset, final AxisGroup group) throws IOException {

		return ancillaryDataset(n5, mainDataset, group.indicesDataset());
	}

	public static String valuesDataset(final N5Reader n5, final String mainDataset, final AxisGroup group) throws IOException {

		return ancillaryDataset(n5, mainDataset, group.valuesDataset());
	}

	/**
	 * Read a two dimensional dataset into memory, grouped along {@code dimensionAxis}: {@code table[i][k]} holds the
	 * value at grid position {@code i} along {@code dimensionAxis} and {@code k} along the other axis. Blocks that do
	 * not exist are filled with 0.
	 *
	 * @throws IOException              if any N5 operation throws {@link IOException}
	 * @throws IllegalArgumentException if {@code dataset} is not two dimensional or not a real type
	 */
	public static double[][] readTable(final N5Reader n5, final String dataset, final int dimensionAxis) throws IOException {

		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		final long[] dimensions = attributes.getDimensions();
		if (dimensions.length != 2)
			throw new IllegalArgumentException(String.format("Expected two dimensional dataset %s but got %d dimensions", dataset, dimensions.length));
		final int otherAxis = 1 - dimensionAxis;

		final double[][] table = new double[(int)dimensions[dimensionAxis]][(int)dimensions[otherAxis]];
		final CellGrid grid = new CellGrid(dimensions, attributes.getBlockSize());
		final long numBlocks = Intervals.numElements(grid.getGridDimensions());
		final long[] gridPosition = new long[2];
		final long[] min = new long[2];
		final long[] max = new long[2];
		for (long blockIndex = 0; blockIndex < numBlocks; ++blockIndex) {
			Grids.linearIndexToCellPositionMinMax(grid, blockIndex, gridPosition, min, max);
			final DataBlock<?> block = n5.readBlock(dataset, attributes, gridPosition);
			if (block == null)
				continue;
			final double[] data = N5Types.asDoubles(block.getData(), attributes.getDataType());
			// stored blocks may be larger than the cell at the border of the dataset
			final int stride = block.getSize()[0];
			for (long y = min[1]; y <= max[1]; ++y)
				for (long x = min[0]; x <= max[0]; ++x) {
					final double value = data[(int)((y - min[1]) * stride + (x - min[0]))];
					final long[] position = {x, y};
					table[(int)position[dimensionAxis]][(int)position[otherAxis]] = value;
				}
		}
		return table;
	}
}
