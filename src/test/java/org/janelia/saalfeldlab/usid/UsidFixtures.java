package org.janelia.saalfeldlab.usid;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.LongType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.janelia.saalfeldlab.usid.n5.UsidN5Helpers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Writes small USID datasets into N5 containers. The main dataset holds {@code 1000 * row + column} so every value
 * identifies its store position.
 * <p>
 * The reference dataset has position dimensions {@code X} (5, changes fastest) and {@code Y} (3), and spectroscopic
 * dimensions {@code Bias} (7, changes fastest) and {@code Cycle} (2).
 */
public class UsidFixtures {

	public static final String MAIN = "Measurement_000/Channel_000/Raw_Data";

	public static final String[] POSITION_LABELS = {"X", "Y"};

	public static final String[] SPECTROSCOPIC_LABELS = {"Bias", "Cycle"};

	public static final long[] POSITION_SIZES = {5, 3};

	public static final long[] SPECTROSCOPIC_SIZES = {7, 2};

	public static final int[] BLOCK_SIZE = {4, 4};

	private UsidFixtures() {

	}

	public static double mainValue(final long row, final long column) {

		return 1000.0 * row + column;
	}

	/**
	 * Physical value stored for index {@code index} of the dimension in table row/column {@code d}.
	 */
	public static double physicalValue(final int d, final long index) {

		return 2.5 * index + d;
	}

	/**
	 * @param sizes        size of each dimension
	 * @param fastestFirst dimensions ordered from fastest to slowest changing
	 * @return {@code combinations[k][d]}: index of dimension {@code d} in combination {@code k}
	 */
	public static long[][] grid(final long[] sizes, final int... fastestFirst) {

		final int numCombinations = (int)Intervals.numElements(sizes);
		final long[][] combinations = new long[numCombinations][sizes.length];
		for (int k = 0; k < numCombinations; ++k) {
			long remainder = k;
			for (final int d : fastestFirst) {
				combinations[k][d] = remainder % sizes[d];
				remainder /= sizes[d];
			}
		}
		return combinations;
	}

	public static long[][] referencePositions() {

		return grid(POSITION_SIZES, 0, 1);
	}

	public static long[][] referenceSpectroscopic() {

		return grid(SPECTROSCOPIC_SIZES, 0, 1);
	}

	public static void writeReference(final N5Writer n5) throws IOException {

		write(n5, MAIN, POSITION_LABELS, referencePositions(), SPECTROSCOPIC_LABELS, referenceSpectroscopic());
	}

	/**
	 * Reference dimensions, but position combinations are enumerated with {@code Y} changing fastest.
	 */
	public static void writeReordered(final N5Writer n5) throws IOException {

		write(n5, MAIN, POSITION_LABELS, grid(POSITION_SIZES, 1, 0), SPECTROSCOPIC_LABELS, referenceSpectroscopic());
	}

	/**
	 * Reference dimensions without the last position combination.
	 */
	public static void writeSparse(final N5Writer n5) throws IOException {

		final long[][] positions = referencePositions();
		write(n5, MAIN, POSITION_LABELS, Arrays.copyOf(positions, positions.length - 1), SPECTROSCOPIC_LABELS, referenceSpectroscopic());
	}

	public static void write(
			final N5Writer n5,
			final String main,
			final String[] positionLabels,
			final long[][] positions,
			final String[] spectroscopicLabels,
			final long[][] spectroscopic) throws IOException {

		writeMain(n5, main, positions.length, spectroscopic.length);
		final String parent = UsidN5Helpers.parent(main);
		writeTables(n5, parent, AxisGroup.POSITION, positionLabels, positions);
		writeTables(n5, parent, AxisGroup.SPECTROSCOPIC, spectroscopicLabels, spectroscopic);
	}

	public static void writeMain(final N5Writer n5, final String main, final long numPositions, final long numSpectroscopic) throws IOException {

		final ArrayImg<DoubleType, DoubleArray> data = ArrayImgs.doubles(numPositions, numSpectroscopic);
		final long[] position = new long[2];
		final Cursor<DoubleType> cursor = data.localizingCursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.localize(position);
			cursor.get().set(mainValue(position[0], position[1]));
		}
		N5Utils.save(data, n5, main, BLOCK_SIZE, new GzipCompression());
		n5.setAttribute(main, UsidN5Helpers.QUANTITY_KEY, "Amplitude");
		n5.setAttribute(main, UsidN5Helpers.UNITS_KEY, "a.u.");
	}

	/**
	 * Write index and value table of {@code group} into {@code parent}.
	 */
	public static void writeTables(
			final N5Writer n5,
			final String parent,
			final AxisGroup group,
			final String[] labels,
			final long[][] combinations) throws IOException {

		final String prefix = parent.isEmpty() ? "" : parent + "/";
		writeTables(n5, prefix + group.indicesDataset(), prefix + group.valuesDataset(), group, labels, combinations);
	}

	public static void writeTables(
			final N5Writer n5,
			final String indicesDataset,
			final String valuesDataset,
			final AxisGroup group,
			final String[] labels,
			final long[][] combinations) throws IOException {

		final int numDimensions = combinations.length == 0 ? labels.length : combinations[0].length;
		final long[] shape = tableShape(group, combinations.length, numDimensions);
		final ArrayImg<LongType, LongArray> indices = ArrayImgs.longs(shape);
		final ArrayImg<DoubleType, DoubleArray> values = ArrayImgs.doubles(shape);
		final RandomAccess<LongType> indexAccess = indices.randomAccess();
		final RandomAccess<DoubleType> valueAccess = values.randomAccess();
		final int combinationAxis = group.mainAxis();
		final int dimensionAxis = group.dimensionAxis();
		for (int k = 0; k < combinations.length; ++k)
			for (int d = 0; d < numDimensions; ++d) {
				indexAccess.setPosition(k, combinationAxis);
				indexAccess.setPosition(d, dimensionAxis);
				indexAccess.get().set(combinations[k][d]);
				valueAccess.setPosition(indexAccess);
				valueAccess.get().set(physicalValue(d, combinations[k][d]));
			}
		N5Utils.save(indices, n5, indicesDataset, BLOCK_SIZE, new GzipCompression());
		N5Utils.save(values, n5, valuesDataset, BLOCK_SIZE, new GzipCompression());
		n5.setAttribute(indicesDataset, UsidN5Helpers.LABELS_KEY, labels);
		n5.setAttribute(valuesDataset, UsidN5Helpers.LABELS_KEY, labels);
		final String[] units = new String[labels.length];
		Arrays.fill(units, group == AxisGroup.POSITION ? "um" : "V");
		n5.setAttribute(indicesDataset, UsidN5Helpers.UNITS_KEY, units);
	}

	public static long[] tableShape(final AxisGroup group, final long numCombinations, final long numDimensions) {

		final long[] shape = new long[2];
		shape[group.mainAxis()] = numCombinations;
		shape[group.dimensionAxis()] = numDimensions;
		return shape;
	}

	/**
	 * In-memory registry of the reference dataset, no container involved.
	 */
	public static DimensionRegistry referenceRegistry() {

		return new DimensionRegistry(
				dimensions(AxisGroup.POSITION, POSITION_LABELS, referencePositions()),
				dimensions(AxisGroup.SPECTROSCOPIC, SPECTROSCOPIC_LABELS, referenceSpectroscopic()));
	}

	public static List<Dimension> dimensions(final AxisGroup group, final String[] labels, final long[][] combinations) {

		final List<Dimension> dimensions = new ArrayList<>();
		for (int d = 0; d < labels.length; ++d) {
			final long[] indices = new long[combinations.length];
			final double[] values = new double[combinations.length];
			for (int k = 0; k < combinations.length; ++k) {
				indices[k] = combinations[k][d];
				values[k] = physicalValue(d, indices[k]);
			}
			dimensions.add(new Dimension(labels[d], group, d, null, indices, values));
		}
		return dimensions;
	}

	/**
	 * @return values of {@code data} with the first axis running fastest
	 */
	public static <T extends RealType<T>> double[] flatValues(final RandomAccessibleInterval<T> data) {

		final double[] values = new double[(int)Intervals.numElements(data)];
		int i = 0;
		for (final T t : Views.flatIterable(data))
			values[i++] = t.getRealDouble();
		return values;
	}

	public static <T extends RealType<T>> double valueAt(final RandomAccessibleInterval<T> data, final long... position) {

		final RandomAccess<T> access = data.randomAccess();
		access.setPosition(position);
		return access.get().getRealDouble();
	}
}
