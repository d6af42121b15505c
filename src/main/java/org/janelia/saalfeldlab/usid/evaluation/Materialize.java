package org.janelia.saalfeldlab.usid.evaluation;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.img.cell.CellGrid;
import net.imglib2.type.NativeType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.janelia.saalfeldlab.usid.util.Grids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Copies a (lazy) {@link RandomAccessibleInterval} into an {@link ArrayImg}, block by block.
 */
public class Materialize {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private Materialize() {

	}

	/**
	 * @param source     zero-min interval to be copied
	 * @param executor   copies blocks in parallel if not {@code null}, otherwise blocks are copied on the calling thread
	 * @param blockEdge  edge length of the copied blocks
	 * @throws EvaluationFailed if copying any block fails or the calling thread is interrupted
	 */
	public static <T extends NativeType<T>> ArrayImg<T, ?> copy(
			final RandomAccessibleInterval<T> source,
			final ExecutorService executor,
			final int blockEdge) {

		final T type = source.randomAccess().get().createVariable();
		final ArrayImg<T, ?> target = new ArrayImgFactory<>(type).create(source);

		final CellGrid grid = new CellGrid(
				Intervals.dimensionsAsLongArray(source),
				Grids.uniformBlockSize(source.numDimensions(), blockEdge));
		final List<Interval> blocks = Grids.collectAllCells(grid);
		LOG.debug("Copying {} values in {} blocks ({})", Intervals.numElements(source), blocks.size(), executor == null ? "sequential" : "parallel");

		if (executor == null) {
			blocks.forEach(block -> copyBlock(source, target, block));
			return target;
		}

		final List<Callable<Void>> tasks = blocks
				.stream()
				.map(block -> (Callable<Void>)() -> {
					copyBlock(source, target, block);
					return null;
				})
				.collect(Collectors.toList());
		try {
			for (final Future<Void> future : executor.invokeAll(tasks))
				future.get();
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EvaluationFailed(e);
		} catch (final ExecutionException e) {
			throw new EvaluationFailed(e.getCause());
		}
		return target;
	}

	private static <T extends NativeType<T>> void copyBlock(
			final RandomAccessibleInterval<T> source,
			final RandomAccessibleInterval<T> target,
			final Interval block) {

		final Cursor<T> sourceCursor = Views.flatIterable(Views.interval(source, block)).cursor();
		final Cursor<T> targetCursor = Views.flatIterable(Views.interval(target, block)).cursor();
		while (targetCursor.hasNext())
			targetCursor.next().set(sourceCursor.next());
	}
}
