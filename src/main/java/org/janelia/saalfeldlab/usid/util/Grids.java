package org.janelia.saalfeldlab.usid.util;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.img.cell.CellGrid;
import net.imglib2.util.Intervals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Grids {

	private Grids() {

	}

	public static void linearIndexToCellPositionMinMax(
			final CellGrid grid,
			final long linearIndex,
			final long[] gridPosition,
			final long[] min,
			final long[] max) {

		grid.getCellGridPositionFlat(linearIndex, gridPosition);
		Arrays.setAll(min, d -> gridPosition[d] * grid.cellDimension(d));
		Arrays.setAll(max, d -> Math.min(min[d] + grid.cellDimension(d), grid.imgDimension(d)) - 1);
	}

	/**
	 * @return every cell of {@code grid} as an {@link Interval}, in flat cell index order
	 */
	public static List<Interval> collectAllCells(final CellGrid grid) {

		final int n = grid.numDimensions();
		final long numCells = Intervals.numElements(grid.getGridDimensions());
		final List<Interval> cells = new ArrayList<>();
		final long[] gridPosition = new long[n];
		final long[] min = new long[n];
		final long[] max = new long[n];
		for (long index = 0; index < numCells; ++index) {
			linearIndexToCellPositionMinMax(grid, index, gridPosition, min, max);
			cells.add(new FinalInterval(min, max));
		}
		return cells;
	}

	/**
	 * @return cell size {@code edgeLength} along every one of {@code numDimensions} axes
	 */
	public static int[] uniformBlockSize(final int numDimensions, final int edgeLength) {

		final int[] blockSize = new int[numDimensions];
		Arrays.fill(blockSize, Math.max(edgeLength, 1));
		return blockSize;
	}
}
