package org.janelia.saalfeldlab.usid.selection;

import gnu.trove.list.array.TLongArrayList;
import gnu.trove.set.hash.TLongHashSet;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.exception.InvalidSelectorType;
import org.janelia.saalfeldlab.usid.exception.SelectorOutOfRange;
import org.janelia.saalfeldlab.usid.exception.UnsupportedNegativeIndex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Selection of grid indices along a single dimension: everything, a single index, a range with step, or an explicit
 * list of indices.
 * <p>
 * {@link #expand(Dimension)} is the strict form used when resolving position and spectroscopic index sets: negative
 * indices are rejected. {@link #normalize(Dimension)} maps negative indices and open range bounds onto the dimension
 * first, the way single-axis indexing of an N-dimensional array treats them.
 */
public abstract class Selector {

	private Selector() {

	}

	public static Selector all() {

		return All.INSTANCE;
	}

	public static Selector index(final long index) {

		return new Index(index);
	}

	/**
	 * @param start first index, {@code null} for the start of the dimension
	 * @param stop  exclusive end, {@code null} for the end of the dimension
	 */
	public static Selector range(final Long start, final Long stop) {

		return range(start, stop, 1);
	}

	/**
	 * Ranges always run forward: unlike slices of an N-dimensional array, a zero or negative {@code step} is rejected
	 * with {@link InvalidSelectorType} when the selector is used, on both the strict and the normalized path.
	 *
	 * @param start first index, {@code null} for the start of the dimension
	 * @param stop  exclusive end, {@code null} for the end of the dimension
	 * @param step  positive step
	 */
	public static Selector range(final Long start, final Long stop, final long step) {

		return new Range(start, stop, step);
	}

	public static Selector list(final long... indices) {

		return new IndexList(indices);
	}

	/**
	 * @return {@code true} if this selector picks a single index and thereby removes its dimension from
	 * N-dimensional results.
	 */
	public boolean isReducing() {

		return false;
	}

	/**
	 * @return ascending, duplicate-free indices into {@code dimension} selected by this selector
	 * @throws UnsupportedNegativeIndex if any index or bound is negative
	 * @throws SelectorOutOfRange       if any selected index is not within {@code [0, dimension.getSize())}
	 * @throws InvalidSelectorType      if the selector is malformed or selects nothing
	 */
	public abstract long[] expand(Dimension dimension);

	/**
	 * @return equivalent selector with negative indices counted from the end of {@code dimension} and open range
	 * bounds clipped to it
	 * @throws SelectorOutOfRange if an index is out of range even after counting from the end
	 */
	public abstract Selector normalize(Dimension dimension);

	static final class All extends Selector {

		private static final All INSTANCE = new All();

		@Override
		public long[] expand(final Dimension dimension) {

			final long[] indices = new long[(int)dimension.getSize()];
			Arrays.setAll(indices, i -> i);
			return indices;
		}

		@Override
		public Selector normalize(final Dimension dimension) {

			return this;
		}

		@Override
		public String toString() {

			return ":";
		}
	}

	static final class Index extends Selector {

		private final long index;

		private Index(final long index) {

			this.index = index;
		}

		@Override
		public boolean isReducing() {

			return true;
		}

		@Override
		public long[] expand(final Dimension dimension) {

			if (index < 0)
				throw new UnsupportedNegativeIndex(dimension.getName(), index);
			checkInRange(dimension, index);
			return new long[]{index};
		}

		@Override
		public Selector normalize(final Dimension dimension) {

			return new Index(countFromEnd(dimension, index));
		}

		@Override
		public boolean equals(final Object other) {

			return other instanceof Index && ((Index)other).index == index;
		}

		@Override
		public int hashCode() {

			return Long.hashCode(index);
		}

		@Override
		public String toString() {

			return Long.toString(index);
		}
	}

	static final class Range extends Selector {

		private final Long start;

		private final Long stop;

		private final long step;

		private Range(final Long start, final Long stop, final long step) {

			this.start = start;
			this.stop = stop;
			this.step = step;
		}

		@Override
		public long[] expand(final Dimension dimension) {

			checkStep(dimension);
			final long first = start == null ? 0 : start;
			final long end = stop == null ? dimension.getSize() : stop;
			if (first < 0)
				throw new UnsupportedNegativeIndex(dimension.getName(), first);
			if (end < 0)
				throw new UnsupportedNegativeIndex(dimension.getName(), end);

			final TLongArrayList indices = new TLongArrayList();
			for (long index = first; index < end; index += step) {
				checkInRange(dimension, index);
				indices.add(index);
				// index + step must not wrap around
				if (step >= end - index)
					break;
			}
			if (indices.isEmpty())
				throw new InvalidSelectorType(String.format("Range %s selects no index of dimension '%s'", this, dimension.getName()));
			return indices.toArray();
		}

		@Override
		public Selector normalize(final Dimension dimension) {

			checkStep(dimension);
			final long size = dimension.getSize();
			return new Range(
					start == null ? 0 : clip(start, size),
					stop == null ? size : clip(stop, size),
					step);
		}

		private void checkStep(final Dimension dimension) {

			if (step <= 0)
				throw new InvalidSelectorType(String.format("Range step must be positive for dimension '%s' but got %d", dimension.getName(), step));
		}

		private static long clip(final long bound, final long size) {

			final long fromStart = bound < 0 ? bound + size : bound;
			return Math.max(0, Math.min(fromStart, size));
		}

		@Override
		public boolean equals(final Object other) {

			if (!(other instanceof Range))
				return false;
			final Range that = (Range)other;
			return Objects.equals(start, that.start) && Objects.equals(stop, that.stop) && step == that.step;
		}

		@Override
		public int hashCode() {

			return Objects.hash(start, stop, step);
		}

		@Override
		public String toString() {

			return String.format("%s:%s:%d", start == null ? "" : start, stop == null ? "" : stop, step);
		}
	}

	static final class IndexList extends Selector {

		private final long[] indices;

		private IndexList(final long[] indices) {

			this.indices = indices.clone();
		}

		@Override
		public long[] expand(final Dimension dimension) {

			if (indices.length == 0)
				throw new InvalidSelectorType(String.format("Empty index list for dimension '%s'", dimension.getName()));
			final TLongHashSet unique = new TLongHashSet();
			for (final long index : indices) {
				if (index < 0)
					throw new UnsupportedNegativeIndex(dimension.getName(), index);
				checkInRange(dimension, index);
				unique.add(index);
			}
			final long[] expanded = unique.toArray();
			Arrays.sort(expanded);
			return expanded;
		}

		@Override
		public Selector normalize(final Dimension dimension) {

			return new IndexList(Arrays.stream(indices).map(index -> countFromEnd(dimension, index)).toArray());
		}

		@Override
		public boolean equals(final Object other) {

			return other instanceof IndexList && Arrays.equals(((IndexList)other).indices, indices);
		}

		@Override
		public int hashCode() {

			return Arrays.hashCode(indices);
		}

		@Override
		public String toString() {

			return Arrays.toString(indices);
		}
	}

	private static void checkInRange(final Dimension dimension, final long index) {

		if (index >= dimension.getSize())
			throw new SelectorOutOfRange(dimension.getName(), index, dimension.getSize());
	}

	private static long countFromEnd(final Dimension dimension, final long index) {

		final long size = dimension.getSize();
		final long normalized = index < 0 ? index + size : index;
		if (normalized < 0 || normalized >= size)
			throw new SelectorOutOfRange(dimension.getName(), index, size);
		return normalized;
	}
}
