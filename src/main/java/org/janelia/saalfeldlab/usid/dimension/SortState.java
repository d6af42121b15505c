package org.janelia.saalfeldlab.usid.dimension;

/**
 * Mutable sort toggle of a single dataset view. It only decides which {@link DimensionOrder} is consulted; the
 * ordering itself is recomputed on every request.
 */
public class SortState {

	private boolean sorted;

	public SortState() {

		this(false);
	}

	public SortState(final boolean sorted) {

		this.sorted = sorted;
	}

	public boolean isSorted() {

		return sorted;
	}

	public void toggle() {

		sorted = !sorted;
	}

	public DimensionOrder order() {

		return sorted ? DimensionOrder.SORTED : DimensionOrder.FILE;
	}
}
