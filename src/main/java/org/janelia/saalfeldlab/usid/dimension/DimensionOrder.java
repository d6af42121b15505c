package org.janelia.saalfeldlab.usid.dimension;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Order in which the dimensions of an axis group are reported and laid out in N-dimensional form.
 */
public enum DimensionOrder {

	/**
	 * Order of the {@code labels} attribute of the ancillary tables.
	 */
	FILE("Data dimensions are in the order they occur in the file."),

	/**
	 * Ranked by change rate in store order: the dimension that changes least often comes first, the one that
	 * changes at (almost) every combination comes last. Ties keep file order.
	 */
	SORTED("Data dimensions are sorted by change rate, slowest changing dimension first.");

	private final String description;

	DimensionOrder(final String description) {

		this.description = description;
	}

	public String getDescription() {

		return description;
	}

	/**
	 * @param dimensions dimensions in file order
	 * @return new list holding {@code dimensions} in this order
	 */
	public List<Dimension> order(final List<Dimension> dimensions) {

		final List<Dimension> ordered = new ArrayList<>(dimensions);
		if (this == SORTED)
			// List.sort is stable
			ordered.sort(Comparator.comparingLong(Dimension::getChangeCount));
		return ordered;
	}
}
