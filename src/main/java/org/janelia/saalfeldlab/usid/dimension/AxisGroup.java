package org.janelia.saalfeldlab.usid.dimension;

/**
 * The two axes of the compact main dataset. Position combinations enumerate the rows (dimension 0) of the main
 * dataset, spectroscopic combinations enumerate its columns (dimension 1).
 */
public enum AxisGroup {

	POSITION("Position"),
	SPECTROSCOPIC("Spectroscopic");

	private final String prefix;

	AxisGroup(final String prefix) {

		this.prefix = prefix;
	}

	public String indicesDataset() {

		return prefix + "_Indices";
	}

	public String valuesDataset() {

		return prefix + "_Values";
	}

	/**
	 * @return axis of the main dataset that enumerates combinations of this group.
	 */
	public int mainAxis() {

		return this == POSITION ? 0 : 1;
	}

	/**
	 * @return axis of the ancillary tables along which the dimensions of this group are laid out.
	 */
	public int dimensionAxis() {

		return this == POSITION ? 1 : 0;
	}
}
