package org.janelia.saalfeldlab.usid.selection;

import org.janelia.saalfeldlab.usid.dimension.AxisGroup;

import java.util.Arrays;

/**
 * Ascending, duplicate-free row indices (position combinations) and column indices (spectroscopic combinations) of
 * the main dataset that satisfy a selection.
 */
public class PosSpecIndices {

	private final long[] positionIndices;

	private final long[] spectroscopicIndices;

	public PosSpecIndices(final long[] positionIndices, final long[] spectroscopicIndices) {

		this.positionIndices = positionIndices;
		this.spectroscopicIndices = spectroscopicIndices;
	}

	public long[] getPositionIndices() {

		return positionIndices.clone();
	}

	public long[] getSpectroscopicIndices() {

		return spectroscopicIndices.clone();
	}

	public long[] indices(final AxisGroup group) {

		return group == AxisGroup.POSITION ? getPositionIndices() : getSpectroscopicIndices();
	}

	public int count(final AxisGroup group) {

		return group == AxisGroup.POSITION ? positionIndices.length : spectroscopicIndices.length;
	}

	@Override
	public String toString() {

		return String.format(
				"PosSpecIndices{positions=%s, spectroscopic=%s}",
				Arrays.toString(positionIndices),
				Arrays.toString(spectroscopicIndices));
	}
}
