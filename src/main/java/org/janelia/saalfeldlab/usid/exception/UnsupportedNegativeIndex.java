package org.janelia.saalfeldlab.usid.exception;

public class UnsupportedNegativeIndex extends UsidRuntimeException {

	private final long index;

	public UnsupportedNegativeIndex(final String dimension, final long index) {

		super(String.format(
				"Negative index %d for dimension '%s' is only supported when slicing in N-dimensional form.",
				index,
				dimension));
		this.index = index;
	}

	public long getIndex() {

		return index;
	}
}
