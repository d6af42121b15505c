package org.janelia.saalfeldlab.usid.exception;

public class SelectorOutOfRange extends UsidRuntimeException {

	private final long index;

	private final long size;

	public SelectorOutOfRange(final String dimension, final long index, final long size) {

		super(String.format("Index %d is out of range for dimension '%s' of size %d", index, dimension, size));
		this.index = index;
		this.size = size;
	}

	public long getIndex() {

		return index;
	}

	public long getSize() {

		return size;
	}
}
