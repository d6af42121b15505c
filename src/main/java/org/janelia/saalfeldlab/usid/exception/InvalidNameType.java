package org.janelia.saalfeldlab.usid.exception;

public class InvalidNameType extends UsidRuntimeException {

	public InvalidNameType(final Object name) {

		super(String.format("Dimension name must be a non-blank string but got '%s'", name));
	}
}
