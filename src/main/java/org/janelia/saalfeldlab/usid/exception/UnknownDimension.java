package org.janelia.saalfeldlab.usid.exception;

import java.util.Collection;

public class UnknownDimension extends UsidRuntimeException {

	private final String dimension;

	public UnknownDimension(final String dimension, final Collection<String> knownDimensions) {

		super(String.format("Unknown dimension '%s'. Known dimensions: %s", dimension, knownDimensions));
		this.dimension = dimension;
	}

	public String getDimension() {

		return dimension;
	}
}
