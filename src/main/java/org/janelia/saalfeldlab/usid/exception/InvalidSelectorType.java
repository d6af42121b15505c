package org.janelia.saalfeldlab.usid.exception;

public class InvalidSelectorType extends UsidRuntimeException {

	public InvalidSelectorType(final String message) {

		super(message);
	}

	public InvalidSelectorType(final String dimension, final Object selector) {

		this(String.format(
				"Selector for dimension '%s' must be an integer, a range, or a list of integers but got %s (%s)",
				dimension,
				selector,
				selector == null ? "null" : selector.getClass().getSimpleName()));
	}
}
