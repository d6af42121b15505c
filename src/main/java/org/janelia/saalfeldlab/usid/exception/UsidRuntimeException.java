package org.janelia.saalfeldlab.usid.exception;

/**
 * Base class for errors caused by the arguments of a request against a dataset view, e.g. an unknown dimension name
 * or a malformed selector. These are never recovered from internally.
 */
public abstract class UsidRuntimeException extends RuntimeException {

	protected UsidRuntimeException(final String message) {

		super(message);
	}

	protected UsidRuntimeException(final String message, final Throwable cause) {

		super(message, cause);
	}

}
