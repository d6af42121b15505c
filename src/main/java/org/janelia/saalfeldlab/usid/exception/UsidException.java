package org.janelia.saalfeldlab.usid.exception;

public abstract class UsidException extends Exception {

	protected UsidException(final String message) {

		super(message);
	}

	protected UsidException(final String message, final Throwable cause) {

		super(message, cause);
	}

}
