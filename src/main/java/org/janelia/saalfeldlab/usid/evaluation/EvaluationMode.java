package org.janelia.saalfeldlab.usid.evaluation;

import java.util.Arrays;
import java.util.Optional;

public enum EvaluationMode {

	/**
	 * Copy every selected value into memory before returning.
	 */
	EAGER,

	/**
	 * Return a lazy view; values are read from the container only when accessed or computed.
	 */
	DEFERRED;

	public static Optional<EvaluationMode> fromName(final String name) {

		return Arrays.stream(values()).filter(mode -> mode.name().equalsIgnoreCase(name)).findFirst();
	}
}
