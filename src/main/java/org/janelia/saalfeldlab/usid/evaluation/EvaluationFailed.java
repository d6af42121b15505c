package org.janelia.saalfeldlab.usid.evaluation;

import org.janelia.saalfeldlab.usid.exception.UsidRuntimeException;

public class EvaluationFailed extends UsidRuntimeException {

	public EvaluationFailed(final Throwable cause) {

		super("Unable to evaluate selection: " + cause.getMessage(), cause);
	}
}
