package org.janelia.saalfeldlab.usid.evaluation;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

import java.util.concurrent.ExecutorService;

/**
 * Materializes every selection into an in-memory array before returning it.
 */
public class EagerEvaluation implements Evaluation {

	private final ExecutorService executor;

	private final int blockEdge;

	/**
	 * @param executor  used to copy blocks in parallel, may be {@code null}
	 * @param blockEdge edge length of copied blocks
	 */
	public EagerEvaluation(final ExecutorService executor, final int blockEdge) {

		this.executor = executor;
		this.blockEdge = blockEdge;
	}

	@Override
	public <T extends NativeType<T>> RandomAccessibleInterval<T> evaluate(final RandomAccessibleInterval<T> view) {

		return Materialize.copy(view, executor, blockEdge);
	}

	@Override
	public EvaluationMode getMode() {

		return EvaluationMode.EAGER;
	}
}
