package org.janelia.saalfeldlab.usid.evaluation;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

import java.util.concurrent.ExecutorService;

/**
 * Wraps every selection into a {@link DeferredArray}; nothing is read until the caller accesses or computes it.
 */
public class DeferredEvaluation implements Evaluation {

	private final ExecutorService executor;

	private final int blockEdge;

	/**
	 * @param executor  default executor for {@link DeferredArray#compute()}, may be {@code null}
	 * @param blockEdge edge length of blocks copied by {@link DeferredArray#compute()}
	 */
	public DeferredEvaluation(final ExecutorService executor, final int blockEdge) {

		this.executor = executor;
		this.blockEdge = blockEdge;
	}

	@Override
	public <T extends NativeType<T>> DeferredArray<T> evaluate(final RandomAccessibleInterval<T> view) {

		return new DeferredArray<>(view, executor, blockEdge);
	}

	@Override
	public EvaluationMode getMode() {

		return EvaluationMode.DEFERRED;
	}
}
