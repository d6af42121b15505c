package org.janelia.saalfeldlab.usid.evaluation;

import org.janelia.saalfeldlab.usid.config.UsidConfig;
import org.janelia.saalfeldlab.usid.util.NamedThreadFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Evaluations {

	private static final Map<Integer, ExecutorService> EXECUTORS = new ConcurrentHashMap<>();

	private Evaluations() {

	}

	public static Evaluation eager() {

		return fromConfig(new UsidConfig().withMode(EvaluationMode.EAGER));
	}

	public static Evaluation deferred() {

		return fromConfig(new UsidConfig().withMode(EvaluationMode.DEFERRED));
	}

	public static Evaluation of(final boolean lazy, final UsidConfig config) {

		return fromConfig(config.withMode(lazy ? EvaluationMode.DEFERRED : EvaluationMode.EAGER));
	}

	public static Evaluation fromConfig(final UsidConfig config) {

		final ExecutorService executor = executor(config.getThreads());
		switch (config.getMode()) {
		case DEFERRED:
			return new DeferredEvaluation(executor, config.getBlockSize());
		case EAGER:
		default:
			return new EagerEvaluation(executor, config.getBlockSize());
		}
	}

	/**
	 * @return shared pool of daemon threads, or {@code null} for fewer than two threads
	 */
	public static ExecutorService executor(final int numThreads) {

		if (numThreads < 2)
			return null;
		return EXECUTORS.computeIfAbsent(
				numThreads,
				n -> Executors.newFixedThreadPool(n, new NamedThreadFactory("usid-evaluation-" + n + "-%d", true)));
	}
}
