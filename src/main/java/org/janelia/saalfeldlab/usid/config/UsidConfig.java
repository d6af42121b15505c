package org.janelia.saalfeldlab.usid.config;

import org.janelia.saalfeldlab.usid.evaluation.EvaluationMode;

/**
 * Defaults for evaluating selections, see {@link UsidConfigYaml}.
 */
public class UsidConfig {

	public static final EvaluationMode DEFAULT_MODE = EvaluationMode.EAGER;

	public static final int DEFAULT_THREADS = 1;

	public static final int DEFAULT_BLOCK_SIZE = 64;

	private final EvaluationMode mode;

	private final int threads;

	private final int blockSize;

	public UsidConfig() {

		this(DEFAULT_MODE, DEFAULT_THREADS, DEFAULT_BLOCK_SIZE);
	}

	/**
	 * @param mode      how selections are evaluated unless requested otherwise
	 * @param threads   number of threads used to copy selections; no executor is used for values {@code < 2}
	 * @param blockSize edge length of blocks copied at once
	 */
	public UsidConfig(final EvaluationMode mode, final int threads, final int blockSize) {

		if (blockSize < 1)
			throw new IllegalArgumentException("Block size must be positive but got " + blockSize);
		this.mode = mode;
		this.threads = Math.max(threads, 1);
		this.blockSize = blockSize;
	}

	public EvaluationMode getMode() {

		return mode;
	}

	public int getThreads() {

		return threads;
	}

	public int getBlockSize() {

		return blockSize;
	}

	public UsidConfig withMode(final EvaluationMode mode) {

		return new UsidConfig(mode, threads, blockSize);
	}

	@Override
	public String toString() {

		return String.format("UsidConfig{mode=%s, threads=%d, blockSize=%d}", mode, threads, blockSize);
	}
}
