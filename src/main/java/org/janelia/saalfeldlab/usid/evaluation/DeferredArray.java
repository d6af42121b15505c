package org.janelia.saalfeldlab.usid.evaluation;

import net.imglib2.AbstractInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.type.NativeType;

import java.util.concurrent.ExecutorService;

/**
 * Unevaluated selection. Random access reads values from the container on demand; {@link #compute()} evaluates
 * the whole selection at once.
 *
 * @param <T> pixel type
 */
public class DeferredArray<T extends NativeType<T>> extends AbstractInterval implements RandomAccessibleInterval<T> {

	private final RandomAccessibleInterval<T> source;

	private final ExecutorService executor;

	private final int blockEdge;

	public DeferredArray(final RandomAccessibleInterval<T> source, final ExecutorService executor, final int blockEdge) {

		super(source);
		this.source = source;
		this.executor = executor;
		this.blockEdge = blockEdge;
	}

	public RandomAccessibleInterval<T> getSource() {

		return source;
	}

	/**
	 * Evaluate with the executor this array was created with.
	 */
	public ArrayImg<T, ?> compute() {

		return compute(executor);
	}

	/**
	 * @param executor copies blocks in parallel if not {@code null}
	 */
	public ArrayImg<T, ?> compute(final ExecutorService executor) {

		return Materialize.copy(source, executor, blockEdge);
	}

	@Override
	public RandomAccess<T> randomAccess() {

		return source.randomAccess();
	}

	@Override
	public RandomAccess<T> randomAccess(final Interval interval) {

		return source.randomAccess(interval);
	}
}
