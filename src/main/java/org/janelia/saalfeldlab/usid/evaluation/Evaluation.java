package org.janelia.saalfeldlab.usid.evaluation;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * Strategy for turning a lazy view of a selection into the result handed to the caller. All implementations
 * preserve the axis order and the logical index order of {@code view}.
 */
public interface Evaluation {

	<T extends NativeType<T>> RandomAccessibleInterval<T> evaluate(RandomAccessibleInterval<T> view);

	EvaluationMode getMode();
}
