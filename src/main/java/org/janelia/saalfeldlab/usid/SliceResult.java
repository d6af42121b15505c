package org.janelia.saalfeldlab.usid;

import net.imglib2.RandomAccessibleInterval;

import java.util.List;

/**
 * Data of a selection together with the form it was returned in.
 *
 * @param <T> pixel type
 */
public class SliceResult<T> {

	private final RandomAccessibleInterval<T> data;

	private final boolean success;

	private final boolean nDimForm;

	private final List<String> axisLabels;

	public SliceResult(
			final RandomAccessibleInterval<T> data,
			final boolean success,
			final boolean nDimForm,
			final List<String> axisLabels) {

		this.data = data;
		this.success = success;
		this.nDimForm = nDimForm;
		this.axisLabels = List.copyOf(axisLabels);
	}

	/**
	 * @return selected values, an in-memory array or a {@link org.janelia.saalfeldlab.usid.evaluation.DeferredArray}
	 * depending on the evaluation
	 */
	public RandomAccessibleInterval<T> getData() {

		return data;
	}

	public boolean isSuccess() {

		return success;
	}

	/**
	 * @return {@code true} if {@link #getData()} has one axis per dimension, {@code false} if it has the two axes of
	 * the main dataset
	 */
	public boolean isNDimForm() {

		return nDimForm;
	}

	/**
	 * @return name of each axis of {@link #getData()}
	 */
	public List<String> getAxisLabels() {

		return axisLabels;
	}

	@Override
	public String toString() {

		return String.format("SliceResult{axes=%s, success=%s, nDimForm=%s}", axisLabels, success, nDimForm);
	}
}
