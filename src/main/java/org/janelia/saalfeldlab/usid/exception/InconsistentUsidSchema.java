package org.janelia.saalfeldlab.usid.exception;

/**
 * The main dataset and its ancillary tables do not form a valid USID dataset, e.g. the position index table has a
 * different number of rows than the main dataset.
 */
public class InconsistentUsidSchema extends UsidException {

	private final String dataset;

	public InconsistentUsidSchema(final String dataset, final String message) {

		super(String.format("Inconsistent USID dataset %s: %s", dataset, message));
		this.dataset = dataset;
	}

	public String getDataset() {

		return dataset;
	}
}
