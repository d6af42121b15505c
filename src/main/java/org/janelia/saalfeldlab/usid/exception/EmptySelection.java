package org.janelia.saalfeldlab.usid.exception;

import org.janelia.saalfeldlab.usid.dimension.AxisGroup;

/**
 * Valid selectors whose combined constraints match no row or no column of the main dataset.
 */
public class EmptySelection extends UsidRuntimeException {

	private final AxisGroup group;

	public EmptySelection(final Object selectors, final AxisGroup group) {

		super(String.format("Selection %s matches no %s combination", selectors, group));
		this.group = group;
	}

	public AxisGroup getGroup() {

		return group;
	}
}
