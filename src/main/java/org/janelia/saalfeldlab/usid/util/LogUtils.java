package org.janelia.saalfeldlab.usid.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

public class LogUtils {

	private LogUtils() {

	}

	public static void setRootLoggerLevel(final Level level) {

		setLoggerLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, level);
	}

	/**
	 * Only has an effect if logback is the slf4j binding.
	 */
	public static void setLoggerLevel(final String name, final Level level) {

		final org.slf4j.Logger logger = LoggerFactory.getLogger(name);
		if (logger instanceof Logger)
			((Logger)logger).setLevel(level);
	}

}
