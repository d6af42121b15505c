package org.janelia.saalfeldlab.usid.selection;

import org.janelia.saalfeldlab.usid.exception.InvalidSelectorType;

import java.util.Arrays;
import java.util.Collection;

/**
 * Conversion of loosely typed selector values, e.g. from a {@code Map<String, ?>} or the command line, into
 * {@link Selector}.
 */
public class Selectors {

	private Selectors() {

	}

	/**
	 * @param dimension name of the dimension, for error reporting
	 * @param value     a {@link Selector}, an integral {@link Number}, an {@code int[]} or {@code long[]}, or a
	 *                  {@link Collection} of integral numbers
	 * @throws InvalidSelectorType for any other value, including {@code null}, text, and floating point numbers
	 */
	public static Selector of(final String dimension, final Object value) {

		if (value instanceof Selector)
			return (Selector)value;
		if (isIntegral(value))
			return Selector.index(((Number)value).longValue());
		if (value instanceof long[])
			return Selector.list((long[])value);
		if (value instanceof int[])
			return Selector.list(Arrays.stream((int[])value).asLongStream().toArray());
		if (value instanceof Collection<?>) {
			final Collection<?> collection = (Collection<?>)value;
			final long[] indices = new long[collection.size()];
			int i = 0;
			for (final Object element : collection) {
				if (!isIntegral(element))
					throw new InvalidSelectorType(dimension, value);
				indices[i++] = ((Number)element).longValue();
			}
			return Selector.list(indices);
		}
		throw new InvalidSelectorType(dimension, value);
	}

	/**
	 * Parse the textual form of a selector: {@code ":"} for everything, {@code "3"} for an index,
	 * {@code "1:5"} or {@code "1:5:2"} for a range with optional empty bounds, {@code "1,2,4"} for a list.
	 *
	 * @throws InvalidSelectorType if {@code text} does not follow any of these forms
	 */
	public static Selector parse(final String dimension, final String text) {

		if (text == null || text.isBlank())
			throw new InvalidSelectorType(dimension, text);
		final String trimmed = text.trim();
		try {
			if (trimmed.contains(":")) {
				final String[] parts = trimmed.split(":", -1);
				if (parts.length > 3)
					throw new InvalidSelectorType(dimension, text);
				final Long start = parseBound(parts[0]);
				final Long stop = parseBound(parts[1]);
				final Long step = parts.length == 3 ? parseBound(parts[2]) : null;
				return start == null && stop == null && step == null
						? Selector.all()
						: Selector.range(start, stop, step == null ? 1 : step);
			}
			if (trimmed.contains(","))
				return Selector.list(Arrays.stream(trimmed.split(",")).map(String::trim).mapToLong(Long::parseLong).toArray());
			return Selector.index(Long.parseLong(trimmed));
		} catch (final NumberFormatException e) {
			throw new InvalidSelectorType(dimension, text);
		}
	}

	private static Long parseBound(final String bound) {

		return bound.isBlank() ? null : Long.parseLong(bound.trim());
	}

	private static boolean isIntegral(final Object value) {

		return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
	}
}
