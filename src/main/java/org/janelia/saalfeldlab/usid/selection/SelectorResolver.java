package org.janelia.saalfeldlab.usid.selection;

import gnu.trove.list.array.TLongArrayList;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates a mapping from dimension name to selector into the rows and columns of the main dataset that satisfy
 * every constraint of their axis group.
 */
public class SelectorResolver {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final DimensionRegistry registry;

	public SelectorResolver(final DimensionRegistry registry) {

		this.registry = registry;
	}

	/**
	 * Resolve {@code selectors} as given: negative indices are not supported.
	 *
	 * @param selectors dimension name to selector, see {@link Selectors#of(String, Object)}; dimensions that are not
	 *                  mentioned are not constrained. {@code null} selects everything.
	 */
	public PosSpecIndices resolve(final Map<String, ?> selectors) {

		return resolve(toSelectors(selectors), false);
	}

	/**
	 * Resolve {@code selectors} after counting negative indices from the end of their dimension and clipping open
	 * range bounds, as for single-axis indexing of the N-dimensional form.
	 */
	public PosSpecIndices resolveNormalized(final Map<String, ?> selectors) {

		return resolve(toSelectors(selectors), true);
	}

	/**
	 * @return selectors keyed by their resolved dimensions, in the iteration order of {@code selectors}
	 */
	public Map<Dimension, Selector> toSelectors(final Map<String, ?> selectors) {

		if (selectors == null || selectors.isEmpty())
			return Collections.emptyMap();

		// unknown names take precedence over malformed selectors
		final Map<Dimension, Object> byDimension = new LinkedHashMap<>();
		for (final Map.Entry<String, ?> entry : selectors.entrySet())
			byDimension.put(registry.resolve(entry.getKey()), entry.getValue());

		final Map<Dimension, Selector> typed = new LinkedHashMap<>();
		byDimension.forEach((dimension, value) -> typed.put(dimension, Selectors.of(dimension.getName(), value)));
		return typed;
	}

	public PosSpecIndices resolve(final Map<Dimension, Selector> selectors, final boolean normalize) {

		final Map<Dimension, long[]> allowed = new LinkedHashMap<>();
		selectors.forEach((dimension, selector) -> {
			final Selector effective = normalize ? selector.normalize(dimension) : selector;
			final long[] indices = effective.expand(dimension);
			LOG.debug("Selector {} on dimension {} allows indices {}", effective, dimension.getName(), indices);
			allowed.put(dimension, indices);
		});

		return new PosSpecIndices(
				matching(AxisGroup.POSITION, allowed),
				matching(AxisGroup.SPECTROSCOPIC, allowed));
	}

	private long[] matching(final AxisGroup group, final Map<Dimension, long[]> allowed) {

		final int numCombinations = registry.numCombinations(group);
		final boolean[] keep = new boolean[numCombinations];
		Arrays.fill(keep, true);

		for (final Dimension dimension : registry.dimensions(group)) {
			final long[] indices = allowed.get(dimension);
			if (indices == null)
				continue;
			final boolean[] isAllowed = new boolean[(int)dimension.getSize()];
			for (final long index : indices)
				isAllowed[(int)index] = true;
			for (int combination = 0; combination < numCombinations; ++combination)
				keep[combination] &= isAllowed[(int)dimension.index(combination)];
		}

		final TLongArrayList matches = new TLongArrayList();
		for (int combination = 0; combination < numCombinations; ++combination)
			if (keep[combination])
				matches.add(combination);
		LOG.debug("{} of {} {} combinations match", matches.size(), numCombinations, group);
		return matches.toArray();
	}
}
