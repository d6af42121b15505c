package org.janelia.saalfeldlab.usid.dimension;

import org.janelia.saalfeldlab.usid.exception.InvalidNameType;
import org.janelia.saalfeldlab.usid.exception.UnknownDimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable lookup from dimension name to {@link Dimension} for both axis groups of a dataset.
 */
public class DimensionRegistry {

	private final List<Dimension> positionDimensions;

	private final List<Dimension> spectroscopicDimensions;

	private final Map<String, Dimension> byName = new LinkedHashMap<>();

	/**
	 * @param positionDimensions      position dimensions in file order
	 * @param spectroscopicDimensions spectroscopic dimensions in file order
	 * @throws IllegalArgumentException if a dimension name occurs more than once
	 */
	public DimensionRegistry(final List<Dimension> positionDimensions, final List<Dimension> spectroscopicDimensions) {

		this.positionDimensions = List.copyOf(positionDimensions);
		this.spectroscopicDimensions = List.copyOf(spectroscopicDimensions);
		for (final Dimension dimension : this.positionDimensions)
			register(dimension, AxisGroup.POSITION);
		for (final Dimension dimension : this.spectroscopicDimensions)
			register(dimension, AxisGroup.SPECTROSCOPIC);
	}

	private void register(final Dimension dimension, final AxisGroup expectedGroup) {

		if (dimension.getGroup() != expectedGroup)
			throw new IllegalArgumentException(String.format("Dimension %s is not a %s dimension", dimension.getName(), expectedGroup));
		if (byName.putIfAbsent(dimension.getName(), dimension) != null)
			throw new IllegalArgumentException(String.format("Duplicate dimension name: %s", dimension.getName()));
	}

	/**
	 * @throws UnknownDimension if {@code name} is not a dimension of either group
	 * @throws InvalidNameType  if {@code name} is {@code null} or blank
	 */
	public Dimension resolve(final String name) {

		checkName(name);
		final Dimension dimension = byName.get(name);
		if (dimension == null)
			throw new UnknownDimension(name, byName.keySet());
		return dimension;
	}

	/**
	 * @throws UnknownDimension if {@code name} is not a dimension of {@code group}
	 * @throws InvalidNameType  if {@code name} is {@code null} or blank
	 */
	public Dimension resolve(final String name, final AxisGroup group) {

		checkName(name);
		final Dimension dimension = byName.get(name);
		if (dimension == null || dimension.getGroup() != group)
			throw new UnknownDimension(name, labels(group, DimensionOrder.FILE));
		return dimension;
	}

	public boolean contains(final String name) {

		return name != null && byName.containsKey(name);
	}

	public List<Dimension> dimensions(final AxisGroup group) {

		return group == AxisGroup.POSITION ? positionDimensions : spectroscopicDimensions;
	}

	public List<Dimension> dimensions(final AxisGroup group, final DimensionOrder order) {

		return Collections.unmodifiableList(order.order(dimensions(group)));
	}

	public List<String> labels(final AxisGroup group, final DimensionOrder order) {

		return dimensions(group, order).stream().map(Dimension::getName).collect(Collectors.toList());
	}

	public long[] sizes(final AxisGroup group, final DimensionOrder order) {

		return dimensions(group, order).stream().mapToLong(Dimension::getSize).toArray();
	}

	public int numCombinations(final AxisGroup group) {

		final List<Dimension> dimensions = dimensions(group);
		return dimensions.isEmpty() ? 0 : dimensions.get(0).numCombinations();
	}

	private static void checkName(final String name) {

		if (name == null || name.isBlank())
			throw new InvalidNameType(name);
	}
}
