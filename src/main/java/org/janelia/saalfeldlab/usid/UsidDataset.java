package org.janelia.saalfeldlab.usid;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.janelia.saalfeldlab.usid.config.UsidConfig;
import org.janelia.saalfeldlab.usid.config.UsidConfigYaml;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.dimension.DimensionOrder;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.janelia.saalfeldlab.usid.dimension.SortState;
import org.janelia.saalfeldlab.usid.evaluation.Evaluation;
import org.janelia.saalfeldlab.usid.evaluation.Evaluations;
import org.janelia.saalfeldlab.usid.exception.EmptySelection;
import org.janelia.saalfeldlab.usid.exception.InconsistentUsidSchema;
import org.janelia.saalfeldlab.usid.n5.N5DimensionReader;
import org.janelia.saalfeldlab.usid.n5.N5Types;
import org.janelia.saalfeldlab.usid.n5.UsidN5Helpers;
import org.janelia.saalfeldlab.usid.reshape.Density;
import org.janelia.saalfeldlab.usid.reshape.DensityClassifier;
import org.janelia.saalfeldlab.usid.reshape.IndexMappedRandomAccessibleInterval;
import org.janelia.saalfeldlab.usid.reshape.ReshapeEngine;
import org.janelia.saalfeldlab.usid.selection.PosSpecIndices;
import org.janelia.saalfeldlab.usid.selection.SelectorResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.LongStream;

/**
 * View of a compact two dimensional USID main dataset in an N5 container: rows enumerate combinations of position
 * dimensions, columns enumerate combinations of spectroscopic dimensions. The view adds access by dimension name,
 * slicing and reshaping into one axis per dimension. The container is never written to.
 *
 * @param <T> pixel type of the main dataset
 */
public class UsidDataset<T extends NativeType<T> & RealType<T>> {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final String dataset;

	private final RandomAccessibleInterval<T> raw;

	private final String quantity;

	private final String units;

	private final DimensionRegistry registry;

	private final SelectorResolver resolver;

	private final DensityClassifier classifier;

	private final ReshapeEngine reshapeEngine;

	private final UsidConfig config;

	private final SortState sortState = new SortState();

	private UsidDataset(
			final String dataset,
			final RandomAccessibleInterval<T> raw,
			final String quantity,
			final String units,
			final DimensionRegistry registry,
			final UsidConfig config) {

		this.dataset = dataset;
		this.raw = raw;
		this.quantity = quantity;
		this.units = units;
		this.registry = registry;
		this.resolver = new SelectorResolver(registry);
		this.classifier = new DensityClassifier(registry);
		this.reshapeEngine = new ReshapeEngine(registry);
		this.config = config;
	}

	/**
	 * Open {@code dataset} with the configuration from {@link UsidConfigYaml#load()}.
	 *
	 * @see #open(N5Reader, String, UsidConfig)
	 */
	public static <T extends NativeType<T> & RealType<T>> UsidDataset<T> open(final N5Reader n5, final String dataset)
			throws IOException, InconsistentUsidSchema {

		return open(n5, dataset, UsidConfigYaml.load());
	}

	/**
	 * Read the ancillary tables of {@code dataset} and open the main dataset lazily. No block of the main dataset is
	 * read before a selection is evaluated.
	 *
	 * @throws IOException            if any N5 operation throws {@link IOException}
	 * @throws InconsistentUsidSchema if {@code dataset} and its ancillary tables do not form a valid USID dataset
	 */
	public static <T extends NativeType<T> & RealType<T>> UsidDataset<T> open(final N5Reader n5, final String dataset, final UsidConfig config)
			throws IOException, InconsistentUsidSchema {

		if (!n5.datasetExists(dataset))
			throw new InconsistentUsidSchema(dataset, "main dataset does not exist");
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		if (attributes.getNumDimensions() != 2)
			throw new InconsistentUsidSchema(dataset, String.format("main dataset must be two dimensional but has %d dimensions", attributes.getNumDimensions()));
		if (!N5Types.isRealType(attributes.getDataType()))
			throw new InconsistentUsidSchema(dataset, "main dataset has non-numeric data type " + attributes.getDataType());

		final long[] shape = attributes.getDimensions();
		final N5DimensionReader reader = new N5DimensionReader(n5, dataset);
		final List<Dimension> positionDimensions = reader.readDimensions(AxisGroup.POSITION, shape[AxisGroup.POSITION.mainAxis()]);
		final List<Dimension> spectroscopicDimensions = reader.readDimensions(AxisGroup.SPECTROSCOPIC, shape[AxisGroup.SPECTROSCOPIC.mainAxis()]);
		final DimensionRegistry registry;
		try {
			registry = new DimensionRegistry(positionDimensions, spectroscopicDimensions);
		} catch (final IllegalArgumentException e) {
			throw new InconsistentUsidSchema(dataset, e.getMessage());
		}

		final RandomAccessibleInterval<T> raw = N5Utils.open(n5, dataset);
		final String quantity = n5.getAttribute(dataset, UsidN5Helpers.QUANTITY_KEY, String.class);
		final String units = n5.getAttribute(dataset, UsidN5Helpers.UNITS_KEY, String.class);
		LOG.debug("Opened USID dataset {} of shape {}x{} with {} and {}", dataset, shape[0], shape[1], positionDimensions, spectroscopicDimensions);
		return new UsidDataset<>(dataset, raw, quantity, units, registry, config);
	}

	public String getDataset() {

		return dataset;
	}

	/**
	 * @return physical quantity of the main dataset, {@code null} if not stored
	 */
	public String getQuantity() {

		return quantity;
	}

	/**
	 * @return units of the main dataset, {@code null} if not stored
	 */
	public String getUnits() {

		return units;
	}

	/**
	 * @return lazily loaded two dimensional main dataset
	 */
	public RandomAccessibleInterval<T> getRaw() {

		return raw;
	}

	public UsidConfig getConfig() {

		return config;
	}

	public DimensionRegistry getRegistry() {

		return registry;
	}

	public boolean isSorted() {

		return sortState.isSorted();
	}

	/**
	 * Switch between file order and sorted order of dimensions. Affects the labels, sizes and the axis order of the
	 * N-dimensional form.
	 */
	public void toggleSorting() {

		sortState.toggle();
		LOG.debug("Toggled sorting of {}: {}", dataset, getCurrentSorting());
	}

	public String getCurrentSorting() {

		return sortState.order().getDescription();
	}

	public DimensionOrder getDimensionOrder() {

		return sortState.order();
	}

	public List<String> getPosDimLabels() {

		return registry.labels(AxisGroup.POSITION, sortState.order());
	}

	public List<String> getSpecDimLabels() {

		return registry.labels(AxisGroup.SPECTROSCOPIC, sortState.order());
	}

	/**
	 * @return labels of all axes of the N-dimensional form: position dimensions, then spectroscopic dimensions
	 */
	public List<String> getNDimLabels() {

		final List<String> labels = new ArrayList<>(getPosDimLabels());
		labels.addAll(getSpecDimLabels());
		return labels;
	}

	public long[] getPosDimSizes() {

		return registry.sizes(AxisGroup.POSITION, sortState.order());
	}

	public long[] getSpecDimSizes() {

		return registry.sizes(AxisGroup.SPECTROSCOPIC, sortState.order());
	}

	public long[] getNDimSizes() {

		return reshapeEngine.nDimShape(sortState.order());
	}

	/**
	 * @return value of position dimension {@code name} for every row of the main dataset
	 */
	public double[] getPosValues(final String name) {

		return registry.resolve(name, AxisGroup.POSITION).getValues();
	}

	/**
	 * @return value of spectroscopic dimension {@code name} for every column of the main dataset
	 */
	public double[] getSpecValues(final String name) {

		return registry.resolve(name, AxisGroup.SPECTROSCOPIC).getValues();
	}

	/**
	 * @return value of position dimension {@code name} for every index {@code 0 .. size - 1}
	 */
	public double[] getPosUnitValues(final String name) {

		return registry.resolve(name, AxisGroup.POSITION).getUnitValues();
	}

	/**
	 * @return value of spectroscopic dimension {@code name} for every index {@code 0 .. size - 1}
	 */
	public double[] getSpecUnitValues(final String name) {

		return registry.resolve(name, AxisGroup.SPECTROSCOPIC).getUnitValues();
	}

	/**
	 * @param selectors dimension name to selector; negative indices are not supported
	 * @return rows and columns of the main dataset that satisfy all {@code selectors}
	 */
	public PosSpecIndices getPosSpecIndices(final Map<String, ?> selectors) {

		return resolver.resolve(selectors);
	}

	public SliceResult<T> getNDimForm() {

		return getNDimForm(Evaluations.fromConfig(config));
	}

	public SliceResult<T> getNDimForm(final boolean lazy) {

		return getNDimForm(Evaluations.of(lazy, config));
	}

	/**
	 * Reshape the whole dataset into one axis per dimension, without dropping axes of length 1.
	 *
	 * @return the N-dimensional form if the ancillary tables describe a complete grid, otherwise the flat form with
	 * {@link SliceResult#isSuccess()} {@code false}
	 */
	public SliceResult<T> getNDimForm(final Evaluation evaluation) {

		final PosSpecIndices all = new PosSpecIndices(
				LongStream.range(0, raw.dimension(AxisGroup.POSITION.mainAxis())).toArray(),
				LongStream.range(0, raw.dimension(AxisGroup.SPECTROSCOPIC.mainAxis())).toArray());
		final Density density = classifier.classify(all);
		if (!density.isDense()) {
			LOG.warn("{} is not a complete grid of its dimensions: returning the flat form", dataset);
			return evaluate(reshapeEngine.flat(raw, all), false, false, evaluation);
		}
		return evaluate(reshapeEngine.nDim(raw, all, density, sortState.order(), false), true, true, evaluation);
	}

	public SliceResult<T> slice(final Map<String, ?> selectors) {

		return slice(selectors, true);
	}

	public SliceResult<T> slice(final Map<String, ?> selectors, final boolean nDimForm) {

		return slice(selectors, nDimForm, Evaluations.fromConfig(config));
	}

	public SliceResult<T> slice(final Map<String, ?> selectors, final boolean nDimForm, final boolean lazy) {

		return slice(selectors, nDimForm, Evaluations.of(lazy, config));
	}

	/**
	 * Select values by dimension name.
	 * <p>
	 * In N-dimensional form, negative indices count from the end of their dimension, axes of length 1 are dropped,
	 * and selections that do not form a complete grid are returned in flat form instead. The flat form has the selected
	 * rows and columns in store order; negative indices are rejected.
	 *
	 * @param selectors  dimension name to selector, {@code null} or empty to select everything
	 * @param nDimForm   request the N-dimensional form
	 * @param evaluation eager or deferred evaluation of the selected values
	 * @throws EmptySelection if the selectors are valid but match no row or no column
	 */
	public SliceResult<T> slice(final Map<String, ?> selectors, final boolean nDimForm, final Evaluation evaluation) {

		final PosSpecIndices indices = nDimForm ? resolver.resolveNormalized(selectors) : resolver.resolve(selectors);
		for (final AxisGroup group : AxisGroup.values())
			if (indices.count(group) == 0)
				throw new EmptySelection(selectors, group);

		if (!nDimForm)
			return evaluate(reshapeEngine.flat(raw, indices), true, false, evaluation);

		final Density density = classifier.classify(indices);
		if (!density.isDense()) {
			LOG.warn("Selection {} of {} is not a complete grid: returning the flat form", selectors, dataset);
			return evaluate(reshapeEngine.flat(raw, indices), true, false, evaluation);
		}
		return evaluate(reshapeEngine.nDim(raw, indices, density, sortState.order(), true), true, true, evaluation);
	}

	private SliceResult<T> evaluate(
			final IndexMappedRandomAccessibleInterval<T> view,
			final boolean success,
			final boolean nDimForm,
			final Evaluation evaluation) {

		LOG.debug("Evaluating view with axes {} ({})", view.getAxisLabels(), evaluation.getMode());
		return new SliceResult<>(evaluation.evaluate(view), success, nDimForm, view.getAxisLabels());
	}

	@Override
	public String toString() {

		final StringBuilder sb = new StringBuilder(dataset).append(System.lineSeparator());
		sb.append("Position dimensions:").append(System.lineSeparator());
		registry.dimensions(AxisGroup.POSITION, sortState.order()).forEach(d -> sb.append('\t').append(d).append(System.lineSeparator()));
		sb.append("Spectroscopic dimensions:").append(System.lineSeparator());
		registry.dimensions(AxisGroup.SPECTROSCOPIC, sortState.order()).forEach(d -> sb.append('\t').append(d).append(System.lineSeparator()));
		return sb.toString();
	}
}
