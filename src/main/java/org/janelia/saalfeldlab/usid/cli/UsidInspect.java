package org.janelia.saalfeldlab.usid.cli;

import ch.qos.logback.classic.Level;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.usid.SliceResult;
import org.janelia.saalfeldlab.usid.UsidDataset;
import org.janelia.saalfeldlab.usid.config.UsidConfigYaml;
import org.janelia.saalfeldlab.usid.dimension.AxisGroup;
import org.janelia.saalfeldlab.usid.dimension.Dimension;
import org.janelia.saalfeldlab.usid.evaluation.Evaluations;
import org.janelia.saalfeldlab.usid.exception.InconsistentUsidSchema;
import org.janelia.saalfeldlab.usid.exception.UsidRuntimeException;
import org.janelia.saalfeldlab.usid.selection.Selector;
import org.janelia.saalfeldlab.usid.selection.Selectors;
import org.janelia.saalfeldlab.usid.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
		name = "usid-inspect",
		mixinStandardHelpOptions = true,
		showDefaultValues = true,
		exitCodeOnInvalidInput = 1,
		description = "Print the dimensions of a USID dataset in an N5 container and the shape of a slice.",
		usageHelpWidth = 120,
		parameterListHeading = "%n@|bold,underline Parameters|@:%n",
		optionListHeading = "%n@|bold,underline Options|@:%n")
public class UsidInspect implements Callable<Integer> {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", paramLabel = "CONTAINER", description = "N5 container on the file system.")
	private final String container = null;

	@Parameters(index = "1", paramLabel = "DATASET", description = "Main dataset inside CONTAINER.")
	private final String dataset = null;

	@Option(names = "--sorted", description = "Sort dimensions by change rate, slowest changing dimension first.")
	private boolean sorted;

	@Option(names = "--select", paramLabel = "NAME=SELECTOR", description = "Selector for a dimension: ':', '3', '1:5:2', or '1,2,4'. Repeatable.")
	private final Map<String, String> selections = null;

	@Option(names = "--flat", description = "Slice in the two dimensional form of the main dataset.")
	private boolean flat;

	@Option(names = "--lazy", description = "Defer reading the sliced values.")
	private boolean lazy;

	@Option(names = "--log-level", converter = LevelConverter.class, description = "Root log level, e.g. DEBUG.")
	private final Level logLevel = null;

	@Override
	public Integer call() {

		LogUtils.setRootLoggerLevel(logLevel == null ? Level.INFO : logLevel);
		final PrintWriter out = spec.commandLine().getOut();
		try {
			inspect(new N5FSReader(container), out);
			return 0;
		} catch (final IOException | InconsistentUsidSchema | UsidRuntimeException e) {
			LOG.error("Unable to inspect {} in {}: {}", dataset, container, e.getMessage());
			LOG.debug("Stack trace", e);
			spec.commandLine().getErr().println(e.getMessage());
			return 1;
		}
	}

	private <T extends NativeType<T> & RealType<T>> void inspect(final N5Reader n5, final PrintWriter out) throws IOException, InconsistentUsidSchema {

		final UsidDataset<T> usid = UsidDataset.open(n5, dataset, UsidConfigYaml.load());
		if (sorted)
			usid.toggleSorting();

		out.println(usid.getDataset());
		out.printf("Quantity: %s (%s)%n", usid.getQuantity(), usid.getUnits());
		for (final AxisGroup group : AxisGroup.values()) {
			out.printf("%s dimensions:%n", group.name().charAt(0) + group.name().substring(1).toLowerCase());
			for (final Dimension dimension : usid.getRegistry().dimensions(group, usid.getDimensionOrder()))
				out.println(dimension);
		}
		out.println(usid.getCurrentSorting());

		final Map<String, Selector> selectors = new LinkedHashMap<>();
		if (selections != null)
			selections.forEach((name, text) -> selectors.put(name, Selectors.parse(name, text)));
		final SliceResult<T> result = usid.slice(selectors, !flat, Evaluations.of(lazy, usid.getConfig()));
		LOG.info("Sliced {} with {}: {}", usid.getDataset(), selectors, result);
		out.printf("Axes: %s%n", result.getAxisLabels());
		out.printf("Shape: %s%n", Arrays.toString(Intervals.dimensionsAsLongArray(result.getData())));
		out.printf("Success: %s%n", result.isSuccess());
		out.printf("N-dimensional form: %s%n", result.isNDimForm());
		out.flush();
	}

	public static int run(final String... args) {

		return new CommandLine(new UsidInspect()).execute(args);
	}

	public static int run(final PrintWriter out, final PrintWriter err, final String... args) {

		return new CommandLine(new UsidInspect())
				.setOut(out)
				.setErr(err)
				.execute(args);
	}

	public static void main(final String[] args) {

		System.exit(run(args));
	}

	private static class LevelConverter implements CommandLine.ITypeConverter<Level> {

		@Override
		public Level convert(final String s) {

			final Level level = Level.toLevel(s, null);
			if (level == null)
				throw new CommandLine.TypeConversionException(String.format("Not a log level: `%s'", s));
			return level;
		}
	}
}
