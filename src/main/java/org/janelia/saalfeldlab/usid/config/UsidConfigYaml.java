package org.janelia.saalfeldlab.usid.config;

import com.pivovarit.function.ThrowingSupplier;
import org.janelia.saalfeldlab.usid.evaluation.EvaluationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads {@link UsidConfig} from YAML. The file named by system property {@value #CONFIG_PROPERTY} takes precedence
 * over the class path resource {@value #USID_YAML}; missing files and missing keys fall back to the defaults.
 * <pre>
 * evaluation:
 *   mode: deferred
 *   threads: 4
 *   blockSize: 128
 * </pre>
 */
public class UsidConfigYaml {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public static final String CONFIG_PROPERTY = "usid.config";

	public static final String USID_YAML = "usid.yml";

	private static final String EVALUATION = "evaluation";

	private UsidConfigYaml() {

	}

	public static UsidConfig load() {

		return fromMap(getConfig());
	}

	public static UsidConfig load(final Path path) {

		return fromMap(readConfigUnchecked(path));
	}

	public static UsidConfig fromMap(final Map<?, ?> config) {

		final String modeName = getConfig(config, () -> UsidConfig.DEFAULT_MODE.name(), String.class, EVALUATION, "mode");
		final EvaluationMode mode = EvaluationMode.fromName(modeName).orElseGet(() -> {
			LOG.warn("Unknown evaluation mode `{}', using {}", modeName, UsidConfig.DEFAULT_MODE);
			return UsidConfig.DEFAULT_MODE;
		});
		final int threads = getConfig(config, () -> UsidConfig.DEFAULT_THREADS, Integer.class, EVALUATION, "threads");
		final int blockSize = getConfig(config, () -> UsidConfig.DEFAULT_BLOCK_SIZE, Integer.class, EVALUATION, "blockSize");
		final UsidConfig usidConfig = new UsidConfig(mode, threads, blockSize);
		LOG.debug("Using {}", usidConfig);
		return usidConfig;
	}

	/**
	 * @param config   nested YAML maps
	 * @param fallBack supplies the value if any segment is missing or the value is not a {@code T}
	 * @param segments path of keys into {@code config}
	 */
	public static <T> T getConfig(final Map<?, ?> config, final Supplier<T> fallBack, final Class<T> type, final String... segments) {

		Map<?, ?> currentConfig = config;
		for (int i = 0; i < segments.length; i++) {
			final Object value = currentConfig.get(segments[i]);
			if (value == null)
				return fallBack.get();
			if (i == segments.length - 1)
				return type.isInstance(value) ? type.cast(value) : fallBack.get();
			if (value instanceof Map<?, ?>)
				currentConfig = (Map<?, ?>)value;
			else
				return fallBack.get();
		}
		return fallBack.get();
	}

	public static Map<?, ?> getConfig() {

		final String configPath = System.getProperty(CONFIG_PROPERTY);
		if (configPath != null)
			return readConfigUnchecked(Paths.get(configPath));
		return readResourceUnchecked();
	}

	private static Map<?, ?> readConfigUnchecked(final Path usidYaml) {

		return ThrowingSupplier.unchecked(() -> readConfig(usidYaml)).get();
	}

	private static Map<?, ?> readResourceUnchecked() {

		return ThrowingSupplier.unchecked(UsidConfigYaml::readResource).get();
	}

	private static Map<?, ?> readConfig(final Path usidYaml) throws IOException {

		try (final InputStream fis = new FileInputStream(usidYaml.toFile())) {
			return load(fis, usidYaml.toString());
		} catch (final FileNotFoundException e) {
			LOG.debug("Config file not found: {}", e.getMessage());
		}
		return new HashMap<>();
	}

	private static Map<?, ?> readResource() throws IOException {

		try (final InputStream is = UsidConfigYaml.class.getClassLoader().getResourceAsStream(USID_YAML)) {
			if (is == null) {
				LOG.debug("No {} on the class path", USID_YAML);
				return new HashMap<>();
			}
			return load(is, USID_YAML);
		}
	}

	private static Map<?, ?> load(final InputStream is, final String source) {

		final Object data = new Yaml().load(is);
		LOG.debug("Loaded config from {}: {}", source, data);
		return data instanceof Map<?, ?> ? (Map<?, ?>)data : new HashMap<>();
	}
}
