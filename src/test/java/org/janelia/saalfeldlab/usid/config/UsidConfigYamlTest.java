package org.janelia.saalfeldlab.usid.config;

import org.janelia.saalfeldlab.usid.evaluation.EvaluationMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UsidConfigYamlTest {

	@Test
	public void testClassPathResource() {

		final UsidConfig config = UsidConfigYaml.load();
		assertEquals(EvaluationMode.EAGER, config.getMode());
		assertEquals(2, config.getThreads());
		assertEquals(8, config.getBlockSize());
	}

	@Test
	public void testSystemPropertyTakesPrecedence(@TempDir final Path tmp) throws IOException {

		final Path yaml = tmp.resolve("usid.yml");
		Files.writeString(yaml, "evaluation:\n  mode: Deferred\n  blockSize: 16\n");
		System.setProperty(UsidConfigYaml.CONFIG_PROPERTY, yaml.toString());
		try {
			final UsidConfig config = UsidConfigYaml.load();
			assertEquals(EvaluationMode.DEFERRED, config.getMode());
			assertEquals(UsidConfig.DEFAULT_THREADS, config.getThreads());
			assertEquals(16, config.getBlockSize());
		} finally {
			System.clearProperty(UsidConfigYaml.CONFIG_PROPERTY);
		}
	}

	@Test
	public void testMissingFileFallsBackToDefaults(@TempDir final Path tmp) {

		final UsidConfig config = UsidConfigYaml.load(tmp.resolve("does-not-exist.yml"));
		assertEquals(UsidConfig.DEFAULT_MODE, config.getMode());
		assertEquals(UsidConfig.DEFAULT_THREADS, config.getThreads());
		assertEquals(UsidConfig.DEFAULT_BLOCK_SIZE, config.getBlockSize());
	}

	@Test
	public void testInvalidValuesFallBack() {

		final UsidConfig config = UsidConfigYaml.fromMap(Map.of("evaluation", Map.of("mode", "sometimes", "threads", "many", "blockSize", 32)));
		assertEquals(UsidConfig.DEFAULT_MODE, config.getMode());
		assertEquals(UsidConfig.DEFAULT_THREADS, config.getThreads());
		assertEquals(32, config.getBlockSize());

		assertEquals(UsidConfig.DEFAULT_MODE, UsidConfigYaml.fromMap(Map.of("evaluation", "eager")).getMode());
	}

	@Test
	public void testGetConfig() {

		final Map<String, Object> config = Map.of("a", Map.of("b", Map.of("c", 3)));
		assertEquals(3, (int)UsidConfigYaml.getConfig(config, () -> -1, Integer.class, "a", "b", "c"));
		assertEquals(-1, (int)UsidConfigYaml.getConfig(config, () -> -1, Integer.class, "a", "x", "c"));
		assertEquals(-1, (int)UsidConfigYaml.getConfig(config, () -> -1, Integer.class, "a", "b", "c", "d"));
		assertEquals("fallback", UsidConfigYaml.getConfig(config, () -> "fallback", String.class, "a", "b", "c"));
	}

	@Test
	public void testInvalidBlockSize() {

		assertThrows(IllegalArgumentException.class, () -> new UsidConfig(EvaluationMode.EAGER, 1, 0));
	}
}
