package org.janelia.saalfeldlab.usid.cli;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.usid.UsidFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.janelia.saalfeldlab.usid.UsidFixtures.MAIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UsidInspectTest {

	@TempDir
	Path tmp;

	private String container;

	private final StringWriter out = new StringWriter();

	private final StringWriter err = new StringWriter();

	@BeforeEach
	public void setUp() throws IOException {

		container = tmp.toAbsolutePath().toString();
		UsidFixtures.writeReference(new N5FSWriter(container));
	}

	private int run(final String... args) {

		return UsidInspect.run(new PrintWriter(out, true), new PrintWriter(err, true), args);
	}

	@Test
	public void testSummary() {

		assertEquals(0, run(container, MAIN, "--log-level", "WARN"));
		final String output = out.toString();
		assertTrue(output.contains("X - size: 5"), output);
		assertTrue(output.contains("Cycle - size: 2"), output);
		assertTrue(output.contains("Data dimensions are in the order they occur in the file."), output);
		assertTrue(output.contains("Axes: [X, Y, Bias, Cycle]"), output);
		assertTrue(output.contains("Shape: [5, 3, 7, 2]"), output);
		assertTrue(output.contains("Success: true"), output);
	}

	@Test
	public void testSortedSelection() {

		assertEquals(0, run(container, MAIN, "--sorted", "--lazy", "--select", "X=1:5:2", "--select", "Cycle=1"));
		final String output = out.toString();
		assertTrue(output.contains("sorted by change rate"), output);
		assertTrue(output.contains("Axes: [Y, X, Bias]"), output);
		assertTrue(output.contains("Shape: [3, 2, 7]"), output);
	}

	@Test
	public void testFlat() {

		assertEquals(0, run(container, MAIN, "--flat", "--select", "Y=0,2"));
		final String output = out.toString();
		assertTrue(output.contains("Shape: [10, 14]"), output);
		assertTrue(output.contains("N-dimensional form: false"), output);
	}

	@Test
	public void testErrors() {

		assertEquals(1, run(container, MAIN, "--select", "blah=1"));
		assertEquals(1, run(container, MAIN, "--flat", "--select", "X=-1"));
		assertEquals(1, run(container, "not/there"));
		assertEquals(1, run(container));
		assertEquals(1, run(container, MAIN, "--log-level", "LOUD"));
	}
}
