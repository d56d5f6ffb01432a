package org.lawlinks.core;

/*
 * This file is part of LawLinks.
 *
 * Copyright (C) 2025 LawLinks contributors
 *
 * LawLinks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LawLinks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LawLinks.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lawlinks.core.conf.ConfigLoader;

class LawLinksMainTest {

	@TempDir
	Path tmp;

	private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

	private static LawLinksMain app(String aliasFile) {
		Properties p = new Properties();
		if (aliasFile != null) p.setProperty("ALIAS_FILE", aliasFile);
		p.setProperty("MORPH_ENABLED", "false");
		return new LawLinksMain(new ConfigLoader(p));
	}

	private static InputStream stdin(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	private int run(LawLinksMain app, InputStream in, String... args) {
		return app.run(args, in, new PrintStream(stdout, true, StandardCharsets.UTF_8));
	}

	private List<String> outputLines() {
		return List.of(stdout.toString(StandardCharsets.UTF_8).split("\\R"));
	}

	@Test
	void stdinToJson() {
		int status = run(app("aliases/test_aliases.json"), stdin("ст. 5 ГК РФ"));

		assertEquals(LawLinksMain.EXIT_OK, status);
		assertEquals(List.of("{\"links\":[{\"law_id\":10,\"article\":\"5\",\"point_article\":null,\"subpoint_article\":null}]}"),
				outputLines());
	}

	@Test
	void directoryInputsAreReadInNameOrder() throws Exception {
		Path dir = Files.createDirectory(tmp.resolve("docs"));
		Files.writeString(dir.resolve("b.txt"), "ч. 2 УК РФ");
		Files.writeString(dir.resolve("a.txt"), "Без ссылок.");
		Files.writeString(dir.resolve("notes.md"), "ст. 5 ГК РФ");

		int status = run(app("aliases/test_aliases.json"), stdin(""), dir.toString());

		assertEquals(LawLinksMain.EXIT_OK, status);
		assertEquals(List.of(
				"{\"links\":[]}",
				"{\"links\":[{\"law_id\":13,\"article\":null,\"point_article\":\"2\",\"subpoint_article\":null}]}"),
				outputLines());
	}

	@Test
	void csvOutput() throws Exception {
		Path in = tmp.resolve("doc.txt");
		Files.writeString(in, "пп. а, б п. 1 ст. 5 ГК РФ");
		Path csv = tmp.resolve("out.csv");

		int status = run(app("aliases/test_aliases.json"), stdin(""), "--csv", csv.toString(), in.toString());

		assertEquals(LawLinksMain.EXIT_OK, status);
		List<String> rows = Files.readAllLines(csv, StandardCharsets.UTF_8);
		assertEquals(3, rows.size());
		assertEquals("SOURCE,LAW_ID,ARTICLE,POINT_ARTICLE,SUBPOINT_ARTICLE", rows.get(0));
		assertEquals(in + ",10,5,1,а", rows.get(1));
		assertEquals(in + ",10,5,1,б", rows.get(2));
	}

	@Test
	void missingInputFileIsReported() {
		int status = run(app("aliases/test_aliases.json"), stdin(""), tmp.resolve("missing.txt").toString());

		assertEquals(LawLinksMain.EXIT_INPUT, status);
	}

	@Test
	void startupFailureExitsWithTwo() {
		assertEquals(LawLinksMain.EXIT_STARTUP, run(app(null), stdin("ст. 5 ГК РФ")));
		assertEquals(LawLinksMain.EXIT_STARTUP, run(app("no/such.json"), stdin("ст. 5 ГК РФ")));
		assertTrue(stdout.toString(StandardCharsets.UTF_8).isEmpty());
	}

	@Test
	void csvOptionNeedsAValue() {
		assertEquals(LawLinksMain.EXIT_INPUT, run(app("aliases/test_aliases.json"), stdin(""), "--csv"));
	}
}
