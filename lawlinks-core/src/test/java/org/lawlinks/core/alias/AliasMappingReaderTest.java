package org.lawlinks.core.alias;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AliasMappingReaderTest {

	@TempDir
	Path tmp;

	private final AliasMappingReader reader = new AliasMappingReader();

	private static InputStream json(String s) {
		return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void keepsKeyOrderAndSkipsMalformedValues() throws Exception {
		Map<String, List<String>> m = reader.parse(json(
				"{\"20\": [\"ТК РФ\"], \"5\": \"not a list\", \"3\": [\"УК РФ\", 7, null, \"Уголовный кодекс\"]}"));

		assertEquals(List.of("20", "3"), new ArrayList<>(m.keySet()));
		assertEquals(List.of("ТК РФ"), m.get("20"));
		assertEquals(List.of("УК РФ", "Уголовный кодекс"), m.get("3"));
	}

	@Test
	void rejectsInvalidJson() {
		assertThrows(AliasIndexException.class, () -> reader.parse(json("{\"1\": [")));
		assertThrows(AliasIndexException.class, () -> reader.parse(json("[\"ГК РФ\"]")));
		assertThrows(AliasIndexException.class, () -> reader.parse(json("")));
	}

	@Test
	void readsFromFilesystem() throws Exception {
		Path f = tmp.resolve("aliases.json");
		Files.writeString(f, "{\"10\": [\"Гражданский кодекс\"]}", StandardCharsets.UTF_8);

		Map<String, List<String>> m = reader.read(f.toString());

		assertEquals(List.of("Гражданский кодекс"), m.get("10"));
	}

	@Test
	void fallsBackToClasspath() throws Exception {
		Map<String, List<String>> m = reader.read("aliases/law_aliases.json");

		assertTrue(m.get("10").contains("ГК РФ"));
	}

	@Test
	void missingSourceFails() {
		assertThrows(AliasIndexException.class, () -> reader.read(tmp.resolve("missing.json").toString()));
		assertThrows(AliasIndexException.class, () -> reader.read(" "));
	}
}
