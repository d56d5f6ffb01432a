package org.lawlinks.core.conf;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@BeforeEach
	void rememberSysProp() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
	}

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loads_from_file_with_defaults() throws Exception {
		Properties p = new Properties();
		p.setProperty("ALIAS_FILE", "/data/законы.json");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "conf1.properties"));

		assertEquals("/data/законы.json", loader.getAliasFile());
		assertEquals(ConfigLoader.DEFAULT_LOOKAHEAD_TOKENS, loader.getLookaheadTokens());
		assertTrue(loader.isCompactMatching());
		assertTrue(loader.isMorphologyEnabled());
		assertTrue(loader.isStemFallback());
		assertEquals(ConfigLoader.DEFAULT_MORPH_DICT, loader.getMorphologyDictionary());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void reads_utf8_file_written_by_hand() throws Exception {
		Path f = tmp.resolve("utf8.properties");
		Files.writeString(f, "ALIAS_FILE=/data/законы.json\nLOOKAHEAD_TOKENS=20\nCOMPACT_MATCHING=off\n");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("/data/законы.json", loader.getAliasFile());
		assertEquals(20, loader.getLookaheadTokens());
		assertFalse(loader.isCompactMatching());
	}

	@Test
	void validate_reports_missing_and_malformed_values() {
		Properties p = new Properties();
		p.setProperty("LOOKAHEAD_TOKENS", "many");
		p.setProperty("MORPH_ENABLED", "perhaps");
		ConfigLoader loader = new ConfigLoader(p);

		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: ALIAS_FILE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("LOOKAHEAD_TOKENS")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("MORPH_ENABLED")));
		assertThrows(IllegalStateException.class, loader::getAliasFile);
	}

	@Test
	void malformed_values_fall_back_to_defaults() {
		Properties p = new Properties();
		p.setProperty("LOOKAHEAD_TOKENS", "-3");
		p.setProperty("MORPH_ENABLED", "perhaps");
		p.setProperty("MORPH_STEM_FALLBACK", "no");
		ConfigLoader loader = new ConfigLoader(p);

		assertEquals(ConfigLoader.DEFAULT_LOOKAHEAD_TOKENS, loader.getLookaheadTokens());
		assertTrue(loader.isMorphologyEnabled());
		assertFalse(loader.isStemFallback());
		assertTrue(loader.validate().stream().anyMatch(s -> s.contains("positive")));
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = new Properties();
		p.setProperty("ALIAS_FILE", "override.json");
		Path f = writePropsFile(p, "override.properties");
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toString());

		assertEquals("override.json", new ConfigLoader().getAliasFile());
	}

	@Test
	void default_classpath_config_is_usable() {
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		ConfigLoader loader = new ConfigLoader();

		assertEquals("aliases/law_aliases.json", loader.getAliasFile());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("nope.properties")));
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader((Path) null));
	}
}
