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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.lawlinks.core.util.Logger;

/**
 * Loads LawLinks configuration from a {@code .properties} file.
 * <p>
 * By default the loader reads <code>config/lawlinks.properties</code> from the
 * classpath. Setting the system property <code>lawlinks.config</code> to a
 * readable path overrides it, as does the {@link #ConfigLoader(Path)}
 * constructor. Files are read as UTF-8 so alias paths may contain Cyrillic.
 *
 * <h3>Keys</h3>
 * <ul>
 * <li><code>ALIAS_FILE</code> (required) – law alias mapping, JSON.</li>
 * <li><code>LOOKAHEAD_TOKENS</code> – words scanned after a citation label
 * (default {@value #DEFAULT_LOOKAHEAD_TOKENS}).</li>
 * <li><code>COMPACT_MATCHING</code> – match aliases without filler words
 * (default true).</li>
 * <li><code>MORPH_ENABLED</code>, <code>MORPH_DICT</code>,
 * <code>MORPH_STEM_FALLBACK</code> – Russian morphology settings.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/lawlinks.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "lawlinks.config";

	public static final int DEFAULT_LOOKAHEAD_TOKENS = 12;
	public static final String DEFAULT_MORPH_DICT = "models/ru-lemmatizer.dict";

	// ---- Property keys -------------------------------------------------------
	private static final String K_ALIAS_FILE = "ALIAS_FILE";
	private static final String K_LOOKAHEAD_TOKENS = "LOOKAHEAD_TOKENS";
	private static final String K_COMPACT_MATCHING = "COMPACT_MATCHING";
	private static final String K_MORPH_ENABLED = "MORPH_ENABLED";
	private static final String K_MORPH_DICT = "MORPH_DICT";
	private static final String K_MORPH_STEM_FALLBACK = "MORPH_STEM_FALLBACK";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Reads {@value #SYS_PROP_CONFIG_PATH} if set and readable, otherwise the
	 * classpath resource {@value #DEFAULT_CLASSPATH_RESOURCE}.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Visible for tests: wrap already-built properties. */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks the keys the service needs before it starts. Never throws; the
	 * caller decides whether the issues are fatal.
	 *
	 * @return human-readable problems, empty when the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		requireNonBlank(K_ALIAS_FILE, issues);

		String lookahead = getOptional(K_LOOKAHEAD_TOKENS, null);
		if (lookahead != null) {
			try {
				if (Integer.parseInt(lookahead) <= 0) {
					issues.add(K_LOOKAHEAD_TOKENS + " must be a positive integer: " + lookahead);
				}
			} catch (NumberFormatException nfe) {
				issues.add(K_LOOKAHEAD_TOKENS + " is not an integer: " + lookahead);
			}
		}
		for (String flag : List.of(K_COMPACT_MATCHING, K_MORPH_ENABLED, K_MORPH_STEM_FALLBACK)) {
			String v = getOptional(flag, null);
			if (v != null && parseBoolean(v) == null) {
				issues.add(flag + " is not a boolean: " + v);
			}
		}
		return issues;
	}

	/** Alias mapping file (filesystem path or classpath resource). */
	public String getAliasFile() {
		return getRequired(K_ALIAS_FILE);
	}

	/**
	 * Non-punctuation tokens scanned after a citation label when looking for the
	 * law name. Invalid or non-positive values fall back to the default.
	 */
	public int getLookaheadTokens() {
		String raw = getOptional(K_LOOKAHEAD_TOKENS, null);
		if (raw == null) return DEFAULT_LOOKAHEAD_TOKENS;
		try {
			int val = Integer.parseInt(raw);
			if (val > 0) return val;
			Logger.warn("Non-positive {}: '{}'. Using default {}", K_LOOKAHEAD_TOKENS, raw, DEFAULT_LOOKAHEAD_TOKENS);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_LOOKAHEAD_TOKENS, raw, DEFAULT_LOOKAHEAD_TOKENS);
		}
		return DEFAULT_LOOKAHEAD_TOKENS;
	}

	public boolean isCompactMatching() {
		return getFlag(K_COMPACT_MATCHING, true);
	}

	public boolean isMorphologyEnabled() {
		return getFlag(K_MORPH_ENABLED, true);
	}

	/** Lemma dictionary in OpenNLP format (word, tag, lemma; tab separated). */
	public String getMorphologyDictionary() {
		return getOptional(K_MORPH_DICT, DEFAULT_MORPH_DICT);
	}

	/** Stem words the dictionary does not know instead of leaving them as-is. */
	public boolean isStemFallback() {
		return getFlag(K_MORPH_STEM_FALLBACK, true);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private void load(InputStream in) throws IOException {
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private boolean getFlag(String key, boolean defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null) return defaultVal;
		Boolean parsed = parseBoolean(raw);
		if (parsed == null) {
			Logger.warn("Invalid boolean for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
		return parsed;
	}

	private static Boolean parseBoolean(String raw) {
		switch (raw.trim().toLowerCase(Locale.ROOT)) {
			case "true": case "yes": case "on": case "1": return Boolean.TRUE;
			case "false": case "no": case "off": case "0": return Boolean.FALSE;
			default: return null;
		}
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}
