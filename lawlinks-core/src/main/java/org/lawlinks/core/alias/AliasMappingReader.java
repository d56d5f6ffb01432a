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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lawlinks.core.util.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the law alias mapping, a JSON object of the form
 *
 * <pre>
 * { "10": ["ГК РФ", "Гражданский кодекс Российской Федерации"], ... }
 * </pre>
 *
 * Key order is preserved, so the first law listed wins when two laws share an
 * alias. Values that are not arrays and array elements that are not strings
 * are skipped with a warning; law id keys are passed through unchecked and
 * validated by {@link LawAliasIndex#build}.
 */
public final class AliasMappingReader {

	private final ObjectMapper mapper;

	public AliasMappingReader() {
		this(new ObjectMapper());
	}

	public AliasMappingReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * Reads the mapping from a filesystem path, or from the classpath when no
	 * such file exists.
	 *
	 * @throws AliasIndexException if the source is missing or not a JSON object
	 */
	public Map<String, List<String>> read(String path) throws AliasIndexException {
		if (path == null || path.isBlank()) {
			throw new AliasIndexException("Alias file path is empty");
		}
		try (InputStream in = tryOpen(path)) {
			if (in == null) {
				throw new AliasIndexException("Alias file not found on filesystem or classpath: " + path);
			}
			Map<String, List<String>> mapping = parse(in);
			Logger.info("Alias mapping read: {} ({} laws)", path, mapping.size());
			return mapping;
		} catch (IOException e) {
			throw new AliasIndexException("Unable to read alias file " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Parses a mapping from a UTF-8 JSON stream. The stream is not closed.
	 *
	 * @throws AliasIndexException if the content is not a JSON object
	 */
	public Map<String, List<String>> parse(InputStream in) throws AliasIndexException {
		JsonNode root;
		try {
			root = mapper.readTree(in);
		} catch (JsonProcessingException e) {
			throw new AliasIndexException("Alias file is not valid JSON: " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new AliasIndexException("Unable to read alias JSON: " + e.getMessage(), e);
		}
		if (root == null || root.isMissingNode() || !root.isObject()) {
			throw new AliasIndexException("Alias JSON must be an object of law id to alias list");
		}

		Map<String, List<String>> mapping = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			JsonNode value = entry.getValue();
			if (!value.isArray()) {
				Logger.warn("Aliases for law {} are not a list; skipped", entry.getKey());
				continue;
			}
			List<String> aliases = new ArrayList<>(value.size());
			for (JsonNode alias : value) {
				if (alias.isTextual()) {
					aliases.add(alias.asText());
				} else {
					Logger.warn("Non-string alias for law {} skipped: {}", entry.getKey(), alias);
				}
			}
			mapping.put(entry.getKey(), aliases);
		}
		return mapping;
	}

	private static InputStream tryOpen(String path) throws IOException {
		try {
			Path p = Path.of(path);
			if (Files.isReadable(p)) return Files.newInputStream(p);
		} catch (InvalidPathException notAPath) {
			Logger.debug("Not a filesystem path, trying classpath: {}", path);
		}
		return AliasMappingReader.class.getClassLoader().getResourceAsStream(path);
	}
}
