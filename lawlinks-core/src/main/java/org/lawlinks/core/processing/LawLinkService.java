package org.lawlinks.core.processing;

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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.lawlinks.core.alias.AliasIndexException;
import org.lawlinks.core.alias.AliasMappingReader;
import org.lawlinks.core.alias.LawAliasIndex;
import org.lawlinks.core.conf.ConfigLoader;
import org.lawlinks.core.extract.LinkExtractor;
import org.lawlinks.core.extract.LookaheadScanner;
import org.lawlinks.core.nlp.DictionaryMorphology;
import org.lawlinks.core.nlp.Lemmatizer;
import org.lawlinks.core.nlp.Tokenizer;
import org.lawlinks.core.om.LawLink;
import org.lawlinks.core.util.Logger;

/**
 * Entry point for citation detection.
 * <p>
 * {@link #start(ConfigLoader)} loads the alias mapping and the morphology
 * dictionary once and builds the index; the resulting service is immutable and
 * {@link #detect(String)} may be called from any number of threads.
 */
public final class LawLinkService {

	private final LawAliasIndex index;
	private final LinkExtractor extractor;

	/**
	 * Wires a service around an existing index.
	 *
	 * @param tokenizer must be the tokenizer the index was built with
	 */
	public LawLinkService(LawAliasIndex index, Tokenizer tokenizer, int lookaheadTokens) {
		this(index, new LinkExtractor(index, new LookaheadScanner(tokenizer, lookaheadTokens)));
	}

	LawLinkService(LawAliasIndex index, LinkExtractor extractor) {
		this.index = Objects.requireNonNull(index, "index must not be null");
		this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
	}

	/**
	 * Builds a ready service from configuration.
	 *
	 * @throws AliasIndexException if the configuration is incomplete or the alias
	 *                             mapping cannot be turned into an index
	 */
	public static LawLinkService start(ConfigLoader cfg) throws AliasIndexException {
		return start(cfg, new AliasMappingReader());
	}

	static LawLinkService start(ConfigLoader cfg, AliasMappingReader reader) throws AliasIndexException {
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			throw new AliasIndexException("Invalid configuration: " + String.join("; ", issues));
		}

		long t0 = System.currentTimeMillis();

		Lemmatizer lemmatizer;
		if (cfg.isMorphologyEnabled()) {
			lemmatizer = new Lemmatizer(DictionaryMorphology.load(cfg.getMorphologyDictionary(), cfg.isStemFallback()));
		} else {
			Logger.info("Morphology disabled; using lower-case normalization only");
			lemmatizer = Lemmatizer.withoutMorphology();
		}
		Tokenizer tokenizer = new Tokenizer(lemmatizer);

		Map<String, List<String>> aliases = reader.read(cfg.getAliasFile());
		LawAliasIndex index = LawAliasIndex.build(aliases, tokenizer, cfg.isCompactMatching());

		Logger.info("LawLinks service started in {} ms: {} laws, lookahead {} tokens, compact matching {}",
				System.currentTimeMillis() - t0, index.getLawCount(), cfg.getLookaheadTokens(),
				index.isCompactEnabled() ? "on" : "off");
		return new LawLinkService(index, tokenizer, cfg.getLookaheadTokens());
	}

	/**
	 * Citations found in {@code text}, in detection order. Never throws; an
	 * unexpected failure is logged and reported as no links.
	 */
	public List<LawLink> detect(String text) {
		if (text == null || text.isBlank()) return Collections.emptyList();
		try {
			return extractor.extract(text);
		} catch (RuntimeException | StackOverflowError e) {
			Logger.error("Link detection failed for text of length {}", e, text.length());
			return Collections.emptyList();
		}
	}

	public LawAliasIndex getIndex() {
		return index;
	}
}
