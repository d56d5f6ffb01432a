package org.lawlinks.core.nlp;

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
import java.util.Locale;
import java.util.Optional;

import org.lawlinks.core.util.Logger;
import org.tartarus.snowball.ext.RussianStemmer;

import opennlp.tools.lemmatizer.DictionaryLemmatizer;

/**
 * {@link Morphology} backed by an OpenNLP lemma dictionary with an optional
 * Snowball stemmer backoff.
 * <p>
 * The dictionary holds {@code word<TAB>tag<TAB>lemma} rows with lower case
 * words and OpenCorpora-style tags. No POS tagger is run: tags are tried in
 * {@link #TAG_PREFERENCE} order and the first hit wins. Words missing from
 * the dictionary are stemmed when {@code stemFallback} is set, which keeps
 * inflected forms of the same unknown word on one key.
 */
public final class DictionaryMorphology implements Morphology {

	/** Order in which tags are tried for an untagged word. */
	static final String[] TAG_PREFERENCE = { "NOUN", "ADJF", "PRTF", "VERB", "ADVB", "NUMR", "PREP", "CONJ" };

	private static final String NO_LEMMA = "O";

	private static final ThreadLocal<RussianStemmer> STEMMER = ThreadLocal.withInitial(RussianStemmer::new);

	// shared for reads
	private final DictionaryLemmatizer dictionary;
	private final boolean stemFallback;

	private DictionaryMorphology(DictionaryLemmatizer dictionary, boolean stemFallback) {
		this.dictionary = dictionary;
		this.stemFallback = stemFallback;
	}

	/**
	 * Reads a dictionary from the stream (UTF-8).
	 *
	 * @throws IOException if the stream cannot be read or parsed
	 */
	public static DictionaryMorphology fromStream(InputStream in, boolean stemFallback) throws IOException {
		try {
			return new DictionaryMorphology(new DictionaryLemmatizer(in), stemFallback);
		} catch (RuntimeException malformed) {
			throw new IOException("Malformed lemma dictionary: " + malformed.getMessage(), malformed);
		}
	}

	/**
	 * Loads the dictionary from the filesystem, then the classpath. A missing
	 * or unreadable dictionary is logged and yields a morphology that only
	 * stems (or answers nothing when stemming is off).
	 */
	public static DictionaryMorphology load(String path, boolean stemFallback) {
		try (InputStream in = tryOpen(path)) {
			if (in == null) {
				Logger.warn("Lemma dictionary not found: {}", path);
				return new DictionaryMorphology(null, stemFallback);
			}
			DictionaryMorphology m = fromStream(in, stemFallback);
			Logger.info("Lemma dictionary loaded: {} ({} entries)", path, m.size());
			return m;
		} catch (IOException e) {
			Logger.warn("Lemma dictionary unreadable: {} :: {}", path, e.getMessage());
			return new DictionaryMorphology(null, stemFallback);
		}
	}

	/** Stemmer only, no dictionary. */
	public static DictionaryMorphology stemmerOnly() {
		return new DictionaryMorphology(null, true);
	}

	/** Number of (word, tag) entries; 0 without a dictionary. */
	public int size() {
		return dictionary == null ? 0 : dictionary.getDictMap().size();
	}

	@Override
	public Optional<String> normalForm(String word) {
		if (word == null || word.isBlank()) return Optional.empty();
		String lower = word.trim().toLowerCase(Locale.ROOT);

		if (dictionary != null) {
			String lemma = lookup(lower);
			if (lemma == null && lower.indexOf('ё') >= 0) {
				lemma = lookup(lower.replace('ё', 'е'));
			}
			if (lemma != null) return Optional.of(lemma);
		}
		if (stemFallback) {
			return Optional.of(stem(lower));
		}
		return Optional.empty();
	}

	private String lookup(String lower) {
		String[] tokens = { lower };
		for (String tag : TAG_PREFERENCE) {
			String[] lemmas = dictionary.lemmatize(tokens, new String[] { tag });
			if (lemmas.length > 0 && !NO_LEMMA.equals(lemmas[0])) {
				return lemmas[0];
			}
		}
		return null;
	}

	private static String stem(String lower) {
		RussianStemmer st = STEMMER.get();
		st.setCurrent(lower);
		return st.stem() ? st.getCurrent() : lower;
	}

	private static InputStream tryOpen(String path) throws IOException {
		if (path == null || path.isBlank()) return null;
		try {
			Path p = Path.of(path);
			if (Files.isReadable(p)) return Files.newInputStream(p);
		} catch (InvalidPathException notAPath) {
			Logger.debug("Not a filesystem path, trying classpath: {}", path);
		}
		return DictionaryMorphology.class.getClassLoader().getResourceAsStream(path);
	}
}
