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

import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.lawlinks.core.util.Logger;

/**
 * Normalizes tokens to the form used for alias matching.
 * <ul>
 * <li>"№" and punctuation are kept as-is.</li>
 * <li>Numbers: en/em dashes become "-".</li>
 * <li>Latin words: lower case.</li>
 * <li>All-caps Cyrillic: lower case with "ё" folded to "е"; abbreviations are
 * never sent to morphology.</li>
 * <li>Other Cyrillic words: morphology normal form, folded. When morphology is
 * absent, answers nothing, or throws, the folded lower case form is used.</li>
 * </ul>
 * The fallback path cannot fail, so {@link #lemma(String)} never throws for a
 * non-null argument.
 */
public final class Lemmatizer {

	private final Morphology morphology;

	/** @param morphology may be {@code null}: fallback normalization only */
	public Lemmatizer(Morphology morphology) {
		this.morphology = morphology;
	}

	public static Lemmatizer withoutMorphology() {
		return new Lemmatizer(null);
	}

	public boolean hasMorphology() {
		return morphology != null;
	}

	public String lemma(String surface) {
		return lemma(TokenKind.classify(surface), surface);
	}

	public String lemma(TokenKind kind, String surface) {
		if (surface == null) return "";
		switch (kind) {
			case NUMBER_SIGN:
			case PUNCTUATION:
				return surface;
			case NUMBER:
				return StringUtils.replaceChars(surface, "–—", "--");
			case LATIN_WORD:
				return surface.toLowerCase(Locale.ROOT);
			case CAPITALIZED_WORD:
			case LOWERCASE_WORD:
				return morphLemma(surface);
			case ABBREVIATION:
			default:
				return fold(surface);
		}
	}

	private String morphLemma(String word) {
		if (morphology == null) return fold(word);
		try {
			Optional<String> normal = morphology.normalForm(word);
			if (normal != null && normal.isPresent() && !normal.get().isBlank()) {
				return fold(normal.get());
			}
		} catch (RuntimeException ex) {
			Logger.debug("Morphology failed for '{}': {}", word, ex.toString());
		}
		return fold(word);
	}

	/** Lower case with "ё" folded to "е". */
	public static String fold(String s) {
		if (s == null) return "";
		return s.toLowerCase(Locale.ROOT).replace('ё', 'е');
	}
}
