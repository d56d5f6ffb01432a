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

import java.util.Set;

/**
 * Fixed lemma vocabularies used by alias matching and the lookahead scan.
 */
public final class LegalLexicon {

	private LegalLexicon() {
	}

	/** Document-type words that announce a law name ("закон", "кодекс", ...). */
	public static final Set<String> DOC_ANCHORS = Set.of(
			"закон", "кодекс", "указ", "постановление", "положение", "правило", "правила");

	/** Lemmas of common code abbreviations. */
	public static final Set<String> ABBR_LEMMAS = Set.of(
			"апк", "гк", "гпк", "ук", "нк", "жк", "ск", "тк", "коап", "рф", "фз");

	/** Country and federation filler words dropped for compact matching. */
	public static final Set<String> OPTIONAL_LEMMAS = Set.of(
			"российский", "федерация", "рф", "россия", "федеральный");

	public static boolean isAnchor(String lemma) {
		return DOC_ANCHORS.contains(lemma) || ABBR_LEMMAS.contains(lemma);
	}

	public static boolean isAbbreviation(String lemma) {
		return ABBR_LEMMAS.contains(lemma);
	}

	public static boolean isOptional(String lemma) {
		return OPTIONAL_LEMMAS.contains(lemma);
	}
}
