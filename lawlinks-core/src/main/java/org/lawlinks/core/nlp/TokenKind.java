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

import java.util.regex.Pattern;

/**
 * Lexical classes produced by {@link Tokenizer}, in the precedence order the
 * tokenizer tries them.
 */
public enum TokenKind {

	/** The literal number sign "№". */
	NUMBER_SIGN,
	/** Numbers with optional dotted parts and a dash range, e.g. "12.3-14.1". */
	NUMBER,
	LATIN_WORD,
	/** All-caps Cyrillic run of two or more letters (ГК, РФ, КОАП). */
	ABBREVIATION,
	CAPITALIZED_WORD,
	LOWERCASE_WORD,
	/** A single punctuation, dash or quote character. */
	PUNCTUATION,
	OTHER;

	static final String NUMBER_SIGN_TEXT = "№";

	private static final Pattern NUMBER_RE = Pattern.compile("\\d+(?:\\.\\d+)*(?:[-–—]\\d+(?:\\.\\d+)*)?");
	private static final Pattern PUNCT_RE = Pattern.compile("[" + Tokenizer.PUNCT_CHARS + "]+");
	private static final Pattern LATIN_RE = Pattern.compile("[A-Za-z]+");
	private static final Pattern ABBREVIATION_RE = Pattern.compile("[А-ЯЁ]{2,}");
	private static final Pattern CYRILLIC_RE = Pattern.compile("[А-Яа-яЁё]+");

	/**
	 * Classifies a standalone surface string the same way the tokenizer would
	 * have typed it. Cyrillic words of mixed case ("КоАП") count as words.
	 */
	public static TokenKind classify(String surface) {
		if (surface == null || surface.isEmpty()) return OTHER;
		if (NUMBER_SIGN_TEXT.equals(surface)) return NUMBER_SIGN;
		if (NUMBER_RE.matcher(surface).matches()) return NUMBER;
		if (PUNCT_RE.matcher(surface).matches()) return PUNCTUATION;
		if (LATIN_RE.matcher(surface).matches()) return LATIN_WORD;
		if (ABBREVIATION_RE.matcher(surface).matches()) return ABBREVIATION;
		if (CYRILLIC_RE.matcher(surface).matches()) {
			return Character.isUpperCase(surface.charAt(0)) ? CAPITALIZED_WORD : LOWERCASE_WORD;
		}
		return OTHER;
	}
}
