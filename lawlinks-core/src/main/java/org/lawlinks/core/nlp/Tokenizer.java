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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Russian legal text into typed tokens and lemmatizes them.
 * <p>
 * Token classes are tried in a fixed order: "№", numbers (before any word
 * class so "12.3-14" is never split into words), Latin words, all-caps
 * Cyrillic runs, capitalized words, lowercase words, single punctuation
 * characters. Characters outside these classes are skipped.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class Tokenizer {

	/** Character-class body of the punctuation set, regex escaped. */
	static final String PUNCT_CHARS = "\\.,;:!?()\\[\\]{}\"«»“”„‟‹›—–\\-";

	private static final Pattern TOKEN_RE = Pattern.compile(
			"(№)"
			+ "|(\\d+(?:\\.\\d+)*(?:[-–—]\\d+(?:\\.\\d+)*)?)"
			+ "|([A-Za-z]+)"
			+ "|([А-ЯЁ]{2,})"
			+ "|([А-ЯЁ][а-яё]+)"
			+ "|([а-яё]+)"
			+ "|([" + PUNCT_CHARS + "])");

	/** Group index → token kind. */
	private static final TokenKind[] GROUP_KINDS = {
			null,
			TokenKind.NUMBER_SIGN,
			TokenKind.NUMBER,
			TokenKind.LATIN_WORD,
			TokenKind.ABBREVIATION,
			TokenKind.CAPITALIZED_WORD,
			TokenKind.LOWERCASE_WORD,
			TokenKind.PUNCTUATION
	};

	private final Lemmatizer lemmatizer;

	public Tokenizer(Lemmatizer lemmatizer) {
		this.lemmatizer = Objects.requireNonNull(lemmatizer, "lemmatizer must not be null");
	}

	/** Tokenize and lemmatize the whole text. Null → empty list. */
	public List<Token> tokenize(String text) {
		List<Token> out = new ArrayList<>();
		if (text == null || text.isEmpty()) return out;
		tokens(text, 0).forEachRemaining(out::add);
		return out;
	}

	/**
	 * Lazily tokenizes {@code text} starting at character offset {@code from}.
	 * Offsets of the returned tokens refer to {@code text}. Each token is
	 * lemmatized only when it is pulled from the iterator.
	 */
	public Iterator<Token> tokens(String text, int from) {
		return new TokenIterator(text == null ? "" : text, from);
	}

	/** Surface strings only, no lemmatization. */
	public static List<String> split(String text) {
		List<String> out = new ArrayList<>();
		if (text == null || text.isEmpty()) return out;
		Matcher m = TOKEN_RE.matcher(text);
		while (m.find()) {
			out.add(m.group());
		}
		return out;
	}

	private final class TokenIterator implements Iterator<Token> {

		private final Matcher matcher;
		private Token next;
		private boolean done;

		TokenIterator(String text, int from) {
			this.matcher = TOKEN_RE.matcher(text);
			int start = Math.max(0, Math.min(from, text.length()));
			matcher.region(start, text.length());
		}

		@Override
		public boolean hasNext() {
			if (next != null) return true;
			if (done) return false;
			if (!matcher.find()) {
				done = true;
				return false;
			}
			TokenKind kind = kindOf(matcher);
			String surface = matcher.group();
			next = new Token(surface, lemmatizer.lemma(kind, surface), kind, matcher.start());
			return true;
		}

		@Override
		public Token next() {
			if (!hasNext()) throw new NoSuchElementException();
			Token t = next;
			next = null;
			return t;
		}
	}

	private static TokenKind kindOf(Matcher m) {
		for (int g = 1; g < GROUP_KINDS.length; g++) {
			if (m.start(g) >= 0) return GROUP_KINDS[g];
		}
		return TokenKind.OTHER;
	}
}
