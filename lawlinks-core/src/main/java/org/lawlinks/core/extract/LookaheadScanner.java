package org.lawlinks.core.extract;

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

import org.lawlinks.core.alias.LegalLexicon;
import org.lawlinks.core.nlp.Token;
import org.lawlinks.core.nlp.Tokenizer;

/**
 * Collects the tokens that follow a citation label, where the law name is
 * expected.
 * <p>
 * The scan stops after {@code budget} word tokens. When a document anchor
 * ("кодекс", "закон", "ГК", ...) was seen and the scan is inside quotes, it
 * keeps going until the quotes close, so a quoted title such as
 * <i>Федеральный закон «О защите прав потребителей»</i> is collected whole.
 * {@link #MAX_TOKENS} bounds the scan for unbalanced quotes.
 */
public final class LookaheadScanner {

	/** Hard cap on collected tokens, punctuation included. */
	public static final int MAX_TOKENS = 800;

	private final Tokenizer tokenizer;
	private final int budget;

	/**
	 * @param budget word tokens to scan; must be positive
	 */
	public LookaheadScanner(Tokenizer tokenizer, int budget) {
		if (budget <= 0) {
			throw new IllegalArgumentException("Lookahead budget must be positive: " + budget);
		}
		this.tokenizer = tokenizer;
		this.budget = budget;
	}

	/**
	 * Tokens of {@code text} from offset {@code from} on, bounded as described
	 * above. Never null.
	 */
	public List<Token> window(String text, int from) {
		List<Token> window = new ArrayList<>();
		if (text == null || from >= text.length()) return window;

		QuoteState quotes = new QuoteState();
		boolean anchorSeen = false;
		int words = 0;

		Iterator<Token> it = tokenizer.tokens(text, from);
		while (it.hasNext()) {
			Token t = it.next();
			window.add(t);
			if (!t.isPunctuation()) {
				words++;
				if (LegalLexicon.isAnchor(t.getLemma())) {
					anchorSeen = true;
				}
			}
			quotes.accept(t.getText());

			if (words >= budget && !(anchorSeen && quotes.isOpen())) break;
			if (window.size() >= MAX_TOKENS) break;
		}
		return window;
	}

	/**
	 * Whether an article label occurs among the next {@code budget} word tokens.
	 * Used to leave "п. 2 ... ст. 5" to the full grammar.
	 */
	public boolean hasArticleLabelAhead(String text, int from) {
		if (text == null || from >= text.length()) return false;

		int words = 0;
		Iterator<Token> it = tokenizer.tokens(text, from);
		while (it.hasNext()) {
			Token t = it.next();
			if (t.isPunctuation()) continue;
			words++;
			if (isArticleLabel(t)) return true;
			if (words >= budget) break;
		}
		return false;
	}

	private static boolean isArticleLabel(Token t) {
		String lemma = t.getLemma();
		return "статья".equals(lemma) || "ст".equals(lemma) || CitationGrammar.isArticleWord(t.getText());
	}

	/**
	 * Open/closed state of the three quote families. ASCII quotes toggle,
	 * guillemets open and close, and typographic quotes open with „ and close
	 * with ” or ‟ while “ toggles (it closes „…“ and opens “…”).
	 */
	static final class QuoteState {

		private boolean ascii;
		private boolean angle;
		private boolean typographic;

		void accept(String surface) {
			switch (surface) {
				case "\"":
					ascii = !ascii;
					break;
				case "«":
					angle = true;
					break;
				case "»":
					angle = false;
					break;
				case "„":
					typographic = true;
					break;
				case "”":
				case "‟":
					typographic = false;
					break;
				case "“":
					typographic = !typographic;
					break;
				default:
					break;
			}
		}

		boolean isOpen() {
			return ascii || angle || typographic;
		}
	}
}
