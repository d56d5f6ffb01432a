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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.lawlinks.core.nlp.Lemmatizer;
import org.lawlinks.core.nlp.Token;
import org.lawlinks.core.nlp.Tokenizer;

class LookaheadScannerTest {

	private final Tokenizer tokenizer = new Tokenizer(Lemmatizer.withoutMorphology());

	private LookaheadScanner scanner(int budget) {
		return new LookaheadScanner(tokenizer, budget);
	}

	private static String last(List<Token> window) {
		return window.get(window.size() - 1).getText();
	}

	@Test
	void stopsAfterBudgetWords() {
		assertEquals(3, scanner(3).window("один два три четыре пять", 0).size());
	}

	@Test
	void punctuationDoesNotCount() {
		List<Token> w = scanner(2).window("а, б, в, г", 0);

		assertEquals(3, w.size());
		assertEquals("б", last(w));
	}

	@Test
	@DisplayName("After a document anchor the scan runs to the closing quote")
	void anchorExtendsThroughQuotes() {
		List<Token> w = scanner(3).window("Федеральный закон «О защите прав потребителей» и другое", 0);

		assertEquals(7, w.size());
		assertEquals("»", last(w));
	}

	@Test
	void quotesWithoutAnchorDoNotExtend() {
		List<Token> w = scanner(2).window("«один два три»", 0);

		assertEquals(3, w.size());
		assertEquals("два", last(w));
	}

	@Test
	void typographicQuotes() {
		assertEquals("“", last(scanner(2).window("кодекс „один два три“ дальше", 0)));
		assertEquals("”", last(scanner(2).window("кодекс “один два” дальше", 0)));
		assertEquals("\"", last(scanner(2).window("закон \"один два\" дальше", 0)));
	}

	@Test
	void unclosedQuoteIsCapped() {
		StringBuilder sb = new StringBuilder("«кодекс ");
		for (int i = 0; i < 1000; i++) {
			sb.append("слово ");
		}

		assertEquals(LookaheadScanner.MAX_TOKENS, scanner(2).window(sb.toString(), 0).size());
	}

	@Test
	void startsAtOffset() {
		String text = "ст. 5 ГК РФ";
		List<Token> w = scanner(12).window(text, 5);

		assertEquals(2, w.size());
		assertEquals("ГК", w.get(0).getText());
		assertTrue(scanner(12).window(text, text.length()).isEmpty());
		assertTrue(scanner(12).window("", 0).isEmpty());
	}

	@Test
	void articleLabelAhead() {
		assertTrue(scanner(12).hasArticleLabelAhead(" 2 настоящей статьи", 0));
		assertTrue(scanner(12).hasArticleLabelAhead(" 2 и ст. 5", 0));
		assertFalse(scanner(12).hasArticleLabelAhead(" 2 ГК РФ", 0));
		assertFalse(scanner(2).hasArticleLabelAhead("один два ст. 5", 0));
		assertTrue(scanner(3).hasArticleLabelAhead("один два ст. 5", 0));
	}

	@Test
	void budgetMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new LookaheadScanner(tokenizer, 0));
	}
}
