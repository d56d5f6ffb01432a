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

import lombok.Value;

/**
 * One lexical unit of the input: surface text, its normalized lemma, its class
 * and the character offset where it starts in the scanned text.
 */
@Value
public class Token {

	String text;
	String lemma;
	TokenKind kind;
	int start;

	public boolean isPunctuation() {
		return kind == TokenKind.PUNCTUATION;
	}

	public int getEnd() {
		return start + text.length();
	}
}
