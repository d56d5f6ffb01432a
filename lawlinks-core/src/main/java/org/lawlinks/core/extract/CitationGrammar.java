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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for Russian citation labels.
 * <p>
 * The full form is {@code [подпункт LIST] [пункт|часть LIST [,;] [в|во]] статья
 * ARTICLES}; the fallback form is {@code пункт|часть LIST} alone. Labels are
 * matched by regular expressions, case-insensitively and never inside a longer
 * word ("пост. 5" is not an article label). Lists are consumed by a forward
 * scanner, so an enumeration of any length is read in constant stack depth.
 * Whitespace includes the no-break spaces common in legal typography.
 */
public final class CitationGrammar {

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

	private static final String NOT_AFTER_WORD = "(?<![\\p{L}\\d])";

	static final Pattern SUB_LABEL = Pattern.compile(NOT_AFTER_WORD + "(?:подпункт[а-я]*|пп\\.?)", FLAGS);
	static final Pattern PT_LABEL = Pattern.compile(NOT_AFTER_WORD + "(?:пункт[а-я]*|п\\.|част[ьи][а-я]*|ч\\.)", FLAGS);
	static final Pattern ART_LABEL = Pattern.compile(NOT_AFTER_WORD + "(?:стать[яеию]|ст\\.?)", FLAGS);

	/** Where a full-form citation may begin. */
	private static final Pattern ANY_LABEL = Pattern.compile(
			NOT_AFTER_WORD + "(?:подпункт|пп|пункт|п\\.|част[ьи]|ч\\.|ст)", FLAGS);

	/** Surface forms of an article label once the tokenizer split off the dot. */
	private static final Pattern ARTICLE_WORD = Pattern.compile("ст|стать[яеию]", FLAGS);

	private static final String DASHES = "-–—";
	private static final String[] CONJUNCTIONS = { "и", "или" };
	private static final String[] CONNECTIVES = { "во", "в" };

	private CitationGrammar() {
	}

	/** Non-overlapping full-grammar matches in text order. */
	public static List<CitationMatch> findFull(String text) {
		List<CitationMatch> out = new ArrayList<>();
		if (text == null || text.isEmpty()) return out;
		Matcher labels = ANY_LABEL.matcher(text);
		int from = 0;
		while (from < text.length() && labels.find(from)) {
			int start = labels.start();
			CitationMatch match = fullAt(text, start);
			if (match != null) {
				out.add(match);
				from = match.getEnd();
			} else {
				from = start + 1;
			}
		}
		return out;
	}

	/** Non-overlapping point/part-only matches in text order. */
	public static List<CitationMatch> findPointOnly(String text) {
		List<CitationMatch> out = new ArrayList<>();
		if (text == null || text.isEmpty()) return out;
		Matcher labels = PT_LABEL.matcher(text);
		int from = 0;
		while (from < text.length() && labels.find(from)) {
			int listStart = skipSpace(text, labels.end());
			int listEnd = list(text, listStart);
			if (listEnd >= 0) {
				out.add(new CitationMatch(CitationMatch.Grammar.POINT_ONLY,
						null, text.substring(listStart, listEnd), null,
						labels.start(), listEnd));
				from = listEnd;
			} else {
				from = labels.start() + 1;
			}
		}
		return out;
	}

	/** Whether a single token's surface text is an article label. */
	public static boolean isArticleWord(String surface) {
		return surface != null && ARTICLE_WORD.matcher(surface).matches();
	}

	private static CitationMatch fullAt(String text, int start) {
		int subEnd = label(SUB_LABEL, text, start);
		if (subEnd >= 0) {
			int listStart = skipSpace(text, subEnd);
			int listEnd = list(text, listStart);
			if (listEnd >= 0) {
				CitationMatch rest = pointAndArticleAt(text, skipSpace(text, listEnd), start);
				if (rest != null) {
					return new CitationMatch(CitationMatch.Grammar.FULL,
							text.substring(listStart, listEnd), rest.getPointList(), rest.getArticleList(),
							start, rest.getEnd());
				}
			}
		}
		return pointAndArticleAt(text, start, start);
	}

	private static CitationMatch pointAndArticleAt(String text, int pos, int start) {
		int ptEnd = label(PT_LABEL, text, pos);
		if (ptEnd >= 0) {
			int listStart = skipSpace(text, ptEnd);
			int listEnd = list(text, listStart);
			if (listEnd >= 0) {
				Span articles = articleAfterSeparator(text, listEnd);
				if (articles != null) {
					return new CitationMatch(CitationMatch.Grammar.FULL,
							null, text.substring(listStart, listEnd), articles.text(text),
							start, articles.end);
				}
			}
		}
		Span articles = articleAt(text, pos);
		if (articles == null) return null;
		return new CitationMatch(CitationMatch.Grammar.FULL,
				null, null, articles.text(text), start, articles.end);
	}

	/** {@code [,;] [в|во]} between a point list and its article label. */
	private static Span articleAfterSeparator(String text, int pos) {
		int i = skipSpace(text, pos);
		if (i < text.length() && (text.charAt(i) == ',' || text.charAt(i) == ';')) {
			i = skipSpace(text, i + 1);
		}
		for (String word : CONNECTIVES) {
			if (text.regionMatches(true, i, word, 0, word.length())) {
				Span articles = articleAt(text, skipSpace(text, i + word.length()));
				if (articles != null) return articles;
			}
		}
		return articleAt(text, i);
	}

	private static Span articleAt(String text, int pos) {
		int labelEnd = label(ART_LABEL, text, pos);
		if (labelEnd < 0) return null;
		int listStart = skipSpace(text, labelEnd);
		int listEnd = articleList(text, listStart);
		return listEnd < 0 ? null : new Span(listStart, listEnd);
	}

	private static int label(Pattern label, String text, int pos) {
		if (pos < 0 || pos >= text.length()) return -1;
		Matcher m = label.matcher(text).region(pos, text.length()).useTransparentBounds(true);
		return m.lookingAt() ? m.end() : -1;
	}

	/** An article number, an optional comma item and an optional "и"/"или" item. */
	private static int articleList(String text, int pos) {
		int end = number(text, pos);
		if (end < 0) return -1;
		int next = number(text, comma(text, end));
		if (next >= 0) end = next;
		next = conjoined(text, end, true);
		return next >= 0 ? next : end;
	}

	/** Comma-separated items with an optional final "и"/"или" item. */
	private static int list(String text, int pos) {
		int end = item(text, pos);
		if (end < 0) return -1;
		int next = item(text, comma(text, end));
		while (next >= 0) {
			end = next;
			next = item(text, comma(text, end));
		}
		next = conjoined(text, end, false);
		return next >= 0 ? next : end;
	}

	private static int conjoined(String text, int pos, boolean articles) {
		int i = skipSpace(text, pos);
		for (String word : CONJUNCTIONS) {
			if (text.regionMatches(true, i, word, 0, word.length())) {
				int start = skipSpace(text, i + word.length());
				int end = articles ? number(text, start) : item(text, start);
				if (end >= 0) return end;
			}
		}
		return -1;
	}

	/** A number or one letter, either with an optional dash range. */
	private static int item(String text, int pos) {
		if (pos < 0 || pos >= text.length()) return -1;
		int end = number(text, pos);
		if (end >= 0) {
			int upper = number(text, dash(text, end));
			return upper >= 0 ? upper : end;
		}
		if (!isRussianLetter(text, pos) || isConnective(text, pos)) return -1;
		int upper = dash(text, pos + 1);
		if (isRussianLetter(text, upper) && !isRussianLetter(text, upper + 1)) return upper + 1;
		return isRussianLetter(text, pos + 1) ? -1 : pos + 1;
	}

	/** The preposition in "ч. 2, в ст. 5" is not a letter item. */
	private static boolean isConnective(String text, int pos) {
		char c = text.charAt(pos);
		if (c != 'в' && c != 'В') return false;
		int next = skipSpace(text, pos + 1);
		return next > pos + 1 && articleAt(text, next) != null;
	}

	/** Digits with optional dotted parts, as in "15.1". */
	private static int number(String text, int pos) {
		int end = digits(text, pos);
		if (end < 0) return -1;
		while (end < text.length() && text.charAt(end) == '.') {
			int part = digits(text, end + 1);
			if (part < 0) break;
			end = part;
		}
		return end;
	}

	private static int digits(String text, int pos) {
		if (pos < 0) return -1;
		int i = pos;
		while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') i++;
		return i > pos ? i : -1;
	}

	private static int comma(String text, int pos) {
		if (pos < 0) return -1;
		int i = skipSpace(text, pos);
		return i < text.length() && text.charAt(i) == ',' ? skipSpace(text, i + 1) : -1;
	}

	private static int dash(String text, int pos) {
		int i = skipSpace(text, pos);
		return i < text.length() && DASHES.indexOf(text.charAt(i)) >= 0 ? skipSpace(text, i + 1) : -1;
	}

	private static int skipSpace(String text, int pos) {
		int i = pos;
		while (i < text.length() && isSpace(text.charAt(i))) i++;
		return i;
	}

	/** ASCII and Unicode whitespace, U+00A0 and U+202F included. */
	private static boolean isSpace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	private static boolean isRussianLetter(String text, int pos) {
		if (pos < 0 || pos >= text.length()) return false;
		char c = Character.toLowerCase(text.charAt(pos));
		return (c >= 'а' && c <= 'я') || c == 'ё';
	}

	private static final class Span {
		final int start;
		final int end;

		Span(int start, int end) {
			this.start = start;
			this.end = end;
		}

		String text(String source) {
			return source.substring(start, end);
		}
	}
}
