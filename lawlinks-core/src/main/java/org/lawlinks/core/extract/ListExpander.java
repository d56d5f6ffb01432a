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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes and expands enumerations such as "6-12", "а–г" or "1, 2 и 5".
 */
public final class ListExpander {

	/** Russian alphabet used for letter ranges. */
	static final String RUSSIAN_ALPHABET = "абвгдеёжзийклмнопрстуфхцчшщъыьэюя";

	/** Largest numeric range expanded item by item. */
	static final int MAX_NUMERIC_SPAN = 400;

	/** Largest letter range expanded item by item. */
	static final int MAX_LETTER_SPAN = 40;

	// no-break spaces count as whitespace
	private static final Pattern CONJUNCTION = Pattern.compile("\\s+(?:и|или)\\s+",
			Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern HYPHEN_SPACING = Pattern.compile("\\s*-\\s*", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern NUMERIC_RANGE = Pattern.compile("^(\\d+)-(\\d+)$");
	private static final Pattern LETTER_RANGE = Pattern.compile("^([А-Яа-яЁё])-([А-Яа-яЁё])$");

	private ListExpander() {
	}

	/**
	 * Canonical form of list text: dashes unified to "-", no spaces around
	 * hyphens, single spaces, trimmed. Null gives "".
	 */
	public static String normalize(String listText) {
		if (listText == null) return "";
		String s = StringUtils.replaceChars(listText, "–—", "--");
		s = HYPHEN_SPACING.matcher(s).replaceAll("-");
		return WHITESPACE.matcher(s).replaceAll(" ").trim();
	}

	/**
	 * Splits list text on commas, "и" and "или" and expands bounded ranges.
	 * Ranges that are reversed or too wide are kept as one literal item.
	 *
	 * @return the items in order; {@code [""]} when nothing is left
	 */
	public static List<String> expand(String listText) {
		List<String> out = new ArrayList<>();
		if (StringUtils.isBlank(listText)) {
			out.add("");
			return out;
		}

		String collapsed = WHITESPACE.matcher(listText).replaceAll(" ").trim();
		String commaSeparated = CONJUNCTION.matcher(collapsed).replaceAll(",");
		for (String raw : StringUtils.split(commaSeparated, ',')) {
			String item = StringUtils.replaceChars(raw, "–—", "--").trim();
			if (item.isEmpty()) continue;

			List<String> range = expandRange(item);
			if (range != null) {
				out.addAll(range);
			} else {
				out.add(item);
			}
		}
		if (out.isEmpty()) out.add("");
		return out;
	}

	private static List<String> expandRange(String item) {
		Matcher num = NUMERIC_RANGE.matcher(item);
		if (num.matches()) {
			return numericRange(num.group(1), num.group(2));
		}
		Matcher let = LETTER_RANGE.matcher(item);
		if (let.matches()) {
			return letterRange(let.group(1), let.group(2));
		}
		return null;
	}

	private static List<String> numericRange(String a, String b) {
		long start;
		long end;
		try {
			start = Long.parseLong(a);
			end = Long.parseLong(b);
		} catch (NumberFormatException tooLong) {
			return null;
		}
		if (start > end || end - start > MAX_NUMERIC_SPAN) return null;

		List<String> items = new ArrayList<>((int) (end - start + 1));
		for (long i = start; i <= end; i++) {
			items.add(Long.toString(i));
		}
		return items;
	}

	private static List<String> letterRange(String a, String b) {
		int from = letterIndex(a);
		int to = letterIndex(b);
		if (from < 0 || to < 0 || from > to || to - from > MAX_LETTER_SPAN) return null;

		List<String> items = new ArrayList<>(to - from + 1);
		for (int i = from; i <= to; i++) {
			items.add(String.valueOf(RUSSIAN_ALPHABET.charAt(i)));
		}
		return items;
	}

	// "ё" folds to "е" before lookup
	private static int letterIndex(String letter) {
		String folded = letter.toLowerCase(Locale.ROOT).replace('ё', 'е');
		return RUSSIAN_ALPHABET.indexOf(folded);
	}
}
