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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

import org.lawlinks.core.nlp.Token;
import org.lawlinks.core.nlp.Tokenizer;
import org.lawlinks.core.util.Logger;

/**
 * Lemma-keyed lookup from law names to law ids.
 * <p>
 * Two tables are built once from the alias mapping:
 * <ul>
 * <li><b>exact</b> – the space-joined lemmas of an alias, first law id wins on
 * collision;</li>
 * <li><b>compact</b> – the same lemmas without filler words such as
 * "российский" or "федерация", kept only when a single law id produced the
 * key. A compact name shared by two laws is dropped from the table entirely,
 * so those laws are only reachable through their full aliases.</li>
 * </ul>
 * The index is immutable after {@link #build} returns and may be read by any
 * number of threads without locking.
 */
public final class LawAliasIndex {

	private final Map<String, Integer> exact;
	private final Map<String, Integer> compact;
	private final boolean compactEnabled;
	private final int maxAliasLength;
	private final int lawCount;

	private LawAliasIndex(Map<String, Integer> exact, Map<String, Integer> compact, boolean compactEnabled,
			int maxAliasLength, int lawCount) {
		this.exact = Collections.unmodifiableMap(exact);
		this.compact = Collections.unmodifiableMap(compact);
		this.compactEnabled = compactEnabled;
		this.maxAliasLength = maxAliasLength;
		this.lawCount = lawCount;
	}

	/**
	 * Builds the index.
	 *
	 * @param aliases      law id (decimal string) → alias names, iterated in
	 *                     the map's order; keys that are not integers and
	 *                     aliases without any word are skipped
	 * @param tokenizer    tokenizer whose lemmatizer is also used on input text
	 * @param allowCompact build the compact table
	 * @throws AliasIndexException when no alias at all could be registered
	 */
	public static LawAliasIndex build(Map<String, ? extends Collection<String>> aliases, Tokenizer tokenizer,
			boolean allowCompact) throws AliasIndexException {
		Objects.requireNonNull(tokenizer, "tokenizer must not be null");
		if (aliases == null || aliases.isEmpty()) {
			throw new AliasIndexException("Alias mapping is empty");
		}

		Map<String, Integer> exact = new HashMap<>();
		Map<String, Set<Integer>> compactIds = new LinkedHashMap<>();
		Set<Integer> indexedLaws = new LinkedHashSet<>();
		int maxLen = 1;
		int skippedKeys = 0;

		for (Map.Entry<String, ? extends Collection<String>> e : aliases.entrySet()) {
			Integer lawId = parseLawId(e.getKey());
			if (lawId == null) {
				skippedKeys++;
				Logger.warn("Skipping alias entry with non-integer law id: '{}'", e.getKey());
				continue;
			}
			if (e.getValue() == null) continue;

			for (String alias : e.getValue()) {
				List<String> lemmas = aliasLemmas(alias, tokenizer);
				if (lemmas.isEmpty()) continue;

				exact.putIfAbsent(String.join(" ", lemmas), lawId);
				indexedLaws.add(lawId);
				maxLen = Math.max(maxLen, lemmas.size());

				if (allowCompact) {
					List<String> reduced = withoutOptional(lemmas);
					if (reduced.size() >= 2) {
						compactIds.computeIfAbsent(String.join(" ", reduced), k -> new LinkedHashSet<>()).add(lawId);
					}
				}
			}
		}

		if (exact.isEmpty()) {
			throw new AliasIndexException("Alias mapping yielded no usable alias (" + aliases.size()
					+ " entries, " + skippedKeys + " with invalid law id)");
		}

		Map<String, Integer> compact = new HashMap<>();
		int ambiguous = 0;
		for (Map.Entry<String, Set<Integer>> e : compactIds.entrySet()) {
			if (e.getValue().size() == 1) {
				compact.put(e.getKey(), e.getValue().iterator().next());
			} else {
				ambiguous++;
				Logger.debug("Compact alias '{}' is shared by laws {}; dropped", e.getKey(), e.getValue());
			}
		}

		Logger.info("Law alias index built: {} laws, {} exact keys, {} compact keys ({} ambiguous dropped), max alias length {}",
				indexedLaws.size(), exact.size(), compact.size(), ambiguous, maxLen);
		return new LawAliasIndex(exact, compact, allowCompact, maxLen, indexedLaws.size());
	}

	// ---------------- Lookup ----------------

	/**
	 * Best law id named inside the window, or empty when no alias occurs.
	 *
	 * @param window tokens in document order, punctuation included
	 */
	public OptionalInt bestMatch(List<Token> window) {
		List<LawCandidate> cands = candidates(window);
		if (cands.isEmpty()) return OptionalInt.empty();
		cands.sort(LawCandidate.RANKING);
		return OptionalInt.of(cands.get(0).getLawId());
	}

	/**
	 * Every alias hit in the window, longest spans first and left to right
	 * within a length. A span with an exact hit is not also tried compactly.
	 */
	public List<LawCandidate> candidates(List<Token> window) {
		List<LawCandidate> out = new ArrayList<>();
		if (window == null || window.isEmpty()) return out;

		final int n = window.size();
		final int maxN = Math.min(maxAliasLength, n);

		for (int len = maxN; len >= 1; len--) {
			for (int i = 0; i + len <= n; i++) {
				int j = i + len;
				List<String> lemmas = wordLemmas(window, i, j);

				Integer id = exact.get(String.join(" ", lemmas));
				if (id != null) {
					out.add(new LawCandidate(id, i, j, LawCandidate.Kind.EXACT, lemmas.size(), hasAbbreviation(window, i, j)));
					continue;
				}

				if (compactEnabled) {
					List<String> reduced = withoutOptional(lemmas);
					if (reduced.size() >= 2) {
						Integer cid = compact.get(String.join(" ", reduced));
						if (cid != null) {
							out.add(new LawCandidate(cid, i, j, LawCandidate.Kind.COMPACT, reduced.size(),
									hasAbbreviation(window, i, j)));
						}
					}
				}
			}
		}
		return out;
	}

	/** Law id registered for an exact lemma key. */
	public OptionalInt exactLookup(String lemmaKey) {
		Integer id = exact.get(lemmaKey);
		return id == null ? OptionalInt.empty() : OptionalInt.of(id);
	}

	/** Law id registered for a compact lemma key; empty for ambiguous keys. */
	public OptionalInt compactLookup(String lemmaKey) {
		Integer id = compact.get(lemmaKey);
		return id == null ? OptionalInt.empty() : OptionalInt.of(id);
	}

	public int getMaxAliasLength() {
		return maxAliasLength;
	}

	public boolean isCompactEnabled() {
		return compactEnabled;
	}

	/** Distinct law ids with at least one registered alias. */
	public int getLawCount() {
		return lawCount;
	}

	public int getExactKeyCount() {
		return exact.size();
	}

	public int getCompactKeyCount() {
		return compact.size();
	}

	// ---------------- Internals ----------------

	private static Integer parseLawId(String raw) {
		if (raw == null) return null;
		try {
			return Integer.valueOf(raw.trim());
		} catch (NumberFormatException nfe) {
			return null;
		}
	}

	private static List<String> aliasLemmas(String alias, Tokenizer tokenizer) {
		List<String> lemmas = new ArrayList<>();
		if (alias == null || alias.isBlank()) return lemmas;
		for (Token t : tokenizer.tokenize(alias)) {
			if (!t.isPunctuation()) lemmas.add(t.getLemma());
		}
		return lemmas;
	}

	private static List<String> wordLemmas(List<Token> toks, int from, int to) {
		List<String> lemmas = new ArrayList<>(to - from);
		for (int k = from; k < to; k++) {
			Token t = toks.get(k);
			if (!t.isPunctuation()) lemmas.add(t.getLemma());
		}
		return lemmas;
	}

	private static List<String> withoutOptional(List<String> lemmas) {
		List<String> out = new ArrayList<>(lemmas.size());
		for (String l : lemmas) {
			if (!LegalLexicon.isOptional(l)) out.add(l);
		}
		return out;
	}

	private static boolean hasAbbreviation(List<Token> toks, int from, int to) {
		for (int k = from; k < to; k++) {
			if (LegalLexicon.isAbbreviation(toks.get(k).getLemma())) return true;
		}
		return false;
	}
}
