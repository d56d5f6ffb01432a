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
import java.util.Objects;
import java.util.OptionalInt;

import org.lawlinks.core.alias.LawAliasIndex;
import org.lawlinks.core.nlp.Token;
import org.lawlinks.core.om.LawLink;
import org.lawlinks.core.util.Logger;

/**
 * Turns citation labels in a text into {@link LawLink} records.
 * <p>
 * Two passes over the text:
 * <ol>
 * <li>Full grammar matches in text order. The law is resolved from the tokens
 * after the match; a match without a law is dropped. Subpoints are expanded
 * into one link each only when a point list is present as well.</li>
 * <li>Point/part-only matches in text order, skipped when they overlap an
 * accepted span or when an article label follows within the lookahead
 * budget. Each accepted match yields one link with only the point set.</li>
 * </ol>
 * Stateless between calls; one instance may serve concurrent callers.
 */
public final class LinkExtractor {

	private final LawAliasIndex index;
	private final LookaheadScanner scanner;

	public LinkExtractor(LawAliasIndex index, LookaheadScanner scanner) {
		this.index = Objects.requireNonNull(index, "index must not be null");
		this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
	}

	public List<LawLink> extract(String text) {
		List<LawLink> links = new ArrayList<>();
		if (text == null || text.isBlank()) return links;

		List<CitationMatch> accepted = new ArrayList<>();

		for (CitationMatch m : CitationGrammar.findFull(text)) {
			if (overlapsAny(m, accepted)) continue;

			OptionalInt lawId = resolveLaw(text, m);
			if (lawId.isEmpty()) {
				Logger.trace("No law found after {}", m);
				continue;
			}

			String sub = ListExpander.normalize(m.getSubpointList());
			String point = ListExpander.normalize(m.getPointList());
			String article = ListExpander.normalize(m.getArticleList());

			if (!sub.isEmpty() && !point.isEmpty()) {
				for (String item : ListExpander.expand(sub)) {
					links.add(LawLink.of(lawId.getAsInt(), article, point, item));
				}
			} else {
				links.add(LawLink.of(lawId.getAsInt(), article, point, null));
			}
			accepted.add(m);
		}

		for (CitationMatch m : CitationGrammar.findPointOnly(text)) {
			if (overlapsAny(m, accepted)) continue;
			if (scanner.hasArticleLabelAhead(text, m.getEnd())) continue;

			OptionalInt lawId = resolveLaw(text, m);
			if (lawId.isEmpty()) continue;

			links.add(LawLink.of(lawId.getAsInt(), null, ListExpander.normalize(m.getPointList()), null));
			accepted.add(m);
		}

		Logger.debug("Extracted {} link(s) from {} accepted span(s)", links.size(), accepted.size());
		return links;
	}

	private OptionalInt resolveLaw(String text, CitationMatch m) {
		List<Token> window = scanner.window(text, m.getEnd());
		if (window.isEmpty()) return OptionalInt.empty();
		return index.bestMatch(window);
	}

	private static boolean overlapsAny(CitationMatch m, List<CitationMatch> accepted) {
		for (CitationMatch a : accepted) {
			if (m.overlaps(a)) return true;
		}
		return false;
	}
}
