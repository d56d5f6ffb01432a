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

import java.util.Comparator;

import lombok.Value;

/**
 * A tentative alias hit inside one lookahead window. Spans are token indexes
 * into the window, end exclusive.
 */
@Value
public class LawCandidate {

	public enum Kind { EXACT, COMPACT }

	/**
	 * Exact before compact, then leftmost, then longest, then spans containing
	 * an abbreviation.
	 */
	public static final Comparator<LawCandidate> RANKING = Comparator
			.comparing(LawCandidate::getKind)
			.thenComparingInt(LawCandidate::getStart)
			.thenComparing(Comparator.comparingInt(LawCandidate::getTokenCount).reversed())
			.thenComparingInt(c -> c.isHasAbbreviation() ? 0 : 1);

	int lawId;
	int start;
	int end;
	Kind kind;
	int tokenCount;
	boolean hasAbbreviation;
}
