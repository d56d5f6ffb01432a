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

import lombok.Value;

/**
 * A label sequence found by {@link CitationGrammar}. List texts are raw
 * (not normalized) and {@code null} when the part is absent. Offsets are
 * character positions in the scanned text, end exclusive.
 */
@Value
public class CitationMatch {

	public enum Grammar {
		/** [subpoint] [point] article */
		FULL,
		/** point or part alone */
		POINT_ONLY
	}

	Grammar grammar;
	String subpointList;
	String pointList;
	String articleList;
	int start;
	int end;

	public boolean overlaps(CitationMatch other) {
		return overlaps(other.start, other.end);
	}

	public boolean overlaps(int otherStart, int otherEnd) {
		return !(end <= otherStart || otherEnd <= start);
	}
}
