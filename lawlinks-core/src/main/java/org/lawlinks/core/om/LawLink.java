package org.lawlinks.core.om;

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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recognized citation: the law and, when present, the article, the point
 * (or part) and the subpoint it refers to. Absent components are {@code null}
 * and serialized as JSON {@code null}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "law_id", "article", "point_article", "subpoint_article" })
public class LawLink {

	@JsonProperty("law_id")
	private int lawId;

	/** Article list as written, e.g. "5" or "5, 6". */
	@JsonProperty("article")
	private String article;

	@JsonProperty("point_article")
	private String pointArticle;

	@JsonProperty("subpoint_article")
	private String subpointArticle;

	/**
	 * Builds a link, mapping empty strings to {@code null}.
	 */
	public static LawLink of(int lawId, String article, String pointArticle, String subpointArticle) {
		return new LawLink(lawId, emptyToNull(article), emptyToNull(pointArticle), emptyToNull(subpointArticle));
	}

	private static String emptyToNull(String s) {
		return (s == null || s.isEmpty()) ? null : s;
	}
}
