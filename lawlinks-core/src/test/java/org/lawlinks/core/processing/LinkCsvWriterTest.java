package org.lawlinks.core.processing;

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

import java.io.StringWriter;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.lawlinks.core.om.LawLink;

class LinkCsvWriterTest {

	@Test
	void writesHeaderAndOneRowPerLink() throws Exception {
		StringWriter out = new StringWriter();
		try (LinkCsvWriter csv = new LinkCsvWriter(out)) {
			csv.write("a.txt", List.of(new LawLink(10, "5", "1", "а"), new LawLink(13, null, "2", null)));
			csv.write("b.txt", List.of(new LawLink(10, "5, 6", null, null)));
			assertEquals(3, csv.getRowCount());
		}

		assertEquals("SOURCE,LAW_ID,ARTICLE,POINT_ARTICLE,SUBPOINT_ARTICLE\n"
				+ "a.txt,10,5,1,а\n"
				+ "a.txt,13,,2,\n"
				+ "b.txt,10,\"5, 6\",,\n", out.toString());
	}

	@Test
	void headerOnlyWhenNothingFound() throws Exception {
		StringWriter out = new StringWriter();
		try (LinkCsvWriter csv = new LinkCsvWriter(out)) {
			csv.write("-", List.of());
		}

		assertEquals("SOURCE,LAW_ID,ARTICLE,POINT_ARTICLE,SUBPOINT_ARTICLE\n", out.toString());
	}
}
