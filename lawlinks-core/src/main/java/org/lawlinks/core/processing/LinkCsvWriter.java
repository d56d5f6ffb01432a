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

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.lawlinks.core.om.LawLink;

/**
 * Writes detected links as CSV rows, one row per link, tagged with the input
 * they came from. Null components are written as empty cells.
 */
public class LinkCsvWriter implements Closeable {

	static final String[] HEADER = { "SOURCE", "LAW_ID", "ARTICLE", "POINT_ARTICLE", "SUBPOINT_ARTICLE" };

	private final CSVPrinter printer;
	private int rows;

	public LinkCsvWriter(Writer out) throws IOException {
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(HEADER)
				.setRecordSeparator("\n")
				.build();
		this.printer = new CSVPrinter(out, format);
	}

	public void write(String source, List<LawLink> links) throws IOException {
		for (LawLink link : links) {
			printer.printRecord(source, link.getLawId(), link.getArticle(), link.getPointArticle(),
					link.getSubpointArticle());
			rows++;
		}
	}

	/** Rows written so far, header excluded. */
	public int getRowCount() {
		return rows;
	}

	public void flush() throws IOException {
		printer.flush();
	}

	@Override
	public void close() throws IOException {
		printer.close(true);
	}
}
