package org.lawlinks.core;

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

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.lawlinks.core.alias.AliasIndexException;
import org.lawlinks.core.conf.ConfigLoader;
import org.lawlinks.core.om.LawLink;
import org.lawlinks.core.om.LinksResponse;
import org.lawlinks.core.processing.LawLinkService;
import org.lawlinks.core.processing.LinkCsvWriter;
import org.lawlinks.core.util.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Command line runner for LawLinks.
 *
 * <pre>
 * LawLinksMain [--csv out.csv] [path ...]
 * </pre>
 *
 * Each path is a text file or a directory whose {@code *.txt} files are read in
 * name order. Without paths the text is read from stdin. By default one
 * {@code {"links":[...]}} JSON line is printed per input; with {@code --csv}
 * all links go to a single CSV file instead.
 * <p>
 * Exit status: 0 on success, 1 for bad arguments or unreadable inputs, 2 when
 * the service cannot start.
 */
public class LawLinksMain {

	static final int EXIT_OK = 0;
	static final int EXIT_INPUT = 1;
	static final int EXIT_STARTUP = 2;

	static final String STDIN_SOURCE = "-";

	private final ConfigLoader cfg;
	private final ObjectMapper mapper = new ObjectMapper();

	public LawLinksMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	public static void main(String[] args) {
		int status = new LawLinksMain(new ConfigLoader()).run(args, System.in, System.out);
		if (status != EXIT_OK) {
			System.exit(status);
		}
	}

	/**
	 * Runs detection for the given arguments.
	 *
	 * @return process exit status
	 */
	int run(String[] args, InputStream stdin, PrintStream out) {
		Path csvPath = null;
		List<String> paths = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			if ("--csv".equals(args[i])) {
				if (i + 1 >= args.length) {
					Logger.error("--csv requires an output file");
					usage();
					return EXIT_INPUT;
				}
				csvPath = Path.of(args[++i]);
			} else if ("-h".equals(args[i]) || "--help".equals(args[i])) {
				usage();
				return EXIT_OK;
			} else {
				paths.add(args[i]);
			}
		}

		LawLinkService service;
		try {
			service = LawLinkService.start(cfg);
		} catch (AliasIndexException | RuntimeException e) {
			Logger.error("LawLinks failed to start: {}", e.getMessage());
			return EXIT_STARTUP;
		}

		List<Path> inputs;
		try {
			inputs = resolveInputs(paths);
		} catch (IOException e) {
			Logger.error("Unable to list inputs: {}", e.getMessage());
			return EXIT_INPUT;
		}

		if (csvPath != null) {
			return runCsv(service, inputs, stdin, csvPath);
		}
		return runJson(service, inputs, stdin, out);
	}

	private int runJson(LawLinkService service, List<Path> inputs, InputStream stdin, PrintStream out) {
		int status = EXIT_OK;
		try {
			if (inputs.isEmpty()) {
				out.println(toJson(service.detect(readStdin(stdin))));
				return status;
			}
			for (Path p : inputs) {
				String text = readFile(p);
				if (text == null) {
					status = EXIT_INPUT;
					continue;
				}
				out.println(toJson(service.detect(text)));
			}
		} catch (IOException e) {
			Logger.error("Unable to process input: {}", e.getMessage());
			return EXIT_INPUT;
		}
		out.flush();
		return status;
	}

	private int runCsv(LawLinkService service, List<Path> inputs, InputStream stdin, Path csvPath) {
		int status = EXIT_OK;
		try (Writer w = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
				LinkCsvWriter csv = new LinkCsvWriter(w)) {
			if (inputs.isEmpty()) {
				csv.write(STDIN_SOURCE, service.detect(readStdin(stdin)));
			}
			for (Path p : inputs) {
				String text = readFile(p);
				if (text == null) {
					status = EXIT_INPUT;
					continue;
				}
				csv.write(p.toString(), service.detect(text));
			}
			csv.flush();
			Logger.info("Wrote {} link row(s) to {}", csv.getRowCount(), csvPath);
		} catch (IOException e) {
			Logger.error("Unable to write CSV {}: {}", csvPath, e.getMessage());
			return EXIT_INPUT;
		}
		return status;
	}

	/** Files named on the command line plus the sorted *.txt files of named directories. */
	static List<Path> resolveInputs(List<String> args) throws IOException {
		List<Path> inputs = new ArrayList<>();
		for (String a : args) {
			Path p = Path.of(a);
			if (Files.isDirectory(p)) {
				try (Stream<Path> stream = Files.list(p)) {
					inputs.addAll(stream
							.filter(Files::isRegularFile)
							.filter(f -> f.getFileName().toString().endsWith(".txt"))
							.sorted()
							.collect(Collectors.toList()));
				}
			} else {
				inputs.add(p);
			}
		}
		return inputs;
	}

	String toJson(List<LawLink> links) throws JsonProcessingException {
		return mapper.writeValueAsString(new LinksResponse(links));
	}

	private static String readFile(Path p) {
		try {
			return Files.readString(p, StandardCharsets.UTF_8);
		} catch (IOException e) {
			Logger.error("Unable to read {}: {}", p, e.getMessage());
			return null;
		}
	}

	private static String readStdin(InputStream in) throws IOException {
		return new String(in.readAllBytes(), StandardCharsets.UTF_8);
	}

	private static void usage() {
		System.err.println("Usage: LawLinksMain [--csv <out.csv>] [file-or-directory ...]");
		System.err.println("  Reads stdin when no file is given. Config: -D" + ConfigLoader.SYS_PROP_CONFIG_PATH + "=<file>");
	}
}
