package org.lawlinks.core.util;

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

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small static logger used across LawLinks.
 *
 * <p>Levels TRACE..ERROR, one line per event with timestamp and thread name,
 * {@code {}} placeholders. WARN and ERROR go to stderr so that the command
 * line runner can keep stdout for JSON output.</p>
 *
 * <ul>
 *   <li><b>lawlinks.log.level</b> – minimum level (default: INFO)</li>
 *   <li><b>lawlinks.log.datetime</b> – timestamp pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null || s.isBlank()) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    public static final String SYS_PROP_LEVEL = "lawlinks.log.level";
    public static final String SYS_PROP_DATETIME = "lawlinks.log.datetime";

    // Read once at class load
    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty(SYS_PROP_LEVEL), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(System.getProperty(SYS_PROP_DATETIME, "yyyy-MM-dd HH:mm:ss"));

    private Logger() {}

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { write(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { write(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { write(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { write(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { write(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { write(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { write(Level.ERROR, t, msg, args); }

    private static void write(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String line = "[" + LocalDateTime.now().format(TS) + "] ["
                + Thread.currentThread().getName() + "] " + level + " " + format(msg, args);
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println(line);
            if (t != null) {
                t.printStackTrace(out);
            }
        }
    }

    /**
     * Replaces each "{}" with the next argument; surplus arguments are appended
     * after a space.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        int i = 0;
        while (i < template.length()) {
            int open = template.indexOf("{}", i);
            if (open < 0 || argIdx >= args.length) {
                sb.append(template, i, template.length());
                break;
            }
            sb.append(template, i, open).append(args[argIdx++]);
            i = open + 2;
        }
        while (argIdx < args.length) {
            sb.append(' ').append(args[argIdx++]);
        }
        return sb.toString();
    }
}
