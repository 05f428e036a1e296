package com.example.analyzer.application.support;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Day-first date parser for operation dates. Bank-specific patterns are tried before the defaults,
 * and any time part after a space or {@code T} is ignored. Resolution is strict, so patterns use
 * {@code u} for the year and impossible dates such as 31.02 are rejected.
 */
public final class OperationDateParser {

    static final List<String> DEFAULT_PATTERNS = List.of(
            "d.M.uuuu",
            "d.M.uu",
            "d/M/uuuu",
            "d-M-uuuu",
            "uuuu-M-d",
            "uuuu.M.d"
    );
    private static final Pattern TIME_SEPARATOR = Pattern.compile("[\\sT]");

    private final List<DateTimeFormatter> formatters;

    private OperationDateParser(List<DateTimeFormatter> formatters) {
        this.formatters = formatters;
    }

	/**
	 * @param extraPatterns bank-specific patterns, tried first; may be empty
	 * @return parser over the extra patterns followed by {@link #DEFAULT_PATTERNS}
	 */
    public static OperationDateParser withPatterns(List<String> extraPatterns) {
        List<DateTimeFormatter> formatters = new ArrayList<>();
        if (extraPatterns != null) {
            extraPatterns.forEach(pattern -> formatters.add(strict(pattern)));
        }
        DEFAULT_PATTERNS.forEach(pattern -> formatters.add(strict(pattern)));
        return new OperationDateParser(List.copyOf(formatters));
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    public static OperationDateParser defaults() {
        return withPatterns(List.of());
    }

	/**
	 * @param raw cell text
	 * @return parsed date, or {@code null} when no pattern matches
	 */
    public LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = TIME_SEPARATOR.split(raw.strip(), 2)[0];
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return null;
    }
}
