package com.rightsparser.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rewrites calendar dates written in common agreement styles to ISO-8601 ({@code yyyy-MM-dd}).
 * Day-first numeric dates are assumed, as in the agreements this service receives.
 */
public class DateNormalizer {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            pattern("d/M/uuuu"),
            pattern("d-M-uuuu"),
            pattern("d.M.uuuu"),
            pattern("uuuu/M/d"),
            pattern("d MMMM uuuu"),
            pattern("d MMM uuuu"),
            pattern("MMMM d, uuuu"),
            pattern("MMM d, uuuu"),
            pattern("d'st' MMMM uuuu"),
            pattern("d'nd' MMMM uuuu"),
            pattern("d'rd' MMMM uuuu"),
            pattern("d'th' MMMM uuuu")
    );

    private DateNormalizer() {
    }

    /**
     * @return the ISO form when the whole value is a date in a known style
     */
    public static Optional<String> normalize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        if (candidate.length() < 6 || candidate.length() > 30) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, format).toString());
            } catch (DateTimeParseException ignored) {
                // try the next style
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
