package com.consent.reconciliation.bulk;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Lenient date parsing for spreadsheet exports.
 *
 * <p>Accepted: ISO dates ({@code 2020-06-01}), ISO date-times, spreadsheet date-times
 * ({@code 2020-06-01 00:00:00}), German dates ({@code 01.06.2020}, {@code 1.6.2020},
 * optionally followed by a time) and {@code 2020/06/01}. The time part is dropped.
 * Anything else parses to empty.</p>
 */
public final class DateValueParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("d.M.uuuu"),
            strict("uuuu/M/d"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm[:ss][.SSS]"),
            strict("d.M.uuuu H:mm[:ss]"));

    private DateValueParser() {
    }

    /**
     * Parses the given text.
     *
     * @param text the raw cell value, may be null
     * @return the date, or empty if the text is blank or not a recognized date
     */
    public static Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> date = tryParse(value, format, false);
            if (date.isPresent()) {
                return date;
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<LocalDate> date = tryParse(value, format, true);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format, boolean withTime) {
        try {
            LocalDate date = withTime
                    ? LocalDateTime.parse(value, format).toLocalDate()
                    : LocalDate.parse(value, format);
            return Optional.of(date);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
