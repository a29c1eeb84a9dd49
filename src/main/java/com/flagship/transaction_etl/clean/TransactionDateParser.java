package com.flagship.transaction_etl.clean;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses the date representations the transaction source is known to emit into
 * a calendar date. Time components and offsets are dropped; the date is taken
 * in the offset the value was written in.
 *
 * Accepted forms:
 * <pre>
 *   2024-01-05                  ISO date
 *   20240105                    basic ISO date
 *   2024/01/05
 *   01/05/2024                  month first
 *   2024-01-05T10:15:30         ISO local date-time (fractional seconds allowed)
 *   2024-01-05 10:15:30
 *   2024-01-05T10:15:30+02:00   ISO offset date-time, also with Z
 * </pre>
 */
public final class TransactionDateParser {

    private static final DateTimeFormatter SLASHED_YEAR_FIRST = strict("uuuu/MM/dd");
    private static final DateTimeFormatter SLASHED_MONTH_FIRST = strict("MM/dd/uuuu");
    private static final DateTimeFormatter SPACED_DATE_TIME = strict("uuuu-MM-dd HH:mm:ss");

    private static final List<Function<String, LocalDate>> PARSERS = List.of(
        value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE),
        value -> LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE),
        value -> LocalDate.parse(value, SLASHED_YEAR_FIRST),
        value -> LocalDate.parse(value, SLASHED_MONTH_FIRST),
        value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate(),
        value -> LocalDateTime.parse(value, SPACED_DATE_TIME).toLocalDate(),
        value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate()
    );

    private TransactionDateParser() {
        // Utility class
    }

    public static Optional<LocalDate> parse(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (!(value instanceof CharSequence)) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return PARSERS.stream()
            .map(parser -> attempt(parser, text))
            .flatMap(Optional::stream)
            .findFirst();
    }

    private static Optional<LocalDate> attempt(Function<String, LocalDate> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
