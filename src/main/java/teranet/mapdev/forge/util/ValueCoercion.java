package teranet.mapdev.forge.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility class for interpreting raw string cell values.
 *
 * Every source value is kept as a string; these helpers convert at the
 * point of use and never throw on dirty data:
 * - blank detection ("", whitespace, nan/none/null)
 * - number parsing
 * - multi-format date/time parsing
 */
public class ValueCoercion {

    private static final Set<String> BLANK_TOKENS = Set.of("nan", "none", "null");

    // Plain decimal or scientific notation, optionally signed.
    private static final Pattern NUMBER_PATTERN = Pattern.compile(
            "[+-]?(\\d+(_\\d+)*(\\.(\\d+(_\\d+)*)?)?|\\.\\d+(_\\d+)*)([eE][+-]?\\d+)?");

    private static final Pattern INFINITY_PATTERN = Pattern.compile("[+-]?(inf|infinity)", Pattern.CASE_INSENSITIVE);

    private static final DateTimeFormatter ISO_DATE = strict("uuuu-M-d");
    private static final DateTimeFormatter ISO_T_DATE_TIME = strict("uuuu-M-d'T'H:m:s");
    private static final DateTimeFormatter ISO_SPACE_DATE_TIME = strict("uuuu-M-d H:m:s");
    private static final DateTimeFormatter US_SHORT_DATE = new DateTimeFormatterBuilder()
            .appendPattern("M/d/")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter US_DATE = strict("M/d/uuuu");


    private ValueCoercion() {
        // Private constructor to prevent instantiation
    }

    /**
     * Check whether a raw value counts as blank.
     *
     * @param value the raw value (may be null)
     * @return true for null, empty or whitespace-only strings and the tokens nan/none/null (any case)
     */
    public static boolean isBlank(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() || BLANK_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT));
    }

    /**
     * Blank-normalize a raw value: blank values become "", others are returned unchanged.
     */
    public static String orEmpty(String value) {
        return isBlank(value) ? "" : value;
    }

    /**
     * Parse a raw value as a number.
     *
     * @param value the raw value
     * @return the parsed number, or empty when blank or unparsable
     */
    public static OptionalDouble toNumber(String value) {
        if (isBlank(value)) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        if (INFINITY_PATTERN.matcher(trimmed).matches()) {
            return OptionalDouble.of(trimmed.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(trimmed.replace("_", "")));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parse a raw value as a date/time.
     *
     * Formats are tried in order: YYYY-MM-DD, YYYY-MM-DDTHH:MM:SS,
     * YYYY-MM-DD HH:MM:SS, MM/DD/YY, MM/DD/YYYY, then a general ISO-8601
     * parse. Values carrying an offset (including a trailing Z) are
     * normalized to UTC.
     *
     * @param value the raw value
     * @return the parsed date/time, or empty when blank or unparsable
     */
    public static Optional<LocalDateTime> toDateTime(String value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();

        return parseDate(trimmed, ISO_DATE)
                .or(() -> parseDateTime(trimmed, ISO_T_DATE_TIME))
                .or(() -> parseDateTime(trimmed, ISO_SPACE_DATE_TIME))
                .or(() -> parseDate(trimmed, US_SHORT_DATE))
                .or(() -> parseDate(trimmed, US_DATE))
                .or(() -> parseIso(trimmed));
    }

    private static Optional<LocalDateTime> parseDate(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter).atStartOfDay());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseDateTime(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(value, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseIso(String value) {
        String iso = value.endsWith("Z") ? value.substring(0, value.length() - 1) + "+00:00" : value;
        if (iso.length() > 10 && iso.charAt(10) == ' ') {
            iso = iso.substring(0, 10) + 'T' + iso.substring(11);
        }
        try {
            return Optional.of(OffsetDateTime.parse(iso, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime());
        } catch (DateTimeParseException e) {
            return parseDateTime(iso, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
