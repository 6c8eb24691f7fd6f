package teranet.mapdev.forge.transformer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.util.ValueCoercion;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses a date/time column and renders it with a declared pattern.
 *
 * Patterns containing '%' are strftime style ("%Y-%m-%d", "%d/%m/%Y %H:%M").
 * Any other pattern is taken as a java.time pattern ("yyyy-MM"). Unparsable
 * values and invalid patterns give "".
 */
@Component
@Slf4j
public class DateFormatFunction implements ComputedColumnFunction {

    private static final DateTimeFormatter INVALID = DateTimeFormatter.BASIC_ISO_DATE;

    // Cache: declared pattern -> formatter (INVALID marks a pattern that failed to compile)
    private final Map<String, DateTimeFormatter> formatterCache = new ConcurrentHashMap<>();

    @Override
    public ComputedColumnType getType() {
        return ComputedColumnType.DATE_FORMAT;
    }

    @Override
    public String derive(Map<String, String> row, ComputedColumnSpec spec) {
        String column = spec.getColumn() == null ? "" : spec.getColumn().trim();
        Optional<LocalDateTime> value = ValueCoercion.toDateTime(row.get(column));
        if (value.isEmpty()) {
            return "";
        }
        String pattern = spec.getFormat() == null || spec.getFormat().isEmpty()
                ? ComputedColumnSpec.DEFAULT_DATE_FORMAT
                : spec.getFormat();
        DateTimeFormatter formatter = formatterCache.computeIfAbsent(pattern, this::compile);
        if (formatter == INVALID) {
            return "";
        }
        try {
            return formatter.format(value.get());
        } catch (DateTimeException e) {
            log.debug("Cannot format {} with pattern '{}': {}", value.get(), pattern, e.getMessage());
            return "";
        }
    }

    private DateTimeFormatter compile(String pattern) {
        String javaPattern = pattern.indexOf('%') >= 0 ? translateStrftime(pattern) : pattern;
        try {
            return DateTimeFormatter.ofPattern(javaPattern, Locale.US);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid date format pattern '{}': {}", pattern, e.getMessage());
            return INVALID;
        }
    }

    /**
     * Translate a strftime pattern into a java.time pattern, quoting literal text.
     */
    static String translateStrftime(String pattern) {
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= pattern.length()) {
                literal.append(c);
                continue;
            }
            char directive = pattern.charAt(++i);
            String translated = directive(directive);
            if (translated == null) {
                literal.append('%').append(directive);
                continue;
            }
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            flushLiteral(out, literal);
            out.append(translated);
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static String directive(char directive) {
        switch (directive) {
            case 'Y': return "uuuu";
            case 'y': return "uu";
            case 'm': return "MM";
            case 'd': return "dd";
            case 'H': return "HH";
            case 'I': return "hh";
            case 'M': return "mm";
            case 'S': return "ss";
            case 'p': return "a";
            case 'b': return "MMM";
            case 'B': return "MMMM";
            case 'a': return "EEE";
            case 'A': return "EEEE";
            case 'j': return "DDD";
            case 'f': return "SSSSSS";
            // Values carry no zone
            case 'Z':
            case 'z': return "";
            case '%': return "%";
            default: return null;
        }
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
