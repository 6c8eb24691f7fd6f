package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.DatasetSample;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for delimited-text parsing.
 *
 * Features:
 * - Detect the field delimiter from a leading text sample
 * - Parse rows handling quoted fields, delimiters and line breaks within quotes
 * - Read a header plus a bounded number of rows into a DatasetSample
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    public static final char DEFAULT_DELIMITER = ',';

    /** Candidates in tie-break order. */
    private static final char[] CANDIDATE_DELIMITERS = {',', '\t', ';', '|'};

    private static final int SNIFF_MAX_LINES = 20;

    private static final char BOM = '\uFEFF';

    /**
     * Detect the delimiter of a text sample.
     *
     * A candidate qualifies when it occurs, outside quotes, the same non-zero
     * number of times on every sampled line. Among qualifying candidates the
     * most frequent wins. The sample's last line is ignored when it may be
     * cut off by the sample boundary.
     *
     * @param sample    leading text of the source
     * @param truncated whether the sample stops before the end of the source
     * @return the detected delimiter, or ',' when detection fails
     */
    public char detectDelimiter(String sample, boolean truncated) {
        List<String> lines = new ArrayList<>();
        String[] rawLines = sample.split("\r\n|\n|\r", -1);
        int usable = truncated && rawLines.length > 1 ? rawLines.length - 1 : rawLines.length;
        for (int i = 0; i < usable && lines.size() < SNIFF_MAX_LINES; i++) {
            if (!rawLines[i].isEmpty()) {
                lines.add(rawLines[i]);
            }
        }
        if (lines.isEmpty()) {
            return DEFAULT_DELIMITER;
        }

        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int expected = countOutsideQuotes(lines.get(0), candidate);
            if (expected == 0) {
                continue;
            }
            boolean consistent = lines.stream().allMatch(line -> countOutsideQuotes(line, candidate) == expected);
            if (consistent && expected > bestCount) {
                best = candidate;
                bestCount = expected;
            }
        }

        if (bestCount == 0) {
            logger.debug("Delimiter detection failed, defaulting to '{}'", DEFAULT_DELIMITER);
        }
        return best;
    }

    /**
     * Read a header and up to maxRows rows.
     *
     * Empty lines are skipped. Missing cells become "", cells beyond the
     * header width are dropped.
     *
     * @param reader    reader positioned at the header line
     * @param delimiter field delimiter
     * @param maxRows   maximum number of data rows to read
     * @return the sample (no columns when the source is empty)
     * @throws IOException if the reader fails
     */
    public DatasetSample readSample(BufferedReader reader, char delimiter, int maxRows) throws IOException {
        String headerRecord = readRecord(reader, delimiter);
        while (headerRecord != null && headerRecord.isEmpty()) {
            headerRecord = readRecord(reader, delimiter);
        }
        if (headerRecord == null) {
            return DatasetSample.empty();
        }
        if (headerRecord.charAt(0) == BOM) {
            headerRecord = headerRecord.substring(1);
        }
        List<String> columns = parseRow(headerRecord, delimiter);

        List<Map<String, String>> rows = new ArrayList<>();
        String record;
        while (rows.size() < maxRows && (record = readRecord(reader, delimiter)) != null) {
            if (record.isEmpty()) {
                continue;
            }
            List<String> values = parseRow(record, delimiter);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < values.size() ? values.get(i) : "");
            }
            rows.add(row);
        }

        logger.debug("Read {} columns and {} rows (cap {})", columns.size(), rows.size(), maxRows);
        return new DatasetSample(columns, rows);
    }

    /**
     * Read one logical record, joining physical lines while a quoted field is open.
     *
     * @return the record text without its terminator, or null at end of input
     */
    String readRecord(BufferedReader reader, char delimiter) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder record = new StringBuilder(line);
        while (hasOpenQuote(record, delimiter)) {
            String next = reader.readLine();
            if (next == null) {
                break;
            }
            record.append('\n').append(next);
        }
        return record.toString();
    }

    /**
     * Parse a delimited row handling quoted fields and delimiters within quotes.
     * Follows RFC 4180 for quote handling; a quote inside an unquoted value is
     * kept as is. Values are not trimmed.
     *
     * Examples (comma):
     *   "John,Smith,30" → ["John", "Smith", "30"]
     *   "John,\"Smith, Jr.\",30" → ["John", "Smith, Jr.", "30"]
     *   "\"Author \"\"John\"\" Doe\",50" → ["Author \"John\" Doe", "50"]
     *   "5\" pipe,2" → ["5\" pipe", "2"]
     *
     * @param line      the record to parse
     * @param delimiter field delimiter
     * @return list of field values
     */
    public List<String> parseRow(String line, char delimiter) {
        List<String> values = new ArrayList<>();
        scanRow(line, delimiter, values);
        return values;
    }

    /**
     * Split a record into values.
     *
     * A quote opens a quoted section only as the first character of a field;
     * anywhere else it is literal. Inside a quoted section "" is an escaped
     * quote and a single quote closes the section.
     *
     * @return true when the record ends inside an open quoted section
     */
    private boolean scanRow(CharSequence line, char delimiter, List<String> values) {
        boolean inQuotes = false;
        boolean fieldStart = true;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (inQuotes) {
                if (c != '"') {
                    currentValue.append(c);
                } else if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = false;
                }
            } else if (c == delimiter) {
                values.add(currentValue.toString());
                currentValue = new StringBuilder();
                fieldStart = true;
                continue;
            } else if (c == '"' && fieldStart) {
                inQuotes = true;
            } else {
                currentValue.append(c);
            }
            fieldStart = false;
        }

        values.add(currentValue.toString());
        return inQuotes;
    }

    private boolean hasOpenQuote(CharSequence text, char delimiter) {
        return scanRow(text, delimiter, new ArrayList<>());
    }

    private int countOutsideQuotes(String line, char candidate) {
        List<String> values = new ArrayList<>();
        scanRow(line, candidate, values);
        return values.size() - 1;
    }
}
