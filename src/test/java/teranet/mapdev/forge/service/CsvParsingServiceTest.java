package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.forge.model.DatasetSample;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CsvParsingService
 * Tests delimiter detection, quoted field handling and bounded sample reading
 */
class CsvParsingServiceTest {

    private CsvParsingService csvParsingService;

    @BeforeEach
    void setUp() {
        csvParsingService = new CsvParsingService();
    }

    // ========== detectDelimiter Tests ==========

    @Test
    void testDetectDelimiter_Comma() {
        assertEquals(',', csvParsingService.detectDelimiter("a,b,c\n1,2,3\n", false));
    }

    @Test
    void testDetectDelimiter_Tab() {
        assertEquals('\t', csvParsingService.detectDelimiter("a\tb\tc\n1\t2\t3\n", false));
    }

    @Test
    void testDetectDelimiter_SemicolonWithCommaInsideQuotes() {
        // Given: commas only appear inside quoted values
        String sample = "name;amount\n\"Smith, J\";1,5\n\"Doe, A\";2,5\n";

        // When / Then: ';' is the only candidate consistent on every line
        assertEquals(';', csvParsingService.detectDelimiter(sample, false));
    }

    @Test
    void testDetectDelimiter_Pipe() {
        assertEquals('|', csvParsingService.detectDelimiter("id|name\n1|x\n2|y", false));
    }

    @Test
    void testDetectDelimiter_IgnoresCutOffLastLineWhenTruncated() {
        // Given: the last line was cut by the sample boundary
        String sample = "a;b;c\n1;2;3\n4;5";

        // Then: the partial line does not break consistency
        assertEquals(';', csvParsingService.detectDelimiter(sample, true));
        assertEquals(',', csvParsingService.detectDelimiter(sample, false));
    }

    @Test
    void testDetectDelimiter_DefaultsToComma() {
        assertEquals(',', csvParsingService.detectDelimiter("single_column\nvalue\n", false));
        assertEquals(',', csvParsingService.detectDelimiter("", false));
    }

    // ========== parseRow Tests ==========

    @Test
    void testParseRow_QuotedFields() {
        List<String> values = csvParsingService.parseRow("John,\"Smith, Jr.\",30", ',');
        assertEquals(List.of("John", "Smith, Jr.", "30"), values);
    }

    @Test
    void testParseRow_EscapedQuotes() {
        List<String> values = csvParsingService.parseRow("\"Author \"\"John\"\" Doe\",50", ',');
        assertEquals(List.of("Author \"John\" Doe", "50"), values);
    }

    @Test
    void testParseRow_KeepsWhitespaceAndEmptyCells() {
        List<String> values = csvParsingService.parseRow(" a ,,c,", ',');
        assertEquals(List.of(" a ", "", "c", ""), values);
    }

    @Test
    void testParseRow_QuoteInsideUnquotedValueIsLiteral() {
        List<String> values = csvParsingService.parseRow("1,5\" pipe,a\"b\"", ',');
        assertEquals(List.of("1", "5\" pipe", "a\"b\""), values);
    }

    // ========== readSample Tests ==========

    @Test
    void testReadSample_PadsAndTruncatesCells() throws IOException {
        // Given: one short row and one long row
        String csv = "id,name,city\n1,Ada\n2,Grace,NYC,extra\n";

        // When
        DatasetSample sample = csvParsingService.readSample(reader(csv), ',', 10);

        // Then
        assertEquals(List.of("id", "name", "city"), sample.getColumns());
        assertEquals(2, sample.getRows().size());
        assertEquals("", sample.getRows().get(0).get("city"));
        assertEquals("NYC", sample.getRows().get(1).get("city"));
        assertThat(sample.getRows().get(1)).hasSize(3);
    }

    @Test
    void testReadSample_MultiLineQuotedField() throws IOException {
        String csv = "id,note\n1,\"line one\nline two\"\n2,plain\n";

        DatasetSample sample = csvParsingService.readSample(reader(csv), ',', 10);

        assertEquals(2, sample.getRows().size());
        assertEquals("line one\nline two", sample.getRows().get(0).get("note"));
        assertEquals("plain", sample.getRows().get(1).get("note"));
    }

    @Test
    void testReadSample_StrayQuoteDoesNotSwallowFollowingRows() throws IOException {
        // Given: an inch mark in the middle of an unquoted value
        String csv = "id,desc\n1,5\" pipe\n2,ok\n3,fine\n";

        // When
        DatasetSample sample = csvParsingService.readSample(reader(csv), ',', 10);

        // Then: every line stays its own record
        assertEquals(3, sample.getRows().size());
        assertEquals("5\" pipe", sample.getRows().get(0).get("desc"));
        assertEquals("ok", sample.getRows().get(1).get("desc"));
        assertEquals("3", sample.getRows().get(2).get("id"));
    }

    @Test
    void testDetectDelimiter_StrayQuoteInUnquotedValue() {
        assertEquals(',', csvParsingService.detectDelimiter("id,desc\n1,5\" pipe\n2,ok\n", false));
    }

    @Test
    void testReadSample_RespectsRowCapAndSkipsEmptyLines() throws IOException {
        String csv = "\nid\n1\n\n2\n3\n4\n";

        DatasetSample sample = csvParsingService.readSample(reader(csv), ',', 2);

        assertEquals(List.of("id"), sample.getColumns());
        assertEquals(2, sample.getRows().size());
        assertEquals("2", sample.getRows().get(1).get("id"));
    }

    @Test
    void testReadSample_StripsByteOrderMark() throws IOException {
        DatasetSample sample = csvParsingService.readSample(reader("\uFEFFid,name\n1,x\n"), ',', 5);

        assertEquals("id", sample.getColumns().get(0));
        assertEquals("1", sample.getRows().get(0).get("id"));
    }

    @Test
    void testReadSample_EmptySource() throws IOException {
        DatasetSample sample = csvParsingService.readSample(reader(""), ',', 5);

        assertTrue(sample.getColumns().isEmpty());
        assertTrue(sample.getRows().isEmpty());
    }

    private BufferedReader reader(String content) {
        return new BufferedReader(new StringReader(content));
    }
}
