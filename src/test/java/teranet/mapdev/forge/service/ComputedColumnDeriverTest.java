package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.forge.model.ComputedColumnSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.forge.util.TestDataFactory.bucket;
import static teranet.mapdev.forge.util.TestDataFactory.functionFactory;
import static teranet.mapdev.forge.util.TestDataFactory.row;

/**
 * Unit tests for ComputedColumnDeriver
 * Runs the real computed column functions through the factory
 */
class ComputedColumnDeriverTest {

    private ComputedColumnDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new ComputedColumnDeriver(functionFactory());
    }

    @Test
    void testBucket_FloorsToBucketStart() {
        Map<String, String> row = row("v", "57");

        deriver.deriveRow(row, List.of(bucket("b", "v", 10)));

        assertEquals("50", row.get("b"));
    }

    @Test
    void testBucket_BlankInputOrZeroSizeIsEmpty() {
        Map<String, String> blank = row("v", "");
        Map<String, String> zeroSize = row("v", "57");

        deriver.deriveRow(blank, List.of(bucket("b", "v", 10)));
        deriver.deriveRow(zeroSize, List.of(bucket("b", "v", 0)));

        assertEquals("", blank.get("b"));
        assertEquals("", zeroSize.get("b"));
    }

    @Test
    void testBucket_NegativeValuesAndDefaultSize() {
        Map<String, String> row = row("v", "-3", "w", "123.9");

        deriver.deriveRow(row, List.of(bucket("neg", "v", 10), bucket("dflt", "w", null), bucket("big", "w", 100)));

        assertEquals("-10", row.get("neg"));
        assertEquals("120", row.get("dflt"));
        assertEquals("100", row.get("big"));
    }

    @Test
    void testBucket_ValuesBeyondLongRangeStayExact() {
        Map<String, String> row = row("v", "1e20", "w", "-1e20");

        deriver.deriveRow(row, List.of(bucket("b", "v", 10), bucket("neg", "w", 10)));

        assertEquals("100000000000000000000", row.get("b"));
        assertEquals("-100000000000000000000", row.get("neg"));
    }

    @Test
    void testConcat_BlankAsEmpty() {
        Map<String, String> row = row("first", "Ada", "middle", "null", "last", "Lovelace");
        ComputedColumnSpec spec = ComputedColumnSpec.builder()
                .name("full").type("concat").columns(List.of("first", "middle", "last")).sep(" ").build();

        deriver.deriveRow(row, List.of(spec));

        assertEquals("Ada  Lovelace", row.get("full"));
    }

    @Test
    void testCoalesce_FirstNonBlank() {
        Map<String, String> row = row("a", " ", "b", "NaN", "c", "third", "d", "fourth");
        ComputedColumnSpec spec = ComputedColumnSpec.builder()
                .name("pick").type("coalesce").columns(List.of("a", "b", "c", "d")).build();
        ComputedColumnSpec none = ComputedColumnSpec.builder()
                .name("none").type("coalesce").columns(List.of("a", "missing")).build();

        deriver.deriveRow(row, List.of(spec, none));

        assertEquals("third", row.get("pick"));
        assertEquals("", row.get("none"));
    }

    @Test
    void testDateFormat_DefaultAndCustomPatterns() {
        Map<String, String> row = row("d", "03/10/2024", "bad", "soon");
        ComputedColumnSpec dflt = ComputedColumnSpec.builder().name("iso").type("date_format").column("d").build();
        ComputedColumnSpec month = ComputedColumnSpec.builder()
                .name("month").type("date_format").column("d").format("%Y/%m").build();
        ComputedColumnSpec javaPattern = ComputedColumnSpec.builder()
                .name("day").type("date_format").column("d").format("dd.MM.yyyy").build();
        ComputedColumnSpec unparsable = ComputedColumnSpec.builder()
                .name("never").type("date_format").column("bad").build();

        deriver.deriveRow(row, List.of(dflt, month, javaPattern, unparsable));

        assertEquals("2024-03-10", row.get("iso"));
        assertEquals("2024/03", row.get("month"));
        assertEquals("10.03.2024", row.get("day"));
        assertEquals("", row.get("never"));
    }

    @Test
    void testDerive_LaterSpecsSeeEarlierOutputs() {
        Map<String, String> row = row("amount", "57");
        ComputedColumnSpec label = ComputedColumnSpec.builder()
                .name("label").type("concat").columns(List.of("band", "amount")).sep(":").build();

        deriver.deriveRow(row, List.of(bucket("band", "amount", 25), label));

        assertEquals("50:57", row.get("label"));
    }

    @Test
    void testDerive_SkipsUnsupportedAndNamelessSpecs() {
        Map<String, String> row = row("v", "1");
        ComputedColumnSpec unsupported = ComputedColumnSpec.builder().name("x").type("upper").column("v").build();
        ComputedColumnSpec nameless = ComputedColumnSpec.builder().name(" ").type("bucket").column("v").build();

        deriver.deriveRow(row, new ArrayList<>(List.of(unsupported, nameless)));

        assertThat(row).containsOnlyKeys("v");
    }

    @Test
    void testDerive_AppliesToEveryRow() {
        List<Map<String, String>> rows = List.of(row("v", "5"), row("v", "15"));

        deriver.derive(rows, List.of(bucket("b", "v", 10)));

        assertThat(rows).extracting(r -> r.get("b")).containsExactly("0", "10");
    }
}
