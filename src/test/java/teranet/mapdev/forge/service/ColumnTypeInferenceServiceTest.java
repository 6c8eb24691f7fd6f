package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.forge.model.ColumnType;
import teranet.mapdev.forge.util.TestDataFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ColumnTypeInferenceServiceTest {

    private ColumnTypeInferenceService service;

    @BeforeEach
    void setUp() {
        service = new ColumnTypeInferenceService();
    }

    @Test
    void testInferType_Datetime() {
        assertEquals(ColumnType.DATETIME, service.inferType(List.of("2024-01-01", "2024-02-01", "2024-03-01")));
    }

    @Test
    void testInferType_NumericBooleanTokensAreBoolean() {
        assertEquals(ColumnType.BOOLEAN, service.inferType(List.of("1", "0", "1", "1")));
    }

    @Test
    void testInferType_Number() {
        assertEquals(ColumnType.NUMBER, service.inferType(List.of("12.5", "7", "3.1")));
    }

    @Test
    void testInferType_String() {
        assertEquals(ColumnType.STRING, service.inferType(List.of("red", "blue")));
    }

    @Test
    void testInferType_WordBooleans() {
        assertEquals(ColumnType.BOOLEAN, service.inferType(List.of("Yes", "no", "TRUE", "n")));
    }

    @Test
    void testInferType_BlankColumnIsUnknown() {
        assertEquals(ColumnType.UNKNOWN, service.inferType(Arrays.asList("", null, "  ", "nan")));
    }

    @Test
    void testInferType_BlanksIgnored() {
        assertEquals(ColumnType.NUMBER, service.inferType(Arrays.asList("", "4.5", null, "8")));
    }

    @Test
    void testInferType_BelowNumberThresholdIsString() {
        // 8 of 10 numeric: under the 90% number threshold
        List<String> values = new ArrayList<>(List.of("1.5", "2.5", "3.5", "4.5", "5.5", "6.5", "7.5", "8.5"));
        values.add("n/a");
        values.add("unknown");

        assertEquals(ColumnType.STRING, service.inferType(values));
    }

    @Test
    void testInferType_OnlyFirstFiftyValuesSampled() {
        // Given: 50 numbers followed by many strings
        List<String> values = new ArrayList<>();
        for (int i = 0; i < ColumnTypeInferenceService.MAX_SAMPLED_VALUES; i++) {
            values.add(String.valueOf(i + 0.5));
        }
        for (int i = 0; i < 100; i++) {
            values.add("text" + i);
        }

        assertEquals(ColumnType.NUMBER, service.inferType(values));
    }

    @Test
    void testInferTypes_KeepsHeaderOrder() {
        Map<String, ColumnType> types = service.inferTypes(TestDataFactory.sample(TestDataFactory.ORDERS_CSV.split("\n")));

        assertThat(types).containsExactly(
                Map.entry("order_id", ColumnType.NUMBER),
                Map.entry("customer_id", ColumnType.STRING),
                Map.entry("amount", ColumnType.NUMBER),
                Map.entry("order_date", ColumnType.DATETIME));
    }
}
