package teranet.mapdev.forge.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValueCoercionTest {

    @Test
    void testIsBlank_BlankValues() {
        assertTrue(ValueCoercion.isBlank(null));
        assertTrue(ValueCoercion.isBlank(""));
        assertTrue(ValueCoercion.isBlank("  "));
        assertTrue(ValueCoercion.isBlank("nan"));
        assertTrue(ValueCoercion.isBlank("NULL"));
        assertTrue(ValueCoercion.isBlank(" None "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "x", "nul", "n/a", "false", " a "})
    void testIsBlank_NonBlankValues(String value) {
        assertFalse(ValueCoercion.isBlank(value));
    }

    @Test
    void testOrEmpty() {
        assertEquals("", ValueCoercion.orEmpty("NaN"));
        assertEquals(" x ", ValueCoercion.orEmpty(" x "));
    }

    @Test
    void testToNumber_ParsesDecimalAndScientific() {
        assertEquals(12.5, ValueCoercion.toNumber(" 12.5 ").getAsDouble());
        assertEquals(-3.0, ValueCoercion.toNumber("-3").getAsDouble());
        assertEquals(1500.0, ValueCoercion.toNumber("1.5e3").getAsDouble());
        assertEquals(0.5, ValueCoercion.toNumber(".5").getAsDouble());
        assertEquals(Double.POSITIVE_INFINITY, ValueCoercion.toNumber("inf").getAsDouble());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "1d", "1f", "0x1A", "1,000", "nan"})
    void testToNumber_UnparsableIsEmpty(String value) {
        assertTrue(ValueCoercion.toNumber(value).isEmpty());
    }

    @Test
    void testToDateTime_SupportedFormats() {
        assertThat(ValueCoercion.toDateTime("2024-01-15")).contains(LocalDateTime.of(2024, 1, 15, 0, 0));
        assertThat(ValueCoercion.toDateTime("2024-01-15T08:30:00")).contains(LocalDateTime.of(2024, 1, 15, 8, 30));
        assertThat(ValueCoercion.toDateTime("2024-01-15 08:30:00")).contains(LocalDateTime.of(2024, 1, 15, 8, 30));
        assertThat(ValueCoercion.toDateTime("01/15/24")).contains(LocalDateTime.of(2024, 1, 15, 0, 0));
        assertThat(ValueCoercion.toDateTime("01/15/2024")).contains(LocalDateTime.of(2024, 1, 15, 0, 0));
    }

    @Test
    void testToDateTime_TwoDigitYearPivot() {
        assertThat(ValueCoercion.toDateTime("06/01/69")).contains(LocalDateTime.of(1969, 6, 1, 0, 0));
        assertThat(ValueCoercion.toDateTime("06/01/68")).contains(LocalDateTime.of(2068, 6, 1, 0, 0));
    }

    @Test
    void testToDateTime_IsoWithOffsetNormalizedToUtc() {
        assertThat(ValueCoercion.toDateTime("2024-01-15T08:30:00Z")).contains(LocalDateTime.of(2024, 1, 15, 8, 30));
        assertThat(ValueCoercion.toDateTime("2024-01-15T08:30:00+02:00"))
                .contains(LocalDateTime.of(2024, 1, 15, 6, 30));
        assertThat(ValueCoercion.toDateTime("2024-01-15T08:30:00.250"))
                .contains(LocalDateTime.of(2024, 1, 15, 8, 30, 0, 250_000_000));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "null", "yesterday", "2024-13-01", "2024-02-30", "15.01.2024", "12"})
    void testToDateTime_UnparsableIsEmpty(String value) {
        assertTrue(ValueCoercion.toDateTime(value).isEmpty());
    }
}
