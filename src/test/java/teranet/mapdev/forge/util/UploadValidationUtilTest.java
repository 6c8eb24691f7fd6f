package teranet.mapdev.forge.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class UploadValidationUtilTest {

    private MockMultipartFile file(String name, String content) {
        return new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "b", "orders", "set_2", "x1234567890123456789012345678901"})
    void testValidateTag_Accepted(String tag) {
        assertEquals(tag, UploadValidationUtil.validateTag(tag));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "A", "1a", "_a", "a-b", "a__b", "a b", "x12345678901234567890123456789012"})
    void testValidateTag_Rejected(String tag) {
        assertThrows(IllegalArgumentException.class, () -> UploadValidationUtil.validateTag(tag));
    }

    @Test
    void testValidateTag_Null() {
        assertThrows(IllegalArgumentException.class, () -> UploadValidationUtil.validateTag(null));
    }

    @Test
    void testValidateAndGetFilename_StripsDirectories() {
        assertEquals("data.csv", UploadValidationUtil.validateAndGetFilename(file("C:\\tmp\\data.csv", "x")));
        assertEquals("data.csv", UploadValidationUtil.validateAndGetFilename(file("../../data.csv", "x")));
    }

    @Test
    void testValidateAndGetFilename_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> UploadValidationUtil.validateAndGetFilename(file("dir/..", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> UploadValidationUtil.validateAndGetFilename(file("  ", "x")));
    }

    @Test
    void testValidateFileExtension_CaseInsensitive() {
        assertDoesNotThrow(() -> UploadValidationUtil.validateFileExtension(file("DATA.CSV.GZ", "x"), "csv", "gz"));
    }

    @Test
    void testValidateFileExtension_ListsAllowedTypes() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> UploadValidationUtil.validateFileExtension(file("data.xlsx", "x"), "csv", "tsv"));

        assertTrue(exception.getMessage().contains("CSV, TSV"));
        assertTrue(exception.getMessage().contains("data.xlsx"));
    }

    @Test
    void testValidateFile_Empty() {
        assertThrows(IllegalArgumentException.class, () -> UploadValidationUtil.validateFile(file("a.csv", ""), "csv"));
        assertThrows(IllegalArgumentException.class, () -> UploadValidationUtil.validateFile(null, "csv"));
    }
}
