package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for source upload responses
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceUploadResponseDto {

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("file_size_bytes")
    private Long fileSizeBytes;

    @JsonProperty("status")
    private String status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("inspection")
    private InspectionResultDto inspection;

    // Static factory methods
    public static SourceUploadResponseDto registered(String tag, String fileName, Long fileSizeBytes,
            InspectionResultDto inspection) {
        return new SourceUploadResponseDto(tag, fileName, fileSizeBytes, "REGISTERED",
                "Source registered and inspected successfully", inspection);
    }

    public static SourceUploadResponseDto unchanged(String tag, String fileName, Long fileSizeBytes,
            InspectionResultDto inspection) {
        return new SourceUploadResponseDto(tag, fileName, fileSizeBytes, "UNCHANGED",
                "Source content identical to the registered file; cached inspection reused", inspection);
    }
}
