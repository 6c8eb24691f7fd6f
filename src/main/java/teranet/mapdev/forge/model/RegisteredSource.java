package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A delimited file registered under a dataset tag.
 * The checksum identifies the uploaded content for schema caching.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredSource {

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("file_name")
    private String fileName;

    @JsonIgnore
    private Path path;

    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("file_size_bytes")
    private Long fileSizeBytes;

    @JsonProperty("registered_at")
    private LocalDateTime registeredAt;

    /**
     * Cache key for inspection results: same tag and same content.
     */
    public String identity() {
        return tag + ":" + checksum;
    }
}
