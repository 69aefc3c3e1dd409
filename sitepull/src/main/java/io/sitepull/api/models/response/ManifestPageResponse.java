package io.sitepull.api.models.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sitepull.manifest.models.ManifestEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Builder
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class ManifestPageResponse extends ApiResponse {
  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("offset")
  private int offset;

  @JsonProperty("limit")
  private int limit;

  @JsonProperty("total_files")
  private long totalFiles;

  @JsonProperty("total_bytes")
  private long totalBytes;

  @JsonProperty("files")
  private List<ManifestEntry> files;
}
