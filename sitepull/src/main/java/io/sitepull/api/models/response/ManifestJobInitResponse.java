package io.sitepull.api.models.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Builder
@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class ManifestJobInitResponse extends ApiResponse {
  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("total_files")
  private long totalFiles;

  @JsonProperty("total_bytes")
  private long totalBytes;

  @JsonProperty("created_at")
  private long createdAt;
}
