package io.sitepull.source.service.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class ManifestJobInfo {
  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("total_files")
  long totalFiles;

  @JsonProperty("total_bytes")
  long totalBytes;

  @JsonProperty("created_at")
  long createdAt;
}
