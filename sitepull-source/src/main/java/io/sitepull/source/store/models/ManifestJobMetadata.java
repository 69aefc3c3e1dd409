package io.sitepull.source.store.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Value
@Jacksonized
public class ManifestJobMetadata {
  @JsonProperty("created_at")
  long createdAt;

  @JsonProperty("total_files")
  long totalFiles;

  @JsonProperty("total_bytes")
  long totalBytes;

  @JsonProperty("chunk_count")
  int chunkCount;
}
