package io.sitepull.source.service.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sitepull.source.store.models.ManifestEntry;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class ManifestPage {
  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("offset")
  int offset;

  @JsonProperty("limit")
  int limit;

  @JsonProperty("total_files")
  long totalFiles;

  @JsonProperty("total_bytes")
  long totalBytes;

  @JsonProperty("files")
  List<ManifestEntry> files;
}
