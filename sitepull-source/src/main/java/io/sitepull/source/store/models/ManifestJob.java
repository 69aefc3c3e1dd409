package io.sitepull.source.store.models;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class ManifestJob {
  @NonNull String jobId;
  @NonNull ManifestJobMetadata metadata;
  @NonNull List<ManifestEntry> entries;
}
