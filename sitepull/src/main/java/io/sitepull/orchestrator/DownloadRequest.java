package io.sitepull.orchestrator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class DownloadRequest {
  @NonNull String url;
  @NonNull String key;
  @NonNull String outputDirectory;
  int concurrency;
}
