package io.sitepull.source.config;

import static io.sitepull.source.constants.ExportConstants.DEFAULT_TIME_BUDGET_SECONDS;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Endpoint settings: what is exported, who may ask for it, and where it is served. */
@Builder
@Value
@Jacksonized
public class SourceConfig {
  @NonNull String rootDirectory;
  @NonNull String accessKey;
  @NonNull String workspaceDirectory;
  @NonNull DatabaseConfig database;

  @Builder.Default int port = 8080;
  @Builder.Default int workerThreads = 8;
  @Builder.Default int jobTtlMinutes = 15;
  @Builder.Default int defaultTimeBudgetSeconds = DEFAULT_TIME_BUDGET_SECONDS;
}
