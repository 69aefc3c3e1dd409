package io.sitepull.source.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Value
@Jacksonized
public class DatabaseConfig {
  @NonNull String jdbcUrl;
  @NonNull String user;
  @Builder.Default String password = "";
}
