package io.sitepull.source.export.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class InitResult {
  @NonNull String cursor;
  @NonNull String preamble;
  @NonNull ExportMetadata metadata;
}
