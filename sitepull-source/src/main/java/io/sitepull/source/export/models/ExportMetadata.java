package io.sitepull.source.export.models;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class ExportMetadata {
  @NonNull List<String> tables;
  int totalTables;
  long totalRows;
  long totalBytes;
  int chunkSize;
}
