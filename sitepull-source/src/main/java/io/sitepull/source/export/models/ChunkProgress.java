package io.sitepull.source.export.models;

import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class ChunkProgress {
  String currentTable;
  int currentTableIndex;
  int tablesCompleted;
  int rowsInChunk;
  long bytesInChunk;
  boolean schemaEmitted;
}
