package io.sitepull.source.export.models;

import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class ChunkPerformance {
  long queryTimeMs;
  long totalTimeMs;
  Compression compression;
  int chunkSizeUsed;
  boolean keysetPagination;
}
