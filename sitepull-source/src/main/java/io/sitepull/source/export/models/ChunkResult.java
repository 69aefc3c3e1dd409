package io.sitepull.source.export.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Output of one pagination step: the serialized slice and the cursor to resume from. */
@Builder
@Value
public class ChunkResult {
  @NonNull byte[] slice;
  @NonNull String cursor;
  boolean complete;
  @NonNull ChunkProgress progress;
  @NonNull ChunkPerformance performance;
}
