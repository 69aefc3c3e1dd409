package io.sitepull.source.export.models;

import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class TableStatus {
  long rowCount;
  long byteSize;
}
