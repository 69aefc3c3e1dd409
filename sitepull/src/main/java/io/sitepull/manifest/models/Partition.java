package io.sitepull.manifest.models;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class Partition {
  @NonNull List<TransferUnit> largeFiles;
  @NonNull List<TransferUnit> batches;
  long totalFiles;
  long totalBytes;

  /** Large files first so the longest transfers start early. */
  public List<TransferUnit> getUnits() {
    List<TransferUnit> units = new ArrayList<>(largeFiles.size() + batches.size());
    units.addAll(largeFiles);
    units.addAll(batches);
    return units;
  }
}
