package io.sitepull.manifest.models;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** One network transfer: a single large file or a batch of small ones. */
@Value
public class TransferUnit {
  /** Position in the partition, stable across runs with the same manifest. */
  int id;

  @NonNull UnitType type;
  @NonNull List<ManifestEntry> entries;

  public int getFileCount() {
    return entries.size();
  }

  public long getTotalBytes() {
    return entries.stream().mapToLong(ManifestEntry::getSize).sum();
  }

  public static TransferUnit largeFile(int id, ManifestEntry entry) {
    return new TransferUnit(id, UnitType.LARGE_FILE, List.of(entry));
  }

  public static TransferUnit batch(int id, List<ManifestEntry> entries) {
    return new TransferUnit(id, UnitType.BATCH, List.copyOf(entries));
  }
}
