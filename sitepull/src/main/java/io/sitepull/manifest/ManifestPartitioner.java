package io.sitepull.manifest;

import io.sitepull.manifest.models.ManifestEntry;
import io.sitepull.manifest.models.Partition;
import io.sitepull.manifest.models.TransferUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a manifest into transfer units in one pass over the entries. Entries above the large-file
 * threshold become singleton units; the rest are packed greedily, in manifest order, into batches
 * bounded by a byte cap and a file count cap. The same input always yields the same boundaries.
 */
@Slf4j
public class ManifestPartitioner {
  private final long largeFileThresholdBytes;
  private final long batchMaxBytes;
  private final int batchMaxFiles;

  public ManifestPartitioner(long largeFileThresholdBytes, long batchMaxBytes, int batchMaxFiles) {
    if (largeFileThresholdBytes < 1 || batchMaxBytes < 1 || batchMaxFiles < 1) {
      throw new IllegalArgumentException("Partition thresholds must be positive");
    }
    this.largeFileThresholdBytes = largeFileThresholdBytes;
    this.batchMaxBytes = batchMaxBytes;
    this.batchMaxFiles = batchMaxFiles;
  }

  public Partition partition(List<ManifestEntry> entries) {
    List<TransferUnit> largeFiles = new ArrayList<>();
    List<TransferUnit> batches = new ArrayList<>();
    List<ManifestEntry> current = new ArrayList<>();
    long currentBytes = 0;
    long totalBytes = 0;
    int nextId = 0;

    for (ManifestEntry entry : entries) {
      totalBytes += entry.getSize();
      if (entry.getSize() > largeFileThresholdBytes) {
        largeFiles.add(TransferUnit.largeFile(nextId++, entry));
        continue;
      }
      // an entry alone above the byte cap still gets a batch of its own
      boolean full =
          current.size() + 1 > batchMaxFiles || currentBytes + entry.getSize() > batchMaxBytes;
      if (full && !current.isEmpty()) {
        batches.add(TransferUnit.batch(nextId++, current));
        current = new ArrayList<>();
        currentBytes = 0;
      }
      current.add(entry);
      currentBytes += entry.getSize();
    }
    if (!current.isEmpty()) {
      batches.add(TransferUnit.batch(nextId, current));
    }

    log.debug(
        "Partitioned {} entries into {} large files and {} batches",
        entries.size(),
        largeFiles.size(),
        batches.size());
    return Partition.builder()
        .largeFiles(largeFiles)
        .batches(batches)
        .totalFiles(entries.size())
        .totalBytes(totalBytes)
        .build();
  }
}
