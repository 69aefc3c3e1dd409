package io.sitepull.retrieval;

import io.sitepull.retrieval.models.ProgressSnapshot;
import io.sitepull.retrieval.models.TransferResult;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of a retrieval. Each counter is its own atomic, so a snapshot may mix values from
 * different instants but never holds a partially written one.
 */
public class ProgressAggregator {
  private final AtomicLong filesCompleted = new AtomicLong();
  private final AtomicLong filesFailed = new AtomicLong();
  private final AtomicLong bytesTransferred = new AtomicLong();
  private final AtomicLong totalFiles = new AtomicLong();
  private final AtomicLong totalBytes = new AtomicLong();

  public void setTotals(long files, long bytes) {
    totalFiles.set(files);
    totalBytes.set(bytes);
  }

  public void addBytes(long bytes) {
    bytesTransferred.addAndGet(bytes);
  }

  public void record(TransferResult result) {
    filesCompleted.addAndGet(result.getFilesSucceeded());
    filesFailed.addAndGet(result.getFilesFailed());
  }

  public ProgressSnapshot snapshot() {
    return new ProgressSnapshot(
        filesCompleted.get(),
        filesFailed.get(),
        bytesTransferred.get(),
        totalFiles.get(),
        totalBytes.get());
  }
}
