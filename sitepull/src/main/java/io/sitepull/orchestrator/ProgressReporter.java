package io.sitepull.orchestrator;

import io.sitepull.retrieval.ProgressAggregator;
import io.sitepull.retrieval.models.ProgressSnapshot;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/** Logs the retrieval totals at a fixed interval while files are being pulled. */
@Slf4j
public class ProgressReporter implements AutoCloseable {
  private final ProgressAggregator aggregator;
  private final ScheduledExecutorService scheduler;

  public ProgressReporter(ProgressAggregator aggregator, int intervalSeconds) {
    this.aggregator = aggregator;
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "sitepull-progress");
              thread.setDaemon(true);
              return thread;
            });
    if (intervalSeconds > 0) {
      scheduler.scheduleAtFixedRate(this::report, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }
  }

  void report() {
    log.info(describe(aggregator.snapshot()));
  }

  static String describe(ProgressSnapshot snapshot) {
    return String.format(
        "Files %d/%d (failed %d), %s of %s",
        snapshot.getFilesCompleted(),
        snapshot.getTotalFiles(),
        snapshot.getFilesFailed(),
        FileUtils.byteCountToDisplaySize(snapshot.getBytesTransferred()),
        FileUtils.byteCountToDisplaySize(snapshot.getTotalBytes()));
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }
}
