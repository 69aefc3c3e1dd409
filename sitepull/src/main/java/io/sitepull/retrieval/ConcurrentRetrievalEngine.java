package io.sitepull.retrieval;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.sitepull.constants.MetricsConstants.UnitFailureReasons;
import io.sitepull.exceptions.SitePullException;
import io.sitepull.exceptions.StorageException;
import io.sitepull.exceptions.TransportException;
import io.sitepull.exceptions.ValidationException;
import io.sitepull.manifest.models.ManifestEntry;
import io.sitepull.manifest.models.TransferUnit;
import io.sitepull.metrics.SitePullMetrics;
import io.sitepull.retrieval.models.TransferResult;
import io.sitepull.retrieval.models.UnitResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Retrieves transfer units with a bounded pool of workers pulling from one shared queue. Each
 * worker sends a {@link UnitResult} per unit to a result queue; the calling thread is the only
 * consumer and folds the messages into the final {@link TransferResult} and the {@link
 * ProgressAggregator}. A failed unit never stops the others.
 *
 * <p>Transport errors are retried up to {@code maxAttempts} per unit. Storage and validation
 * errors fail the unit at once. Files of a failed attempt are deleted before the next one.
 */
@Slf4j
public class ConcurrentRetrievalEngine {
  private static final long COLLECT_POLL_MILLIS = 200;

  private final UnitTransport transport;
  private final SitePullMetrics metrics;
  private final int maxAttempts;
  private final long retryDelayMillis;

  public ConcurrentRetrievalEngine(
      @Nonnull UnitTransport transport,
      @Nonnull SitePullMetrics metrics,
      int maxAttempts,
      long retryDelayMillis) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    this.transport = transport;
    this.metrics = metrics;
    this.maxAttempts = maxAttempts;
    this.retryDelayMillis = retryDelayMillis;
  }

  public TransferResult retrieve(
      List<TransferUnit> units, Path destinationRoot, int concurrency, ProgressListener onProgress) {
    return retrieve(units, destinationRoot, concurrency, onProgress, new ProgressAggregator());
  }

  public TransferResult retrieve(
      List<TransferUnit> units,
      Path destinationRoot,
      int concurrency,
      ProgressListener onProgress,
      ProgressAggregator aggregator) {
    if (concurrency < 1) {
      throw new ValidationException("Concurrency must be positive: " + concurrency);
    }
    if (units.isEmpty()) {
      return TransferResult.EMPTY;
    }
    Queue<TransferUnit> pending = new ConcurrentLinkedQueue<>(units);
    BlockingQueue<UnitResult> results = new LinkedBlockingQueue<>();
    ProgressListener listener =
        bytes -> {
          aggregator.addBytes(bytes);
          onProgress.onBytesTransferred(bytes);
        };

    int workers = Math.min(concurrency, units.size());
    ExecutorService pool =
        Executors.newFixedThreadPool(
            workers,
            new ThreadFactoryBuilder().setNameFormat("sitepull-retrieval-%d").setDaemon(true).build());
    List<Future<?>> futures = new ArrayList<>(workers);
    log.info("Retrieving {} units with {} workers", units.size(), workers);
    try {
      for (int i = 0; i < workers; i++) {
        futures.add(pool.submit(() -> drain(pending, destinationRoot, listener, results)));
      }
      return collect(units, results, futures, aggregator);
    } finally {
      pool.shutdownNow();
    }
  }

  private void drain(
      Queue<TransferUnit> pending,
      Path destinationRoot,
      ProgressListener listener,
      BlockingQueue<UnitResult> results) {
    TransferUnit unit;
    while (!Thread.currentThread().isInterrupted() && (unit = pending.poll()) != null) {
      results.add(process(unit, destinationRoot, listener));
    }
  }

  private TransferResult collect(
      List<TransferUnit> units,
      BlockingQueue<UnitResult> results,
      List<Future<?>> workers,
      ProgressAggregator aggregator) {
    TransferResult total = TransferResult.EMPTY;
    Set<Integer> reported = new HashSet<>();
    try {
      while (reported.size() < units.size()) {
        UnitResult message = results.poll(COLLECT_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (message != null) {
          reported.add(message.getUnit().getId());
          total = total.combine(message.getResult());
          aggregator.record(message.getResult());
        } else if (workers.stream().allMatch(Future::isDone) && results.isEmpty()) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SitePullException("Retrieval interrupted", e);
    }

    // a worker that died without reporting leaves units behind
    for (TransferUnit unit : units) {
      if (!reported.contains(unit.getId())) {
        log.error("Unit {} was never reported by a worker", unit.getId());
        TransferResult lost = TransferResult.failure(unit.getFileCount());
        total = total.combine(lost);
        aggregator.record(lost);
      }
    }
    return total;
  }

  private UnitResult process(TransferUnit unit, Path destinationRoot, ProgressListener listener) {
    metrics.unitStarted();
    Stopwatch stopwatch = Stopwatch.createStarted();
    for (int attempt = 1; ; attempt++) {
      UnitFailureReasons reason;
      try {
        TransferResult result = transport.transfer(unit, destinationRoot, listener);
        // units of empty files write no bytes but still count as progress
        listener.onBytesTransferred(0);
        Duration elapsed = stopwatch.elapsed();
        metrics.unitSucceeded(unit.getType(), elapsed);
        metrics.bytesTransferred(result.getBytesTransferred());
        if (result.getFilesFailed() > 0) {
          metrics.filesFailed(result.getFilesFailed(), UnitFailureReasons.MISSING_FROM_BATCH);
        }
        log.debug(
            "Unit {} done in {} ms: {} files, {} bytes",
            unit.getId(),
            elapsed.toMillis(),
            result.getFilesSucceeded(),
            result.getBytesTransferred());
        return new UnitResult(unit, result, attempt, null);
      } catch (TransportException e) {
        deletePartialFiles(unit, destinationRoot);
        if (attempt < maxAttempts) {
          log.warn(
              "Unit {} failed on attempt {}/{}: {}", unit.getId(), attempt, maxAttempts, e.getMessage());
          metrics.unitRetried(unit.getType());
          if (pause(attempt)) {
            continue;
          }
        }
        reason = UnitFailureReasons.TRANSPORT;
        log.error("Unit {} failed after {} attempts: {}", unit.getId(), attempt, e.getMessage());
      } catch (StorageException e) {
        deletePartialFiles(unit, destinationRoot);
        reason = UnitFailureReasons.STORAGE;
        log.error("Unit {} could not be written: {}", unit.getId(), e.getMessage(), e);
      } catch (ValidationException e) {
        deletePartialFiles(unit, destinationRoot);
        reason = UnitFailureReasons.VALIDATION;
        log.error("Unit {} rejected: {}", unit.getId(), e.getMessage());
      } catch (RuntimeException e) {
        deletePartialFiles(unit, destinationRoot);
        reason = UnitFailureReasons.UNKNOWN;
        log.error("Unit {} failed unexpectedly", unit.getId(), e);
      }
      metrics.unitFailed(unit.getType(), reason);
      metrics.filesFailed(unit.getFileCount(), reason);
      return new UnitResult(unit, TransferResult.failure(unit.getFileCount()), attempt, reason);
    }
  }

  /** Returns false when interrupted, which ends the retries. */
  private boolean pause(int attempt) {
    if (retryDelayMillis <= 0) {
      return true;
    }
    try {
      Thread.sleep(retryDelayMillis * attempt);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void deletePartialFiles(TransferUnit unit, Path destinationRoot) {
    for (ManifestEntry entry : unit.getEntries()) {
      try {
        Files.deleteIfExists(DestinationPaths.resolve(destinationRoot, entry.getPath()));
      } catch (IOException | ValidationException e) {
        log.warn("Could not remove partial file {}: {}", entry.getPath(), e.getMessage());
      }
    }
  }
}
