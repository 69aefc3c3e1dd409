package io.sitepull.metrics;

import io.micrometer.core.instrument.Tag;
import io.sitepull.constants.MetricsConstants;
import io.sitepull.manifest.models.UnitType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import javax.inject.Inject;

public class SitePullMetrics {
  static final String METRICS_COMMON_PREFIX = "sitepull_";

  // Tag keys
  static final String UNIT_TYPE_TAG_KEY = "unit_type";
  static final String FAILURE_REASON_TAG_KEY = "failure_reason";
  static final String ACTION_TAG_KEY = "action";

  // Metrics
  static final String UNIT_SUCCESS_COUNTER = METRICS_COMMON_PREFIX + "unit_success";
  static final String UNIT_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "unit_failure";
  static final String UNIT_RETRY_COUNTER = METRICS_COMMON_PREFIX + "unit_retry";
  static final String FILES_FAILED_COUNTER = METRICS_COMMON_PREFIX + "files_failed";
  static final String BYTES_TRANSFERRED_COUNTER = METRICS_COMMON_PREFIX + "bytes_transferred";
  static final String API_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "api_failure";
  static final String DB_CHUNK_COUNTER = METRICS_COMMON_PREFIX + "db_chunks_processed";
  static final String UNIT_DURATION_TIMER = METRICS_COMMON_PREFIX + "unit_duration";
  static final String UNITS_IN_FLIGHT_GAUGE = METRICS_COMMON_PREFIX + "units_in_flight";
  static final String FILES_TOTAL_GAUGE = METRICS_COMMON_PREFIX + "files_total";

  private final Metrics metrics;
  private final AtomicLong unitsInFlight;
  private final AtomicLong filesTotal;

  @Inject
  public SitePullMetrics(@Nonnull Metrics metrics) {
    this.metrics = metrics;
    this.unitsInFlight = metrics.gauge(UNITS_IN_FLIGHT_GAUGE, "Transfer units being retrieved");
    this.filesTotal = metrics.gauge(FILES_TOTAL_GAUGE, "Files listed by the manifest");
  }

  public void setFilesTotal(long files) {
    filesTotal.set(files);
  }

  public void unitStarted() {
    unitsInFlight.incrementAndGet();
  }

  public void unitSucceeded(UnitType type, Duration duration) {
    unitsInFlight.decrementAndGet();
    List<Tag> tags = unitTags(type);
    metrics.increment(UNIT_SUCCESS_COUNTER, tags);
    metrics.timer(UNIT_DURATION_TIMER, duration, tags);
  }

  public void unitFailed(UnitType type, MetricsConstants.UnitFailureReasons reason) {
    unitsInFlight.decrementAndGet();
    List<Tag> tags = unitTags(type);
    tags.add(Tag.of(FAILURE_REASON_TAG_KEY, reason.name()));
    metrics.increment(UNIT_FAILURE_COUNTER, tags);
  }

  public void unitRetried(UnitType type) {
    metrics.increment(UNIT_RETRY_COUNTER, unitTags(type));
  }

  public void filesFailed(long files, MetricsConstants.UnitFailureReasons reason) {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(FAILURE_REASON_TAG_KEY, reason.name()));
    metrics.increment(FILES_FAILED_COUNTER, files, tags);
  }

  public void bytesTransferred(long bytes) {
    metrics.increment(BYTES_TRANSFERRED_COUNTER, bytes, new ArrayList<>());
  }

  public void databaseChunkProcessed() {
    metrics.increment(DB_CHUNK_COUNTER, new ArrayList<>());
  }

  public void apiFailure(String action, MetricsConstants.ApiFailureReasons reason) {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(ACTION_TAG_KEY, action));
    tags.add(Tag.of(FAILURE_REASON_TAG_KEY, reason.name()));
    metrics.increment(API_FAILURE_COUNTER, tags);
  }

  private static List<Tag> unitTags(UnitType type) {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(UNIT_TYPE_TAG_KEY, type.name()));
    return tags;
  }
}
