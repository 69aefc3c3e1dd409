package io.sitepull.config.models.configv1;

import static io.sitepull.constants.DownloadConstants.DEFAULT_BATCH_MAX_BYTES;
import static io.sitepull.constants.DownloadConstants.DEFAULT_BATCH_MAX_FILES;
import static io.sitepull.constants.DownloadConstants.DEFAULT_DB_MAX_PROCESS_CALLS;
import static io.sitepull.constants.DownloadConstants.DEFAULT_DB_PROCESS_DELAY_MILLIS;
import static io.sitepull.constants.DownloadConstants.DEFAULT_DB_TIME_BUDGET_SECONDS;
import static io.sitepull.constants.DownloadConstants.DEFAULT_LARGE_FILE_THRESHOLD_BYTES;
import static io.sitepull.constants.DownloadConstants.DEFAULT_MANIFEST_PAGE_SIZE;
import static io.sitepull.constants.DownloadConstants.DEFAULT_PROGRESS_LOG_INTERVAL_SECONDS;
import static io.sitepull.constants.DownloadConstants.DEFAULT_UNIT_ATTEMPTS;
import static io.sitepull.constants.DownloadConstants.DEFAULT_UNIT_RETRY_DELAY_MILLIS;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/** Tuning of one download run. Every field has a default, so the YAML file may omit any of them. */
@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class DownloadConfig {
  /** Files strictly larger than this are fetched alone. */
  @Builder.Default private long largeFileThresholdBytes = DEFAULT_LARGE_FILE_THRESHOLD_BYTES;

  @Builder.Default private long batchMaxBytes = DEFAULT_BATCH_MAX_BYTES;
  @Builder.Default private int batchMaxFiles = DEFAULT_BATCH_MAX_FILES;
  @Builder.Default private int unitAttempts = DEFAULT_UNIT_ATTEMPTS;
  @Builder.Default private long unitRetryDelayMillis = DEFAULT_UNIT_RETRY_DELAY_MILLIS;
  @Builder.Default private int dbTimeBudgetSeconds = DEFAULT_DB_TIME_BUDGET_SECONDS;
  @Builder.Default private long dbProcessDelayMillis = DEFAULT_DB_PROCESS_DELAY_MILLIS;

  /** Upper bound on process calls for one dump; a source that never finishes fails the run. */
  @Builder.Default private int dbMaxProcessCalls = DEFAULT_DB_MAX_PROCESS_CALLS;

  @Builder.Default private int manifestPageSize = DEFAULT_MANIFEST_PAGE_SIZE;
  @Builder.Default private int progressLogIntervalSeconds = DEFAULT_PROGRESS_LOG_INTERVAL_SECONDS;
}
