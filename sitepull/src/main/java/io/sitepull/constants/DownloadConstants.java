package io.sitepull.constants;

public class DownloadConstants {

  private DownloadConstants() {}

  public static final long DEFAULT_LARGE_FILE_THRESHOLD_BYTES = 8L * 1024 * 1024;
  public static final long DEFAULT_BATCH_MAX_BYTES = 8L * 1024 * 1024;
  public static final int DEFAULT_BATCH_MAX_FILES = 2000;
  public static final int DEFAULT_CONCURRENCY = 4;
  public static final int MAX_CONCURRENCY = 32;
  public static final int DEFAULT_UNIT_ATTEMPTS = 3;
  public static final long DEFAULT_UNIT_RETRY_DELAY_MILLIS = 500;
  public static final int DEFAULT_DB_TIME_BUDGET_SECONDS = 5;
  public static final long DEFAULT_DB_PROCESS_DELAY_MILLIS = 100;
  public static final int DEFAULT_DB_MAX_PROCESS_CALLS = 100_000;
  public static final int DEFAULT_MANIFEST_PAGE_SIZE = 2000;
  public static final int DEFAULT_PROGRESS_LOG_INTERVAL_SECONDS = 5;

  // Workspace and archive layout
  public static final String FILES_DIRECTORY = "files";
  public static final String DATABASE_DIRECTORY = "database";
  public static final String DATABASE_FILE_NAME = "database.sql";
  public static final String ARCHIVES_DIRECTORY = "archives";
  public static final String WORKSPACE_DIRECTORY_PREFIX = ".sitepull-work-";
  public static final String ARCHIVE_TIMESTAMP_PATTERN = "yyyyMMdd-HHmmss";

  public static final int COPY_BUFFER_BYTES = 64 * 1024;
}
