package io.sitepull.source.constants;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

public class SourceConstants {

  private SourceConstants() {}

  // Actions
  public static final String ACTION_PARAM = "action";
  public static final String DB_JOB_INIT = "db_job_init";
  public static final String DB_JOB_PROCESS = "db_job_process";
  public static final String DB_JOB_DOWNLOAD = "db_job_download";
  public static final String DB_JOB_FINISH = "db_job_finish";
  public static final String MANIFEST_JOB_INIT = "manifest_job_init";
  public static final String MANIFEST_JOB_PAGE = "manifest_job_page";
  public static final String MANIFEST_JOB_FINISH = "manifest_job_finish";
  public static final String FILE_FETCH = "file_fetch";
  public static final String FILE_BATCH = "file_batch";

  // Request parameters
  public static final String JOB_ID_PARAM = "job_id";
  public static final String TIME_BUDGET_PARAM = "time_budget";
  public static final String OFFSET_PARAM = "offset";
  public static final String LIMIT_PARAM = "limit";
  public static final String PATH_PARAM = "path";
  public static final String PATHS_PARAM = "paths[]";

  // Authentication
  public static final String ACCESS_KEY_HEADER = "X-Sitepull-Key";
  public static final String ACCESS_KEY_PARAM = "sitepull_key";

  // Job storage
  public static final Duration JOB_TTL = Duration.ofMinutes(15);
  public static final int MANIFEST_ENTRIES_PER_CHUNK = 2000;
  public static final int MAX_STORED_VALUE_BYTES = 1024 * 1024;
  public static final int JOB_ID_LENGTH = 20;
  public static final int DEFAULT_MANIFEST_PAGE_LIMIT = 2000;
  public static final int MAX_MANIFEST_PAGE_LIMIT = 10000;

  public static final Set<String> SKIPPED_DIRECTORIES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList(".git", ".svn", ".hg")));

  public static final int STREAM_BUFFER_BYTES = 64 * 1024;
}
