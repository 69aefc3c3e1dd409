package io.sitepull.constants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ApiConstants {

  private ApiConstants() {}

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

  // Header constants
  public static final String ACCESS_KEY_HEADER = "X-Sitepull-Key";

  // Statuses that a retry cannot fix
  public static final List<Integer> ACCEPTABLE_HTTP_FAILURE_STATUS_CODES =
      Collections.unmodifiableList(new ArrayList<>(Arrays.asList(404, 400, 403, 401, 409)));

  public static final String FORBIDDEN_ERROR_MESSAGE =
      "The endpoint rejected the access key. Confirm that it matches the key configured on the site.";
}
