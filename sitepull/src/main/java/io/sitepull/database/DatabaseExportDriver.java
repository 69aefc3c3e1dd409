package io.sitepull.database;

import io.sitepull.api.ApiCalls;
import io.sitepull.api.SourceApiClient;
import io.sitepull.api.models.response.DatabaseJobInitResponse;
import io.sitepull.api.models.response.DatabaseJobProcessResponse;
import io.sitepull.config.models.configv1.DownloadConfig;
import io.sitepull.constants.ApiConstants;
import io.sitepull.exceptions.ProtocolException;
import io.sitepull.exceptions.SitePullException;
import io.sitepull.metrics.SitePullMetrics;
import io.sitepull.retrieval.ProgressListener;
import io.sitepull.retrieval.StreamCopier;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.io.FileUtils;

/**
 * Drives a database export job on the endpoint. Process calls are issued one at a time, each
 * waiting for the previous reply, with a short pause between them.
 */
@Slf4j
public class DatabaseExportDriver {
  private final SourceApiClient apiClient;
  private final DownloadConfig config;
  private final SitePullMetrics metrics;

  public DatabaseExportDriver(
      SourceApiClient apiClient, DownloadConfig config, SitePullMetrics metrics) {
    this.apiClient = apiClient;
    this.config = config;
    this.metrics = metrics;
  }

  public DatabaseJobInitResponse start() {
    DatabaseJobInitResponse response =
        SourceApiClient.requireSuccess(
            ApiCalls.await(apiClient.initDatabaseJob()), ApiConstants.DB_JOB_INIT);
    if (response.getJobId() == null) {
      throw new ProtocolException("Database job reply has no job id");
    }
    log.info(
        "Database job {}: {} tables, ~{} rows",
        response.getJobId(),
        response.getTotalTables(),
        response.getTotalRows());
    return response;
  }

  /** Runs process calls until the endpoint reports the dump complete. */
  public DatabaseJobProcessResponse runToCompletion(String jobId) {
    for (int call = 1; call <= config.getDbMaxProcessCalls(); call++) {
      DatabaseJobProcessResponse progress =
          SourceApiClient.requireSuccess(
              ApiCalls.await(
                  apiClient.processDatabaseJob(jobId, config.getDbTimeBudgetSeconds())),
              ApiConstants.DB_JOB_PROCESS);
      metrics.databaseChunkProcessed();
      log.info(
          "DB: tables {}/{}, {}",
          progress.getCompletedTables(),
          progress.getTotalTables(),
          FileUtils.byteCountToDisplaySize(progress.getBytesWritten()));
      if (progress.isDone()) {
        return progress;
      }
      pause();
    }
    throw new ProtocolException(
        String.format(
            "Database job %s not complete after %d process calls",
            jobId, config.getDbMaxProcessCalls()));
  }

  /** Streams the finished dump to {@code destination}; an empty dump is an error. */
  public long download(String jobId, Path destination) {
    try (Response response = ApiCalls.await(apiClient.downloadDatabaseJob(jobId))) {
      ResponseBody body = response.body();
      if (body == null) {
        throw new ProtocolException("Database download reply has no body");
      }
      long bytes = StreamCopier.copy(body.byteStream(), destination, ProgressListener.NONE);
      if (bytes == 0) {
        throw new ProtocolException("Downloaded database dump is empty");
      }
      log.info("Database dump downloaded ({})", FileUtils.byteCountToDisplaySize(bytes));
      return bytes;
    } catch (SitePullException e) {
      deleteQuietly(destination);
      throw e;
    }
  }

  /** Best effort: an unfinished job expires on the endpoint. */
  public void finish(String jobId) {
    try {
      SourceApiClient.requireSuccess(
          ApiCalls.await(apiClient.finishDatabaseJob(jobId)), ApiConstants.DB_JOB_FINISH);
    } catch (RuntimeException e) {
      log.warn("Failed to finish database job {}: {}", jobId, e.getMessage());
    }
  }

  private void pause() {
    if (config.getDbProcessDelayMillis() <= 0) {
      return;
    }
    try {
      Thread.sleep(config.getDbProcessDelayMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SitePullException("Interrupted while exporting the database", e);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove partial dump {}: {}", path, e.getMessage());
    }
  }
}
