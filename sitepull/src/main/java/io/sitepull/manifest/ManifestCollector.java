package io.sitepull.manifest;

import io.sitepull.api.ApiCalls;
import io.sitepull.api.SourceApiClient;
import io.sitepull.api.models.response.ManifestJobInitResponse;
import io.sitepull.api.models.response.ManifestPageResponse;
import io.sitepull.constants.ApiConstants;
import io.sitepull.exceptions.ProtocolException;
import io.sitepull.manifest.models.ManifestEntry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Starts a manifest job on the endpoint and pages through its entries. */
@Slf4j
public class ManifestCollector {
  private final SourceApiClient apiClient;
  private final int pageSize;

  public ManifestCollector(SourceApiClient apiClient, int pageSize) {
    this.apiClient = apiClient;
    this.pageSize = pageSize;
  }

  public ManifestJobInitResponse start() {
    ManifestJobInitResponse response =
        SourceApiClient.requireSuccess(
            ApiCalls.await(apiClient.initManifestJob()), ApiConstants.MANIFEST_JOB_INIT);
    if (response.getJobId() == null) {
      throw new ProtocolException("Manifest job reply has no job id");
    }
    log.info(
        "Manifest job {}: {} files ({} bytes)",
        response.getJobId(),
        response.getTotalFiles(),
        response.getTotalBytes());
    return response;
  }

  public List<ManifestEntry> collect(String jobId, long totalFiles) {
    List<ManifestEntry> entries = new ArrayList<>();
    while (entries.size() < totalFiles) {
      ManifestPageResponse page =
          SourceApiClient.requireSuccess(
              ApiCalls.await(apiClient.getManifestPage(jobId, entries.size(), pageSize)),
              ApiConstants.MANIFEST_JOB_PAGE);
      if (page.getFiles() == null || page.getFiles().isEmpty()) {
        throw new ProtocolException(
            String.format(
                "Manifest job %s ended after %d of %d files", jobId, entries.size(), totalFiles));
      }
      entries.addAll(page.getFiles());
      log.debug("Collected {}/{} manifest entries", entries.size(), totalFiles);
    }
    return entries;
  }

  /** Best effort: an unfinished job expires on the endpoint. */
  public void finish(String jobId) {
    try {
      SourceApiClient.requireSuccess(
          ApiCalls.await(apiClient.finishManifestJob(jobId)), ApiConstants.MANIFEST_JOB_FINISH);
    } catch (RuntimeException e) {
      log.warn("Failed to finish manifest job {}: {}", jobId, e.getMessage());
    }
  }
}
