package io.sitepull.source.service;

import static io.sitepull.source.constants.SourceConstants.MAX_MANIFEST_PAGE_LIMIT;

import io.sitepull.source.exceptions.InvalidRequestException;
import io.sitepull.source.service.models.ManifestJobInfo;
import io.sitepull.source.service.models.ManifestPage;
import io.sitepull.source.store.ManifestJobStore;
import io.sitepull.source.store.models.ManifestEntry;
import io.sitepull.source.store.models.ManifestJob;
import io.sitepull.source.store.models.ManifestJobMetadata;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Manifest job lifecycle: scan once at init, then page through the stored entry list. */
@Slf4j
public class ManifestJobService {
  private final FileScanner fileScanner;
  private final ManifestJobStore jobStore;
  private final JobIdGenerator jobIdGenerator;

  public ManifestJobService(
      FileScanner fileScanner, ManifestJobStore jobStore, JobIdGenerator jobIdGenerator) {
    this.fileScanner = fileScanner;
    this.jobStore = jobStore;
    this.jobIdGenerator = jobIdGenerator;
  }

  public ManifestJobInfo init() {
    List<ManifestEntry> entries = fileScanner.scan();
    String jobId = jobIdGenerator.nextId();
    ManifestJobMetadata metadata = jobStore.save(jobId, entries);
    log.info(
        "Created manifest job {}: {} files, {} bytes",
        jobId,
        metadata.getTotalFiles(),
        metadata.getTotalBytes());
    return ManifestJobInfo.builder()
        .jobId(jobId)
        .totalFiles(metadata.getTotalFiles())
        .totalBytes(metadata.getTotalBytes())
        .createdAt(metadata.getCreatedAt())
        .build();
  }

  public ManifestPage page(String jobId, int offset, int limit) {
    requireJobId(jobId);
    if (offset < 0) {
      throw new InvalidRequestException("offset must not be negative.");
    }
    if (limit < 1 || limit > MAX_MANIFEST_PAGE_LIMIT) {
      throw new InvalidRequestException(
          "limit must be between 1 and " + MAX_MANIFEST_PAGE_LIMIT + ".");
    }
    ManifestJob job = jobStore.load(jobId);
    List<ManifestEntry> entries = job.getEntries();
    int from = Math.min(offset, entries.size());
    int to = Math.min(entries.size(), from + limit);
    return ManifestPage.builder()
        .jobId(jobId)
        .offset(offset)
        .limit(limit)
        .totalFiles(job.getMetadata().getTotalFiles())
        .totalBytes(job.getMetadata().getTotalBytes())
        .files(entries.subList(from, to))
        .build();
  }

  public void finish(String jobId) {
    requireJobId(jobId);
    jobStore.delete(jobId);
    log.info("Finished manifest job {}", jobId);
  }

  private static void requireJobId(String jobId) {
    if (StringUtils.isBlank(jobId)) {
      throw new InvalidRequestException("Manifest job ID is required.");
    }
  }
}
