package io.sitepull.source.exceptions;

public class JobNotFoundException extends SourceException {
  public JobNotFoundException(String jobId) {
    super(404, "sitepull_job_missing", String.format("Job %s not found or expired.", jobId));
  }
}
