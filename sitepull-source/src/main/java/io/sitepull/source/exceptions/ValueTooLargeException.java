package io.sitepull.source.exceptions;

public class ValueTooLargeException extends SourceException {
  public ValueTooLargeException(String key, int size, int limit) {
    super(
        500,
        "sitepull_job_save_failed",
        String.format("Value for %s is %d bytes, store limit is %d bytes", key, size, limit));
  }
}
