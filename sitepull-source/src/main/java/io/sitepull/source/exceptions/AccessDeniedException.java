package io.sitepull.source.exceptions;

public class AccessDeniedException extends SourceException {
  public AccessDeniedException() {
    super(403, "sitepull_forbidden", "Invalid access key.");
  }
}
