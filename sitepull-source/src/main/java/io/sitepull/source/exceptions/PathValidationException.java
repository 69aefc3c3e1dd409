package io.sitepull.source.exceptions;

public class PathValidationException extends SourceException {
  public PathValidationException(String message) {
    super(400, "sitepull_invalid_path", message);
  }
}
