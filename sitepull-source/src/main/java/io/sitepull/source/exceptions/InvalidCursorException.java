package io.sitepull.source.exceptions;

public class InvalidCursorException extends SourceException {
  public InvalidCursorException(String message) {
    super(400, "sitepull_invalid_cursor", message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(400, "sitepull_invalid_cursor", message, cause);
  }
}
