package io.sitepull.source.exceptions;

public class TableSourceException extends SourceException {
  public TableSourceException(String message, Throwable cause) {
    super(500, "sitepull_db_error", message, cause);
  }

  public TableSourceException(String message) {
    super(500, "sitepull_db_error", message);
  }
}
