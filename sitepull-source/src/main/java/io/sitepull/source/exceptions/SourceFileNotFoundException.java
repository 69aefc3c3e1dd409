package io.sitepull.source.exceptions;

public class SourceFileNotFoundException extends SourceException {
  public SourceFileNotFoundException(String path) {
    super(404, "sitepull_file_not_found", "Requested file not found: " + path);
  }
}
