package io.sitepull.source.server;

import java.io.IOException;
import java.io.OutputStream;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Response of an action. The body is written lazily so files can be streamed. */
@Builder
@Value
public class SourceResponse {
  public static final String JSON = "application/json; charset=utf-8";
  public static final String OCTET_STREAM = "application/octet-stream";
  public static final String ZIP = "application/zip";
  public static final String SQL = "application/sql; charset=utf-8";

  @FunctionalInterface
  public interface BodyWriter {
    void writeTo(OutputStream out) throws IOException;
  }

  int statusCode;
  @NonNull String contentType;

  /** Body length in bytes, or -1 when unknown in advance. */
  long contentLength;

  @NonNull BodyWriter body;
}
