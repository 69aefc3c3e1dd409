package io.sitepull.source.constants;

public class ExportConstants {

  private ExportConstants() {}

  public static final String STREAM_VERSION = "1.0";

  public static final int MIN_CHUNK_ROWS = 100;
  public static final int DEFAULT_CHUNK_ROWS = 1000;
  public static final int MAX_CHUNK_ROWS = 5000;

  public static final long KEYSET_THRESHOLD_ROWS = 100_000L;
  public static final long KEYSET_THRESHOLD_BYTES = 100L * 1024 * 1024;

  // adaptive chunk sizing window, in milliseconds
  public static final long FAST_CHUNK_MILLIS = 1_000L;
  public static final long SLOW_CHUNK_MILLIS = 3_000L;
  public static final double CHUNK_GROWTH_FACTOR = 1.5;
  public static final double CHUNK_SHRINK_FACTOR = 0.75;

  public static final int DEFAULT_TIME_BUDGET_SECONDS = 5;
  public static final int MAX_TIME_BUDGET_SECONDS = 30;
  public static final int GZIP_LEVEL = 6;
}
