package io.sitepull.constants;

public class MetricsConstants {
  public static final int PROMETHEUS_METRICS_SCRAPING_DISABLED = 0;
  public static final int PROMETHEUS_METRICS_SCRAPE_PORT =
      Integer.parseInt(
          System.getenv()
              .getOrDefault(
                  "PROMETHEUS_METRICS_SCRAPE_PORT",
                  String.valueOf(PROMETHEUS_METRICS_SCRAPING_DISABLED)));

  public enum UnitFailureReasons {
    TRANSPORT,
    STORAGE,
    VALIDATION,
    MISSING_FROM_BATCH,
    UNKNOWN,
  }

  public enum ApiFailureReasons {
    API_FAILURE_USER_ERROR,
    API_FAILURE_SYSTEM_ERROR,
  }
}
