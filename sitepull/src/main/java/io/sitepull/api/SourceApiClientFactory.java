package io.sitepull.api;

import com.google.inject.Inject;
import io.sitepull.metrics.SitePullMetrics;
import javax.annotation.Nonnull;

/** Binds the shared HTTP client to the endpoint given for a run. */
public class SourceApiClientFactory {
  private final AsyncHttpClientWithRetry asyncClient;
  private final SitePullMetrics metrics;

  @Inject
  public SourceApiClientFactory(
      @Nonnull AsyncHttpClientWithRetry asyncClient, @Nonnull SitePullMetrics metrics) {
    this.asyncClient = asyncClient;
    this.metrics = metrics;
  }

  public SourceApiClient create(SourceEndpoint endpoint) {
    return new SourceApiClient(asyncClient, endpoint, metrics);
  }
}
