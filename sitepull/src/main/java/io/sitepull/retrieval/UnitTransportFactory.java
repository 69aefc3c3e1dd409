package io.sitepull.retrieval;

import io.sitepull.api.SourceApiClient;

@FunctionalInterface
public interface UnitTransportFactory {
  UnitTransport create(SourceApiClient apiClient);
}
