package io.sitepull.config.models.common;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class HttpClientConfig {
  @Builder.Default private int connectTimeoutSeconds = 15;

  // file and dump downloads stream for a long time on slow sites
  @Builder.Default private int readTimeoutSeconds = 120;
  @Builder.Default private int writeTimeoutSeconds = 15;
  @Builder.Default private int maxRetries = 3;
  @Builder.Default private long retryDelayMillis = 1000;
}
