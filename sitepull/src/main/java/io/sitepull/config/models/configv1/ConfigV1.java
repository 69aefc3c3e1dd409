package io.sitepull.config.models.configv1;

import io.sitepull.config.Config;
import io.sitepull.config.ConfigVersion;
import io.sitepull.config.models.common.HttpClientConfig;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class ConfigV1 implements Config {
  @NonNull private String version;

  @Builder.Default private HttpClientConfig httpClientConfig = HttpClientConfig.builder().build();
  @Builder.Default private DownloadConfig downloadConfig = DownloadConfig.builder().build();

  @Override
  public ConfigVersion getVersion() {
    return ConfigVersion.valueOf(version);
  }
}
