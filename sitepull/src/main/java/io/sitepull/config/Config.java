package io.sitepull.config;

import io.sitepull.config.models.common.HttpClientConfig;
import io.sitepull.config.models.configv1.DownloadConfig;

public interface Config {
  ConfigVersion getVersion();

  HttpClientConfig getHttpClientConfig();

  DownloadConfig getDownloadConfig();
}
