package io.sitepull.config;

import java.util.concurrent.atomic.AtomicReference;

public class ConfigProvider {
  private final AtomicReference<Config> configRef;

  public ConfigProvider(Config config) {
    configRef = new AtomicReference<>(config);
  }

  public Config getConfig() {
    return configRef.get();
  }
}
