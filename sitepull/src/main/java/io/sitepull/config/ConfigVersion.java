package io.sitepull.config;

public enum ConfigVersion {
  V1
}
