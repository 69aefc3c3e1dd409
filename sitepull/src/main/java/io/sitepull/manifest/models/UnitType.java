package io.sitepull.manifest.models;

public enum UnitType {
  LARGE_FILE,
  BATCH
}
