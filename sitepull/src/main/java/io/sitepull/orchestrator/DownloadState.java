package io.sitepull.orchestrator;

public enum DownloadState {
  INIT,
  DB_EXPORT,
  DB_DOWNLOAD,
  MANIFEST_INIT,
  PARTITION,
  RETRIEVE,
  PACKAGE,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
