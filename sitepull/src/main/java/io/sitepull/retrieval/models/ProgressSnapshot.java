package io.sitepull.retrieval.models;

import lombok.Value;

@Value
public class ProgressSnapshot {
  long filesCompleted;
  long filesFailed;
  long bytesTransferred;
  long totalFiles;
  long totalBytes;
}
