package io.sitepull.source.store.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One file of the source tree: path relative to the root with '/' separators. */
@Builder
@Value
@Jacksonized
public class ManifestEntry {
  @NonNull String path;
  long size;
  long mtime;
}
