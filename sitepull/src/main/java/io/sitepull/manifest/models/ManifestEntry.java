package io.sitepull.manifest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A remote file: '/'-separated path relative to the site root, size in bytes, mtime in seconds. */
@Builder
@Value
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestEntry {
  @NonNull String path;
  long size;
  long mtime;
}
