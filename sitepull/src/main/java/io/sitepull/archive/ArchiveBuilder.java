package io.sitepull.archive;

import java.nio.file.Path;

public interface ArchiveBuilder {
  /**
   * Packs every regular file below {@code sourceDirectory} into {@code archiveFile}, named by its
   * '/'-separated path relative to the source directory. Returns the archive size in bytes.
   */
  long build(Path sourceDirectory, Path archiveFile);
}
