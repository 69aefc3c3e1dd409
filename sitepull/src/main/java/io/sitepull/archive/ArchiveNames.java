package io.sitepull.archive;

import static io.sitepull.constants.DownloadConstants.ARCHIVES_DIRECTORY;
import static io.sitepull.constants.DownloadConstants.ARCHIVE_TIMESTAMP_PATTERN;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.apache.commons.lang3.StringUtils;

/** Archives land in {@code <output>/archives/<hostname>-<yyyyMMdd-HHmmss>.zip}. */
public final class ArchiveNames {
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern(ARCHIVE_TIMESTAMP_PATTERN);

  private ArchiveNames() {}

  public static Path archivePath(Path outputDirectory, String hostname, Clock clock) {
    String host = StringUtils.defaultIfBlank(hostname, "site").replaceAll("[^A-Za-z0-9.-]", "_");
    String name = host + "-" + LocalDateTime.now(clock).format(TIMESTAMP) + ".zip";
    return outputDirectory.resolve(ARCHIVES_DIRECTORY).resolve(name);
  }
}
