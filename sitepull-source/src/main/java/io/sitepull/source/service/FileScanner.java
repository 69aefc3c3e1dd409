package io.sitepull.source.service;

import static io.sitepull.source.constants.SourceConstants.SKIPPED_DIRECTORIES;

import io.sitepull.source.store.models.ManifestEntry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Lists the regular files below a root directory in a stable order. Version-control directories,
 * the excluded directories and files that cannot be read are left out.
 */
@Slf4j
public class FileScanner {
  private final Path root;
  private final Set<Path> excludedDirectories;

  public FileScanner(Path root, Collection<Path> excludedDirectories) {
    this.root = root.toAbsolutePath().normalize();
    this.excludedDirectories =
        excludedDirectories.stream()
            .map(p -> p.toAbsolutePath().normalize())
            .collect(Collectors.toSet());
  }

  public List<ManifestEntry> scan() {
    List<ManifestEntry> entries = new ArrayList<>();
    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (excludedDirectories.contains(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              Path name = dir.getFileName();
              if (!dir.equals(root) && name != null && SKIPPED_DIRECTORIES.contains(name.toString())) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile() && Files.isReadable(file)) {
                entries.add(
                    ManifestEntry.builder()
                        .path(relativize(file))
                        .size(attrs.size())
                        .mtime(attrs.lastModifiedTime().toMillis() / 1000)
                        .build());
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to scan " + root, e);
    }
    entries.sort((a, b) -> a.getPath().compareTo(b.getPath()));
    log.info("Scanned {} files below {}", entries.size(), root);
    return entries;
  }

  private String relativize(Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
