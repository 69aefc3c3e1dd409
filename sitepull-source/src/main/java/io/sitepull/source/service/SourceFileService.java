package io.sitepull.source.service;

import io.sitepull.source.exceptions.PathValidationException;
import io.sitepull.source.exceptions.SourceFileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Serves files below the source root. Every requested path is resolved against the real path of
 * the root and rejected when it ends up outside of it, symbolic links included.
 */
@Slf4j
public class SourceFileService {
  private final Path root;

  public SourceFileService(Path root) {
    this.root = root;
  }

  /** Resolves a client supplied relative path to an existing regular file below the root. */
  public Path resolve(String requestedPath) {
    String relative = normalize(requestedPath);
    Path rootReal = realRoot();
    Path candidate;
    try {
      candidate = rootReal.resolve(relative).normalize();
    } catch (InvalidPathException e) {
      throw new PathValidationException("Invalid file path.");
    }
    if (!candidate.startsWith(rootReal)) {
      throw new PathValidationException("Path is outside the site root.");
    }
    if (!Files.exists(candidate)) {
      throw new SourceFileNotFoundException(relative);
    }
    Path real;
    try {
      real = candidate.toRealPath();
    } catch (IOException e) {
      throw new SourceFileNotFoundException(relative);
    }
    if (!real.startsWith(rootReal)) {
      throw new PathValidationException("Path is outside the site root.");
    }
    if (!Files.isRegularFile(real) || !Files.isReadable(real)) {
      throw new SourceFileNotFoundException(relative);
    }
    return real;
  }

  /**
   * Validates every requested path before anything is streamed. Files that do not exist are left
   * out of the batch; the caller counts them as failed.
   */
  public Map<String, Path> resolveBatch(List<String> requestedPaths) {
    if (requestedPaths.isEmpty()) {
      throw new PathValidationException("No file paths requested.");
    }
    Map<String, Path> files = new LinkedHashMap<>();
    for (String requested : requestedPaths) {
      String relative = normalize(requested);
      try {
        files.put(relative, resolve(relative));
      } catch (SourceFileNotFoundException e) {
        log.warn("Batch file {} not found, leaving it out", relative);
      }
    }
    return files;
  }

  /** Writes the resolved files as a ZIP stream, entries named by their relative paths. */
  public int writeBatch(Map<String, Path> files, OutputStream out) throws IOException {
    int written = 0;
    // not closed: the caller owns the stream
    ZipOutputStream zip = new ZipOutputStream(out);
    for (Map.Entry<String, Path> file : files.entrySet()) {
      try (InputStream in = Files.newInputStream(file.getValue())) {
        zip.putNextEntry(new ZipEntry(file.getKey()));
        IOUtils.copyLarge(in, zip);
        zip.closeEntry();
        written++;
      } catch (NoSuchFileException e) {
        log.warn("Batch file {} disappeared while streaming", file.getKey());
      }
    }
    zip.finish();
    log.debug("Streamed batch of {} files", written);
    return written;
  }

  static String normalize(String requestedPath) {
    if (StringUtils.isBlank(requestedPath)) {
      throw new PathValidationException("File path is required.");
    }
    if (requestedPath.indexOf('\0') >= 0) {
      throw new PathValidationException("Invalid file path.");
    }
    // surrounding spaces are part of the file name
    String relative = StringUtils.stripStart(requestedPath.replace('\\', '/'), "/");
    if (relative.isEmpty()) {
      throw new PathValidationException("File path is required.");
    }
    return relative;
  }

  private Path realRoot() {
    try {
      return root.toRealPath();
    } catch (IOException e) {
      throw new UncheckedIOException("Site root is not accessible: " + root, e);
    }
  }
}
