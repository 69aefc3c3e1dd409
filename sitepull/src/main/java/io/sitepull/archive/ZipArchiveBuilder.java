package io.sitepull.archive;

import io.sitepull.exceptions.StorageException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.extern.slf4j.Slf4j;

/** Single threaded ZIP packer. Entries are written in sorted path order. */
@Slf4j
public class ZipArchiveBuilder implements ArchiveBuilder {

  @Override
  public long build(Path sourceDirectory, Path archiveFile) {
    List<Path> files;
    try (Stream<Path> walk = Files.walk(sourceDirectory)) {
      files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new StorageException("Failed to list " + sourceDirectory, e);
    }

    try {
      Files.createDirectories(archiveFile.toAbsolutePath().getParent());
      try (OutputStream out = Files.newOutputStream(archiveFile);
          ZipOutputStream zip = new ZipOutputStream(out)) {
        for (Path file : files) {
          String name = entryName(sourceDirectory.relativize(file));
          ZipEntry entry = new ZipEntry(name);
          FileTime modified = Files.getLastModifiedTime(file);
          entry.setLastModifiedTime(modified);
          zip.putNextEntry(entry);
          Files.copy(file, zip);
          zip.closeEntry();
        }
      }
      long size = Files.size(archiveFile);
      log.debug("Packed {} files into {} ({} bytes)", files.size(), archiveFile, size);
      return size;
    } catch (IOException e) {
      throw new StorageException("Failed to write archive " + archiveFile, e);
    }
  }

  private static String entryName(Path relative) {
    StringBuilder name = new StringBuilder();
    for (Path part : relative) {
      if (name.length() > 0) {
        name.append('/');
      }
      name.append(part.toString());
    }
    return name.toString();
  }
}
