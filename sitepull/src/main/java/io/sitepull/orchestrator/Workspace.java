package io.sitepull.orchestrator;

import static io.sitepull.constants.DownloadConstants.DATABASE_DIRECTORY;
import static io.sitepull.constants.DownloadConstants.DATABASE_FILE_NAME;
import static io.sitepull.constants.DownloadConstants.FILES_DIRECTORY;
import static io.sitepull.constants.DownloadConstants.WORKSPACE_DIRECTORY_PREFIX;

import io.sitepull.exceptions.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Transient directory under the output directory holding the tree that becomes the archive:
 * {@code files/} for the retrieved site and {@code database/database.sql} for the dump.
 */
@Slf4j
@Getter
public class Workspace {
  private final Path root;
  private final Path filesRoot;
  private final Path databaseFile;

  private Workspace(Path root) {
    this.root = root;
    this.filesRoot = root.resolve(FILES_DIRECTORY);
    this.databaseFile = root.resolve(DATABASE_DIRECTORY).resolve(DATABASE_FILE_NAME);
  }

  public static Workspace create(Path outputDirectory) {
    try {
      Path root = Files.createTempDirectory(outputDirectory, WORKSPACE_DIRECTORY_PREFIX);
      Workspace workspace = new Workspace(root);
      Files.createDirectories(workspace.filesRoot);
      Files.createDirectories(workspace.databaseFile.getParent());
      log.debug("Working directory: {}", root);
      return workspace;
    } catch (IOException e) {
      throw new StorageException("Failed to create a working directory in " + outputDirectory, e);
    }
  }

  /** Best effort. */
  public void cleanup() {
    try {
      FileUtils.deleteDirectory(root.toFile());
    } catch (IOException e) {
      log.warn("Could not remove working directory {}: {}", root, e.getMessage());
    }
  }
}
