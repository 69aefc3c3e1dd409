package io.sitepull.retrieval;

import io.sitepull.exceptions.ValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;

/** Maps remote '/'-separated paths onto the local destination tree. */
public final class DestinationPaths {

  private DestinationPaths() {}

  public static Path resolve(Path destinationRoot, String remotePath) {
    if (StringUtils.isBlank(remotePath) || remotePath.indexOf('\0') >= 0) {
      throw new ValidationException("Invalid remote path: " + remotePath);
    }
    String relative = StringUtils.stripStart(remotePath.replace('\\', '/'), "/");
    Path root = destinationRoot.toAbsolutePath().normalize();
    Path target;
    try {
      target = root.resolve(relative).normalize();
    } catch (InvalidPathException e) {
      throw new ValidationException("Invalid remote path: " + remotePath);
    }
    if (target.equals(root) || !target.startsWith(root)) {
      throw new ValidationException("Remote path escapes the destination: " + remotePath);
    }
    return target;
  }
}
