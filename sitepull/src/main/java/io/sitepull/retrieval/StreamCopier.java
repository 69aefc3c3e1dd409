package io.sitepull.retrieval;

import static io.sitepull.constants.DownloadConstants.COPY_BUFFER_BYTES;

import io.sitepull.exceptions.StorageException;
import io.sitepull.exceptions.TransportException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Copies a network stream to a local file. Read failures are transport errors, write failures storage errors. */
public final class StreamCopier {

  private StreamCopier() {}

  public static long copy(InputStream in, Path target, ProgressListener listener) {
    try {
      Files.createDirectories(target.getParent());
    } catch (IOException e) {
      throw new StorageException("Failed to create directory for " + target, e);
    }
    byte[] buffer = new byte[COPY_BUFFER_BYTES];
    long total = 0;
    try (OutputStream out = Files.newOutputStream(target)) {
      while (true) {
        int read;
        try {
          read = in.read(buffer);
        } catch (IOException e) {
          throw new TransportException("Transfer interrupted for " + target.getFileName(), e);
        }
        if (read < 0) {
          return total;
        }
        out.write(buffer, 0, read);
        total += read;
        listener.onBytesTransferred(read);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to write " + target, e);
    }
  }
}
