package io.sitepull.retrieval;

import io.sitepull.manifest.models.TransferUnit;
import io.sitepull.retrieval.models.TransferResult;
import java.nio.file.Path;

/**
 * Performs the network transfer of one unit and writes its files below the destination root.
 * Throws {@link io.sitepull.exceptions.TransportException} for network failures, {@link
 * io.sitepull.exceptions.StorageException} for local write failures and {@link
 * io.sitepull.exceptions.ValidationException} for paths that would leave the root. Files the
 * source no longer has are reported as failed in the returned result.
 */
public interface UnitTransport {
  TransferResult transfer(TransferUnit unit, Path destinationRoot, ProgressListener listener);
}
