package io.sitepull.retrieval.models;

import lombok.Value;

/**
 * Files succeeded, files failed and bytes transferred. {@link #combine} is commutative and
 * associative with {@link #EMPTY} as identity, so unit results fold to the same total in any
 * completion order.
 */
@Value
public class TransferResult {
  public static final TransferResult EMPTY = new TransferResult(0, 0, 0);

  long filesSucceeded;
  long filesFailed;
  long bytesTransferred;

  public static TransferResult success(long files, long bytes) {
    return new TransferResult(files, 0, bytes);
  }

  public static TransferResult failure(long files) {
    return new TransferResult(0, files, 0);
  }

  public TransferResult combine(TransferResult other) {
    return new TransferResult(
        filesSucceeded + other.filesSucceeded,
        filesFailed + other.filesFailed,
        bytesTransferred + other.bytesTransferred);
  }

  public long getFilesTotal() {
    return filesSucceeded + filesFailed;
  }
}
