package io.sitepull.retrieval;

/**
 * Receives byte counts as they are written. Called concurrently from worker threads, so it may only
 * accumulate.
 */
@FunctionalInterface
public interface ProgressListener {
  ProgressListener NONE = bytes -> {};

  void onBytesTransferred(long bytes);
}
