package io.sitepull.source.store;

import java.util.Optional;

/**
 * Key/value storage whose entries expire after a fixed time-to-live and whose values are bounded
 * in size.
 */
public interface TransientStore {
  /**
   * @throws io.sitepull.source.exceptions.ValueTooLargeException when the value exceeds {@link
   *     #getMaxValueBytes()}
   */
  void put(String key, byte[] value);

  Optional<byte[]> get(String key);

  void delete(String key);

  int getMaxValueBytes();
}
