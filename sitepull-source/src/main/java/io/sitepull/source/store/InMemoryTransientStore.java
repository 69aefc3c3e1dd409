package io.sitepull.source.store;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.sitepull.source.exceptions.ValueTooLargeException;
import java.time.Duration;
import java.util.Optional;

/** {@link TransientStore} held in process memory, entries expiring a fixed time after writing. */
public class InMemoryTransientStore implements TransientStore {
  private final Cache<String, byte[]> cache;
  private final int maxValueBytes;

  public InMemoryTransientStore(Duration ttl, int maxValueBytes) {
    this(ttl, maxValueBytes, Ticker.systemTicker());
  }

  public InMemoryTransientStore(Duration ttl, int maxValueBytes, Ticker ticker) {
    this.cache = CacheBuilder.newBuilder().expireAfterWrite(ttl).ticker(ticker).build();
    this.maxValueBytes = maxValueBytes;
  }

  @Override
  public void put(String key, byte[] value) {
    if (value.length > maxValueBytes) {
      throw new ValueTooLargeException(key, value.length, maxValueBytes);
    }
    cache.put(key, value.clone());
  }

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(byte[]::clone);
  }

  @Override
  public void delete(String key) {
    cache.invalidate(key);
  }

  @Override
  public int getMaxValueBytes() {
    return maxValueBytes;
  }
}
