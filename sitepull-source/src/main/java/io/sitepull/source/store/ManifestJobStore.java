package io.sitepull.source.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import io.sitepull.source.exceptions.JobNotFoundException;
import io.sitepull.source.store.models.ManifestEntry;
import io.sitepull.source.store.models.ManifestJob;
import io.sitepull.source.store.models.ManifestJobMetadata;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists manifest jobs in a {@link TransientStore}. The entry list is split into chunks of at most
 * a fixed number of entries, halved further until each chunk fits the store's value limit. Each
 * chunk is stored under its own key, plus one metadata record. A job is only visible once its
 * metadata record exists, and loading fails as not-found when any chunk is gone.
 */
@Slf4j
public class ManifestJobStore {
  static final String META_KEY_PREFIX = "sitepull_job_meta_";
  static final String CHUNK_KEY_PREFIX = "sitepull_job_chunk_";
  private static final TypeReference<List<ManifestEntry>> ENTRY_LIST = new TypeReference<>() {};

  private final TransientStore store;
  private final int entriesPerChunk;
  private final Clock clock;
  private final ObjectMapper mapper;

  public ManifestJobStore(
      @Nonnull TransientStore store, int entriesPerChunk, @Nonnull Clock clock) {
    if (entriesPerChunk < 1) {
      throw new IllegalArgumentException("entries per chunk must be positive");
    }
    this.store = store;
    this.entriesPerChunk = entriesPerChunk;
    this.clock = clock;
    this.mapper = new ObjectMapper();
  }

  public ManifestJobMetadata save(String jobId, List<ManifestEntry> entries) {
    try {
      List<byte[]> chunks = new ArrayList<>();
      for (List<ManifestEntry> part : Lists.partition(entries, entriesPerChunk)) {
        addChunk(part, chunks);
      }
      for (int i = 0; i < chunks.size(); i++) {
        store.put(chunkKey(jobId, i), chunks.get(i));
      }
      ManifestJobMetadata metadata =
          ManifestJobMetadata.builder()
              .createdAt(clock.instant().getEpochSecond())
              .totalFiles(entries.size())
              .totalBytes(entries.stream().mapToLong(ManifestEntry::getSize).sum())
              .chunkCount(chunks.size())
              .build();
      // written last: a job without metadata does not exist for readers
      store.put(metaKey(jobId), mapper.writeValueAsBytes(metadata));
      log.debug("Saved manifest job {} with {} entries in {} chunks", jobId, entries.size(), chunks.size());
      return metadata;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize manifest job " + jobId, e);
    }
  }

  // a single entry over the limit is left for the store to reject
  private void addChunk(List<ManifestEntry> part, List<byte[]> chunks) throws IOException {
    byte[] bytes = mapper.writeValueAsBytes(part);
    if (bytes.length <= store.getMaxValueBytes() || part.size() == 1) {
      chunks.add(bytes);
      return;
    }
    int half = part.size() / 2;
    addChunk(part.subList(0, half), chunks);
    addChunk(part.subList(half, part.size()), chunks);
  }

  public ManifestJob load(String jobId) {
    ManifestJobMetadata metadata = loadMetadata(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    List<ManifestEntry> entries = new ArrayList<>();
    for (int i = 0; i < metadata.getChunkCount(); i++) {
      Optional<byte[]> chunk = store.get(chunkKey(jobId, i));
      if (!chunk.isPresent()) {
        log.warn("Manifest job {} is missing chunk {} of {}", jobId, i, metadata.getChunkCount());
        throw new JobNotFoundException(jobId);
      }
      entries.addAll(readChunk(jobId, chunk.get()));
    }
    return ManifestJob.builder().jobId(jobId).metadata(metadata).entries(entries).build();
  }

  /** Removes every chunk and the metadata record. Chunks that outlive a failed delete expire. */
  public void delete(String jobId) {
    loadMetadata(jobId)
        .ifPresent(
            metadata -> {
              for (int i = 0; i < metadata.getChunkCount(); i++) {
                store.delete(chunkKey(jobId, i));
              }
            });
    store.delete(metaKey(jobId));
  }

  private Optional<ManifestJobMetadata> loadMetadata(String jobId) {
    return store
        .get(metaKey(jobId))
        .map(
            bytes -> {
              try {
                return mapper.readValue(bytes, ManifestJobMetadata.class);
              } catch (IOException e) {
                log.error("Corrupted metadata for manifest job {}", jobId, e);
                throw new JobNotFoundException(jobId);
              }
            });
  }

  private List<ManifestEntry> readChunk(String jobId, byte[] bytes) {
    try {
      return mapper.readValue(bytes, ENTRY_LIST);
    } catch (IOException e) {
      log.error("Corrupted chunk for manifest job {}", jobId, e);
      throw new JobNotFoundException(jobId);
    }
  }

  private static String metaKey(String jobId) {
    return META_KEY_PREFIX + jobId;
  }

  private static String chunkKey(String jobId, int index) {
    return CHUNK_KEY_PREFIX + jobId + "_" + index;
  }
}
