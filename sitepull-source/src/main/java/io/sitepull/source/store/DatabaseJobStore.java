package io.sitepull.source.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sitepull.source.exceptions.JobNotFoundException;
import io.sitepull.source.store.models.DatabaseJobState;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/** Keeps the state of database export jobs between process calls. */
@Slf4j
public class DatabaseJobStore {
  static final String KEY_PREFIX = "sitepull_db_job_";

  private final TransientStore store;
  private final ObjectMapper mapper;

  public DatabaseJobStore(@Nonnull TransientStore store) {
    this.store = store;
    this.mapper = new ObjectMapper();
  }

  public void save(String jobId, DatabaseJobState state) {
    try {
      store.put(KEY_PREFIX + jobId, mapper.writeValueAsBytes(state));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize database job " + jobId, e);
    }
  }

  public DatabaseJobState load(String jobId) {
    byte[] bytes = store.get(KEY_PREFIX + jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    try {
      return mapper.readValue(bytes, DatabaseJobState.class);
    } catch (IOException e) {
      log.error("Corrupted state for database job {}", jobId, e);
      throw new JobNotFoundException(jobId);
    }
  }

  public void delete(String jobId) {
    store.delete(KEY_PREFIX + jobId);
  }
}
