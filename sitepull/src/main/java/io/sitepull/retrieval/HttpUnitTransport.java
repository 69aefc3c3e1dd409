package io.sitepull.retrieval;

import io.sitepull.api.ApiCalls;
import io.sitepull.api.SourceApiClient;
import io.sitepull.exceptions.ProtocolException;
import io.sitepull.exceptions.TransportException;
import io.sitepull.manifest.models.ManifestEntry;
import io.sitepull.manifest.models.TransferUnit;
import io.sitepull.retrieval.models.TransferResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Fetches large files one by one and small files as a ZIP stream from the endpoint. */
@Slf4j
public class HttpUnitTransport implements UnitTransport {
  private final SourceApiClient apiClient;

  public HttpUnitTransport(@Nonnull SourceApiClient apiClient) {
    this.apiClient = apiClient;
  }

  @Override
  public TransferResult transfer(
      TransferUnit unit, Path destinationRoot, ProgressListener listener) {
    switch (unit.getType()) {
      case LARGE_FILE:
        return transferFile(unit.getEntries().get(0), destinationRoot, listener);
      case BATCH:
        return transferBatch(unit.getEntries(), destinationRoot, listener);
      default:
        throw new IllegalArgumentException("Unsupported unit type: " + unit.getType());
    }
  }

  private TransferResult transferFile(
      ManifestEntry entry, Path destinationRoot, ProgressListener listener) {
    Path target = DestinationPaths.resolve(destinationRoot, entry.getPath());
    try (Response response = ApiCalls.await(apiClient.fetchFile(entry.getPath()))) {
      long bytes = StreamCopier.copy(body(response).byteStream(), target, listener);
      return TransferResult.success(1, bytes);
    }
  }

  private TransferResult transferBatch(
      List<ManifestEntry> entries, Path destinationRoot, ProgressListener listener) {
    Set<String> requested =
        entries.stream().map(ManifestEntry::getPath).collect(Collectors.toSet());
    Set<String> received = new HashSet<>();
    long bytes = 0;
    List<String> paths = entries.stream().map(ManifestEntry::getPath).collect(Collectors.toList());
    try (Response response = ApiCalls.await(apiClient.fetchBatch(paths));
        ZipInputStream zip = new ZipInputStream(body(response).byteStream())) {
      ZipEntry zipEntry;
      while ((zipEntry = nextEntry(zip)) != null) {
        String name = zipEntry.getName();
        if (zipEntry.isDirectory() || !requested.contains(name) || received.contains(name)) {
          log.warn("Ignoring unexpected batch entry {}", name);
          continue;
        }
        bytes += StreamCopier.copy(zip, DestinationPaths.resolve(destinationRoot, name), listener);
        received.add(name);
      }
    } catch (IOException e) {
      throw new TransportException("Failed to close batch stream", e);
    }
    int missing = requested.size() - received.size();
    if (missing > 0) {
      log.warn("{} of {} batch files were not returned by the source", missing, requested.size());
    }
    return new TransferResult(received.size(), missing, bytes);
  }

  private static ResponseBody body(Response response) {
    ResponseBody body = response.body();
    if (body == null) {
      throw new ProtocolException("Transfer reply has no body");
    }
    return body;
  }

  private static ZipEntry nextEntry(ZipInputStream zip) {
    try {
      return zip.getNextEntry();
    } catch (IOException e) {
      throw new TransportException("Failed to read batch stream", e);
    }
  }
}
