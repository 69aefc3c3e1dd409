package io.sitepull.source.server;

import static io.sitepull.source.constants.ExportConstants.DEFAULT_TIME_BUDGET_SECONDS;
import static io.sitepull.source.constants.ExportConstants.MAX_TIME_BUDGET_SECONDS;
import static io.sitepull.source.constants.SourceConstants.ACCESS_KEY_HEADER;
import static io.sitepull.source.constants.SourceConstants.ACCESS_KEY_PARAM;
import static io.sitepull.source.constants.SourceConstants.ACTION_PARAM;
import static io.sitepull.source.constants.SourceConstants.DB_JOB_DOWNLOAD;
import static io.sitepull.source.constants.SourceConstants.DB_JOB_FINISH;
import static io.sitepull.source.constants.SourceConstants.DB_JOB_INIT;
import static io.sitepull.source.constants.SourceConstants.DB_JOB_PROCESS;
import static io.sitepull.source.constants.SourceConstants.DEFAULT_MANIFEST_PAGE_LIMIT;
import static io.sitepull.source.constants.SourceConstants.FILE_BATCH;
import static io.sitepull.source.constants.SourceConstants.FILE_FETCH;
import static io.sitepull.source.constants.SourceConstants.JOB_ID_PARAM;
import static io.sitepull.source.constants.SourceConstants.LIMIT_PARAM;
import static io.sitepull.source.constants.SourceConstants.MANIFEST_JOB_FINISH;
import static io.sitepull.source.constants.SourceConstants.MANIFEST_JOB_INIT;
import static io.sitepull.source.constants.SourceConstants.MANIFEST_JOB_PAGE;
import static io.sitepull.source.constants.SourceConstants.OFFSET_PARAM;
import static io.sitepull.source.constants.SourceConstants.PATHS_PARAM;
import static io.sitepull.source.constants.SourceConstants.PATH_PARAM;
import static io.sitepull.source.constants.SourceConstants.TIME_BUDGET_PARAM;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.sitepull.source.exceptions.InvalidRequestException;
import io.sitepull.source.exceptions.SourceException;
import io.sitepull.source.service.DatabaseExportJobService;
import io.sitepull.source.service.ManifestJobService;
import io.sitepull.source.service.SourceFileService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Routes an action request to the job and file services. Failures are reported as JSON {@code
 * {"error": code, "message": text}} with the status carried by the {@link SourceException}.
 */
@Slf4j
public class SourceActionDispatcher {
  private final AccessKeyValidator accessKeyValidator;
  private final SourceFileService files;
  private final Duration defaultTimeBudget;
  private final ObjectMapper mapper;
  private final Map<String, Function<SourceRequest, SourceResponse>> handlers;

  public SourceActionDispatcher(
      AccessKeyValidator accessKeyValidator,
      DatabaseExportJobService databaseJobs,
      ManifestJobService manifestJobs,
      SourceFileService files) {
    this(
        accessKeyValidator,
        databaseJobs,
        manifestJobs,
        files,
        Duration.ofSeconds(DEFAULT_TIME_BUDGET_SECONDS));
  }

  public SourceActionDispatcher(
      AccessKeyValidator accessKeyValidator,
      DatabaseExportJobService databaseJobs,
      ManifestJobService manifestJobs,
      SourceFileService files,
      Duration defaultTimeBudget) {
    this.accessKeyValidator = accessKeyValidator;
    this.files = files;
    this.defaultTimeBudget = defaultTimeBudget;
    this.mapper = new ObjectMapper();
    this.handlers =
        ImmutableMap.<String, Function<SourceRequest, SourceResponse>>builder()
            .put(DB_JOB_INIT, request -> json(databaseJobs.init()))
            .put(
                DB_JOB_PROCESS,
                request -> json(databaseJobs.process(jobId(request), timeBudget(request))))
            .put(
                DB_JOB_DOWNLOAD,
                request -> file(databaseJobs.download(jobId(request)), SourceResponse.SQL))
            .put(
                DB_JOB_FINISH,
                request -> {
                  databaseJobs.finish(jobId(request));
                  return ok();
                })
            .put(MANIFEST_JOB_INIT, request -> json(manifestJobs.init()))
            .put(
                MANIFEST_JOB_PAGE,
                request ->
                    json(
                        manifestJobs.page(
                            jobId(request),
                            intParameter(request, OFFSET_PARAM, 0),
                            intParameter(request, LIMIT_PARAM, DEFAULT_MANIFEST_PAGE_LIMIT))))
            .put(
                MANIFEST_JOB_FINISH,
                request -> {
                  manifestJobs.finish(jobId(request));
                  return ok();
                })
            .put(
                FILE_FETCH,
                request ->
                    file(
                        files.resolve(request.getParameter(PATH_PARAM)),
                        SourceResponse.OCTET_STREAM))
            .put(FILE_BATCH, this::batch)
            .build();
  }

  public SourceResponse dispatch(SourceRequest request) {
    String action = request.getParameter(ACTION_PARAM);
    try {
      accessKeyValidator.validate(accessKey(request));
      Function<SourceRequest, SourceResponse> handler =
          handlers.get(StringUtils.trimToEmpty(action));
      if (handler == null) {
        throw new InvalidRequestException("Unknown action: " + action);
      }
      return handler.apply(request);
    } catch (RuntimeException e) {
      return failure(action, e);
    }
  }

  /**
   * Maps a failure to its JSON error reply. Anything that is not a {@link SourceException} is an
   * internal error.
   */
  public SourceResponse failure(@Nullable String action, RuntimeException e) {
    if (e instanceof SourceException) {
      SourceException failure = (SourceException) e;
      log.warn("Action {} failed: {}", action, failure.getMessage());
      return error(failure.getStatusCode(), failure.getErrorCode(), failure.getMessage());
    }
    log.error("Action {} failed with an internal error", action, e);
    return error(500, "sitepull_internal_error", "Internal error while handling " + action + ".");
  }

  private SourceResponse batch(SourceRequest request) {
    List<String> requested = new ArrayList<>(request.getParameterValues(PATHS_PARAM));
    Map<String, Path> resolved = files.resolveBatch(requested);
    return SourceResponse.builder()
        .statusCode(200)
        .contentType(SourceResponse.ZIP)
        .contentLength(-1)
        .body(out -> files.writeBatch(resolved, out))
        .build();
  }

  private static String accessKey(SourceRequest request) {
    String key = request.getHeader(ACCESS_KEY_HEADER);
    return StringUtils.isNotEmpty(key) ? key : request.getParameter(ACCESS_KEY_PARAM);
  }

  private static String jobId(SourceRequest request) {
    return request.getParameter(JOB_ID_PARAM);
  }

  private Duration timeBudget(SourceRequest request) {
    String value = request.getParameter(TIME_BUDGET_PARAM);
    if (StringUtils.isBlank(value)) {
      return defaultTimeBudget;
    }
    int seconds = intParameter(request, TIME_BUDGET_PARAM, DEFAULT_TIME_BUDGET_SECONDS);
    return Duration.ofSeconds(Math.max(1, Math.min(seconds, MAX_TIME_BUDGET_SECONDS)));
  }

  private static int intParameter(SourceRequest request, String name, int defaultValue) {
    String value = request.getParameter(name);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidRequestException("Parameter " + name + " must be an integer.");
    }
  }

  private SourceResponse json(Object body) {
    return json(200, body);
  }

  private SourceResponse ok() {
    return json(200, ImmutableMap.of("ok", true));
  }

  private SourceResponse error(int status, String code, String message) {
    return json(status, ImmutableMap.of("error", code, "message", message));
  }

  private SourceResponse json(int status, Object body) {
    byte[] bytes;
    try {
      bytes = mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize response", e);
    }
    return SourceResponse.builder()
        .statusCode(status)
        .contentType(SourceResponse.JSON)
        .contentLength(bytes.length)
        .body(out -> out.write(bytes))
        .build();
  }

  private static SourceResponse file(Path path, String contentType) {
    long size;
    try {
      size = Files.size(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read size of " + path, e);
    }
    return SourceResponse.builder()
        .statusCode(200)
        .contentType(contentType)
        .contentLength(size)
        .body(
            out -> {
              try (InputStream in = Files.newInputStream(path)) {
                IOUtils.copyLarge(in, out);
              }
            })
        .build();
  }
}
