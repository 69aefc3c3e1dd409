package io.sitepull.api;

import static io.sitepull.constants.ApiConstants.ACCEPTABLE_HTTP_FAILURE_STATUS_CODES;
import static io.sitepull.constants.ApiConstants.ACCESS_KEY_HEADER;
import static io.sitepull.constants.ApiConstants.ACTION_PARAM;
import static io.sitepull.constants.ApiConstants.DB_JOB_DOWNLOAD;
import static io.sitepull.constants.ApiConstants.DB_JOB_FINISH;
import static io.sitepull.constants.ApiConstants.DB_JOB_INIT;
import static io.sitepull.constants.ApiConstants.DB_JOB_PROCESS;
import static io.sitepull.constants.ApiConstants.FILE_BATCH;
import static io.sitepull.constants.ApiConstants.FILE_FETCH;
import static io.sitepull.constants.ApiConstants.FORBIDDEN_ERROR_MESSAGE;
import static io.sitepull.constants.ApiConstants.JOB_ID_PARAM;
import static io.sitepull.constants.ApiConstants.LIMIT_PARAM;
import static io.sitepull.constants.ApiConstants.MANIFEST_JOB_FINISH;
import static io.sitepull.constants.ApiConstants.MANIFEST_JOB_INIT;
import static io.sitepull.constants.ApiConstants.MANIFEST_JOB_PAGE;
import static io.sitepull.constants.ApiConstants.OFFSET_PARAM;
import static io.sitepull.constants.ApiConstants.PATHS_PARAM;
import static io.sitepull.constants.ApiConstants.PATH_PARAM;
import static io.sitepull.constants.ApiConstants.TIME_BUDGET_PARAM;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.sitepull.api.models.response.ApiResponse;
import io.sitepull.api.models.response.DatabaseJobInitResponse;
import io.sitepull.api.models.response.DatabaseJobProcessResponse;
import io.sitepull.api.models.response.FinishJobResponse;
import io.sitepull.api.models.response.ManifestJobInitResponse;
import io.sitepull.api.models.response.ManifestPageResponse;
import io.sitepull.constants.MetricsConstants;
import io.sitepull.exceptions.ProtocolException;
import io.sitepull.exceptions.TransportException;
import io.sitepull.metrics.SitePullMetrics;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

/**
 * Calls the site's action endpoint. Every call is a form POST carrying an {@code action} parameter
 * and the access key header. JSON replies are mapped onto {@link ApiResponse} subclasses, with
 * failures flagged on the response; streamed replies hand the open {@link Response} to the caller.
 */
@Slf4j
public class SourceApiClient {
  private final AsyncHttpClientWithRetry asyncClient;
  private final SourceEndpoint endpoint;
  private final SitePullMetrics metrics;
  private final ObjectMapper mapper;

  public SourceApiClient(
      @Nonnull AsyncHttpClientWithRetry asyncClient,
      @Nonnull SourceEndpoint endpoint,
      @Nonnull SitePullMetrics metrics) {
    this.asyncClient = asyncClient;
    this.endpoint = endpoint;
    this.metrics = metrics;
    this.mapper = new ObjectMapper();
  }

  public CompletableFuture<DatabaseJobInitResponse> initDatabaseJob() {
    return asyncPost(form(DB_JOB_INIT), DatabaseJobInitResponse.class);
  }

  public CompletableFuture<DatabaseJobProcessResponse> processDatabaseJob(
      String jobId, int timeBudgetSeconds) {
    FormBody body =
        form(DB_JOB_PROCESS)
            .add(JOB_ID_PARAM, jobId)
            .add(TIME_BUDGET_PARAM, String.valueOf(timeBudgetSeconds))
            .build();
    return asyncPost(body, DatabaseJobProcessResponse.class);
  }

  /** Streams the finished dump. The caller closes the response. */
  public CompletableFuture<Response> downloadDatabaseJob(String jobId) {
    return asyncStream(form(DB_JOB_DOWNLOAD).add(JOB_ID_PARAM, jobId).build(), DB_JOB_DOWNLOAD);
  }

  public CompletableFuture<FinishJobResponse> finishDatabaseJob(String jobId) {
    return asyncPost(form(DB_JOB_FINISH).add(JOB_ID_PARAM, jobId).build(), FinishJobResponse.class);
  }

  public CompletableFuture<ManifestJobInitResponse> initManifestJob() {
    return asyncPost(form(MANIFEST_JOB_INIT), ManifestJobInitResponse.class);
  }

  public CompletableFuture<ManifestPageResponse> getManifestPage(
      String jobId, int offset, int limit) {
    FormBody body =
        form(MANIFEST_JOB_PAGE)
            .add(JOB_ID_PARAM, jobId)
            .add(OFFSET_PARAM, String.valueOf(offset))
            .add(LIMIT_PARAM, String.valueOf(limit))
            .build();
    return asyncPost(body, ManifestPageResponse.class);
  }

  public CompletableFuture<FinishJobResponse> finishManifestJob(String jobId) {
    return asyncPost(
        form(MANIFEST_JOB_FINISH).add(JOB_ID_PARAM, jobId).build(), FinishJobResponse.class);
  }

  /** Streams one file. The caller closes the response. */
  public CompletableFuture<Response> fetchFile(String path) {
    return asyncStream(form(FILE_FETCH).add(PATH_PARAM, path).build(), FILE_FETCH);
  }

  /** Streams a ZIP holding the requested files that still exist. The caller closes the response. */
  public CompletableFuture<Response> fetchBatch(List<String> paths) {
    FormBody.Builder body = form(FILE_BATCH);
    for (String path : paths) {
      body.add(PATHS_PARAM, path);
    }
    return asyncStream(body.build(), FILE_BATCH);
  }

  /**
   * Turns a failed JSON reply into an exception: statuses a retry cannot fix become {@link
   * ProtocolException}, the rest {@link TransportException}.
   */
  public static <T extends ApiResponse> T requireSuccess(T response, String action) {
    if (!response.isFailure()) {
      return response;
    }
    String message =
        String.format(
            "Action %s failed with status %d: %s",
            action, response.getStatusCode(), response.getCause());
    if (response.getStatusCode() == 400
        || response.getStatusCode() == 404
        || response.getStatusCode() == 409) {
      throw new ProtocolException(response.getStatusCode(), response.getErrorCode(), message);
    }
    throw new TransportException(response.getStatusCode(), message);
  }

  private FormBody.Builder form(String action) {
    return new FormBody.Builder().add(ACTION_PARAM, action);
  }

  private <T extends ApiResponse> CompletableFuture<T> asyncPost(
      FormBody.Builder body, Class<T> typeReference) {
    return asyncPost(body.build(), typeReference);
  }

  @VisibleForTesting
  <T extends ApiResponse> CompletableFuture<T> asyncPost(FormBody body, Class<T> typeReference) {
    String action = actionOf(body);
    return asyncClient
        .makeRequestWithRetry(request(body))
        .thenApply(response -> handleResponse(response, action, typeReference));
  }

  private CompletableFuture<Response> asyncStream(FormBody body, String action) {
    return asyncClient
        .makeRequestWithRetry(request(body))
        .thenApply(
            response -> {
              if (response.isSuccessful()) {
                return response;
              }
              try (Response ignored = response) {
                ErrorBody error = readError(response);
                emitApiErrorMetric(action, response.code());
                throw new TransportException(
                    response.code(),
                    String.format(
                        "Action %s failed with status %d: %s",
                        action, response.code(), error.message));
              }
            });
  }

  private Request request(FormBody body) {
    return new Request.Builder()
        .url(endpoint.getUrl())
        .header(ACCESS_KEY_HEADER, endpoint.getAccessKey())
        .post(body)
        .build();
  }

  private <T extends ApiResponse> T handleResponse(
      Response response, String action, Class<T> typeReference) {
    try (Response ignored = response) {
      if (response.isSuccessful()) {
        ResponseBody body = response.body();
        if (body == null) {
          throw new ProtocolException("Empty reply to action " + action);
        }
        try {
          return mapper.readValue(body.string(), typeReference);
        } catch (IOException e) {
          throw new UncheckedIOException("Failed to deserialize reply to " + action, e);
        }
      }
      ErrorBody error = readError(response);
      emitApiErrorMetric(action, response.code());
      T errorResponse = newInstance(typeReference);
      errorResponse.setError(response.code(), error.code, error.message);
      return errorResponse;
    }
  }

  private ErrorBody readError(Response response) {
    if (response.code() == 403) {
      return new ErrorBody("sitepull_forbidden", FORBIDDEN_ERROR_MESSAGE);
    }
    String fallback = StringUtils.defaultIfBlank(response.message(), "HTTP " + response.code());
    ResponseBody body = response.body();
    if (body == null) {
      return new ErrorBody("", fallback);
    }
    try {
      JsonNode node = mapper.readTree(body.string());
      if (node != null && node.hasNonNull("error")) {
        return new ErrorBody(
            node.get("error").asText(),
            node.hasNonNull("message") ? node.get("message").asText() : fallback);
      }
    } catch (IOException e) {
      log.debug("Error reply is not JSON: {}", e.getMessage());
    }
    return new ErrorBody("", fallback);
  }

  private static <T> T newInstance(Class<T> typeReference) {
    try {
      return typeReference.getDeclaredConstructor().newInstance();
    } catch (InstantiationException
        | IllegalAccessException
        | NoSuchMethodException
        | InvocationTargetException e) {
      throw new IllegalStateException("Failed to instantiate error response object", e);
    }
  }

  private void emitApiErrorMetric(String action, int statusCode) {
    metrics.apiFailure(
        action,
        ACCEPTABLE_HTTP_FAILURE_STATUS_CODES.contains(statusCode)
            ? MetricsConstants.ApiFailureReasons.API_FAILURE_USER_ERROR
            : MetricsConstants.ApiFailureReasons.API_FAILURE_SYSTEM_ERROR);
  }

  private static String actionOf(FormBody body) {
    for (int i = 0; i < body.size(); i++) {
      if (ACTION_PARAM.equals(body.name(i))) {
        return body.value(i);
      }
    }
    return "";
  }

  private static class ErrorBody {
    final String code;
    final String message;

    ErrorBody(String code, String message) {
      this.code = code;
      this.message = message;
    }
  }
}
