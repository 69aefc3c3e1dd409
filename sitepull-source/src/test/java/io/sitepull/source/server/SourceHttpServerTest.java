package io.sitepull.source.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sitepull.source.service.DatabaseExportJobService;
import io.sitepull.source.service.ManifestJobService;
import io.sitepull.source.service.SourceFileService;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SourceHttpServerTest {
  private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded");

  @Mock private SourceActionDispatcher dispatcher;
  @Mock private DatabaseExportJobService databaseJobs;
  @Mock private ManifestJobService manifestJobs;
  @Mock private SourceFileService files;
  private final OkHttpClient client = new OkHttpClient();
  private SourceHttpServer server;

  @BeforeEach
  void setUp() throws Exception {
    server = new SourceHttpServer(dispatcher, 0, 2);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  private static String endpoint(SourceHttpServer server) {
    return "http://localhost:" + server.getPort() + SourceHttpServer.ENDPOINT_PATH;
  }

  @Test
  void testFormBodyAndHeadersReachDispatcher() throws Exception {
    byte[] payload = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
    when(dispatcher.dispatch(any()))
        .thenReturn(
            SourceResponse.builder()
                .statusCode(200)
                .contentType(SourceResponse.JSON)
                .contentLength(payload.length)
                .body(out -> out.write(payload))
                .build());

    Request request =
        new Request.Builder()
            .url(endpoint(server) + "?action=file_batch")
            .header("X-Sitepull-Key", "abc")
            .post(RequestBody.create("paths%5B%5D=a+b.txt&paths%5B%5D=c%2Fd.txt", FORM))
            .build();
    try (Response response = client.newCall(request).execute()) {
      assertEquals(200, response.code());
      assertEquals("{\"ok\":true}", response.body().string());
    }

    ArgumentCaptor<SourceRequest> captor = ArgumentCaptor.forClass(SourceRequest.class);
    verify(dispatcher).dispatch(captor.capture());
    SourceRequest received = captor.getValue();
    assertEquals("file_batch", received.getParameter("action"));
    assertEquals("abc", received.getHeader("X-Sitepull-Key"));
    assertEquals(Arrays.asList("a b.txt", "c/d.txt"), received.getParameterValues("paths[]"));
  }

  @Test
  void testStreamedBodyOfUnknownLength() throws Exception {
    when(dispatcher.dispatch(any()))
        .thenReturn(
            SourceResponse.builder()
                .statusCode(404)
                .contentType(SourceResponse.OCTET_STREAM)
                .contentLength(-1)
                .body(out -> out.write(new byte[] {1, 2, 3}))
                .build());

    try (Response response =
        client.newCall(new Request.Builder().url(endpoint(server)).get().build()).execute()) {
      assertEquals(404, response.code());
      assertEquals(3, response.body().bytes().length);
    }
  }

  @Test
  void testMalformedFormEncodingIsRejectedAsBadRequest() throws Exception {
    SourceActionDispatcher realDispatcher =
        new SourceActionDispatcher(
            new AccessKeyValidator("k3y"), databaseJobs, manifestJobs, files, Duration.ofSeconds(5));
    SourceHttpServer realServer = new SourceHttpServer(realDispatcher, 0, 1);
    realServer.start();
    try {
      Request request =
          new Request.Builder()
              .url(endpoint(realServer))
              .header("X-Sitepull-Key", "k3y")
              .post(RequestBody.create("action=file_fetch&path=100%zz", FORM))
              .build();
      try (Response response = client.newCall(request).execute()) {
        assertEquals(400, response.code());
        JsonNode body = new ObjectMapper().readTree(response.body().string());
        assertEquals("sitepull_invalid_request", body.get("error").asText());
        assertTrue(body.get("message").asText().startsWith("Malformed form encoding"));
      }
      verifyNoInteractions(files);
    } finally {
      realServer.stop();
    }
  }
}
