package io.sitepull.source.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

/** Serves the action endpoint on one path, accepting GET query strings and POST form bodies. */
@Slf4j
public class SourceHttpServer {
  public static final String ENDPOINT_PATH = "/sitepull";

  private final SourceActionDispatcher dispatcher;
  private final HttpServer server;
  private final ExecutorService executor;

  public SourceHttpServer(SourceActionDispatcher dispatcher, int port, int workerThreads)
      throws IOException {
    this.dispatcher = dispatcher;
    this.server = HttpServer.create(new InetSocketAddress(port), 0);
    this.executor = Executors.newFixedThreadPool(workerThreads);
    server.createContext(ENDPOINT_PATH, this::handle);
    server.setExecutor(executor);
  }

  public void start() {
    server.start();
    log.info("Serving actions on port {} at {}", getPort(), ENDPOINT_PATH);
  }

  public int getPort() {
    return server.getAddress().getPort();
  }

  public void stop() {
    server.stop(1);
    executor.shutdown();
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      SourceResponse response;
      try {
        response = dispatcher.dispatch(toRequest(exchange));
      } catch (RuntimeException e) {
        response = dispatcher.failure(null, e);
      }
      exchange.getResponseHeaders().set("Content-Type", response.getContentType());
      long length = response.getContentLength();
      if (length == 0) {
        exchange.sendResponseHeaders(response.getStatusCode(), -1);
        return;
      }
      // HttpServer takes 0 as chunked transfer of unknown length
      exchange.sendResponseHeaders(response.getStatusCode(), length < 0 ? 0 : length);
      try (OutputStream out = exchange.getResponseBody()) {
        response.getBody().writeTo(out);
      }
    } catch (IOException e) {
      log.warn("Failed to send response to {}", exchange.getRemoteAddress(), e);
      throw e;
    } catch (RuntimeException e) {
      // headers are already out, closing the exchange truncates the body
      log.error("Failed while streaming response to {}", exchange.getRemoteAddress(), e);
    } finally {
      exchange.close();
    }
  }

  private static SourceRequest toRequest(HttpExchange exchange) throws IOException {
    Map<String, List<String>> parameters =
        SourceRequest.parseForm(exchange.getRequestURI().getRawQuery());
    if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      try (InputStream in = exchange.getRequestBody()) {
        String body = IOUtils.toString(in, StandardCharsets.UTF_8);
        SourceRequest.parseForm(body)
            .forEach(
                (name, values) ->
                    parameters.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values));
      }
    }
    SourceRequest.SourceRequestBuilder builder = SourceRequest.builder().parameters(parameters);
    exchange
        .getRequestHeaders()
        .forEach(
            (name, values) -> {
              if (!values.isEmpty()) {
                builder.header(name.toLowerCase(Locale.ROOT), values.get(0));
              }
            });
    return builder.build();
  }
}
