package io.sitepull;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import io.sitepull.api.AsyncHttpClientWithRetry;
import io.sitepull.archive.ArchiveBuilder;
import io.sitepull.archive.ZipArchiveBuilder;
import io.sitepull.config.Config;
import io.sitepull.config.ConfigProvider;
import io.sitepull.config.models.common.HttpClientConfig;
import io.sitepull.retrieval.HttpUnitTransport;
import io.sitepull.retrieval.UnitTransportFactory;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class RuntimeModule extends AbstractModule {
  private static final int IO_WORKLOAD_NUM_THREAD_MULTIPLIER = 4;
  private final Config config;

  public RuntimeModule(Config config) {
    this.config = config;
  }

  @Provides
  @Singleton
  static OkHttpClient providesOkHttpClient(Config config, ExecutorService executorService) {
    HttpClientConfig httpConfig = config.getHttpClientConfig();
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(httpConfig.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(httpConfig.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .writeTimeout(httpConfig.getWriteTimeoutSeconds(), TimeUnit.SECONDS)
            .dispatcher(new Dispatcher(executorService));

    String httpProxyEnv = System.getenv("HTTP_PROXY");
    if (StringUtils.isNotBlank(httpProxyEnv)) {
      builder.proxy(buildProxy(httpProxyEnv.trim()));
      log.info("Configured HTTP client to use proxy from HTTP_PROXY env var: {}", httpProxyEnv);
    }
    return builder.build();
  }

  @Provides
  @Singleton
  static AsyncHttpClientWithRetry providesHttpAsyncClient(Config config, OkHttpClient okHttpClient) {
    HttpClientConfig httpConfig = config.getHttpClientConfig();
    return new AsyncHttpClientWithRetry(
        httpConfig.getMaxRetries(), httpConfig.getRetryDelayMillis(), okHttpClient);
  }

  @Provides
  @Singleton
  static ConfigProvider configProvider(Config config) {
    return new ConfigProvider(config);
  }

  @Provides
  @Singleton
  static Clock providesClock() {
    return Clock.systemDefaultZone();
  }

  @Provides
  @Singleton
  static ExecutorService providesExecutorService() {
    // calls mostly wait on the network
    int numThreads = Runtime.getRuntime().availableProcessors() * IO_WORKLOAD_NUM_THREAD_MULTIPLIER;
    log.debug("Spinning up {} HTTP threads", numThreads);
    AtomicInteger counter = new AtomicInteger(1);
    ForkJoinPool.ForkJoinWorkerThreadFactory threadFactory =
        pool -> {
          ForkJoinWorkerThread thread =
              ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
          thread.setName(String.format("sitepull-http-%d", counter.getAndIncrement()));
          return thread;
        };
    return new ForkJoinPool(
        numThreads,
        threadFactory,
        (thread, throwable) ->
            log.error(String.format("Uncaught exception in a thread (%s)", thread.getName()), throwable),
        true);
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
    bind(ArchiveBuilder.class).to(ZipArchiveBuilder.class);
    bind(UnitTransportFactory.class).toInstance(HttpUnitTransport::new);
  }

  private static Proxy buildProxy(String proxyEnv) {
    String proxyUrl = proxyEnv.matches("^[a-zA-Z]+://.*") ? proxyEnv : "http://" + proxyEnv;
    URI uri;
    try {
      uri = URI.create(proxyUrl);
    } catch (IllegalArgumentException e) {
      log.error("Failed to parse proxy url: {}", proxyEnv, e);
      return Proxy.NO_PROXY;
    }
    if (uri.getHost() == null) {
      log.error("Proxy url has no host: {}", proxyEnv);
      return Proxy.NO_PROXY;
    }
    int port = uri.getPort() == -1 ? 80 : uri.getPort();
    return new Proxy(Proxy.Type.HTTP, new InetSocketAddress(uri.getHost(), port));
  }
}
