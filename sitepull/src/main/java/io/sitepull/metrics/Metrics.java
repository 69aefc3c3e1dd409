package io.sitepull.metrics;

import static io.micrometer.prometheus.PrometheusConfig.DEFAULT;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.CollectorRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Process wide meter registry, scraped by {@link MetricsServer} when enabled. */
public class Metrics {
  private static final Metrics INSTANCE = new Metrics(new PrometheusMeterRegistry(DEFAULT));

  private final PrometheusMeterRegistry meterRegistry;
  private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

  @VisibleForTesting
  Metrics(PrometheusMeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public static Metrics getInstance() {
    return INSTANCE;
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }

  public CollectorRegistry getCollectorRegistry() {
    return meterRegistry.getPrometheusRegistry();
  }

  public void increment(String name, List<Tag> tags) {
    increment(name, 1, tags);
  }

  public void increment(String name, double amount, List<Tag> tags) {
    Counter.builder(name).tags(tags).register(meterRegistry).increment(amount);
  }

  public void timer(String name, Duration duration, List<Tag> tags) {
    Timer.builder(name).tags(tags).register(meterRegistry).record(duration);
  }

  /** Returns the value holder backing the gauge, registering it on first use. */
  public AtomicLong gauge(String name, String description) {
    return gauges.computeIfAbsent(
        name,
        key -> {
          AtomicLong value = new AtomicLong();
          Gauge.builder(key, value, AtomicLong::get)
              .description(description)
              .register(meterRegistry);
          return value;
        });
  }
}
