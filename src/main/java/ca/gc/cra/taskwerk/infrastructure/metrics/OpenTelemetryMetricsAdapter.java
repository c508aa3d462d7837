package ca.gc.cra.taskwerk.infrastructure.metrics;

import ca.gc.cra.taskwerk.application.port.EnvironmentPort;
import ca.gc.cra.taskwerk.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry counters and long histograms.
 *
 * <p>Instruments are created lazily per key and cached. Each data point carries the original key in the
 * {@code taskwerk.metric.key} attribute, since instrument names are sanitized.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("taskwerk.metric.key");
  private static final String FALLBACK_NAME = "taskwerk.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from the process environment. */
  public OpenTelemetryMetricsAdapter() {
    this(EnvironmentPort.SYSTEM);
  }

  /**
   * Creates an adapter configured from {@code environment}.
   *
   * @param environment source of the {@code OTEL_*} variables
   */
  public OpenTelemetryMetricsAdapter(EnvironmentPort environment) {
    this(OpenTelemetryBootstrap.initialize(environment));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    if (handle.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  /**
   * Returns whether metrics are discarded.
   *
   * @return {@code true} when exporting is disabled or failed to initialize
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.close();
  }

  private LongCounter createCounter(String key) {
    return handle.meter()
        .counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Taskwerk configuration counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return handle.meter()
        .histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("Taskwerk configuration observation for " + key)
        .build();
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }
}
