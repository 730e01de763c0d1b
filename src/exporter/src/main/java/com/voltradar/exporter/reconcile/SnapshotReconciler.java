package com.voltradar.exporter.reconcile;

import com.voltradar.exporter.config.TeslaFiProperties;
import com.voltradar.exporter.teslafi.Snapshot;
import com.voltradar.exporter.teslafi.TeslaFiClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SnapshotReconciler {
  private static final Logger log = LoggerFactory.getLogger(SnapshotReconciler.class);

  /** Dropped by the feed while the car sleeps, together with every other live sensor value. */
  public static final String COMPLETENESS_SENTINEL = "outside_temp";

  private final TeslaFiClient client;
  private final FallbackSnapshotCache cache;
  private final TeslaFiProperties properties;
  private final Counter fallbackFetchCounter;
  private volatile Boolean lastComplete;

  public SnapshotReconciler(
      TeslaFiClient client,
      FallbackSnapshotCache cache,
      TeslaFiProperties properties,
      MeterRegistry meterRegistry) {
    this.client = client;
    this.cache = cache;
    this.properties = properties;
    this.fallbackFetchCounter = Counter.builder("exporter.teslafi.fallback.fetch.total")
        .description("Extra feed calls made to seed the last-good snapshot")
        .register(meterRegistry);
    meterRegistry.gauge("exporter.teslafi.fallback.cached", cache, c -> c.isPresent() ? 1.0 : 0.0);
  }

  /**
   * Fetches the current snapshot and picks the source its missing fields are read from.
   *
   * @return current snapshot plus fallback source (the current one itself when complete)
   */
  public ReconciledSnapshot reconcile() {
    Snapshot current = client.fetch(properties.command());

    if (current.hasValue(COMPLETENESS_SENTINEL)) {
      noteCompleteness(true);
      if (!cache.refresh(current)) {
        log.debug("Kept cached snapshot, it is newer than the one just fetched");
      }
      return new ReconciledSnapshot(current, current);
    }

    noteCompleteness(false);
    Snapshot fallback = cache.getOrLoad(this::fetchLastGood);
    return new ReconciledSnapshot(current, fallback);
  }

  private Snapshot fetchLastGood() {
    log.info("No last-good snapshot cached yet, calling feed with command={}", properties.fallbackCommand());
    fallbackFetchCounter.increment();
    return client.fetch(properties.fallbackCommand());
  }

  private void noteCompleteness(boolean complete) {
    Boolean previous = lastComplete;
    lastComplete = complete;
    if (previous == null || previous != complete) {
      if (complete) {
        log.info("Feed snapshot is complete ({} present), vehicle reporting live data", COMPLETENESS_SENTINEL);
      } else {
        log.info("Feed snapshot is incomplete ({} missing), vehicle likely asleep", COMPLETENESS_SENTINEL);
      }
    }
  }
}
