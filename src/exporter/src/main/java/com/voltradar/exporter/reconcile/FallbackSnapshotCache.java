package com.voltradar.exporter.reconcile;

import com.voltradar.exporter.teslafi.Snapshot;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Process-wide holder of the last snapshot known to carry the temperature fields.
 *
 * <p>Starts empty, is never cleared and lives in memory only. All access is synchronized on the
 * cache, including the fetch that fills a cold cache, so overlapping scrapes never fetch twice.
 */
@Component
public class FallbackSnapshotCache {
  /** Monotonic record id assigned by the feed. */
  static final String RECORD_ID_FIELD = "data_id";

  private Snapshot snapshot;

  public synchronized Optional<Snapshot> get() {
    return Optional.ofNullable(snapshot);
  }

  /**
   * Stores {@code complete} unless the cached snapshot carries a higher record id.
   * Snapshots without a numeric record id are always stored.
   *
   * @return true when the cache now holds {@code complete}
   */
  public synchronized boolean refresh(Snapshot complete) {
    if (snapshot != null && isOlder(complete, snapshot)) {
      return false;
    }
    snapshot = complete;
    return true;
  }

  /**
   * Returns the cached snapshot, loading it with {@code loader} first when the cache is empty.
   * A failing loader leaves the cache empty and its exception propagates.
   */
  public synchronized Snapshot getOrLoad(Supplier<Snapshot> loader) {
    if (snapshot == null) {
      snapshot = loader.get();
    }
    return snapshot;
  }

  public synchronized boolean isPresent() {
    return snapshot != null;
  }

  private static boolean isOlder(Snapshot candidate, Snapshot cached) {
    OptionalLong candidateId = recordId(candidate);
    OptionalLong cachedId = recordId(cached);
    if (candidateId.isEmpty() || cachedId.isEmpty()) {
      return false;
    }
    return candidateId.getAsLong() < cachedId.getAsLong();
  }

  private static OptionalLong recordId(Snapshot snapshot) {
    String raw = snapshot.get(RECORD_ID_FIELD);
    if (raw == null) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }
}
