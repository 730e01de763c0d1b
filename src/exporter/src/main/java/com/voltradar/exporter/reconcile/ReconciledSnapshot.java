package com.voltradar.exporter.reconcile;

import com.voltradar.exporter.teslafi.Snapshot;
import java.util.Objects;

/**
 * The current snapshot paired with the snapshot used to fill its gaps.
 *
 * <p>When the current snapshot is complete both sides are the same instance.
 */
public record ReconciledSnapshot(Snapshot current, Snapshot fallback) {
  public ReconciledSnapshot {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(fallback, "fallback");
  }

  /**
   * Resolves one field: the current value, else the fallback value, else null. Empty text counts
   * as missing on both sides.
   */
  public String resolve(String field) {
    if (current.hasValue(field)) {
      return current.get(field);
    }
    if (fallback.hasValue(field)) {
      return fallback.get(field);
    }
    return null;
  }

  public String resolve(String field, String defaultValue) {
    String value = resolve(field);
    return value == null ? defaultValue : value;
  }

  public boolean usesFallback() {
    return current != fallback;
  }
}
