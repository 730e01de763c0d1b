package com.voltradar.exporter.teslafi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One point-in-time read of the TeslaFi feed: top-level field name to its text value.
 *
 * <p>JSON nulls are kept as absent entries, so {@link #get(String)} returns null for both.
 */
public final class Snapshot {
  private final Map<String, String> fields;

  public Snapshot(Map<String, String> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields)));
  }

  public static Snapshot of(Map<String, String> fields) {
    return new Snapshot(fields);
  }

  public String get(String field) {
    return fields.get(field);
  }

  /** True when the field carries a non-empty value. */
  public boolean hasValue(String field) {
    String value = fields.get(field);
    return value != null && !value.isEmpty();
  }

  public Map<String, String> fields() {
    return fields;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Snapshot snapshot)) {
      return false;
    }
    return fields.equals(snapshot.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "Snapshot" + fields;
  }
}
