package com.voltradar.exporter.metrics;

import java.util.List;
import java.util.Objects;

/**
 * A counter or gauge read from one field, or from one field per sub-label value.
 *
 * @param subLabel extra label name for multi-instance gauges, null for single observations
 * @param defaultValue value used when neither snapshot has the field; null makes it required
 */
public record NumericDescriptor(
    String name,
    MetricKind kind,
    String help,
    String subLabel,
    List<Observation> observations,
    ValueConversion conversion,
    Double defaultValue) implements MetricDescriptor {

  public NumericDescriptor {
    if (kind != MetricKind.COUNTER && kind != MetricKind.GAUGE) {
      throw new IllegalArgumentException("numeric metric " + name + " cannot be " + kind);
    }
    Objects.requireNonNull(conversion, "conversion");
    observations = List.copyOf(observations);
    if (observations.isEmpty()) {
      throw new IllegalArgumentException("numeric metric " + name + " has no source field");
    }
    if (subLabel == null && observations.size() != 1) {
      throw new IllegalArgumentException("numeric metric " + name + " needs a sub-label for several fields");
    }
  }

  public NumericDescriptor withDefault(double value) {
    return new NumericDescriptor(name, kind, help, subLabel, observations, conversion, value);
  }

  /** One source field; {@code labelValue} is null unless the descriptor has a sub-label. */
  public record Observation(String labelValue, String field) {}
}
