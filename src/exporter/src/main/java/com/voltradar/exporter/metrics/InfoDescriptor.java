package com.voltradar.exporter.metrics;

import java.util.List;

/** Descriptive attributes exposed as labels of a constant-1 info sample. */
public record InfoDescriptor(String name, String help, List<String> fields) implements MetricDescriptor {
  public InfoDescriptor {
    fields = List.copyOf(fields);
  }

  @Override
  public MetricKind kind() {
    return MetricKind.INFO;
  }
}
