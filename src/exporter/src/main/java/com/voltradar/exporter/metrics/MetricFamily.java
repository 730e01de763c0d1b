package com.voltradar.exporter.metrics;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record MetricFamily(String name, MetricKind kind, String help, List<MetricSample> samples) {
  public MetricFamily {
    samples = List.copyOf(samples);
  }

  /** First sample whose labels contain every given pair. */
  public Optional<MetricSample> sample(Map<String, String> labels) {
    return samples.stream()
        .filter(sample -> sample.labels().entrySet().containsAll(labels.entrySet()))
        .findFirst();
  }
}
