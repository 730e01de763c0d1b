package com.voltradar.exporter.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MetricSample(Map<String, String> labels, double value) {
  public MetricSample {
    labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
  }
}
