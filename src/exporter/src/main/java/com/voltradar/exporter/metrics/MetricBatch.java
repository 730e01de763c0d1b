package com.voltradar.exporter.metrics;

import java.util.List;
import java.util.Optional;

/** Metric families materialised by one scrape, in catalog order. */
public record MetricBatch(List<MetricFamily> families) {
  public MetricBatch {
    families = List.copyOf(families);
  }

  public Optional<MetricFamily> family(String name) {
    return families.stream().filter(family -> family.name().equals(name)).findFirst();
  }
}
