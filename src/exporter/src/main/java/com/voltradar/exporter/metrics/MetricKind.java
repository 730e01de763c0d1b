package com.voltradar.exporter.metrics;

public enum MetricKind {
  INFO,
  COUNTER,
  GAUGE,
  STATE_SET
}
