package com.voltradar.exporter.metrics;

/** Static shape of one exposed metric family and where its values come from. */
public sealed interface MetricDescriptor
    permits InfoDescriptor, NumericDescriptor, StateSetDescriptor {

  String name();

  String help();

  MetricKind kind();
}
