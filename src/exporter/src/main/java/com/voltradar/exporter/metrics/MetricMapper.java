package com.voltradar.exporter.metrics;

import com.voltradar.exporter.config.TeslaFiProperties;
import com.voltradar.exporter.reconcile.ReconciledSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Materialises the {@link MetricCatalog} against one reconciled snapshot.
 *
 * <p>Stateless apart from its meters, so overlapping scrapes can share one instance.
 */
@Component
public class MetricMapper {
  private static final Logger log = LoggerFactory.getLogger(MetricMapper.class);

  private final List<MetricDescriptor> descriptors;
  private final ChargeTimeUnit chargeTimeUnit;
  private final MeterRegistry meterRegistry;

  public MetricMapper(TeslaFiProperties properties, MeterRegistry meterRegistry) {
    this.descriptors = MetricCatalog.descriptors();
    this.chargeTimeUnit = properties.schema().timeToFullChargeUnit();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Builds one family per catalog entry.
   *
   * @throws MissingRequiredFieldException when a required numeric field resolves to nothing
   * @throws IllegalStateException when a numeric field holds text that is not a number
   */
  public MetricBatch map(ReconciledSnapshot snapshot) {
    Map<String, String> identity = new LinkedHashMap<>();
    for (String label : MetricCatalog.IDENTITY_LABELS) {
      identity.put(label, snapshot.resolve(label, ""));
    }

    List<MetricFamily> families = new ArrayList<>(descriptors.size());
    for (MetricDescriptor descriptor : descriptors) {
      families.add(map(descriptor, snapshot, identity));
    }
    return new MetricBatch(families);
  }

  private MetricFamily map(MetricDescriptor descriptor, ReconciledSnapshot snapshot, Map<String, String> identity) {
    if (descriptor instanceof InfoDescriptor info) {
      return info(info, snapshot);
    }
    if (descriptor instanceof NumericDescriptor numeric) {
      return numeric(numeric, snapshot, identity);
    }
    if (descriptor instanceof StateSetDescriptor stateSet) {
      return stateSet(stateSet, snapshot, identity);
    }
    throw new IllegalArgumentException("Unsupported descriptor: " + descriptor);
  }

  private MetricFamily info(InfoDescriptor descriptor, ReconciledSnapshot snapshot) {
    Map<String, String> labels = new LinkedHashMap<>();
    for (String field : descriptor.fields()) {
      labels.put(field, snapshot.resolve(field, ""));
    }
    return new MetricFamily(
        descriptor.name(), MetricKind.INFO, descriptor.help(), List.of(new MetricSample(labels, 1.0)));
  }

  private MetricFamily numeric(
      NumericDescriptor descriptor, ReconciledSnapshot snapshot, Map<String, String> identity) {
    List<MetricSample> samples = new ArrayList<>(descriptor.observations().size());
    for (NumericDescriptor.Observation observation : descriptor.observations()) {
      Map<String, String> labels = new LinkedHashMap<>(identity);
      if (descriptor.subLabel() != null) {
        labels.put(descriptor.subLabel(), observation.labelValue());
      }
      samples.add(new MetricSample(labels, value(descriptor, observation.field(), snapshot)));
    }
    return new MetricFamily(descriptor.name(), descriptor.kind(), descriptor.help(), samples);
  }

  private double value(NumericDescriptor descriptor, String field, ReconciledSnapshot snapshot) {
    String raw = snapshot.resolve(field);
    if (raw == null) {
      if (descriptor.defaultValue() == null) {
        throw new MissingRequiredFieldException(descriptor.name(), field);
      }
      return descriptor.defaultValue();
    }
    try {
      return descriptor.conversion().convert(raw, chargeTimeUnit);
    } catch (NumberFormatException ex) {
      throw new IllegalStateException(
          "Metric " + descriptor.name() + " field '" + field + "' is not numeric: '" + raw + "'", ex);
    }
  }

  private MetricFamily stateSet(
      StateSetDescriptor descriptor, ReconciledSnapshot snapshot, Map<String, String> identity) {
    StateObservation observation = observe(descriptor, snapshot);

    List<MetricSample> samples = new ArrayList<>();
    for (Map.Entry<String, Boolean> flag : observation.flags().entrySet()) {
      Map<String, String> labels = new LinkedHashMap<>(identity);
      labels.put(descriptor.name(), flag.getKey());
      samples.add(new MetricSample(labels, flag.getValue() ? 1.0 : 0.0));
    }
    return new MetricFamily(descriptor.name(), MetricKind.STATE_SET, descriptor.help(), samples);
  }

  private StateObservation observe(StateSetDescriptor descriptor, ReconciledSnapshot snapshot) {
    String observed = descriptor.normalize(snapshot.resolve(descriptor.field()));
    StateObservation observation = new StateObservation(descriptor.states(), observed);
    if (!observation.recognized()) {
      log.info("Unknown/unexpected {}: {}", descriptor.field(), observed);
      Counter.builder("exporter.state.unrecognized.total")
          .description("State-set values outside the known enumeration")
          .tag("metric", descriptor.name())
          .register(meterRegistry)
          .increment();
    }
    return observation;
  }
}
