package com.voltradar.exporter.prometheus;

import com.voltradar.exporter.metrics.MetricBatch;
import com.voltradar.exporter.metrics.MetricCatalog;
import com.voltradar.exporter.metrics.MetricDescriptor;
import com.voltradar.exporter.metrics.MetricFamily;
import com.voltradar.exporter.metrics.MetricKind;
import com.voltradar.exporter.metrics.MetricMapper;
import com.voltradar.exporter.metrics.MetricSample;
import com.voltradar.exporter.metrics.MissingRequiredFieldException;
import com.voltradar.exporter.reconcile.ReconciledSnapshot;
import com.voltradar.exporter.reconcile.SnapshotReconciler;
import com.voltradar.exporter.teslafi.TeslaFiApiException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.prometheus.client.Collector;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pull-side bridge: every scrape of the Prometheus registry fetches, reconciles and maps a fresh
 * batch.
 *
 * <p>Failures are rethrown so the scrape endpoint answers with an error instead of a partial page.
 */
@Component
public class TeslaFiCollector extends Collector implements Collector.Describable {
  private static final Logger log = LoggerFactory.getLogger(TeslaFiCollector.class);

  private final SnapshotReconciler reconciler;
  private final MetricMapper mapper;
  private final MeterRegistry meterRegistry;

  public TeslaFiCollector(SnapshotReconciler reconciler, MetricMapper mapper, MeterRegistry meterRegistry) {
    this.reconciler = reconciler;
    this.mapper = mapper;
    this.meterRegistry = meterRegistry;
  }

  /** Produces the current batch; one or two feed calls, no caching of the batch itself. */
  public MetricBatch collectBatch() {
    try {
      ReconciledSnapshot snapshot = reconciler.reconcile();
      return mapper.map(snapshot);
    } catch (RuntimeException ex) {
      failureCounter(reason(ex)).increment();
      log.error("Scrape failed", ex);
      throw ex;
    }
  }

  @Override
  public List<MetricFamilySamples> collect() {
    MetricBatch batch = collectBatch();
    List<MetricFamilySamples> families = new ArrayList<>(batch.families().size());
    for (MetricFamily family : batch.families()) {
      families.add(toSamples(family));
    }
    return families;
  }

  // Registration only needs names, so it must not reach the feed.
  @Override
  public List<MetricFamilySamples> describe() {
    List<MetricFamilySamples> families = new ArrayList<>();
    for (MetricDescriptor descriptor : MetricCatalog.descriptors()) {
      families.add(new MetricFamilySamples(
          descriptor.name(), type(descriptor.kind()), descriptor.help(), List.of()));
    }
    return families;
  }

  static MetricFamilySamples toSamples(MetricFamily family) {
    String sampleName = switch (family.kind()) {
      case INFO -> family.name() + "_info";
      case COUNTER -> family.name() + "_total";
      case GAUGE, STATE_SET -> family.name();
    };
    List<MetricFamilySamples.Sample> samples = new ArrayList<>(family.samples().size());
    for (MetricSample sample : family.samples()) {
      List<String> labelNames = new ArrayList<>(sample.labels().size());
      List<String> labelValues = new ArrayList<>(sample.labels().size());
      for (Map.Entry<String, String> label : sample.labels().entrySet()) {
        labelNames.add(label.getKey());
        labelValues.add(label.getValue());
      }
      samples.add(new MetricFamilySamples.Sample(sampleName, labelNames, labelValues, sample.value()));
    }
    return new MetricFamilySamples(family.name(), type(family.kind()), family.help(), samples);
  }

  private static Type type(MetricKind kind) {
    return switch (kind) {
      case INFO -> Type.INFO;
      case COUNTER -> Type.COUNTER;
      case GAUGE -> Type.GAUGE;
      case STATE_SET -> Type.STATE_SET;
    };
  }

  private static String reason(RuntimeException ex) {
    if (ex instanceof TeslaFiApiException api) {
      return api.getKind().name().toLowerCase(Locale.ROOT);
    }
    if (ex instanceof MissingRequiredFieldException) {
      return "missing_field";
    }
    return "mapping";
  }

  private Counter failureCounter(String reason) {
    return Counter.builder("exporter.scrape.failures.total")
        .description("Scrapes that failed before producing a batch (by reason)")
        .tag("reason", reason)
        .register(meterRegistry);
  }
}
