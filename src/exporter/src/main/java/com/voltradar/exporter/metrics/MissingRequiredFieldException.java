package com.voltradar.exporter.metrics;

/**
 * A numeric field without a default is absent from both the current and the fallback snapshot.
 *
 * <p>Usually means the feed schema changed; the scrape fails instead of exposing a made-up zero.
 */
public class MissingRequiredFieldException extends RuntimeException {
  private final String metric;
  private final String field;

  public MissingRequiredFieldException(String metric, String field) {
    super("Metric " + metric + " requires field '" + field + "' but neither snapshot has a value");
    this.metric = metric;
    this.field = field;
  }

  public String getMetric() {
    return metric;
  }

  public String getField() {
    return field;
  }
}
