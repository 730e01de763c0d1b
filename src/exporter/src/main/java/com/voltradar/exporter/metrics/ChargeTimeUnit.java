package com.voltradar.exporter.metrics;

/**
 * Unit the feed reports {@code time_to_full_charge} in. Older feed revisions used minutes, current
 * ones use hours.
 */
public enum ChargeTimeUnit {
  MINUTES(60.0),
  HOURS(3600.0);

  private final double secondsPerUnit;

  ChargeTimeUnit(double secondsPerUnit) {
    this.secondsPerUnit = secondsPerUnit;
  }

  public double toSeconds(double value) {
    return value * secondsPerUnit;
  }
}
