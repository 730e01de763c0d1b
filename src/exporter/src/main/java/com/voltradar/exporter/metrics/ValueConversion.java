package com.voltradar.exporter.metrics;

import java.util.Locale;

/** Turns the feed's text value into the exposed number. */
public enum ValueConversion {
  IDENTITY {
    @Override
    double convert(String raw, ChargeTimeUnit chargeTimeUnit) {
      return parse(raw);
    }
  },
  MILES_TO_METERS {
    @Override
    double convert(String raw, ChargeTimeUnit chargeTimeUnit) {
      return parse(raw) * METERS_PER_MILE;
    }
  },
  MPH_TO_KMH {
    @Override
    double convert(String raw, ChargeTimeUnit chargeTimeUnit) {
      return parse(raw) * KILOMETERS_PER_MILE;
    }
  },
  /** {@code True}/{@code False} as sent by the feed, or already numeric 0/1. */
  BOOLEAN {
    @Override
    double convert(String raw, ChargeTimeUnit chargeTimeUnit) {
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "true" -> 1.0;
        case "false" -> 0.0;
        default -> parse(raw);
      };
    }
  },
  TIME_TO_FULL_CHARGE {
    @Override
    double convert(String raw, ChargeTimeUnit chargeTimeUnit) {
      return chargeTimeUnit.toSeconds(parse(raw));
    }
  };

  public static final double METERS_PER_MILE = 1609.344;
  public static final double KILOMETERS_PER_MILE = 1.609344;

  abstract double convert(String raw, ChargeTimeUnit chargeTimeUnit);

  private static double parse(String raw) {
    return Double.parseDouble(raw.trim());
  }
}
