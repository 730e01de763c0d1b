package com.voltradar.exporter.config;

import com.voltradar.exporter.metrics.ChargeTimeUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "teslafi")
public record TeslaFiProperties(
    String apiToken,
    String baseUrl,
    String command,
    String fallbackCommand,
    Schema schema) {

  public static final String DEFAULT_BASE_URL = "https://www.teslafi.com/feed.php";
  public static final String DEFAULT_FALLBACK_COMMAND = "lastGoodTemp";

  public TeslaFiProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = DEFAULT_BASE_URL;
    }
    if (fallbackCommand == null || fallbackCommand.isBlank()) {
      fallbackCommand = DEFAULT_FALLBACK_COMMAND;
    }
    if (schema == null) {
      schema = new Schema(ChargeTimeUnit.HOURS);
    }
  }

  /** Upstream schema revision knobs; the feed changed units without versioning its payload. */
  public record Schema(ChargeTimeUnit timeToFullChargeUnit) {
    public Schema {
      if (timeToFullChargeUnit == null) {
        timeToFullChargeUnit = ChargeTimeUnit.HOURS;
      }
    }
  }
}
