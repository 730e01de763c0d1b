package com.voltradar.exporter.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ValueConversionTest {

  @Test
  void unitConversionsUseExactFactors() {
    assertThat(ValueConversion.MILES_TO_METERS.convert("100", ChargeTimeUnit.HOURS)).isCloseTo(160934.4, within(1e-9));
    assertThat(ValueConversion.MPH_TO_KMH.convert("60", ChargeTimeUnit.HOURS)).isCloseTo(96.56064, within(1e-9));
    assertThat(ValueConversion.IDENTITY.convert(" 21.5 ", ChargeTimeUnit.HOURS)).isEqualTo(21.5);
  }

  @Test
  void booleanAcceptsFeedSpellingsAndNumbers() {
    assertThat(ValueConversion.BOOLEAN.convert("True", ChargeTimeUnit.HOURS)).isEqualTo(1.0);
    assertThat(ValueConversion.BOOLEAN.convert("false", ChargeTimeUnit.HOURS)).isEqualTo(0.0);
    assertThat(ValueConversion.BOOLEAN.convert("1", ChargeTimeUnit.HOURS)).isEqualTo(1.0);
    assertThat(ValueConversion.BOOLEAN.convert("0", ChargeTimeUnit.HOURS)).isEqualTo(0.0);
    assertThatThrownBy(() -> ValueConversion.BOOLEAN.convert("maybe", ChargeTimeUnit.HOURS))
        .isInstanceOf(NumberFormatException.class);
  }

  @Test
  void timeToFullChargeDependsOnSchemaUnit() {
    assertThat(ValueConversion.TIME_TO_FULL_CHARGE.convert("0.25", ChargeTimeUnit.HOURS)).isEqualTo(900.0);
    assertThat(ValueConversion.TIME_TO_FULL_CHARGE.convert("15", ChargeTimeUnit.MINUTES)).isEqualTo(900.0);
  }
}
