package com.voltradar.exporter.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StateObservationTest {

  @Test
  void recognizedValueSetsExactlyItsFlag() {
    StateObservation observation = new StateObservation(List.of("online", "asleep", "offline"), "asleep");

    assertThat(observation.recognized()).isTrue();
    assertThat(observation.flags())
        .containsExactly(
            entry("online", false),
            entry("asleep", true),
            entry("offline", false));
  }

  @Test
  void unrecognizedValueIsAppendedAsTrueFlag() {
    StateObservation observation = new StateObservation(List.of("online", "asleep"), "waking");

    assertThat(observation.recognized()).isFalse();
    assertThat(observation.flags()).containsKeys("online", "asleep", "waking");
    assertThat(observation.flags().get("waking")).isTrue();
    assertThat(observation.flags().values().stream().filter(Boolean::booleanValue)).hasSize(1);
  }

  @Test
  void descriptorNormalizesMissingAndAliasedValuesToNone() {
    StateSetDescriptor descriptor = new StateSetDescriptor(
        "teslafi_fast_charger_type", "Fast charger type", "fast_charger_type", List.of("None"), Set.of("<invalid>"));

    assertThat(descriptor.normalize(null)).isEqualTo("None");
    assertThat(descriptor.normalize("<invalid>")).isEqualTo("None");
    assertThat(descriptor.normalize("Supercharger")).isEqualTo("Supercharger");
  }
}
