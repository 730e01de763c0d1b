package com.voltradar.exporter.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The observed state of one state-set metric: the fixed enumeration plus the literal seen.
 *
 * <p>A literal outside the enumeration becomes one extra flag for this scrape only; the
 * descriptor's enumeration is never changed.
 */
public record StateObservation(List<String> states, String observed) {
  public StateObservation {
    states = List.copyOf(states);
  }

  public boolean recognized() {
    return states.contains(observed);
  }

  /** Flag per state in enumeration order, the unrecognised literal last. Exactly one is true. */
  public Map<String, Boolean> flags() {
    Map<String, Boolean> flags = new LinkedHashMap<>();
    for (String state : states) {
      flags.put(state, state.equals(observed));
    }
    if (!recognized()) {
      flags.put(observed, true);
    }
    return flags;
  }
}
