package com.voltradar.exporter.metrics;

import java.util.List;
import java.util.Set;

/**
 * A free-text status field rendered as mutually exclusive flags.
 *
 * @param states fixed enumeration, in exposition order
 * @param noneAliases raw values that stand for the {@code None} state besides a missing value
 */
public record StateSetDescriptor(
    String name,
    String help,
    String field,
    List<String> states,
    Set<String> noneAliases) implements MetricDescriptor {

  public static final String NONE = "None";

  public StateSetDescriptor {
    states = List.copyOf(states);
    noneAliases = Set.copyOf(noneAliases);
  }

  @Override
  public MetricKind kind() {
    return MetricKind.STATE_SET;
  }

  /** Maps a resolved value onto the state it stands for; a missing value is {@code None}. */
  public String normalize(String value) {
    if (value == null || noneAliases.contains(value)) {
      return NONE;
    }
    return value;
  }
}
