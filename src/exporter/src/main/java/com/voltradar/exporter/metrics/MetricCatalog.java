package com.voltradar.exporter.metrics;

import static com.voltradar.exporter.metrics.ValueConversion.BOOLEAN;
import static com.voltradar.exporter.metrics.ValueConversion.IDENTITY;
import static com.voltradar.exporter.metrics.ValueConversion.MILES_TO_METERS;
import static com.voltradar.exporter.metrics.ValueConversion.MPH_TO_KMH;
import static com.voltradar.exporter.metrics.ValueConversion.TIME_TO_FULL_CHARGE;

import com.voltradar.exporter.metrics.NumericDescriptor.Observation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Every metric the exporter exposes, in exposition order.
 *
 * <p>Field names are those of the TeslaFi feed, which mirrors the Tesla owner API. Defaults are
 * kept per field as the feed has behaved so far: fields that go blank while the car sleeps
 * default to -1 (unknown), the rest are required.
 */
public final class MetricCatalog {
  public static final String NAMESPACE = "teslafi";
  public static final List<String> IDENTITY_LABELS = List.of("vin", "display_name");

  private static final double UNKNOWN = -1.0;
  private static final List<MetricDescriptor> DESCRIPTORS = build();

  private MetricCatalog() {}

  public static List<MetricDescriptor> descriptors() {
    return DESCRIPTORS;
  }

  private static List<MetricDescriptor> build() {
    List<MetricDescriptor> d = new ArrayList<>();

    d.add(new InfoDescriptor(NAMESPACE, "TeslaFi car info (almost never changing)", List.of(
        "vin", "display_name", "vehicle_id", "option_codes", "exterior_color", "roof_color",
        "measure", "eu_vehicle", "rhd", "motorized_charge_port", "spoiler_type", "third_row_seats",
        "car_type", "rear_seat_heaters")));
    d.add(new InfoDescriptor(name("status"), "TeslaFi car info (rarely changing)", List.of(
        "vin", "display_name", "vehicle_name", "car_version", "newVersion", "wheel_type",
        "api_version")));

    d.add(counter("data_id", "TeslaFi ID of the data record", "data_id", IDENTITY));
    d.add(counter("odometer_meter", "Odometer in meters", "odometer", MILES_TO_METERS));

    d.add(gauge("polling", "TeslaFi polling (0=false, 1=true)", "polling", BOOLEAN).withDefault(0));

    // Climate
    d.add(gauge("outside_temperature", "Outside temperature in °C", "outside_temp", IDENTITY));
    d.add(gauge("inside_temperature", "Inside temperature in °C", "inside_temp", IDENTITY));
    d.add(gauge("driver_set_temperature", "Driver set temperature in °C", "driver_temp_setting", IDENTITY));
    d.add(gauge("passenger_set_temperature", "Passenger set temperature in °C", "passenger_temp_setting", IDENTITY));
    d.add(gauge("fan_status", "HVAC fan status", "fan_status", IDENTITY));

    // Battery and range
    d.add(gauge("battery_level", "Battery level in % SOC", "battery_level", IDENTITY));
    d.add(gauge("usable_battery_level",
        "Usable battery level in % SOC (partially locked e.g. because of battery temperature)",
        "usable_battery_level", IDENTITY));
    d.add(gauge("battery_range_meter", "Rated range in meter", "battery_range", MILES_TO_METERS));
    d.add(gauge("battery_range_ideal_meter", "Ideal range in meter", "ideal_battery_range", MILES_TO_METERS));
    d.add(gauge("battery_range_est_meter", "Estimated range in meter", "est_battery_range", MILES_TO_METERS));
    d.add(gauge("maxRange_meter", "Maximum range in meter", "maxRange", MILES_TO_METERS));
    d.add(gauge("charge_limit_soc", "Charge limit in % SOC", "charge_limit_soc", IDENTITY));
    d.add(gauge("charge_limit_soc_min", "Lowest selectable charge limit in % SOC", "charge_limit_soc_min", IDENTITY)
        .withDefault(UNKNOWN));
    d.add(gauge("charge_limit_soc_std", "Standard charge limit in % SOC", "charge_limit_soc_std", IDENTITY)
        .withDefault(UNKNOWN));
    d.add(gauge("charge_limit_soc_max", "Highest selectable charge limit in % SOC", "charge_limit_soc_max", IDENTITY)
        .withDefault(UNKNOWN));

    // Position
    d.add(gauge("gps_as_of", "GPS timestamp", "gps_as_of", IDENTITY));
    d.add(gauge("heading", "Heading (in degree)", "heading", IDENTITY));
    d.add(gauge("longitude", "Longitude (in degree)", "longitude", IDENTITY));
    d.add(gauge("latitude", "Latitude (in degree)", "latitude", IDENTITY));

    // TeslaFi bookkeeping
    d.add(gauge("idleTime", "Idle time in minutes (negative while a sleep attempt is running)", "idleTime", IDENTITY));
    d.add(multiGauge("number", "Number of state monitored by TeslaFi", "state", IDENTITY,
        new Observation("idle", "idleNumber"),
        new Observation("sleep", "sleepNumber"),
        new Observation("drive", "driveNumber"),
        new Observation("charge", "chargeNumber")));

    // Vehicle state
    d.add(gauge("sentry_mode", "Sentry mode (0=off, 1=on)", "sentry_mode", BOOLEAN));
    d.add(gauge("locked", "Locked (0=unlocked, 1=locked)", "locked", BOOLEAN));
    d.add(gauge("is_user_present", "User present (0=no, 1=yes)", "is_user_present", BOOLEAN));
    d.add(gauge("in_service", "Car in service (0=no, 1=yes, -1=unknown)", "in_service", BOOLEAN)
        .withDefault(UNKNOWN));
    d.add(gauge("center_display_state", "Center display state (0=off, -1=unknown)", "center_display_state", IDENTITY)
        .withDefault(UNKNOWN));
    d.add(gauge("valet_mode", "Valet mode (0=off, 1=on, -1=unknown)", "valet_mode", BOOLEAN).withDefault(UNKNOWN));
    d.add(gauge("homelink_nearby", "HomeLink device nearby (0=no, 1=yes, -1=unknown)", "homelink_nearby", BOOLEAN)
        .withDefault(UNKNOWN));

    d.add(multiGauge("door_open", "Door state (0=closed, 1=open)", "location", BOOLEAN,
        new Observation("front driver", "df"),
        new Observation("rear driver", "dr"),
        new Observation("front passenger", "pf"),
        new Observation("rear passenger", "pr"),
        new Observation("front trunk", "ft"),
        new Observation("rear trunk", "rt")));
    d.add(multiGauge("window_open", "Window state (0=closed, 1=open)", "location", BOOLEAN,
        new Observation("front driver", "fd_window"),
        new Observation("rear driver", "rd_window"),
        new Observation("front passenger", "fp_window"),
        new Observation("rear passenger", "rp_window")));
    d.add(multiGauge("seat_heater", "Seat heater level (0=off, -1=unknown)", "location", IDENTITY,
        new Observation("front driver", "seat_heater_left"),
        new Observation("rear driver", "seat_heater_rear_left"),
        new Observation("front passenger", "seat_heater_right"),
        new Observation("rear passenger", "seat_heater_rear_right"),
        new Observation("rear center", "seat_heater_rear_center")).withDefault(UNKNOWN));

    // HVAC
    d.add(gauge("battery_heater_on", "Battery heater (0=off, 1=on, -1=unknown)", "battery_heater_on", BOOLEAN)
        .withDefault(UNKNOWN));
    d.add(gauge("is_front_defroster_on", "Front defroster (0=off, 1=on)", "is_front_defroster_on", BOOLEAN));
    d.add(gauge("is_rear_defroster_on", "Rear defroster (0=off, 1=on)", "is_rear_defroster_on", BOOLEAN));
    d.add(gauge("defrost_mode", "Defrost mode (0=off, 1=on, -1=unknown)", "defrost_mode", IDENTITY)
        .withDefault(UNKNOWN));
    d.add(gauge("is_preconditioning", "Preconditioning (0=off, 1=on, -1=unknown)", "is_preconditioning", BOOLEAN)
        .withDefault(UNKNOWN));
    d.add(gauge("is_auto_conditioning_on", "Auto conditioning (0=off, 1=on)", "is_auto_conditioning_on", BOOLEAN));
    d.add(gauge("is_climate_on", "Climate on (0=off, 1=on)", "is_climate_on", BOOLEAN));
    d.add(gauge("left_temp_direction", "Left temp direction", "left_temp_direction", IDENTITY));
    d.add(gauge("right_temp_direction", "Right temp direction", "right_temp_direction", IDENTITY));

    // Charging
    d.add(gauge("charge_port_cold_weather_mode", "Charge port cold weather mode (0=off, 1=on, -1=unknown)",
        "charge_port_cold_weather_mode", BOOLEAN).withDefault(UNKNOWN));
    d.add(gauge("charge_port_door_open", "Charge port door open (0=closed, 1=open)", "charge_port_door_open", BOOLEAN));
    d.add(gauge("time_to_full_charge_seconds",
        "Estimated time to full charge in seconds (granularity about 15 minutes)",
        "time_to_full_charge", TIME_TO_FULL_CHARGE));
    d.add(gauge("charge_current_request_ampere", "Requested charge current in Ampere (per phase)",
        "charge_current_request", IDENTITY));
    d.add(gauge("charge_enable_request", "Charging enabled (if possible)", "charge_enable_request", BOOLEAN));
    d.add(gauge("charger_power_kw", "Charge power in kW", "charger_power", IDENTITY));
    d.add(gauge("charger_pilot_current_ampere", "Max current allowed by charger in ampere per phase",
        "charger_pilot_current", IDENTITY));
    d.add(gauge("charger_actual_current_ampere", "Actual charge current in ampere per phase",
        "charger_actual_current", IDENTITY));
    d.add(gauge("charge_current_request_max_ampere", "Maximum requestable charge current in ampere",
        "charge_current_request_max", IDENTITY));
    d.add(gauge("charge_energy_added_kwh", "Energy charged since start of current/last charge session in kWh",
        "charge_energy_added", IDENTITY));
    d.add(gauge("charge_range_ideal_added_meter",
        "Ideal range added since start of current/last charge session in meter",
        "charge_miles_added_ideal", MILES_TO_METERS));
    d.add(gauge("charge_range_rated_added_meter",
        "Rated range added since start of current/last charge session in meter",
        "charge_miles_added_rated", MILES_TO_METERS));
    d.add(gauge("charge_rate", "Charge rate in km/h of range", "charge_rate", MPH_TO_KMH));
    d.add(gauge("charger_voltage", "Charger voltage in Volt", "charger_voltage", IDENTITY));
    d.add(gauge("fast_charger_present", "Fast charger present (0=no, 1=yes, -1=unknown)",
        "fast_charger_present", BOOLEAN).withDefault(UNKNOWN));
    d.add(gauge("trip_charging", "Trip charging (0=no, 1=yes, -1=unknown)", "trip_charging", BOOLEAN)
        .withDefault(UNKNOWN));
    d.add(gauge("scheduled_charging_pending", "Scheduled charging pending (0=no, 1=yes, -1=unknown)",
        "scheduled_charging_pending", BOOLEAN).withDefault(UNKNOWN));
    d.add(gauge("max_range_charge_counter", "Number of charges to max range (-1=unknown)",
        "max_range_charge_counter", IDENTITY).withDefault(UNKNOWN));

    // Driving
    d.add(gauge("speed_kmh", "Speed in km/h", "speed", MPH_TO_KMH).withDefault(0));
    d.add(gauge("power_kw", "Current power use in kW, negative during regen", "power", IDENTITY));

    // State sets
    d.add(stateSet("carState", "Car state", "carState",
        List.of("Sleeping", "Idling", "Driving", "Charging")));
    d.add(stateSet("shift_state", "Shift state", "shift_state",
        List.of("None", "P", "R", "N", "D")));
    d.add(stateSet("charger_phases", "Charger phases", "charger_phases",
        List.of("None", "1", "2", "3")));
    d.add(stateSet("api_state", "API state", "state",
        List.of("online", "asleep", "offline")));
    d.add(stateSet("fast_charger_type", "Fast charger type", "fast_charger_type",
        List.of("None"), "<invalid>"));
    d.add(stateSet("charge_port_led_color", "Charge port LED color", "charge_port_led_color",
        List.of("None")));
    d.add(stateSet("charge_port_latch", "Charge port latch status", "charge_port_latch",
        List.of("Engaged", "Disengaged", "Blocking")));
    d.add(stateSet("charging_state", "Charging state", "charging_state",
        List.of("Disconnected", "NoPower", "Starting", "Charging", "Stopped", "Complete")));
    d.add(stateSet("climate_keeper_mode", "Climate keeper mode", "climate_keeper_mode",
        List.of("off", "on", "dog", "camp")));
    d.add(stateSet("conn_charge_cable", "Connected charge cable type", "conn_charge_cable",
        List.of("None", "IEC", "SAE", "GB_AC", "GB_DC"), "<invalid>"));
    d.add(stateSet("fast_charger_brand", "Fast charger brand", "fast_charger_brand",
        List.of("None", "Tesla"), "<invalid>"));
    d.add(stateSet("newVersionStatus", "Firmware update rollout status", "newVersionStatus",
        List.of("None", "downloading_wifi_wait", "downloading", "available", "scheduled", "installing")));
    d.add(stateSet("location", "Location tagged in TeslaFi", "location",
        List.of("None")));
    d.add(stateSet("rangeDisplay", "Range display mode", "rangeDisplay",
        List.of("rated", "ideal")));

    return List.copyOf(d);
  }

  private static String name(String suffix) {
    return NAMESPACE + "_" + suffix;
  }

  private static NumericDescriptor counter(String suffix, String help, String field, ValueConversion conversion) {
    return new NumericDescriptor(
        name(suffix), MetricKind.COUNTER, help, null, List.of(new Observation(null, field)), conversion, null);
  }

  private static NumericDescriptor gauge(String suffix, String help, String field, ValueConversion conversion) {
    return new NumericDescriptor(
        name(suffix), MetricKind.GAUGE, help, null, List.of(new Observation(null, field)), conversion, null);
  }

  private static NumericDescriptor multiGauge(
      String suffix, String help, String subLabel, ValueConversion conversion, Observation... observations) {
    return new NumericDescriptor(
        name(suffix), MetricKind.GAUGE, help, subLabel, Arrays.asList(observations), conversion, null);
  }

  // Empty text already resolves to a missing value, so it always lands on None.
  private static StateSetDescriptor stateSet(
      String suffix, String help, String field, List<String> states, String... noneAliases) {
    return new StateSetDescriptor(name(suffix), help, field, states, Set.of(noneAliases));
  }
}
