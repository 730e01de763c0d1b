package com.voltradar.exporter;

import com.voltradar.exporter.config.TeslaFiProperties;
import com.voltradar.exporter.metrics.ChargeTimeUnit;
import com.voltradar.exporter.teslafi.Snapshot;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Feed payloads shaped like real TeslaFi responses. */
public final class TeslaFiFixtures {
  private TeslaFiFixtures() {}

  public static TeslaFiProperties properties() {
    return properties(ChargeTimeUnit.HOURS);
  }

  public static TeslaFiProperties properties(ChargeTimeUnit unit) {
    return new TeslaFiProperties(
        "secret-token",
        "https://teslafi.example/feed.php",
        "",
        "lastGoodTemp",
        new TeslaFiProperties.Schema(unit));
  }

  /** Every field the catalog reads, as an awake car reports them. */
  public static Map<String, String> awakeFields() {
    Map<String, String> f = new LinkedHashMap<>();
    f.put("data_id", "1234567");
    f.put("Date", "2021-02-02 14:06:17");
    f.put("vin", "5YJ3E7EB0KF000001");
    f.put("display_name", "Sparky");
    f.put("vehicle_id", "1234567890");
    f.put("option_codes", "AD15,MDL3,PBSB");
    f.put("exterior_color", "MidnightSilver");
    f.put("roof_color", "Glass");
    f.put("measure", "metric");
    f.put("eu_vehicle", "1");
    f.put("rhd", "0");
    f.put("motorized_charge_port", "1");
    f.put("spoiler_type", "None");
    f.put("third_row_seats", "None");
    f.put("car_type", "model3");
    f.put("rear_seat_heaters", "1");
    f.put("vehicle_name", "Sparky");
    f.put("car_version", "2020.48.37.1 4bd1b6d4f3b5");
    f.put("newVersion", "");
    f.put("wheel_type", "Pinwheel18");
    f.put("api_version", "10");
    f.put("polling", "True");
    f.put("odometer", "12345.6");
    f.put("outside_temp", "4.5");
    f.put("inside_temp", "18.0");
    f.put("driver_temp_setting", "21.0");
    f.put("passenger_temp_setting", "21.0");
    f.put("fan_status", "0");
    f.put("battery_level", "80");
    f.put("usable_battery_level", "79");
    f.put("battery_range", "200.5");
    f.put("ideal_battery_range", "210.25");
    f.put("est_battery_range", "180.0");
    f.put("maxRange", "250.0");
    f.put("charge_limit_soc", "90");
    f.put("charge_limit_soc_min", "50");
    f.put("charge_limit_soc_std", "90");
    f.put("charge_limit_soc_max", "100");
    f.put("gps_as_of", "1612271177");
    f.put("heading", "185");
    f.put("longitude", "7.881");
    f.put("latitude", "46.294");
    f.put("idleTime", "12");
    f.put("idleNumber", "3");
    f.put("sleepNumber", "5");
    f.put("driveNumber", "2");
    f.put("chargeNumber", "1");
    f.put("sentry_mode", "0");
    f.put("locked", "1");
    f.put("is_user_present", "0");
    f.put("in_service", "0");
    f.put("center_display_state", "0");
    f.put("valet_mode", "0");
    f.put("homelink_nearby", "0");
    f.put("df", "0");
    f.put("dr", "0");
    f.put("pf", "0");
    f.put("pr", "0");
    f.put("ft", "0");
    f.put("rt", "1");
    f.put("fd_window", "0");
    f.put("rd_window", "0");
    f.put("fp_window", "0");
    f.put("rp_window", "0");
    f.put("seat_heater_left", "1");
    f.put("seat_heater_rear_left", "0");
    f.put("seat_heater_right", "0");
    f.put("seat_heater_rear_right", "0");
    f.put("seat_heater_rear_center", "0");
    f.put("battery_heater_on", "0");
    f.put("is_front_defroster_on", "0");
    f.put("is_rear_defroster_on", "0");
    f.put("defrost_mode", "0");
    f.put("is_preconditioning", "0");
    f.put("is_auto_conditioning_on", "0");
    f.put("is_climate_on", "0");
    f.put("left_temp_direction", "0");
    f.put("right_temp_direction", "0");
    f.put("charge_port_cold_weather_mode", "0");
    f.put("charge_port_door_open", "0");
    f.put("time_to_full_charge", "0.0");
    f.put("charge_current_request", "16");
    f.put("charge_enable_request", "1");
    f.put("charger_power", "0");
    f.put("charger_pilot_current", "16");
    f.put("charger_actual_current", "0");
    f.put("charge_current_request_max", "16");
    f.put("charge_energy_added", "12.5");
    f.put("charge_miles_added_ideal", "50.0");
    f.put("charge_miles_added_rated", "40.0");
    f.put("charge_rate", "0.0");
    f.put("charger_voltage", "2");
    f.put("fast_charger_present", "0");
    f.put("trip_charging", "0");
    f.put("scheduled_charging_pending", "0");
    f.put("max_range_charge_counter", "0");
    f.put("speed", "0");
    f.put("power", "0");
    f.put("carState", "Idling");
    f.put("shift_state", "P");
    f.put("charger_phases", "1");
    f.put("state", "online");
    f.put("fast_charger_type", "<invalid>");
    f.put("charge_port_led_color", "");
    f.put("charge_port_latch", "Engaged");
    f.put("charging_state", "Disconnected");
    f.put("climate_keeper_mode", "off");
    f.put("conn_charge_cable", "<invalid>");
    f.put("fast_charger_brand", "<invalid>");
    f.put("newVersionStatus", "");
    f.put("location", "Bahnhof Visp");
    f.put("rangeDisplay", "rated");
    return f;
  }

  /**
   * What the feed sends for a sleeping car: bookkeeping fields only, every sensor value null
   * (nulls are dropped while parsing, so they are simply absent here).
   */
  public static Map<String, String> asleepFields() {
    Map<String, String> f = new HashMap<>();
    f.put("data_id", "1234999");
    f.put("vin", "5YJ3E7EB0KF000001");
    f.put("display_name", "Sparky");
    f.put("battery_level", "77");
    f.put("odometer", "12350.0");
    f.put("carState", "Sleeping");
    f.put("state", "asleep");
    f.put("polling", "False");
    f.put("idleTime", "-5");
    return f;
  }

  public static Snapshot awake() {
    return Snapshot.of(awakeFields());
  }

  public static Snapshot asleep() {
    return Snapshot.of(asleepFields());
  }

  public static Snapshot awakeWith(String field, String value) {
    Map<String, String> fields = awakeFields();
    if (value == null) {
      fields.remove(field);
    } else {
      fields.put(field, value);
    }
    return Snapshot.of(fields);
  }
}
