package com.voltradar.exporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExporterApplication {
  // Main entrypoint: boots Spring and serves the scrape endpoint; no background polling.
  public static void main(String[] args) {
    SpringApplication.run(ExporterApplication.class, args);
  }
}
