package com.voltradar.exporter.config;

import com.voltradar.exporter.prometheus.TeslaFiCollector;
import io.prometheus.client.CollectorRegistry;
import java.net.http.HttpClient;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient() {
    return HttpClient.newHttpClient();
  }

  // Shares the registry behind /metrics with Micrometer, so both sets of samples come out of one scrape.
  @Bean
  public InitializingBean teslaFiCollectorRegistration(
      TeslaFiCollector collector, CollectorRegistry collectorRegistry) {
    return () -> collector.register(collectorRegistry);
  }
}
