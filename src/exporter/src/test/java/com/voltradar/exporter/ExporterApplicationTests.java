package com.voltradar.exporter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.voltradar.exporter.teslafi.TeslaFiApiException;
import com.voltradar.exporter.teslafi.TeslaFiClient;
import java.util.Objects;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
      "teslafi.api-token=test-token"
    })
@AutoConfigureMockMvc
@AutoConfigureObservability
class ExporterApplicationTests {
  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private TestRestTemplate restTemplate;

  @MockBean
  private TeslaFiClient teslaFiClient;

  @Test
  void metricsEndpointServesVehicleAndExporterMetrics() throws Exception {
    when(teslaFiClient.fetch(any())).thenReturn(TeslaFiFixtures.awake());

    String body = mockMvc.perform(get("/metrics"))
        .andExpect(status().isOk())
        .andReturn()
        .getResponse()
        .getContentAsString();

    assertThat(body)
        .contains("teslafi_battery_level{vin=\"5YJ3E7EB0KF000001\",display_name=\"Sparky\",} 80.0")
        .contains("teslafi_odometer_meter_total")
        .contains("teslafi_info{")
        .contains("exporter_teslafi_fallback_cached");
  }

  @Test
  void failedFeedCallFailsTheScrape() {
    when(teslaFiClient.fetch(any()))
        .thenThrow(new TeslaFiApiException(TeslaFiApiException.Kind.UPSTREAM_REJECTED, "Invalid token"));

    Throwable thrown = catchThrowable(() -> mockMvc.perform(get("/metrics")));

    assertThat(Stream.iterate(thrown, Objects::nonNull, Throwable::getCause))
        .anyMatch(TeslaFiApiException.class::isInstance);
  }

  @Test
  void failedFeedCallAnswersServerError() {
    when(teslaFiClient.fetch(any()))
        .thenThrow(new TeslaFiApiException(TeslaFiApiException.Kind.TRANSPORT, "status=502 body=bad gateway"));

    ResponseEntity<String> response = restTemplate.getForEntity("/metrics", String.class);

    assertThat(response.getStatusCode().is5xxServerError()).isTrue();
  }
}
