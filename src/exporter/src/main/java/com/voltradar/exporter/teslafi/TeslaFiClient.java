package com.voltradar.exporter.teslafi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltradar.exporter.config.TeslaFiProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TeslaFiClient {
  private static final Logger log = LoggerFactory.getLogger(TeslaFiClient.class);

  private final TeslaFiProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter httpErrorCounter;
  private final Counter rejectedCounter;
  private final Counter invalidCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public TeslaFiClient(
      TeslaFiProperties properties,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.requestTimer = Timer.builder("exporter.teslafi.http.duration")
        .description("TeslaFi feed HTTP request duration (seconds)")
        .register(meterRegistry);

    // One series per outcome; the command is deliberately not a tag.
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.httpErrorCounter = outcomeCounter(meterRegistry, "http_error");
    this.rejectedCounter = outcomeCounter(meterRegistry, "rejected");
    this.invalidCounter = outcomeCounter(meterRegistry, "invalid");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");

    meterRegistry.gauge("exporter.teslafi.http.last_status", lastStatusCode);
  }

  @PostConstruct
  public void logFeedConfig() {
    if (properties.apiToken() == null || properties.apiToken().isBlank()) {
      throw new IllegalStateException(
          "TeslaFi API token is missing (set teslafi.api-token or --teslafi_api_token).");
    }
    log.info(
        "TeslaFi feed configured: baseUrl={}, token={}, fallbackCommand={}, timeToFullChargeUnit={}",
        properties.baseUrl(),
        mask(properties.apiToken()),
        properties.fallbackCommand(),
        properties.schema().timeToFullChargeUnit());
  }

  /**
   * Fetches one snapshot from the feed.
   *
   * @param command optional feed sub-command (for example {@code lastGoodTemp}); null or blank
   *     selects the default view
   * @return the flattened top-level fields of the response
   * @throws TeslaFiApiException when the call fails or the feed rejects it
   */
  public Snapshot fetch(String command) {
    URI uri = buildUri(command);
    log.debug("Calling TeslaFi feed {}", redact(uri));

    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response;
    long startNs = System.nanoTime();
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException ex) {
      failedCall(startNs);
      throw new TeslaFiApiException(TeslaFiApiException.Kind.TRANSPORT, "I/O error: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      failedCall(startNs);
      Thread.currentThread().interrupt();
      throw new TeslaFiApiException(TeslaFiApiException.Kind.TRANSPORT, "request interrupted", ex);
    }
    requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    lastStatusCode.set(response.statusCode());

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      httpErrorCounter.increment();
      log.warn("TeslaFi feed call failed: status={}", response.statusCode());
      throw new TeslaFiApiException(
          TeslaFiApiException.Kind.TRANSPORT,
          "status=" + response.statusCode() + " body=" + response.body());
    }

    JsonNode root = parseBody(response.body());

    // The feed wraps its own errors (bad token, rate limit) in a 200 response.
    if (root.has("response")) {
      rejectedCounter.increment();
      JsonNode result = root.path("response").path("result");
      String detail = result.isMissingNode() || result.isNull() ? "" : result.asText();
      log.warn("TeslaFi feed rejected the call: {}", detail);
      throw new TeslaFiApiException(TeslaFiApiException.Kind.UPSTREAM_REJECTED, detail);
    }

    successCounter.increment();
    log.debug("TeslaFi feed response: {}", response.body());
    return toSnapshot(root);
  }

  URI buildUri(String command) {
    StringBuilder url = new StringBuilder(properties.baseUrl())
        .append("?token=")
        .append(urlEncode(properties.apiToken()));
    if (command != null && !command.isBlank()) {
      url.append("&command=").append(urlEncode(command));
    }
    return URI.create(url.toString());
  }

  private JsonNode parseBody(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      invalidCounter.increment();
      throw new TeslaFiApiException(
          TeslaFiApiException.Kind.INVALID_RESPONSE, "body is not JSON: " + ex.getOriginalMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      invalidCounter.increment();
      throw new TeslaFiApiException(TeslaFiApiException.Kind.INVALID_RESPONSE, "body is not a JSON object");
    }
    return root;
  }

  private Snapshot toSnapshot(JsonNode root) {
    Map<String, String> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode node = entry.getValue();
      if (node == null || node.isNull()) {
        continue;
      }
      fields.put(entry.getKey(), node.isValueNode() ? node.asText() : node.toString());
    }
    return new Snapshot(fields);
  }

  private void failedCall(long startNs) {
    lastStatusCode.set(0);
    requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    exceptionCounter.increment();
  }

  private String redact(URI uri) {
    String token = urlEncode(properties.apiToken());
    return uri.toString().replace("token=" + token, "token=" + mask(properties.apiToken()));
  }

  private static String mask(String token) {
    if (token == null || token.length() <= 4) {
      return "****";
    }
    return "****" + token.substring(token.length() - 4);
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("exporter.teslafi.http.requests.total")
        .description("TeslaFi feed HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
