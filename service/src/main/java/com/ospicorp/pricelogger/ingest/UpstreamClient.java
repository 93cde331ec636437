package com.ospicorp.pricelogger.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Fetches the five-minute report from the upstream market data endpoint.
 */
@Component
public class UpstreamClient {

  private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);
  static final String FIVE_MINUTE_KEY = "5MIN";

  private final RestTemplate restTemplate;
  private final String apiUrl;
  private final Map<String, String> extraHeaders;

  public UpstreamClient(@Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
      IngestionProperties properties, ObjectMapper mapper) {
    this.restTemplate = restTemplate;
    this.apiUrl = properties.apiUrl();
    this.extraHeaders = parseHeaders(properties.apiHeaders(), mapper);
  }

  /**
   * Posts {@code {"timeScale":["5MIN"]}} and returns the {@code 5MIN} array of the response.
   *
   * @throws UpstreamException on a transport failure, a non-2xx status, or a body without the
   *     array
   */
  public JsonNode fetchFiveMinute() {
    if (!StringUtils.hasText(apiUrl)) {
      throw new UpstreamException("Upstream URL is not configured");
    }
    HttpHeaders headers = new HttpHeaders();
    extraHeaders.forEach(headers::set);
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    HttpEntity<Map<String, List<String>>> request =
        new HttpEntity<>(Map.of("timeScale", List.of(FIVE_MINUTE_KEY)), headers);

    ResponseEntity<JsonNode> response;
    try {
      response = restTemplate.exchange(apiUrl, HttpMethod.POST, request, JsonNode.class);
    } catch (RestClientException ex) {
      throw new UpstreamException("Upstream request failed: " + ex.getMessage(), ex);
    }
    JsonNode body = response.getBody();
    JsonNode records = body == null ? null : body.get(FIVE_MINUTE_KEY);
    if (records == null || !records.isArray()) {
      throw new UpstreamException("Upstream response has no " + FIVE_MINUTE_KEY + " array");
    }
    log.debug("Upstream returned {} {} records", records.size(), FIVE_MINUTE_KEY);
    return records;
  }

  static Map<String, String> parseHeaders(String json, ObjectMapper mapper) {
    if (!StringUtils.hasText(json)) {
      return Map.of();
    }
    try {
      Map<String, Object> raw = mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
      Map<String, String> headers = new LinkedHashMap<>();
      raw.forEach((name, value) -> {
        if (value != null) {
          headers.put(name, value.toString());
        }
      });
      return headers;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("aemo.ingestion.api-headers must be a JSON object", ex);
    }
  }
}
