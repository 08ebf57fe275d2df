package com.cricket.live.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class GrassrootsApiClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(GrassrootsApiClient.class);
  private static final Pattern EMBEDDED_DTO_PATTERN =
      Pattern.compile("window\\.Dto\\s*=\\s*(\\{.*?\\});", Pattern.DOTALL);

  private final RestTemplate restTemplate;
  private final ObjectReader strictReader;

  public GrassrootsApiClient(
      RestTemplateBuilder restTemplateBuilder,
      ObjectMapper objectMapper,
      @Value("${cricket.api.connect-timeout-ms:10000}") long connectTimeoutMs,
      @Value("${cricket.api.read-timeout-ms:30000}") long readTimeoutMs) {
    this.restTemplate =
        restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .build();
    this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public JsonNode fetchJson(URI url) {
    LOGGER.info("Fetching grassroots resource {}", url);
    return parseBody(readBody(url));
  }

  JsonNode parseBody(String body) {
    String text = body == null ? "" : body;
    JsonNode direct = tryParse(text);
    if (direct != null) {
      return direct;
    }
    Matcher matcher = EMBEDDED_DTO_PATTERN.matcher(text);
    if (matcher.find()) {
      JsonNode embedded = tryParse(matcher.group(1));
      if (embedded != null) {
        return embedded;
      }
    }
    throw new UpstreamParseException("Could not parse response as JSON or extract window.Dto");
  }

  private String readBody(URI url) {
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_HTML, MediaType.ALL));
    try {
      // bytes are decoded here: html pages arrive without a charset and are UTF-8
      ResponseEntity<byte[]> entity =
          restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<Void>(headers), byte[].class);
      byte[] body = entity.getBody();
      return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    } catch (HttpStatusCodeException ex) {
      // error pages still carry a body worth parsing
      LOGGER.warn("Grassroots API answered status={} for {}", ex.getStatusCode().value(), url);
      return ex.getResponseBodyAsString(StandardCharsets.UTF_8);
    } catch (RestClientException ex) {
      throw new UpstreamUnavailableException("Request to " + url + " failed: " + ex.getMessage(), ex);
    }
  }

  private JsonNode tryParse(String text) {
    try {
      JsonNode node = strictReader.readTree(text);
      return node == null || node.isMissingNode() ? null : node;
    } catch (JsonProcessingException ex) {
      LOGGER.debug("Body is not plain JSON: {}", ex.getOriginalMessage());
      return null;
    }
  }
}
