package com.cricket.live.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

class GrassrootsApiClientTest {
  private static final URI URL = URI.create("https://api.test/scores/grades/123/matches");

  private MockRestServiceServer server;
  private GrassrootsApiClient client;

  @BeforeEach
  void setUp() {
    MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
    client = new GrassrootsApiClient(new RestTemplateBuilder(customizer), new ObjectMapper(), 1000, 1000);
    server = customizer.getServer();
  }

  @Test
  void parsesPlainJsonBody() {
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess("{\"matches\":[{\"id\":\"M1\"}]}", MediaType.APPLICATION_JSON));

    JsonNode body = client.fetchJson(URL);

    assertThat(body.path("matches").get(0).path("id").asText()).isEqualTo("M1");
    server.verify();
  }

  @Test
  void extractsPayloadEmbeddedInHtmlPage() {
    String page =
        "<html><head><script>\n"
            + "window.Dto = {\"matches\": [{\"id\": \"M7\",\n \"status\": \"LIVE\"}]};\n"
            + "window.Other = {};</script></head><body></body></html>";
    server.expect(requestTo(URL)).andRespond(withSuccess(page, MediaType.TEXT_HTML));

    JsonNode body = client.fetchJson(URL);

    assertThat(body.path("matches").get(0).path("status").asText()).isEqualTo("LIVE");
  }

  @Test
  void htmlPageWithoutCharsetIsReadAsUtf8() {
    String page = "<script>window.Dto = {\"name\":\"Pe\u00f1a\"};</script>";
    server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(page.getBytes(StandardCharsets.UTF_8), MediaType.TEXT_HTML));

    JsonNode body = client.fetchJson(URL);

    assertThat(body.path("name").asText()).isEqualTo("Pe\u00f1a");
  }

  @Test
  void errorPageWithoutCharsetIsReadAsUtf8() {
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.TEXT_HTML)
                .body("window.Dto = {\"clubName\":\"S\u00e3o Paulo CC\"};".getBytes(StandardCharsets.UTF_8)));

    JsonNode body = client.fetchJson(URL);

    assertThat(body.path("clubName").asText()).isEqualTo("S\u00e3o Paulo CC");
  }

  @Test
  void pageWithoutEmbeddedPayloadIsParseError() {
    server
        .expect(requestTo(URL))
        .andRespond(withSuccess("<html><body>Service unavailable</body></html>", MediaType.TEXT_HTML));

    assertThatThrownBy(() -> client.fetchJson(URL))
        .isInstanceOf(UpstreamParseException.class)
        .hasMessage("Could not parse response as JSON or extract window.Dto");
  }

  @Test
  void emptyBodyIsParseError() {
    server.expect(requestTo(URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.fetchJson(URL)).isInstanceOf(UpstreamParseException.class);
  }

  @Test
  void errorStatusBodyIsStillParsed() {
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"matches\":[]}"));

    JsonNode body = client.fetchJson(URL);

    assertThat(body.path("matches").isArray()).isTrue();
  }

  @Test
  void transportFailureIsUpstreamUnavailable() {
    server
        .expect(requestTo(URL))
        .andRespond(
            request -> {
              throw new IOException("Connection refused");
            });

    assertThatThrownBy(() -> client.fetchJson(URL))
        .isInstanceOf(UpstreamUnavailableException.class)
        .hasMessageContaining("Connection refused");
  }

  @Test
  void trailingGarbageAfterJsonFallsBackToEmbeddedPayload() {
    String body = "{\"ignored\":true} window.Dto = {\"matches\":[]};";

    JsonNode parsed = client.parseBody(body);

    assertThat(parsed.has("matches")).isTrue();
    assertThat(parsed.has("ignored")).isFalse();
  }
}
