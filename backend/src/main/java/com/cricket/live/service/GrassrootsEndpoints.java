package com.cricket.live.service;

import java.net.URI;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class GrassrootsEndpoints {
  private final String baseUrl;
  private final String jsConfig;

  public GrassrootsEndpoints(
      @Value("${cricket.api.base-url:https://grassrootsapiproxy.cricket.com.au/scores}") String baseUrl,
      @Value("${cricket.api.jsconfig:eccn:true}") String jsConfig) {
    this.baseUrl = baseUrl;
    this.jsConfig = jsConfig;
  }

  public URI matchesForGrade(String gradeId) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .pathSegment("grades", "{gradeId}", "matches")
        .queryParam("jsconfig", "{jsconfig}")
        .encode()
        .buildAndExpand(Map.of("gradeId", gradeId, "jsconfig", jsConfig))
        .toUri();
  }

  public URI matchDetail(String matchId) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .pathSegment("matches", "{matchId}")
        .queryParam("responseModifier", "includeScorecard")
        .queryParam("jsconfig", "{jsconfig}")
        .encode()
        .buildAndExpand(Map.of("matchId", matchId, "jsconfig", jsConfig))
        .toUri();
  }

  public URI balls(String matchId) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .pathSegment("matches", "{matchId}", "balls")
        .queryParam("jsconfig", "{jsconfig}")
        .encode()
        .buildAndExpand(Map.of("matchId", matchId, "jsconfig", jsConfig))
        .toUri();
  }

  public URI ballsFallback(String matchId) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .pathSegment("matches", "{matchId}", "balls")
        .encode()
        .buildAndExpand(Map.of("matchId", matchId))
        .toUri();
  }
}
