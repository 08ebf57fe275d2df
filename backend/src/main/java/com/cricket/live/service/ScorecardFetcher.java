package com.cricket.live.service;

import com.cricket.live.model.Innings;
import com.cricket.live.model.Scorecard;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class ScorecardFetcher {
  private final GrassrootsApiClient apiClient;
  private final GrassrootsEndpoints endpoints;

  public ScorecardFetcher(GrassrootsApiClient apiClient, GrassrootsEndpoints endpoints) {
    this.apiClient = apiClient;
    this.endpoints = endpoints;
  }

  public Optional<Scorecard> fetchDetail(String matchId) {
    return BestEffort.attempt(
        "Match detail fetch for " + matchId,
        () -> Optional.of(toScorecard(unwrap(apiClient.fetchJson(endpoints.matchDetail(matchId))))));
  }

  // The detail arrives bare, inside matches[0], inside match, or both.
  static JsonNode unwrap(JsonNode body) {
    JsonNode detail = body;
    JsonNode matches = detail.path("matches");
    if (matches.isArray() && matches.size() > 0) {
      detail = matches.get(0);
    }
    JsonNode match = detail.path("match");
    if (JsonFields.isSet(match)) {
      detail = match;
    }
    return detail;
  }

  static Scorecard toScorecard(JsonNode detail) {
    List<Innings> innings = new ArrayList<>();
    JsonNode inningsNode = detail.path("innings");
    if (inningsNode.isArray()) {
      for (JsonNode entry : inningsNode) {
        innings.add(
            new Innings(
                JsonFields.text(entry.path("battingTeamId")),
                JsonFields.firstSetText(entry, "oversBowled"),
                elements(entry.path("batting")),
                elements(entry.path("bowling"))));
      }
    }
    return new Scorecard(detail, innings);
  }

  private static List<JsonNode> elements(JsonNode array) {
    List<JsonNode> items = new ArrayList<>();
    if (array.isArray()) {
      array.forEach(items::add);
    }
    return items;
  }
}
