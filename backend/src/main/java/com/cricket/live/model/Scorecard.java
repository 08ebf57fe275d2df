package com.cricket.live.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

public final class Scorecard {
  private final JsonNode raw;
  private final List<Innings> innings;

  public Scorecard(JsonNode raw, List<Innings> innings) {
    this.raw = raw;
    this.innings = List.copyOf(innings);
  }

  public JsonNode getRaw() {
    return raw;
  }

  public List<Innings> getInnings() {
    return innings;
  }

  public Optional<Innings> currentInnings() {
    return innings.isEmpty() ? Optional.empty() : Optional.of(innings.get(innings.size() - 1));
  }

  public Optional<Innings> firstInningsBattedBy(String teamId) {
    return innings.stream().filter(item -> teamId.equals(item.getBattingTeamId())).findFirst();
  }
}
