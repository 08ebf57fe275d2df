package com.cricket.live.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

public final class MatchSummary {
  private final String id;
  private final List<Team> teams;
  private final String status;
  private final Instant scheduledStart;
  private final JsonNode raw;

  public MatchSummary(
      String id, List<Team> teams, String status, Instant scheduledStart, JsonNode raw) {
    this.id = id;
    this.teams = List.copyOf(teams);
    this.status = status;
    this.scheduledStart = scheduledStart;
    this.raw = raw;
  }

  public String getId() {
    return id;
  }

  public List<Team> getTeams() {
    return teams;
  }

  public String getStatus() {
    return status;
  }

  public Instant getScheduledStart() {
    return scheduledStart;
  }

  public JsonNode getRaw() {
    return raw;
  }

  public boolean involves(String teamId) {
    return teams.stream().anyMatch(team -> teamId.equals(team.getId()));
  }
}
