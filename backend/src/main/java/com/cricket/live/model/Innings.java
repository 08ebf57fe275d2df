package com.cricket.live.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public final class Innings {
  private final String battingTeamId;
  private final String oversBowled;
  private final List<JsonNode> batting;
  private final List<JsonNode> bowling;

  public Innings(
      String battingTeamId, String oversBowled, List<JsonNode> batting, List<JsonNode> bowling) {
    this.battingTeamId = battingTeamId;
    this.oversBowled = oversBowled;
    this.batting = List.copyOf(batting);
    this.bowling = List.copyOf(bowling);
  }

  public String getBattingTeamId() {
    return battingTeamId;
  }

  public String getOversBowled() {
    return oversBowled;
  }

  public List<JsonNode> getBatting() {
    return batting;
  }

  public List<JsonNode> getBowling() {
    return bowling;
  }
}
