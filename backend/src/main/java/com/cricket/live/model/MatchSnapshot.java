package com.cricket.live.model;

import java.util.Map;
import java.util.Optional;

public final class MatchSnapshot {
  private final MatchSummary match;
  private final Scorecard scorecard;
  private final Ball lastBall;
  private final CurrentPlayers currentPlayers;
  private final Map<String, String> oversByTeamId;

  private MatchSnapshot(
      MatchSummary match,
      Scorecard scorecard,
      Ball lastBall,
      CurrentPlayers currentPlayers,
      Map<String, String> oversByTeamId) {
    this.match = match;
    this.scorecard = scorecard;
    this.lastBall = lastBall;
    this.currentPlayers = currentPlayers;
    this.oversByTeamId = Map.copyOf(oversByTeamId);
  }

  public static MatchSnapshot of(MatchSummary match) {
    return new MatchSnapshot(match, null, null, null, Map.of());
  }

  public MatchSnapshot withScorecard(Optional<Scorecard> value) {
    return new MatchSnapshot(match, value.orElse(null), lastBall, currentPlayers, oversByTeamId);
  }

  // Current players are derived from the last ball, so both are set or neither is.
  public MatchSnapshot withLastBall(Ball ball, CurrentPlayers players) {
    if ((ball == null) != (players == null)) {
      throw new IllegalArgumentException("lastBall and currentPlayers must be set together");
    }
    return new MatchSnapshot(match, scorecard, ball, players, oversByTeamId);
  }

  public MatchSnapshot withOvers(Map<String, String> overs) {
    return new MatchSnapshot(match, scorecard, lastBall, currentPlayers, overs);
  }

  public MatchSummary getMatch() {
    return match;
  }

  public Optional<Scorecard> getScorecard() {
    return Optional.ofNullable(scorecard);
  }

  public Optional<Ball> getLastBall() {
    return Optional.ofNullable(lastBall);
  }

  public Optional<CurrentPlayers> getCurrentPlayers() {
    return Optional.ofNullable(currentPlayers);
  }

  public Map<String, String> getOversByTeamId() {
    return oversByTeamId;
  }
}
