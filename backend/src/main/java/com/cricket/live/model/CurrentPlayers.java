package com.cricket.live.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({
  "strikerId",
  "strikerName",
  "nonStrikerId",
  "nonStrikerName",
  "bowlerId",
  "bowlerName",
  "lastBallTime",
  "strikerRuns",
  "strikerBalls",
  "nonStrikerRuns",
  "nonStrikerBalls",
  "bowlerRuns",
  "bowlerBalls",
  "bowlerOvers",
  "bowlerMaidens",
  "bowlerRunsConceded",
  "bowlerWickets",
  "bowlerNoBalls",
  "bowlerWides",
  "bowlerEconomy",
  "isBowling"
})
public final class CurrentPlayers {
  private final Ball ball;
  private final BattingFigure striker;
  private final BattingFigure nonStriker;
  private final BattingFigure bowlerBatting;
  private final BowlingFigure bowlerBowling;

  public CurrentPlayers(
      Ball ball,
      BattingFigure striker,
      BattingFigure nonStriker,
      BattingFigure bowlerBatting,
      BowlingFigure bowlerBowling) {
    this.ball = ball;
    this.striker = striker;
    this.nonStriker = nonStriker;
    this.bowlerBatting = bowlerBatting;
    this.bowlerBowling = bowlerBowling;
  }

  public String getStrikerId() {
    return ball.getStrikerId();
  }

  public String getStrikerName() {
    return ball.getStrikerName();
  }

  public String getNonStrikerId() {
    return ball.getNonStrikerId();
  }

  public String getNonStrikerName() {
    return ball.getNonStrikerName();
  }

  public String getBowlerId() {
    return ball.getBowlerId();
  }

  public String getBowlerName() {
    return ball.getBowlerName();
  }

  public String getLastBallTime() {
    return ball.getBallTime();
  }

  public Integer getStrikerRuns() {
    return striker.getRuns();
  }

  public Integer getStrikerBalls() {
    return striker.getBalls();
  }

  public Integer getNonStrikerRuns() {
    return nonStriker.getRuns();
  }

  public Integer getNonStrikerBalls() {
    return nonStriker.getBalls();
  }

  public Integer getBowlerRuns() {
    return bowlerBatting.getRuns();
  }

  public Integer getBowlerBalls() {
    return bowlerBatting.getBalls();
  }

  public String getBowlerOvers() {
    return bowlerBowling.getOvers();
  }

  public Integer getBowlerMaidens() {
    return bowlerBowling.getMaidens();
  }

  public Integer getBowlerRunsConceded() {
    return bowlerBowling.getRunsConceded();
  }

  public Integer getBowlerWickets() {
    return bowlerBowling.getWickets();
  }

  public Integer getBowlerNoBalls() {
    return bowlerBowling.getNoBalls();
  }

  public Integer getBowlerWides() {
    return bowlerBowling.getWides();
  }

  public Double getBowlerEconomy() {
    return bowlerBowling.getEconomy();
  }

  @JsonProperty("isBowling")
  public Boolean getIsBowling() {
    return bowlerBowling.getBowling();
  }
}
