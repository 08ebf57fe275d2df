package com.cricket.live.model;

import com.fasterxml.jackson.databind.JsonNode;

public final class Ball {
  private final String strikerId;
  private final String strikerName;
  private final String nonStrikerId;
  private final String nonStrikerName;
  private final String bowlerId;
  private final String bowlerName;
  private final String ballTime;
  private final JsonNode raw;

  public Ball(
      String strikerId,
      String strikerName,
      String nonStrikerId,
      String nonStrikerName,
      String bowlerId,
      String bowlerName,
      String ballTime,
      JsonNode raw) {
    this.strikerId = strikerId;
    this.strikerName = strikerName;
    this.nonStrikerId = nonStrikerId;
    this.nonStrikerName = nonStrikerName;
    this.bowlerId = bowlerId;
    this.bowlerName = bowlerName;
    this.ballTime = ballTime;
    this.raw = raw;
  }

  public String getStrikerId() {
    return strikerId;
  }

  public String getStrikerName() {
    return strikerName;
  }

  public String getNonStrikerId() {
    return nonStrikerId;
  }

  public String getNonStrikerName() {
    return nonStrikerName;
  }

  public String getBowlerId() {
    return bowlerId;
  }

  public String getBowlerName() {
    return bowlerName;
  }

  public String getBallTime() {
    return ballTime;
  }

  public JsonNode getRaw() {
    return raw;
  }
}
