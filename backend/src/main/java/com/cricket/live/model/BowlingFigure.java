package com.cricket.live.model;

public final class BowlingFigure {
  private final String participantId;
  private final String overs;
  private final Integer maidens;
  private final Integer runsConceded;
  private final Integer wickets;
  private final Integer noBalls;
  private final Integer wides;
  private final Double economy;
  private final Boolean bowling;

  public BowlingFigure(
      String participantId,
      String overs,
      Integer maidens,
      Integer runsConceded,
      Integer wickets,
      Integer noBalls,
      Integer wides,
      Double economy,
      Boolean bowling) {
    this.participantId = participantId;
    this.overs = overs;
    this.maidens = maidens;
    this.runsConceded = runsConceded;
    this.wickets = wickets;
    this.noBalls = noBalls;
    this.wides = wides;
    this.economy = economy;
    this.bowling = bowling;
  }

  public static BowlingFigure absent(String participantId) {
    return new BowlingFigure(participantId, null, null, null, null, null, null, null, null);
  }

  public String getParticipantId() {
    return participantId;
  }

  public String getOvers() {
    return overs;
  }

  public Integer getMaidens() {
    return maidens;
  }

  public Integer getRunsConceded() {
    return runsConceded;
  }

  public Integer getWickets() {
    return wickets;
  }

  public Integer getNoBalls() {
    return noBalls;
  }

  public Integer getWides() {
    return wides;
  }

  public Double getEconomy() {
    return economy;
  }

  public Boolean getBowling() {
    return bowling;
  }
}
