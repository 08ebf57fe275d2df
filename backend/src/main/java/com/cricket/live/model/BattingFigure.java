package com.cricket.live.model;

public final class BattingFigure {
  private final String participantId;
  private final Integer runs;
  private final Integer balls;

  public BattingFigure(String participantId, Integer runs, Integer balls) {
    this.participantId = participantId;
    this.runs = runs;
    this.balls = balls;
  }

  // No scorecard entry: nothing is known, which is not the same as zero.
  public static BattingFigure absent(String participantId) {
    return new BattingFigure(participantId, null, null);
  }

  public String getParticipantId() {
    return participantId;
  }

  public Integer getRuns() {
    return runs;
  }

  public Integer getBalls() {
    return balls;
  }
}
