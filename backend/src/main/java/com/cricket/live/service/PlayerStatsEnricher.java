package com.cricket.live.service;

import com.cricket.live.model.Ball;
import com.cricket.live.model.BattingFigure;
import com.cricket.live.model.BowlingFigure;
import com.cricket.live.model.CurrentPlayers;
import com.cricket.live.model.Innings;
import com.cricket.live.model.Scorecard;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class PlayerStatsEnricher {

  public CurrentPlayers buildCurrentPlayers(Ball lastBall, Scorecard detail) {
    Optional<Innings> current =
        Optional.ofNullable(detail).flatMap(Scorecard::currentInnings);
    return new CurrentPlayers(
        lastBall,
        batting("Striker batting lookup", current, lastBall.getStrikerId()),
        batting("Non-striker batting lookup", current, lastBall.getNonStrikerId()),
        batting("Bowler batting lookup", current, lastBall.getBowlerId()),
        bowling(current, lastBall.getBowlerId()));
  }

  private BattingFigure batting(String step, Optional<Innings> innings, String participantId) {
    BattingFigure absent = BattingFigure.absent(participantId);
    return BestEffort.attemptOr(
        step,
        () ->
            innings
                .flatMap(item -> ScorecardSchema.findEntry(item.getBatting(), participantId))
                .map(entry -> ScorecardSchema.battingFigure(participantId, entry))
                .orElse(absent),
        absent);
  }

  private BowlingFigure bowling(Optional<Innings> innings, String participantId) {
    BowlingFigure absent = BowlingFigure.absent(participantId);
    return BestEffort.attemptOr(
        "Bowler bowling lookup",
        () ->
            innings
                .flatMap(item -> ScorecardSchema.findEntry(item.getBowling(), participantId))
                .map(entry -> ScorecardSchema.bowlingFigure(participantId, entry))
                .orElse(absent),
        absent);
  }
}
