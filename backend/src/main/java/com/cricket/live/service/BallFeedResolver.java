package com.cricket.live.service;

import com.cricket.live.model.Ball;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BallFeedResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(BallFeedResolver.class);

  private final GrassrootsApiClient apiClient;
  private final GrassrootsEndpoints endpoints;

  public BallFeedResolver(GrassrootsApiClient apiClient, GrassrootsEndpoints endpoints) {
    this.apiClient = apiClient;
    this.endpoints = endpoints;
  }

  public Optional<Ball> fetchLastBall(String matchId) {
    Optional<JsonNode> primary =
        BestEffort.attempt(
            "Ball feed fetch for match " + matchId,
            () -> Optional.of(apiClient.fetchJson(endpoints.balls(matchId))));
    if (primary.isEmpty()) {
      return Optional.empty();
    }
    Optional<Ball> lastBall = lastBallIn(primary.get());
    if (lastBall.isPresent()) {
      return lastBall;
    }

    LOGGER.info("Ball feed for match {} had no deliveries, retrying without jsconfig", matchId);
    return BestEffort.attempt(
        "Fallback ball feed fetch for match " + matchId,
        () -> lastBallIn(apiClient.fetchJson(endpoints.ballsFallback(matchId))));
  }

  static Optional<Ball> lastBallIn(JsonNode body) {
    BallFeedShape shape = BallFeedShape.classify(body);
    List<List<JsonNode>> innings = shape.innings(body);
    LOGGER.debug("Ball feed classified as {} with {} innings", shape, innings.size());
    if (innings.isEmpty()) {
      return Optional.empty();
    }
    List<JsonNode> balls = innings.get(innings.size() - 1);
    if (balls.isEmpty()) {
      return Optional.empty();
    }
    JsonNode last = balls.get(balls.size() - 1);
    return last.isObject() ? Optional.of(toBall(last)) : Optional.empty();
  }

  static Ball toBall(JsonNode ball) {
    return new Ball(
        JsonFields.firstSetText(ball, "strikerParticipantId"),
        JsonFields.firstSetText(ball, "strikerShortName", "striker"),
        JsonFields.firstSetText(ball, "nonStrikerParticipantId"),
        JsonFields.firstSetText(ball, "nonStrikerShortName", "nonStriker"),
        JsonFields.firstSetText(ball, "bowlerParticipantId"),
        JsonFields.firstSetText(ball, "bowlerShortName", "bowler"),
        JsonFields.firstSetText(ball, "ballTime"),
        ball);
  }
}
