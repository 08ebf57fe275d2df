package com.cricket.live.service;

import com.cricket.live.model.Ball;
import com.cricket.live.model.CurrentPlayers;
import com.cricket.live.model.MatchSnapshot;
import com.cricket.live.model.MatchSummary;
import com.cricket.live.model.Scorecard;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CurrentMatchService {
  private static final Logger LOGGER = LoggerFactory.getLogger(CurrentMatchService.class);

  private final GrassrootsApiClient apiClient;
  private final GrassrootsEndpoints endpoints;
  private final MatchSelector matchSelector;
  private final ScorecardFetcher scorecardFetcher;
  private final BallFeedResolver ballFeedResolver;
  private final PlayerStatsEnricher playerStatsEnricher;
  private final TeamOversAnnotator teamOversAnnotator;
  private final ObjectMapper objectMapper;

  public CurrentMatchService(
      GrassrootsApiClient apiClient,
      GrassrootsEndpoints endpoints,
      MatchSelector matchSelector,
      ScorecardFetcher scorecardFetcher,
      BallFeedResolver ballFeedResolver,
      PlayerStatsEnricher playerStatsEnricher,
      TeamOversAnnotator teamOversAnnotator,
      ObjectMapper objectMapper) {
    this.apiClient = apiClient;
    this.endpoints = endpoints;
    this.matchSelector = matchSelector;
    this.scorecardFetcher = scorecardFetcher;
    this.ballFeedResolver = ballFeedResolver;
    this.playerStatsEnricher = playerStatsEnricher;
    this.teamOversAnnotator = teamOversAnnotator;
    this.objectMapper = objectMapper;
  }

  public ObjectNode currentMatches(String gradeId, String teamId) {
    JsonNode body = apiClient.fetchJson(endpoints.matchesForGrade(gradeId));
    JsonNode matches = body.path("matches");

    ObjectNode response = objectMapper.createObjectNode();
    if (teamId == null || teamId.isBlank()) {
      response.set("matches", matches.isArray() ? matches : objectMapper.createArrayNode());
      return response;
    }

    ArrayNode result = response.putArray("matches");
    Optional<MatchSummary> chosen =
        matchSelector.selectCandidate(matchSelector.summarize(matches), teamId);
    if (chosen.isEmpty()) {
      LOGGER.info("No matches for team={} in grade={}", teamId, gradeId);
      return response;
    }
    result.add(render(enrich(chosen.get())));
    return response;
  }

  MatchSnapshot enrich(MatchSummary match) {
    MatchSnapshot snapshot = MatchSnapshot.of(match);
    String matchId = match.getId();
    if (matchId == null) {
      LOGGER.warn("Chosen match has no id, skipping scorecard and ball feed");
      return teamOversAnnotator.annotateOvers(snapshot);
    }

    snapshot = snapshot.withScorecard(scorecardFetcher.fetchDetail(matchId));
    Optional<Ball> lastBall = ballFeedResolver.fetchLastBall(matchId);
    if (lastBall.isPresent()) {
      Scorecard detail = snapshot.getScorecard().orElse(null);
      CurrentPlayers players = playerStatsEnricher.buildCurrentPlayers(lastBall.get(), detail);
      snapshot = snapshot.withLastBall(lastBall.get(), players);
    } else {
      LOGGER.info("No last ball resolved for match {}", matchId);
    }
    return teamOversAnnotator.annotateOvers(snapshot);
  }

  ObjectNode render(MatchSnapshot snapshot) {
    JsonNode raw = snapshot.getMatch().getRaw();
    ObjectNode match = raw.isObject() ? ((ObjectNode) raw).deepCopy() : objectMapper.createObjectNode();

    JsonNode teams = match.path("teams");
    for (JsonNode team : teams) {
      if (!team.isObject()) {
        continue;
      }
      String teamId = JsonFields.text(team.path("id"));
      String overs =
          teamId == null
              ? TeamOversAnnotator.NO_OVERS
              : snapshot.getOversByTeamId().getOrDefault(teamId, TeamOversAnnotator.NO_OVERS);
      ((ObjectNode) team).put("oversBowled", overs);
    }

    match.set(
        "detail", snapshot.getScorecard().map(Scorecard::getRaw).orElse(NullNode.getInstance()));
    match.set("lastBall", snapshot.getLastBall().map(Ball::getRaw).orElse(NullNode.getInstance()));
    match.set(
        "currentPlayers",
        snapshot
            .getCurrentPlayers()
            .<JsonNode>map(objectMapper::valueToTree)
            .orElse(NullNode.getInstance()));
    return match;
  }
}
