package com.cricket.live.service;

import com.cricket.live.model.MatchSummary;
import com.cricket.live.model.Team;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MatchSelector {
  private static final Logger LOGGER = LoggerFactory.getLogger(MatchSelector.class);
  static final String UPCOMING = "UPCOMING";

  private static final Comparator<MatchSummary> MOST_RECENT_START_FIRST =
      Comparator.comparing(
              MatchSummary::getScheduledStart, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
          .reversed();

  public List<MatchSummary> summarize(JsonNode matches) {
    List<MatchSummary> summaries = new ArrayList<>();
    if (matches == null || !matches.isArray()) {
      return summaries;
    }
    for (JsonNode match : matches) {
      summaries.add(summarizeEntry(match));
    }
    return summaries;
  }

  public Optional<MatchSummary> selectCandidate(List<MatchSummary> matches, String teamId) {
    List<MatchSummary> teamMatches =
        matches.stream().filter(match -> match.involves(teamId)).toList();
    if (teamMatches.isEmpty()) {
      return Optional.empty();
    }
    List<MatchSummary> notUpcoming =
        teamMatches.stream().filter(match -> !UPCOMING.equals(match.getStatus())).toList();
    List<MatchSummary> candidates =
        new ArrayList<>(notUpcoming.isEmpty() ? teamMatches : notUpcoming);
    candidates.sort(MOST_RECENT_START_FIRST);
    MatchSummary chosen = candidates.get(0);
    LOGGER.info(
        "Selected match id={} status={} for team={} out of {} candidates",
        chosen.getId(),
        chosen.getStatus(),
        teamId,
        candidates.size());
    return Optional.of(chosen);
  }

  private MatchSummary summarizeEntry(JsonNode match) {
    if (!match.isObject()) {
      return new MatchSummary(null, List.of(), null, null, match);
    }
    List<Team> teams = new ArrayList<>();
    JsonNode teamsNode = match.path("teams");
    if (teamsNode.isArray()) {
      for (JsonNode team : teamsNode) {
        teams.add(new Team(JsonFields.text(team.path("id")), JsonFields.text(team.path("name"))));
      }
    }
    String start = JsonFields.text(match.path("matchSchedule").path(0).path("startDateTime"));
    return new MatchSummary(
        JsonFields.text(match.path("id")),
        teams,
        JsonFields.text(match.path("status")),
        parseStart(start),
        match);
  }

  static Instant parseStart(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value.trim(), OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime) {
        return ((OffsetDateTime) parsed).toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      try {
        return LocalDate.parse(value.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException dateOnlyEx) {
        LOGGER.debug("Unreadable schedule start '{}', sorting it last", value);
        return null;
      }
    }
  }
}
