package com.cricket.live.service;

import com.cricket.live.model.BattingFigure;
import com.cricket.live.model.BowlingFigure;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ScorecardSchema {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScorecardSchema.class);

  static final FieldAlias BATTING_RUNS = new FieldAlias("runsScored", "runs");
  static final FieldAlias BATTING_BALLS = new FieldAlias("ballsFaced", "balls");
  static final FieldAlias BOWLING_OVERS = new FieldAlias("oversBowled", "overs");
  static final FieldAlias BOWLING_MAIDENS = new FieldAlias("maidensBowled", "maidens");
  static final FieldAlias BOWLING_RUNS = new FieldAlias("runsConceded", "runs");
  static final FieldAlias BOWLING_WICKETS = new FieldAlias("wicketsTaken", "wickets");
  static final FieldAlias BOWLING_NO_BALLS = new FieldAlias("noBalls");
  static final FieldAlias BOWLING_WIDES = new FieldAlias("wideBalls", "wides");
  static final FieldAlias BOWLING_ECONOMY = new FieldAlias("economy");
  static final FieldAlias BOWLING_ACTIVE = new FieldAlias("isBowling");

  private ScorecardSchema() {}

  enum ParticipantIdLocator {
    FLAT {
      @Override
      JsonNode idOf(JsonNode entry) {
        return entry.path("participantId");
      }
    },
    NESTED {
      @Override
      JsonNode idOf(JsonNode entry) {
        return entry.path("participant").path("id");
      }
    };

    abstract JsonNode idOf(JsonNode entry);

    // Decided from the first entry that carries an id in either place.
    static ParticipantIdLocator detect(List<JsonNode> entries) {
      for (JsonNode entry : entries) {
        if (!JsonFields.isAbsent(FLAT.idOf(entry))) {
          return FLAT;
        }
        if (!JsonFields.isAbsent(NESTED.idOf(entry))) {
          return NESTED;
        }
      }
      return FLAT;
    }
  }

  static final class FieldAlias {
    private final String[] names;

    FieldAlias(String... names) {
      this.names = names;
    }

    JsonNode read(JsonNode entry) {
      return JsonFields.firstPresent(entry, names);
    }

    String label() {
      return names[0];
    }
  }

  static Optional<JsonNode> findEntry(List<JsonNode> entries, String participantId) {
    if (participantId == null || entries.isEmpty()) {
      return Optional.empty();
    }
    ParticipantIdLocator locator = ParticipantIdLocator.detect(entries);
    return entries.stream()
        .filter(entry -> participantId.equals(JsonFields.text(locator.idOf(entry))))
        .findFirst();
  }

  static BattingFigure battingFigure(String participantId, JsonNode entry) {
    return new BattingFigure(
        participantId,
        figure(entry, BATTING_RUNS, JsonFields::toInteger),
        figure(entry, BATTING_BALLS, JsonFields::toInteger));
  }

  // No-balls and wides read as zero when the entry exists but does not mention them.
  static BowlingFigure bowlingFigure(String participantId, JsonNode entry) {
    Integer noBalls = figure(entry, BOWLING_NO_BALLS, JsonFields::toInteger);
    Integer wides = figure(entry, BOWLING_WIDES, JsonFields::toInteger);
    return new BowlingFigure(
        participantId,
        JsonFields.text(BOWLING_OVERS.read(entry)),
        figure(entry, BOWLING_MAIDENS, JsonFields::toInteger),
        figure(entry, BOWLING_RUNS, JsonFields::toInteger),
        figure(entry, BOWLING_WICKETS, JsonFields::toInteger),
        noBalls == null ? 0 : noBalls,
        wides == null ? 0 : wides,
        figure(entry, BOWLING_ECONOMY, JsonFields::toDouble),
        figure(entry, BOWLING_ACTIVE, JsonFields::toBoolean));
  }

  // A value that does not convert blanks that one figure and leaves the rest of the entry intact.
  private static <T> T figure(
      JsonNode entry, FieldAlias alias, BiFunction<JsonNode, String, T> converter) {
    JsonNode value = alias.read(entry);
    try {
      return converter.apply(value, alias.label());
    } catch (EnrichmentException ex) {
      LOGGER.debug("Ignoring {} value {}: {}", alias.label(), value, ex.getMessage());
      return null;
    }
  }
}
