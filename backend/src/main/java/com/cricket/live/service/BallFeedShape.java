package com.cricket.live.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

enum BallFeedShape {
  // [{balls: [...]}, ...]
  INNINGS_LIST {
    @Override
    List<List<JsonNode>> innings(JsonNode body) {
      return ballsPerInnings(body);
    }
  },
  // [ball, ball, ...] read as a single innings
  FLAT_BALL_LIST {
    @Override
    List<List<JsonNode>> innings(JsonNode body) {
      return List.of(elements(body));
    }
  },
  // {innings: [{balls: [...]}, ...]}
  WRAPPED_INNINGS {
    @Override
    List<List<JsonNode>> innings(JsonNode body) {
      return ballsPerInnings(body.path("innings"));
    }
  },
  // {balls: [...]} read as a single innings
  WRAPPED_BALLS {
    @Override
    List<List<JsonNode>> innings(JsonNode body) {
      return List.of(elements(body.path("balls")));
    }
  },
  UNRECOGNISED {
    @Override
    List<List<JsonNode>> innings(JsonNode body) {
      return List.of();
    }
  };

  abstract List<List<JsonNode>> innings(JsonNode body);

  static BallFeedShape classify(JsonNode body) {
    if (body == null) {
      return UNRECOGNISED;
    }
    if (body.isArray()) {
      boolean firstHoldsBalls = body.size() > 0 && JsonFields.isSet(body.get(0).path("balls"));
      return firstHoldsBalls ? INNINGS_LIST : FLAT_BALL_LIST;
    }
    if (body.isObject()) {
      if (body.path("innings").isArray()) {
        return WRAPPED_INNINGS;
      }
      if (body.path("balls").isArray()) {
        return WRAPPED_BALLS;
      }
    }
    return UNRECOGNISED;
  }

  private static List<List<JsonNode>> ballsPerInnings(JsonNode inningsArray) {
    List<List<JsonNode>> innings = new ArrayList<>();
    for (JsonNode entry : inningsArray) {
      innings.add(elements(entry.path("balls")));
    }
    return innings;
  }

  private static List<JsonNode> elements(JsonNode array) {
    List<JsonNode> items = new ArrayList<>();
    if (array.isArray()) {
      array.forEach(items::add);
    }
    return items;
  }
}
