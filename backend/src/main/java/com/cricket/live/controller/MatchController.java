package com.cricket.live.controller;

import com.cricket.live.service.CurrentMatchService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@CrossOrigin(origins = "${cricket.cors.allowed-origins:*}")
public class MatchController {
  private static final Logger LOGGER = LoggerFactory.getLogger(MatchController.class);

  private final CurrentMatchService currentMatchService;

  public MatchController(CurrentMatchService currentMatchService) {
    this.currentMatchService = currentMatchService;
  }

  @GetMapping("/api/matches")
  public ResponseEntity<?> matches(
      @RequestParam(name = "gradeId", required = false) String gradeId,
      @RequestParam(name = "teamId", required = false) String teamId) {
    LOGGER.info("Received /api/matches gradeId={} teamId={}", gradeId, teamId);
    if (gradeId == null || gradeId.isBlank()) {
      return ResponseEntity.badRequest().body(Map.of("error", "Missing gradeId parameter"));
    }
    try {
      return ResponseEntity.ok(currentMatchService.currentMatches(gradeId, teamId));
    } catch (RuntimeException ex) {
      LOGGER.warn("Match lookup failed for gradeId={} teamId={}", gradeId, teamId, ex);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(Map.of("error", String.valueOf(ex.getMessage())));
    }
  }
}
