package com.cricket.live.controller;

import com.cricket.live.model.ClubConfig;
import com.cricket.live.service.ClubConfigService;
import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@CrossOrigin(origins = "${cricket.cors.allowed-origins:*}")
public class ClubController {
  private final ClubConfigService clubConfigService;

  public ClubController(ClubConfigService clubConfigService) {
    this.clubConfigService = clubConfigService;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    return Map.of(
        "status", "ok",
        "uptime", uptimeSeconds,
        "timestamp", Instant.now().toEpochMilli());
  }

  @GetMapping("/config")
  public ClubConfig config() {
    return clubConfigService.loadConfig();
  }
}
