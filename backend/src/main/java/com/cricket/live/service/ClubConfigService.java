package com.cricket.live.service;

import com.cricket.live.model.ClubConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

@Service
public class ClubConfigService {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClubConfigService.class);

  private final ObjectMapper objectMapper;
  private final String configuredPath;
  private final Resource bundledConfig;

  public ClubConfigService(
      ObjectMapper objectMapper,
      @Value("${cricket.club-config.path:}") String configuredPath,
      @Value("${cricket.club-config.bundled:classpath:config.json}") Resource bundledConfig) {
    this.objectMapper = objectMapper;
    this.configuredPath = configuredPath;
    this.bundledConfig = bundledConfig;
  }

  public ClubConfig loadConfig() {
    ClubConfig config = readConfiguredFile().orElseGet(ClubConfig::new);
    if (!config.isComplete()) {
      readBundled().ifPresent(config::fillMissingFrom);
    }
    LOGGER.debug(
        "Club config resolved organisationId={} seasonId={} clubName={}",
        config.getOrganisationId(),
        config.getSeasonId(),
        config.getClubName());
    return config;
  }

  private Optional<ClubConfig> readConfiguredFile() {
    Path path = resolvePath(configuredPath);
    if (path == null) {
      LOGGER.debug("CLUB_CONFIG not set, skipping file load");
      return Optional.empty();
    }
    if (!Files.exists(path)) {
      LOGGER.warn("CLUB_CONFIG file not found at {}", path);
      return Optional.empty();
    }
    try (InputStream input = Files.newInputStream(path)) {
      return Optional.of(objectMapper.readValue(input, ClubConfig.class));
    } catch (IOException ex) {
      LOGGER.warn("Failed to read CLUB_CONFIG file {}", path, ex);
      return Optional.empty();
    }
  }

  // Relative paths resolve against the directory the service was started from.
  static Path resolvePath(String configuredPath) {
    if (configuredPath == null || configuredPath.isBlank()) {
      return null;
    }
    return Paths.get(configuredPath.trim()).toAbsolutePath().normalize();
  }

  private Optional<ClubConfig> readBundled() {
    if (bundledConfig == null || !bundledConfig.exists()) {
      return Optional.empty();
    }
    try (InputStream input = bundledConfig.getInputStream()) {
      return Optional.of(objectMapper.readValue(input, ClubConfig.class));
    } catch (IOException ex) {
      LOGGER.warn("Could not read bundled club config {}", bundledConfig.getDescription(), ex);
      return Optional.empty();
    }
  }
}
