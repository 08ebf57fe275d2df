package com.cricket.live.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ClubConfig {
  private String organisationId;
  private String seasonId;
  private String clubName;
  private String logoPath;

  public ClubConfig() {}

  public String getOrganisationId() {
    return organisationId;
  }

  public void setOrganisationId(String organisationId) {
    this.organisationId = organisationId;
  }

  public String getSeasonId() {
    return seasonId;
  }

  public void setSeasonId(String seasonId) {
    this.seasonId = seasonId;
  }

  public String getClubName() {
    return clubName;
  }

  public void setClubName(String clubName) {
    this.clubName = clubName;
  }

  public String getLogoPath() {
    return logoPath;
  }

  public void setLogoPath(String logoPath) {
    this.logoPath = logoPath;
  }

  @JsonIgnore
  public boolean isComplete() {
    return isSet(organisationId) && isSet(seasonId) && isSet(clubName) && isSet(logoPath);
  }

  public void fillMissingFrom(ClubConfig other) {
    if (!isSet(organisationId)) {
      organisationId = other.organisationId;
    }
    if (!isSet(seasonId)) {
      seasonId = other.seasonId;
    }
    if (!isSet(clubName)) {
      clubName = other.clubName;
    }
    if (!isSet(logoPath)) {
      logoPath = other.logoPath;
    }
  }

  private static boolean isSet(String value) {
    return value != null && !value.isEmpty();
  }
}
