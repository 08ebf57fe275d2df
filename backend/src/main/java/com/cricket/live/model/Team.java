package com.cricket.live.model;

public final class Team {
  private final String id;
  private final String name;

  public Team(String id, String name) {
    this.id = id;
    this.name = name;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }
}
