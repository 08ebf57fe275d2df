package com.cricket.live.service;

public class EnrichmentException extends RuntimeException {
  public EnrichmentException(String message) {
    super(message);
  }
}
