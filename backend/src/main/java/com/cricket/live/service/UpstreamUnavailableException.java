package com.cricket.live.service;

public class UpstreamUnavailableException extends UpstreamException {
  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
