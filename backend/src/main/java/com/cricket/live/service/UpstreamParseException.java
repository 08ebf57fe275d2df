package com.cricket.live.service;

public class UpstreamParseException extends UpstreamException {
  public UpstreamParseException(String message) {
    super(message);
  }

  public UpstreamParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
