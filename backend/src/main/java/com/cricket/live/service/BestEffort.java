package com.cricket.live.service;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class BestEffort {
  private static final Logger LOGGER = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {}

  static <T> Optional<T> attempt(String step, Supplier<Optional<T>> action) {
    try {
      Optional<T> result = action.get();
      return result == null ? Optional.empty() : result;
    } catch (RuntimeException ex) {
      LOGGER.warn("{} failed, continuing without it: {}", step, ex.getMessage(), ex);
      return Optional.empty();
    }
  }

  static <T> T attemptOr(String step, Supplier<T> action, T fallback) {
    return BestEffort.<T>attempt(step, () -> Optional.ofNullable(action.get())).orElse(fallback);
  }
}
