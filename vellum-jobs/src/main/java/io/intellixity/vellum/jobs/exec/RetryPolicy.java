package io.intellixity.vellum.jobs.exec;

import java.time.Duration;

/**
 * Bounded retry of transient failures. Attempt {@code n} (zero based) is retried while
 * {@code n < maxRetries}, after a pause of {@code n + 1} seconds.
 */
public record RetryPolicy(int maxRetries) {
  public RetryPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(5);
  }

  public boolean canRetry(int attempt) {
    return attempt < maxRetries;
  }

  public Duration backoff(int attempt) {
    return Duration.ofSeconds(attempt + 1L);
  }
}
