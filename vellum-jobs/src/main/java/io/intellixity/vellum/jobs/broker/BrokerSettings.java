package io.intellixity.vellum.jobs.broker;

import java.time.Duration;
import java.util.Objects;

/** Fixed-wait retry for opening the broker connection. */
public record BrokerSettings(int connectAttempts, Duration retryWait) {
  public BrokerSettings {
    if (connectAttempts <= 0) throw new IllegalArgumentException("connectAttempts must be > 0");
    Objects.requireNonNull(retryWait, "retryWait");
    if (retryWait.isNegative()) throw new IllegalArgumentException("retryWait must be >= 0");
  }

  public static BrokerSettings defaults() {
    return new BrokerSettings(10, Duration.ofSeconds(1));
  }
}
