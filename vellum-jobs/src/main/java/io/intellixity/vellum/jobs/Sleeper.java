package io.intellixity.vellum.jobs;

import java.time.Duration;

/** Pause between retries; replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return d -> Thread.sleep(d.toMillis());
  }
}
