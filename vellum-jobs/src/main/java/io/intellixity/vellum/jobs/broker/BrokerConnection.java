package io.intellixity.vellum.jobs.broker;

import io.intellixity.vellum.jobs.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Process-wide, lazily opened broker connection.\n
 *
 * The first {@link #get()} connects, retrying {@link BrokerUnavailableException} with a fixed wait
 * up to {@link BrokerSettings#connectAttempts()} times; the last failure is rethrown. Later calls
 * return the same broker until {@link #close()}.
 */
public final class BrokerConnection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BrokerConnection.class);

  private final QueueBrokerFactory factory;
  private final BrokerSettings settings;
  private final Sleeper sleeper;

  private QueueBroker broker;

  public BrokerConnection(QueueBrokerFactory factory, BrokerSettings settings, Sleeper sleeper) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public BrokerConnection(QueueBrokerFactory factory) {
    this(factory, BrokerSettings.defaults(), Sleeper.system());
  }

  public synchronized QueueBroker get() {
    if (broker != null) return broker;
    BrokerUnavailableException last = null;
    for (int attempt = 1; attempt <= settings.connectAttempts(); attempt++) {
      try {
        broker = Objects.requireNonNull(factory.connect(), "QueueBrokerFactory returned null");
        if (attempt > 1) log.info("vellum.jobs.broker connected attempt={}", attempt);
        return broker;
      } catch (BrokerUnavailableException e) {
        last = e;
        log.warn("vellum.jobs.broker unavailable attempt={}/{}: {}", attempt, settings.connectAttempts(), e.getMessage());
        if (attempt < settings.connectAttempts()) pause();
      }
    }
    throw last;
  }

  public synchronized boolean isConnected() { return broker != null; }

  @Override
  public synchronized void close() {
    if (broker == null) return;
    try {
      broker.close();
    } finally {
      broker = null;
    }
  }

  private void pause() {
    try {
      sleeper.sleep(settings.retryWait());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerUnavailableException("Interrupted while connecting to the queue broker", e);
    }
  }
}
