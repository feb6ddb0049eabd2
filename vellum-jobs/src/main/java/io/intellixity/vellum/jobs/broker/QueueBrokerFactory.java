package io.intellixity.vellum.jobs.broker;

/** Opens a broker connection; one attempt per call. */
@FunctionalInterface
public interface QueueBrokerFactory {
  QueueBroker connect();
}
