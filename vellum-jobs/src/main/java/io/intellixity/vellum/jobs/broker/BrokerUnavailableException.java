package io.intellixity.vellum.jobs.broker;

/** The queue broker could not be reached or is still loading. */
public class BrokerUnavailableException extends RuntimeException {
  public BrokerUnavailableException(String message) {
    super(message);
  }

  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
