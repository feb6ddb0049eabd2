package io.intellixity.vellum.jobs;

/** Thrown by a job body to ask for another attempt with a fresh session. */
public class RetryJobException extends RuntimeException {
  public RetryJobException(String message) {
    super(message);
  }

  public RetryJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
