package io.intellixity.vellum.jobs;

/** A job body failed with a non-retryable error, or ran out of retries. */
public final class JobFailedException extends RuntimeException {
  private final String method;

  public JobFailedException(String method, Throwable cause) {
    super("Job failed: " + method, cause);
    this.method = method;
  }

  public JobFailedException(String method, String message) {
    super(message);
    this.method = method;
  }

  public String method() { return method; }
}
