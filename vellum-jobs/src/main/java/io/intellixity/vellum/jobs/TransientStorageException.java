package io.intellixity.vellum.jobs;

/** Lock wait timeout or deadlock reported by the datastore. Retried by the executor. */
public class TransientStorageException extends RuntimeException {
  public TransientStorageException(String message) {
    super(message);
  }

  public TransientStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
