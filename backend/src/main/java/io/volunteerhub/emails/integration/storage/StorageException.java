package io.volunteerhub.emails.integration.storage;

/** An object storage call failed. */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
