package com.codeheadsystems.pqsession.server.store;

/**
 * The durable session backend could not be reached. Writes fail closed when this is raised.
 */
public class StorageBackendUnavailableException extends RuntimeException {

  public StorageBackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
