package io.github.scagogogo.central_search.exceptions;

import lombok.Getter;

/**
 * Thrown by a transport when the search endpoint could not be reached or answered with an error
 * status.
 */
@Getter
public class TransportException extends SearchClientException {

  /** Status used when no HTTP response was received. */
  public static final int NO_STATUS = -1;

  private final int httpStatus;

  public TransportException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public TransportException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }
}
