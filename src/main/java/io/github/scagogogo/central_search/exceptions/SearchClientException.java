package io.github.scagogogo.central_search.exceptions;

/**
 * Umbrella exception for all search client errors.
 *
 * <p>Callers can catch this single type, or one of its subclasses to tell a malformed response
 * ({@link DecodeException}) from a failed exchange ({@link TransportException}).
 */
public class SearchClientException extends RuntimeException {

  public SearchClientException(String message) {
    super(message);
  }

  public SearchClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
