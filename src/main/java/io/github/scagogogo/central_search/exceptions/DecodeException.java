package io.github.scagogogo.central_search.exceptions;

/** Thrown when a response payload is not valid JSON or lacks its header or body. */
public class DecodeException extends SearchClientException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
