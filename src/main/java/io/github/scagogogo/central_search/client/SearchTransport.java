package io.github.scagogogo.central_search.client;

import io.github.scagogogo.central_search.exceptions.TransportException;

/**
 * Sends an encoded parameter string to the search endpoint and returns the raw payload.
 *
 * <p>Implementations own connection handling, retries and timeouts. The request builder and the
 * response decoder never call the network themselves.
 */
public interface SearchTransport {

  /**
   * Executes one search call.
   *
   * @param encodedParams output of {@code SearchRequest.toRequestParams()}
   * @return raw response body
   * @throws TransportException if no successful response could be obtained
   */
  String fetch(String encodedParams);
}
