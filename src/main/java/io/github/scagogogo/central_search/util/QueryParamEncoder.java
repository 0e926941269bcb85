package io.github.scagogogo.central_search.util;

import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;

/**
 * Percent-encodes parameter values for the search endpoint's query string.
 *
 * <p>Behaves like {@code application/x-www-form-urlencoded} encoding (space becomes {@code +})
 * except that {@code :} and {@code *} stay literal, so field clauses such as {@code g:org.apache}
 * and the match-all clause {@code *:*} remain readable on the wire.
 */
public final class QueryParamEncoder {

  private static final Escaper VALUE_ESCAPER = new PercentEscaper("-_.*:", true);

  private QueryParamEncoder() {}

  /**
   * Encodes a single parameter value.
   *
   * @param value raw value, may be null
   * @return encoded value, or an empty string for null
   */
  public static String encode(String value) {
    if (value == null) {
      return "";
    }
    return VALUE_ESCAPER.escape(value);
  }
}
