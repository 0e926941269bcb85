package io.github.scagogogo.central_search.response;

import static io.github.scagogogo.central_search.Constants.EMPHASIS_CLOSE;
import static io.github.scagogogo.central_search.Constants.EMPHASIS_OPEN;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the {@code <em>}/{@code </em>} emphasis markers in highlighted fragments.
 *
 * <p>Markers are treated as a fixed literal pair. Nested or unbalanced markers are not a supported
 * shape and give unspecified results.
 */
public final class HighlightMarkers {

  private HighlightMarkers() {}

  /**
   * Removes every opening and closing marker.
   *
   * <pre>
   * strip("&lt;em&gt;org&lt;/em&gt;.junit.Assert") = "org.junit.Assert"
   * </pre>
   */
  public static String strip(String fragment) {
    if (fragment == null) {
      return null;
    }
    return fragment.replace(EMPHASIS_OPEN, "").replace(EMPHASIS_CLOSE, "");
  }

  /**
   * Returns the emphasized texts, left to right. An opening marker without a matching closing
   * marker ends the scan.
   */
  public static List<String> emphasizedTerms(String fragment) {
    List<String> terms = new ArrayList<>();
    if (fragment == null) {
      return terms;
    }
    int from = 0;
    while (true) {
      int open = fragment.indexOf(EMPHASIS_OPEN, from);
      if (open < 0) {
        break;
      }
      int textStart = open + EMPHASIS_OPEN.length();
      int close = fragment.indexOf(EMPHASIS_CLOSE, textStart);
      if (close < 0) {
        break;
      }
      terms.add(fragment.substring(textStart, close));
      from = close + EMPHASIS_CLOSE.length();
    }
    return terms;
  }
}
