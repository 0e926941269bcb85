package io.github.scagogogo.central_search.response;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class HighlightMarkersTest {

  private static final String FRAGMENT =
      "<em>org</em>.<em>specs</em>.<em>runner</em>.<em>JUnit</em>";

  @Test
  void stripRemovesEveryMarker() {
    assertEquals("org.specs.runner.JUnit", HighlightMarkers.strip(FRAGMENT));
  }

  @Test
  void stripLeavesPlainTextUntouched() {
    assertEquals("org.junit.Assert", HighlightMarkers.strip("org.junit.Assert"));
    assertNull(HighlightMarkers.strip(null));
  }

  @Test
  void stripRemovesUnbalancedMarkersLiterally() {
    assertEquals("FileUtils", HighlightMarkers.strip("<em>FileUtils"));
  }

  @Test
  void emphasizedTermsAreReturnedLeftToRight() {
    assertEquals(
        List.of("org", "specs", "runner", "JUnit"), HighlightMarkers.emphasizedTerms(FRAGMENT));
  }

  @Test
  void emphasizedTermsStopAtUnclosedMarker() {
    assertEquals(
        List.of("commons"), HighlightMarkers.emphasizedTerms("org.<em>commons</em>.<em>io"));
    assertTrue(HighlightMarkers.emphasizedTerms("no markers").isEmpty());
    assertTrue(HighlightMarkers.emphasizedTerms(null).isEmpty());
  }
}
