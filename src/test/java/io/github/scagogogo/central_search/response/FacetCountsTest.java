package io.github.scagogogo.central_search.response;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FacetCountsTest {

  @Test
  void valueCountsPairsAlternatingEntries() {
    FacetCounts counts =
        new FacetCounts(
            Map.of("p", List.of("jar", 120, "pom", 40, "bundle", 3L)), null, null);

    assertEquals(
        List.of(new FacetValue("jar", 120), new FacetValue("pom", 40), new FacetValue("bundle", 3)),
        counts.valueCounts("p"));
  }

  @Test
  void valueCountsDropsTrailingValueWithoutCount() {
    FacetCounts counts =
        new FacetCounts(Map.of("g", List.of("org.apache", 30, "dangling")), null, null);

    assertEquals(List.of(new FacetValue("org.apache", 30)), counts.valueCounts("g"));
  }

  @Test
  void valueCountsSkipsNonNumericCounts() {
    FacetCounts counts =
        new FacetCounts(Map.of("g", Arrays.asList("a", "x", "b", 2)), null, null);

    assertEquals(List.of(new FacetValue("b", 2)), counts.valueCounts("g"));
  }

  @Test
  void missingBlocksBecomeEmptyMaps() {
    FacetCounts counts = new FacetCounts(null, null, null);

    assertTrue(counts.facetFields().isEmpty());
    assertTrue(counts.facetQueries().isEmpty());
    assertTrue(counts.facetDates().isEmpty());
    assertTrue(counts.valueCounts("g").isEmpty());
  }
}
