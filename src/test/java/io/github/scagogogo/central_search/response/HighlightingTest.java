package io.github.scagogogo.central_search.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Highlighting Tests")
class HighlightingTest {

  private Highlighting highlighting;

  @BeforeEach
  void setUp() {
    Map<String, Map<String, List<String>>> raw = new LinkedHashMap<>();
    raw.put("org.junit:junit:4.13.2", Map.of("fch", List.of("<em>org.junit</em>.Assert")));
    raw.put("org.junit:junit:4.12", Map.of("fch", List.of()));
    raw.put("junit:junit:4.11", Map.of("text", List.of("<em>junit</em>")));
    highlighting = new Highlighting(raw);
  }

  @Test
  void shouldLookUpFragmentsByDocumentAndField() {
    assertThat(highlighting.fragments("org.junit:junit:4.13.2", "fch"))
        .containsExactly("<em>org.junit</em>.Assert");
    assertThat(highlighting.fragments("org.junit:junit:4.13.2", "text")).isEmpty();
    assertThat(highlighting.fragments("unknown", "fch")).isEmpty();
  }

  @Test
  void shouldLookUpByDocumentKey() {
    Version doc =
        new Version("junit:junit:4.11", "junit", "junit", "4.11", "jar", 0L, null, null);

    assertThat(highlighting.forDocument(doc)).containsOnlyKeys("text");
  }

  @Test
  void shouldCollectOneFieldAcrossDocumentsSkippingEmptyLists() {
    assertThat(highlighting.fieldFragments("fch"))
        .containsOnlyKeys("org.junit:junit:4.13.2")
        .containsEntry("org.junit:junit:4.13.2", List.of("<em>org.junit</em>.Assert"));
  }

  @Test
  void shouldKeepServiceOrderOfDocuments() {
    assertThat(highlighting.documentIds())
        .containsExactly("org.junit:junit:4.13.2", "org.junit:junit:4.12", "junit:junit:4.11");
  }

  @Test
  void shouldBeImmutable() {
    assertThatThrownBy(() -> highlighting.forDocumentId("junit:junit:4.11").put("x", List.of()))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldTreatNullAsEmpty() {
    Highlighting empty = new Highlighting(null);

    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.fieldFragments("fch")).isEmpty();
  }
}
