package io.github.scagogogo.central_search.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Query Tests")
class QueryTest {

  @Nested
  @DisplayName("Rendering")
  class Rendering {

    @Test
    @DisplayName("Should render match-all when nothing is set")
    void shouldRenderMatchAllForEmptyQuery() {
      assertEquals("*:*", new Query().render());
    }

    @Test
    @DisplayName("Should render a single clause for a single field")
    void shouldRenderSingleClause() {
      assertEquals("g:org.apache.commons", new Query().setGroupId("org.apache.commons").render());
    }

    @Test
    @DisplayName("Should join all field clauses with AND in a fixed order")
    void shouldRenderAllFieldsInOrder() {
      Query query =
          new Query()
              .setClassifier("sources")
              .setPackaging("jar")
              .setFullyQualifiedClassName("org.junit.Assert")
              .setClassName("Assert")
              .setSha1("35379fb6")
              .setTags("testing")
              .setVersion("4.13.2")
              .setArtifactId("junit")
              .setGroupId("junit");

      assertEquals(
          "g:junit AND a:junit AND v:4.13.2 AND tags:testing AND 1:35379fb6 AND c:Assert"
              + " AND fc:org.junit.Assert AND p:jar AND l:sources",
          query.render());
    }

    @Test
    @DisplayName("Should skip empty and null fields")
    void shouldSkipEmptyFields() {
      Query query = new Query().setGroupId("").setArtifactId("guava").setVersion(null);

      assertEquals("a:guava", query.render());
    }

    @Test
    @DisplayName("Should fall back to match-all when every field is empty")
    void shouldRenderMatchAllWhenAllFieldsEmpty() {
      Query query = new Query().setGroupId("").setArtifactId("").setPackaging("");

      assertEquals("*:*", query.render());
    }

    @Test
    @DisplayName("Should use custom query verbatim and ignore field clauses")
    void shouldPreferCustomQuery() {
      Query query = new Query().setGroupId("junit").setCustomQuery("d:junit:junit");

      assertEquals("d:junit:junit", query.render());
    }

    @Test
    @DisplayName("Should ignore an empty custom query")
    void shouldIgnoreEmptyCustomQuery() {
      Query query = new Query().setGroupId("junit").setCustomQuery("");

      assertEquals("g:junit", query.render());
    }

    @Test
    @DisplayName("Should render identically on repeated calls")
    void shouldBePure() {
      Query query = new Query().setGroupId("junit").setArtifactId("junit");

      assertEquals(query.render(), query.render());
      assertEquals("g:junit AND a:junit", query.render());
    }

    @Test
    @DisplayName("Should not escape query grammar metacharacters")
    void shouldNotEscapeGrammarMetacharacters() {
      assertEquals("a:spring-*", new Query().setArtifactId("spring-*").render());
    }
  }

  @Nested
  @DisplayName("Parameter Encoding")
  class ParameterEncoding {

    @Test
    @DisplayName("Should keep match-all readable")
    void shouldEncodeMatchAll() {
      assertEquals("*:*", new Query().toRequestParamValue());
    }

    @Test
    @DisplayName("Should encode spaces between clauses")
    void shouldEncodeSpaces() {
      Query query = new Query().setGroupId("org.apache.commons").setArtifactId("commons-io");

      assertEquals("g:org.apache.commons+AND+a:commons-io", query.toRequestParamValue());
    }

    @Test
    @DisplayName("Should percent-encode URL delimiters inside values")
    void shouldEncodeDelimiters() {
      assertEquals("c:A%26B", new Query().setClassName("A&B").toRequestParamValue());
    }
  }

  @Test
  @DisplayName("Setters should return the same instance")
  void settersShouldChain() {
    Query query = new Query();

    assertSame(query, query.setGroupId("g").setArtifactId("a").setCustomQuery(""));
    assertFalse(query.render().isEmpty());
  }
}
