package io.github.scagogogo.central_search.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class QueryParamEncoderTest {

  @Test
  void keepsClauseSyntaxReadable() {
    assertEquals("*:*", QueryParamEncoder.encode("*:*"));
    assertEquals("g:org.apache.commons", QueryParamEncoder.encode("g:org.apache.commons"));
    assertEquals("a:commons-lang3", QueryParamEncoder.encode("a:commons-lang3"));
  }

  @Test
  void encodesSpacesAsPlus() {
    assertEquals("g:junit+AND+a:junit", QueryParamEncoder.encode("g:junit AND a:junit"));
    assertEquals("timestamp+desc", QueryParamEncoder.encode("timestamp desc"));
  }

  @Test
  void encodesParameterDelimiters() {
    assertEquals("a%26b%3Dc%2Bd%23e", QueryParamEncoder.encode("a&b=c+d#e"));
  }

  @Test
  void encodesNonAsciiAsUtf8() {
    assertEquals("%C3%A9", QueryParamEncoder.encode("é"));
  }

  @Test
  void nullBecomesEmpty() {
    assertEquals("", QueryParamEncoder.encode(null));
  }
}
