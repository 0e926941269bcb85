package io.github.scagogogo.central_search.util;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public class FixtureLoader {

  /**
   * Loads a response fixture from test resources as a string.
   *
   * @param resourcePath path relative to src/test/resources
   * @return the raw payload
   * @throws IOException if the file cannot be read
   * @throws AssertionError if the file is not found
   */
  public static String loadFixture(String resourcePath) throws IOException {
    InputStream inputStream =
        FixtureLoader.class.getClassLoader().getResourceAsStream(resourcePath);

    assertNotNull(inputStream, "Test file not found: " + resourcePath);

    try {
      return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
    } finally {
      inputStream.close();
    }
  }
}
