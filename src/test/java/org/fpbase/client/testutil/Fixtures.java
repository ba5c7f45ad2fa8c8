package org.fpbase.client.testutil;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads JSON response bodies from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {
  private Fixtures() {}

  public static byte[] bytes(String name) {
    String resource = "/fixtures/" + name;
    try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture " + resource);
      }
      return in.readAllBytes();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read fixture " + resource, ex);
    }
  }

  public static byte[] json(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
