package org.fpbase.client.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClientConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void missingFileYieldsDefaults() throws IOException {
    ClientConfig config = ClientConfigLoader.load(tempDir.resolve("absent.yaml"), new Properties());

    assertEquals(ClientConfig.defaults(), config);
    assertEquals(URI.create("https://www.fpbase.org/graphql/"), config.endpoint());
    assertEquals("fpbase-java", config.userAgent());
    assertEquals(Duration.ofSeconds(10), config.connectTimeout());
    assertEquals(Duration.ofSeconds(30), config.requestTimeout());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void yamlClientSectionIsApplied() throws IOException {
    Path file = tempDir.resolve("fpbase.yaml");
    Files.writeString(file, """
        client:
          endpoint: http://localhost:8000/graphql/
          userAgent: lab-scripts/1.0
          connectTimeoutMillis: 2500
          requestTimeoutMillis: 60000
          metrics:
            exporter: OTLP
        other:
          ignored: true
        """);

    ClientConfig config = ClientConfigLoader.load(file, new Properties());

    assertEquals(URI.create("http://localhost:8000/graphql/"), config.endpoint());
    assertEquals("lab-scripts/1.0", config.userAgent());
    assertEquals(Duration.ofMillis(2500), config.connectTimeout());
    assertEquals(Duration.ofMinutes(1), config.requestTimeout());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.metricsEnabled());
  }

  @Test
  void systemPropertiesOverrideYaml() throws IOException {
    Path file = tempDir.resolve("fpbase.yaml");
    Files.writeString(file, "client:\n  userAgent: from-file\n  requestTimeoutMillis: 1000\n");
    Properties overrides = new Properties();
    overrides.setProperty("fpbase.userAgent", "from-property");
    overrides.setProperty("fpbase.endpoint", "https://staging.fpbase.test/graphql/");

    ClientConfig config = ClientConfigLoader.load(file, overrides);

    assertEquals("from-property", config.userAgent());
    assertEquals("staging.fpbase.test", config.endpoint().getHost());
    assertEquals(Duration.ofSeconds(1), config.requestTimeout());
  }

  @Test
  void fileWithoutClientSectionYieldsDefaults() throws IOException {
    Path file = tempDir.resolve("fpbase.yaml");
    Files.writeString(file, "server:\n  port: 1\n");

    assertEquals(ClientConfig.defaults(), ClientConfigLoader.load(file, new Properties()));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ClientConfigLoader.resolve(Map.of("connectTimeoutMillis", "soon"), new Properties()));
    assertThrows(IllegalArgumentException.class,
        () -> ClientConfigLoader.resolve(Map.of("requestTimeoutMillis", "0"), new Properties()));
    assertThrows(IllegalArgumentException.class,
        () -> ClientConfigLoader.resolve(Map.of("endpoint", "ftp://fpbase.org/"), new Properties()));
    assertThrows(IllegalArgumentException.class,
        () -> ClientConfigLoader.resolve(Map.of("metrics.exporter", "prometheus"), new Properties()));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path file = tempDir.resolve("broken.yaml");
    Files.writeString(file, "client: [unterminated\n");

    assertThrows(IllegalArgumentException.class, () -> ClientConfigLoader.load(file, new Properties()));
  }

  @Test
  void yamlArraysAreRejected() throws IOException {
    Path file = tempDir.resolve("arrays.yaml");
    Files.writeString(file, "client:\n  endpoint:\n    - a\n    - b\n");

    assertThrows(IllegalArgumentException.class, () -> ClientConfigLoader.load(file, new Properties()));
  }
}
