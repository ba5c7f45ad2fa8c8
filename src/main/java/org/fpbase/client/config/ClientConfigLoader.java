package org.fpbase.client.config;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Builds {@link ClientConfig} from an optional YAML file plus JVM system properties.
 * <p><strong>Why:</strong> Library users and the CLI share one resolution order without code changes.</p>
 * <p><strong>Precedence:</strong> defaults, then the YAML {@code client} section, then system properties
 * ({@code fpbase.endpoint}, {@code fpbase.userAgent}, {@code fpbase.connectTimeoutMillis},
 * {@code fpbase.requestTimeoutMillis}, {@code fpbase.metrics.exporter}).</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ClientConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ClientConfigLoader.class);

  /** System property naming a YAML configuration file. */
  public static final String CONFIG_PROPERTY = "fpbase.config";
  /** Environment variable naming a YAML configuration file. */
  public static final String CONFIG_ENV = "FPBASE_CONFIG";

  static final String SECTION = "client";
  static final String KEY_ENDPOINT = "endpoint";
  static final String KEY_USER_AGENT = "userAgent";
  static final String KEY_CONNECT_TIMEOUT = "connectTimeoutMillis";
  static final String KEY_REQUEST_TIMEOUT = "requestTimeoutMillis";
  static final String KEY_METRICS_EXPORTER = "metrics.exporter";
  private static final String PROPERTY_PREFIX = "fpbase.";

  private ClientConfigLoader() {}

  /**
   * Resolves configuration from {@code fpbase.config} or {@code FPBASE_CONFIG} when set, else from defaults and
   * system properties only.
   *
   * @return resolved configuration
   * @throws IllegalArgumentException when a source holds an invalid value
   * @throws IllegalStateException when the named file cannot be read
   */
  public static ClientConfig loadDefault() {
    String location = firstNonBlank(System.getProperty(CONFIG_PROPERTY), System.getenv(CONFIG_ENV));
    try {
      return location == null
          ? resolve(Map.of(), System.getProperties())
          : load(Path.of(location));
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to read FPbase client config at " + location, ex);
    }
  }

  /**
   * Loads configuration from a YAML file, then applies system property overrides.
   *
   * @param path YAML file; a missing file contributes nothing
   * @return resolved configuration
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or holds an invalid value
   */
  public static ClientConfig load(Path path) throws IOException {
    return load(path, System.getProperties());
  }

  static ClientConfig load(Path path, Properties overrides) throws IOException {
    Objects.requireNonNull(path, "path");
    return resolve(readSection(path), overrides);
  }

  static ClientConfig resolve(Map<String, String> fileValues, Properties overrides) {
    Map<String, String> merged = new LinkedHashMap<>(fileValues);
    for (String key : new String[] {
        KEY_ENDPOINT, KEY_USER_AGENT, KEY_CONNECT_TIMEOUT, KEY_REQUEST_TIMEOUT, KEY_METRICS_EXPORTER}) {
      String value = overrides.getProperty(PROPERTY_PREFIX + key);
      if (value != null && !value.isBlank()) {
        merged.put(key, value.trim());
      }
    }
    ClientConfig defaults = ClientConfig.defaults();
    ClientConfig config = new ClientConfig(
        uri(merged.get(KEY_ENDPOINT), defaults.endpoint()),
        text(merged.get(KEY_USER_AGENT), defaults.userAgent()),
        millis(KEY_CONNECT_TIMEOUT, merged.get(KEY_CONNECT_TIMEOUT), defaults.connectTimeout()),
        millis(KEY_REQUEST_TIMEOUT, merged.get(KEY_REQUEST_TIMEOUT), defaults.requestTimeout()),
        text(merged.get(KEY_METRICS_EXPORTER), defaults.metricsExporter()));
    log.debug("Resolved FPbase client config: endpoint={} exporter={}", config.endpoint(), config.metricsExporter());
    return config;
  }

  static Map<String, String> readSection(Path path) throws IOException {
    if (!Files.exists(path)) {
      log.debug("No FPbase client config at {}; using defaults", path);
      return Map.of();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, Object> root = asMap(document, "root");
      Object section = findSection(root, SECTION);
      if (section == null) {
        return Map.of();
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(section, SECTION), "", flattened);
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static URI uri(String raw, URI fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return new URI(raw.trim());
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("endpoint must be a valid URI", ex);
    }
  }

  private static String text(String raw, String fallback) {
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static Duration millis(String key, String raw, Duration fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Duration.ofMillis(Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer number of milliseconds", ex);
    }
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }
}
