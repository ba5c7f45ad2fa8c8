package org.fpbase.client.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed representation of CLI arguments: the help and verbose switches plus positional arguments.
 *
 * <p>Unrecognized {@code --} options are logged and dropped. Positional arguments keep their inner whitespace so names such as {@code "Alexa Fluor 488"} survive intact.</p>
 */
public final class CliInput {
  private static final Logger log = LoggerFactory.getLogger(CliInput.class);
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] positional;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] positional, boolean help, boolean verbose) {
    this.positional = positional;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into switches and positional arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false);
    }

    List<String> positional = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower) && positional.isEmpty()) {
        help = true;
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        continue;
      }
      if (arg.startsWith("--")) {
        log.warn("Ignoring unknown flag {}", arg);
        continue;
      }
      positional.add(arg);
    }
    return new CliInput(positional.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns a defensive copy of the positional arguments; the first is the command.
   *
   * @return copy of positional arguments
   */
  public String[] positional() {
    return Arrays.copyOf(positional, positional.length);
  }

  /**
   * Indicates whether a help flag was supplied before the command.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return verbose;
  }
}
