package org.fpbase.client.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.fpbase.client.application.client.FpbaseClient;
import org.fpbase.client.application.port.TransportException;
import org.fpbase.client.application.resolve.NotFoundException;
import org.fpbase.client.application.schema.JsonSupport;
import org.fpbase.client.application.schema.ValidationException;
import org.fpbase.client.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code fpbase} command dispatcher: looks up catalog entities by name and prints them.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: fpbase <fluorophore|protein|dye|filter|camera|light|microscope|list|query> [args] [--verbose]";
  private static final String LIST_USAGE =
      "usage: fpbase list <fluorophores|proteins|dyes|filters|cameras|lights|microscopes>";
  private static final String HELP_TEXT = """
      FPbase catalog client

      Usage:
        fpbase <command> [args]

      Commands:
        fluorophore NAME   Dye or protein by name, slug, or protein id
        protein NAME       Protein by name, slug, or id
        dye NAME           Dye by name or slug
        filter NAME        Filter by name (e.g. "Chroma ET525/50m")
        camera NAME        Camera by name
        light NAME         Light source by name
        microscope ID      Microscope by id (see: list microscopes)
        list KIND          fluorophores|proteins|dyes|filters|cameras|lights|microscopes
        query GRAPHQL      Run a raw GraphQL query and print its data as JSON

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging

      Configuration:
        -Dfpbase.config=PATH or FPBASE_CONFIG=PATH selects a YAML file with a 'client:' section.
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a command against the shared client and returns its exit code without terminating the JVM.
   *
   * @param args command followed by its arguments
   * @return exit code
   */
  public static ExitCode run(String[] args) {
    return run(args, FpbaseClient::instance);
  }

  static ExitCode run(String[] args, Supplier<FpbaseClient> clientSupplier) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    String[] positional = input.positional();
    if (positional.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = positional[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(positional, 1, positional.length);
    if (!isKnown(command)) {
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (rest.length == 0) {
      log.error("Command '{}' requires an argument", command);
      CliPrinter.println(command.equals("list") ? LIST_USAGE : SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String argument = String.join(" ", rest);

    FpbaseClient client;
    try {
      client = clientSupplier.get();
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Invalid FPbase client configuration: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }

    try {
      return execute(client, command, argument);
    } catch (NotFoundException ex) {
      log.warn(ex.getMessage());
      CliPrinter.println(ex.getMessage());
      return ExitCode.NOT_FOUND;
    } catch (TransportException ex) {
      log.error("FPbase request failed: {}", ex.getMessage(), ex);
      return ExitCode.TRANSPORT_ERROR;
    } catch (ValidationException ex) {
      log.error("FPbase returned an unexpected payload: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Command '{}' failed", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      flushMetrics(client);
    }
  }

  private static void flushMetrics(FpbaseClient client) {
    try {
      client.flushMetrics();
    } catch (RuntimeException ex) {
      log.warn("Failed to flush metrics: {}", ex.getMessage(), ex);
    }
  }

  private static ExitCode execute(FpbaseClient client, String command, String argument) {
    switch (command) {
      case "fluorophore" -> CliPrinter.printLines(EntityFormatter.fluorophore(client.getFluorophore(argument)));
      case "protein" -> CliPrinter.printLines(EntityFormatter.fluorophore(client.getProtein(argument)));
      case "dye" -> CliPrinter.printLines(EntityFormatter.fluorophore(client.getDye(argument)));
      case "filter" -> CliPrinter.printLines(EntityFormatter.owner(client.getFilter(argument)));
      case "camera" -> CliPrinter.printLines(EntityFormatter.owner(client.getCamera(argument)));
      case "light" -> CliPrinter.printLines(EntityFormatter.owner(client.getLight(argument)));
      case "microscope" -> CliPrinter.printLines(EntityFormatter.microscope(client.getMicroscope(argument)));
      case "query" -> {
        Map<String, Object> data = client.query(argument, Map.of());
        CliPrinter.println(new String(new JsonSupport().write(data), StandardCharsets.UTF_8));
      }
      case "list" -> {
        List<String> names = list(client, argument.toLowerCase(Locale.ROOT));
        if (names == null) {
          log.error("Unknown list kind: {}", argument);
          CliPrinter.println(LIST_USAGE);
          return ExitCode.INVALID_ARGS;
        }
        CliPrinter.printLines(names);
      }
      default -> throw new IllegalStateException("Unhandled command " + command);
    }
    return ExitCode.SUCCESS;
  }

  private static List<String> list(FpbaseClient client, String kind) {
    return switch (kind) {
      case "fluorophores" -> client.listFluorophores();
      case "proteins" -> client.listProteins();
      case "dyes" -> client.listDyes();
      case "filters" -> client.listFilters();
      case "cameras" -> client.listCameras();
      case "lights" -> client.listLights();
      case "microscopes" -> client.listMicroscopes();
      default -> null;
    };
  }

  private static boolean isKnown(String command) {
    return switch (command) {
      case "fluorophore", "protein", "dye", "filter", "camera", "light", "microscope", "list", "query" -> true;
      default -> false;
    };
  }
}
