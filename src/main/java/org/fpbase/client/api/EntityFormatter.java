package org.fpbase.client.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.fpbase.client.domain.model.Camera;
import org.fpbase.client.domain.model.Filter;
import org.fpbase.client.domain.model.FilterPlacement;
import org.fpbase.client.domain.model.Fluorophore;
import org.fpbase.client.domain.model.LightSource;
import org.fpbase.client.domain.model.Microscope;
import org.fpbase.client.domain.model.OpticalConfig;
import org.fpbase.client.domain.model.Protein;
import org.fpbase.client.domain.model.Spectrum;
import org.fpbase.client.domain.model.SpectrumOwner;
import org.fpbase.client.domain.model.State;

/**
 * Renders domain records as indented plain-text lines for the CLI.
 */
final class EntityFormatter {
  private static final String INDENT = "  ";

  private EntityFormatter() {}

  static List<String> fluorophore(Fluorophore fluorophore) {
    List<String> lines = new ArrayList<>();
    lines.add(fluorophore.type().name().toLowerCase(Locale.ROOT) + " " + fluorophore.name()
        + " (id " + fluorophore.id() + ")");
    if (fluorophore instanceof Protein protein) {
      protein.findPrimaryReference().ifPresent(ref -> lines.add(INDENT + "reference: " + ref.url()));
      if (protein.agg() != null) {
        lines.add(INDENT + "oligomerization: " + protein.agg().code());
      }
      if (protein.switchType() != null) {
        lines.add(INDENT + "switch type: " + protein.switchType().code());
      }
    }
    String defaultId = fluorophore.findDefaultState().map(State::id).orElse(null);
    for (State state : fluorophore.states()) {
      String marker = state.id().equals(defaultId) ? " [default]" : "";
      lines.add(INDENT + "state " + state.name() + marker
          + ": ex " + number(state.exMax()) + " nm, em " + number(state.emMax()) + " nm"
          + ", EC " + number(state.extCoeff()) + ", QY " + number(state.qy()));
      for (Spectrum spectrum : state.spectra()) {
        lines.add(INDENT + INDENT + spectrum(spectrum));
      }
    }
    return lines;
  }

  static List<String> owner(SpectrumOwner owner) {
    List<String> lines = new ArrayList<>();
    lines.add(kind(owner) + " " + owner.name() + " (id " + owner.id() + ")");
    String manufacturer = manufacturer(owner);
    if (!manufacturer.isEmpty()) {
      lines.add(INDENT + "manufacturer: " + manufacturer);
    }
    if (owner instanceof Filter filter && filter.bandCenter() != null) {
      lines.add(INDENT + "band: " + number(filter.bandCenter()) + "/" + number(filter.bandWidth()));
    }
    lines.add(INDENT + spectrum(owner.spectrum()));
    return lines;
  }

  static List<String> microscope(Microscope microscope) {
    List<String> lines = new ArrayList<>();
    lines.add("microscope " + microscope.name() + " (id " + microscope.id() + ")");
    for (OpticalConfig config : microscope.opticalConfigs()) {
      lines.add(INDENT + "config " + config.name());
      for (FilterPlacement placement : config.filters()) {
        lines.add(INDENT + INDENT + placement.path().name() + " " + placement.filter().name()
            + (placement.reflects() ? " (reflects)" : ""));
      }
      config.findCamera().ifPresent(camera -> lines.add(INDENT + INDENT + "camera " + camera.name()));
      config.findLight().ifPresent(light -> lines.add(INDENT + INDENT + "light " + light.name()));
      if (config.laser() != null) {
        lines.add(INDENT + INDENT + "laser " + config.laser() + " nm");
      }
    }
    return lines;
  }

  private static String spectrum(Spectrum spectrum) {
    return "spectrum " + spectrum.id() + " " + spectrum.subtype().code() + " (" + spectrum.data().size() + " points)";
  }

  private static String kind(SpectrumOwner owner) {
    if (owner instanceof Filter) {
      return "filter";
    }
    if (owner instanceof Camera) {
      return "camera";
    }
    return owner instanceof LightSource ? "light" : "owner";
  }

  private static String manufacturer(SpectrumOwner owner) {
    if (owner instanceof Filter filter) {
      return filter.manufacturer();
    }
    if (owner instanceof Camera camera) {
      return camera.manufacturer();
    }
    return owner instanceof LightSource light ? light.manufacturer() : "";
  }

  private static String number(Double value) {
    if (value == null) {
      return "-";
    }
    return value == Math.rint(value) ? Long.toString(value.longValue()) : value.toString();
  }
}
