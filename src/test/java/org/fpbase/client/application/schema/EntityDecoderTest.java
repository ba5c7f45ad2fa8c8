package org.fpbase.client.application.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.fpbase.client.domain.model.Filter;
import org.fpbase.client.domain.model.Protein;
import org.fpbase.client.domain.model.Spectrum;
import org.fpbase.client.domain.model.SpectrumPoint;
import org.fpbase.client.domain.model.SpectrumType;
import org.fpbase.client.domain.model.SwitchType;
import org.fpbase.client.testutil.Fixtures;
import org.junit.jupiter.api.Test;

class EntityDecoderTest {
  private final EntityDecoder decoder = new EntityDecoder();

  @Test
  void decodesProteinFixture() {
    Protein protein = decoder.decodeProtein(Fixtures.bytes("protein-R9NL8.json"));

    assertEquals("R9NL8", protein.id());
    assertEquals(SwitchType.BASIC, protein.switchType());
    assertEquals("31", protein.defaultState().id());
    assertEquals(SpectrumType.A_2P, protein.defaultState().spectra().get(2).subtype());
  }

  @Test
  void unknownSubtypeNamesFullPath() {
    String body = """
        {"data": {"protein": {"id": "X", "name": "Bad", "states": [
          {"id": 1, "name": "s", "spectra": [
            {"id": 1, "subtype": "EX", "data": []},
            {"id": 2, "subtype": "XX", "data": []}
          ]}
        ]}}}
        """;

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeProtein(bytes(body)));

    assertEquals("data.protein.states[0].spectra[1].subtype", ex.path());
    assertTrue(ex.getMessage().startsWith("data.protein.states[0].spectra[1].subtype: expected one of ["),
        ex.getMessage());
    assertTrue(ex.getMessage().endsWith("but was 'XX'"), ex.getMessage());
  }

  @Test
  void missingRequiredFieldIsReported() {
    String body = "{\"data\": {\"microscope\": {\"id\": \"m1\", \"opticalConfigs\": []}}}";

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeMicroscope(bytes(body)));

    assertEquals("data.microscope.name", ex.path());
    assertTrue(ex.getMessage().contains("required field is missing"));
  }

  @Test
  void wrongTypeIsReported() {
    String body = "{\"data\": {\"microscope\": {\"id\": \"m1\", \"name\": 42}}}";

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeMicroscope(bytes(body)));

    assertEquals("data.microscope.name", ex.path());
    assertTrue(ex.getMessage().contains("expected a string"), ex.getMessage());
  }

  @Test
  void nullEntityIsReported() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> decoder.decodeMicroscope(bytes("{\"data\": {\"microscope\": null}}")));
    assertEquals("data.microscope", ex.path());
  }

  @Test
  void spectrumOwnerIsDecoded() {
    Spectrum spectrum = decoder.decodeSpectrum(Fixtures.bytes("spectrum-101.json"));

    Filter filter = assertInstanceOf(Filter.class, spectrum.findOwner().orElseThrow());
    assertEquals("Chroma ET525/50m", filter.name());
    assertEquals(3, spectrum.data().size());
    assertEquals(525.0, spectrum.data().get(1).wavelength());
  }

  @Test
  void multipleOwnersAreRejected() {
    String body = """
        {"data": {"spectrum": {"id": 1, "subtype": "BP", "data": [],
          "ownerFilter": {"id": 1, "name": "f", "spectrum": {"id": 1, "subtype": "BP", "data": []}},
          "ownerCamera": {"id": 2, "name": "c", "spectrum": {"id": 1, "subtype": "QE", "data": []}},
          "ownerLight": null}}}
        """;

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeSpectrum(bytes(body)));
    assertEquals("data.spectrum", ex.path());
  }

  @Test
  void malformedDataPointIsRejected() {
    String body = "{\"data\": {\"spectrum\": {\"id\": 1, \"subtype\": \"EM\", \"data\": [[500]]}}}";

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeSpectrum(bytes(body)));
    assertEquals("data.spectrum.data[0]", ex.path());
  }

  @Test
  void spectrumListingSkipsOwnerlessRows() {
    List<ListingItem> rows = decoder.decodeSpectrumListing(Fixtures.bytes("filter-listing.json"));

    assertEquals(2, rows.size());
    assertEquals(new ListingItem("101", "Chroma ET525/50m", null), rows.get(0));
  }

  @Test
  void listingWithNullFieldIsEmpty() {
    assertTrue(decoder.decodeListing(bytes("{\"data\": {\"microscopes\": null}}"), "microscopes").isEmpty());
  }

  @Test
  void listingWithoutFieldIsRejected() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> decoder.decodeListing(bytes("{\"data\": {}}"), "microscopes"));
    assertEquals("data.microscopes", ex.path());
  }

  @Test
  void graphQlErrorsSurfaceFirstMessage() {
    String body = "{\"data\": null, \"errors\": [{\"message\": \"boom\"}, {\"message\": \"second\"}]}";

    ValidationException ex = assertThrows(ValidationException.class, () -> decoder.decodeData(bytes(body)));
    assertEquals("data: GraphQL error: boom", ex.getMessage());
  }

  @Test
  void dyeWithoutDefaultStateFallsBackToFirstState() {
    String body = """
        {"data": {"dye": {"id": 9, "name": "Two", "states": [
          {"id": 1, "name": "a"}, {"id": 2, "name": "b"}]}}}
        """;

    assertEquals("1", decoder.decodeDye(bytes(body)).defaultState().id());
  }

  @Test
  void dyeWithoutStatesOrExMaxHasNoDefault() {
    String body = "{\"data\": {\"dye\": {\"id\": 9, \"name\": \"Empty\", \"states\": null}}}";

    assertNull(decoder.decodeDye(bytes(body)).defaultState());
  }

  @Test
  void spectralPairsSurviveDecodeAndReserialize() {
    String body = """
        {"data": {"spectrum": {"id": 7, "subtype": "EM", "data": [
          [500.123456789012, 0.30000000000000004],
          [1e-5, 123456789.125],
          [400, 1.7976931348623157E308]
        ]}}}
        """;
    JsonSupport json = new JsonSupport();

    Spectrum spectrum = decoder.decodeSpectrum(bytes(body));
    List<List<Double>> pairs = new ArrayList<>();
    for (SpectrumPoint point : spectrum.data()) {
      pairs.add(List.of(point.wavelength(), point.value()));
    }
    Object reparsed = json.parse(json.write(pairs));

    List<List<Double>> expected = List.of(
        List.of(500.123456789012, 0.30000000000000004),
        List.of(1e-5, 123456789.125),
        List.of(400.0, 1.7976931348623157E308));
    assertEquals(expected, reparsed);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
