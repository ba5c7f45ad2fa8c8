package org.fpbase.client.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class LookupFamilyTest {

  @Test
  void fluorophoreKeysAreOnlyLowerCased() {
    assertEquals("alexa fluor 488", LookupFamily.FLUOROPHORE.normalize("Alexa Fluor 488"));
    assertEquals("mscarlet", LookupFamily.FLUOROPHORE.normalize("mScarlet"));
  }

  @Test
  void spectrumOwnerKeysReplaceSpacesAndSlashes() {
    assertEquals("chroma-et525-50m", LookupFamily.FILTER.normalize("Chroma ET525/50m"));
    assertEquals("semrock-ff01-520-35", LookupFamily.FILTER.normalize("Semrock FF01-520/35"));
    assertEquals("andor-zyla-4.2", LookupFamily.CAMERA.normalize("Andor Zyla 4.2"));
  }

  @Test
  void normalizationIsIdempotent() {
    for (LookupFamily family : LookupFamily.values()) {
      String once = family.normalize("Chroma ET525/50m");
      assertEquals(once, family.normalize(once));
    }
  }

  @Test
  void categoriesMatchListingCodes() {
    assertNull(LookupFamily.FLUOROPHORE.spectrumCategory());
    assertEquals("F", LookupFamily.FILTER.spectrumCategory());
    assertEquals("C", LookupFamily.CAMERA.spectrumCategory());
    assertEquals("L", LookupFamily.LIGHT.spectrumCategory());
  }
}
