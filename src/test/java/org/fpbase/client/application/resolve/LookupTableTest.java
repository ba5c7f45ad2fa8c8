package org.fpbase.client.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.fpbase.client.domain.model.FluorophoreType;
import org.junit.jupiter.api.Test;

class LookupTableTest {

  @Test
  void blankAliasesAreIgnored() {
    LookupEntry entry = new LookupEntry("1", "Alexa Fluor 488", FluorophoreType.DYE);
    LookupTable table = LookupTable.builder(LookupFamily.FLUOROPHORE)
        .put("Alexa Fluor 488", entry)
        .put(null, entry)
        .put("  ", entry)
        .build();

    assertEquals(1, table.size());
    assertTrue(table.find("alexa fluor 488").isPresent());
  }

  @Test
  void displayNamesCollapseAliases() {
    LookupEntry egfp = new LookupEntry("R9NL8", "EGFP", FluorophoreType.PROTEIN);
    LookupEntry alexa = new LookupEntry("1", "Alexa Fluor 488", FluorophoreType.DYE);
    LookupTable table = LookupTable.builder(LookupFamily.FLUOROPHORE)
        .put("EGFP", egfp)
        .put("egfp", egfp)
        .put("R9NL8", egfp)
        .put("Alexa Fluor 488", alexa)
        .build();

    assertEquals(List.of("Alexa Fluor 488", "EGFP"), table.displayNames());
    assertEquals(List.of(alexa, egfp), table.distinctEntries());
  }
}
