package org.frcmap.locate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Normalizer Tests")
class NormalizerTest {
   private final Normalizer normalizer = Normalizer.getInstance();

   @Test
   @DisplayName("Accents and case are ignored")
   void testAccentAndCaseInsensitive() {
      assertEquals("SAO PAULO", normalizer.normalize("São Paulo"));
      assertEquals("SAO PAULO", normalizer.normalize("SAO PAULO"));
      assertEquals("SAO PAULO", normalizer.normalize("sao paulo"));
      assertEquals("CEKMEKOY", normalizer.normalize("Çekmeköy"));
      assertEquals("MONTREAL", normalizer.normalize("Montréal"));
   }

   @Test
   @DisplayName("Null and empty input normalize to the empty string")
   void testMissingInput() {
      assertEquals("", normalizer.normalize(null));
      assertEquals("", normalizer.normalize(""));
      assertEquals("", normalizer.normalize("   "));
   }

   @Test
   @DisplayName("Surrounding spaces are trimmed, inner spaces kept")
   void testTrim() {
      assertEquals("NEW YORK", normalizer.normalize("  New York "));
   }

   @Test
   @DisplayName("Characters without an ASCII base letter are dropped")
   void testNonAsciiDropped() {
      assertEquals("", normalizer.normalize("חיפה"));
      assertEquals("TAIPEI", normalizer.normalize("Taipei 臺北市"));
   }

   @Test
   @DisplayName("Normalizing twice gives the same result")
   void testIdempotent() {
      String[] samples = {"São Paulo", " Zürich ", "Lee's Summit", "Noord-Brabant", "Ñuñoa", "", "臺北市 Taipei"};
      for (String sample : samples) {
         String once = normalizer.normalize(sample);
         assertEquals(once, normalizer.normalize(once), sample);
      }
   }

   @Test
   @DisplayName("Postal codes are only uppercased")
   void testPostalCode() {
      assertEquals("K1A 0B1", normalizer.normalizePostalCode("k1a 0b1"));
      assertEquals("", normalizer.normalizePostalCode(null));
      assertEquals(" 12345", normalizer.normalizePostalCode(" 12345"));
   }
}
