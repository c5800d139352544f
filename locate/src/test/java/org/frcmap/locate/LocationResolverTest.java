package org.frcmap.locate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocationResolver Tests")
class LocationResolverTest {
   private final List<String> unresolved = new ArrayList<String>();
   private LocationResolver resolver;

   private final UnresolvedPlaceHandler collector = new UnresolvedPlaceHandler() {
      @Override
      public void placeNotFound(String key, String placeName) {
         unresolved.add(key + "|" + placeName);
      }
   };

   @BeforeEach
   void setUp() throws IOException {
      resolver = new LocationResolver(GazetteerFixtures.gazetteer(), CorrectionRules.getDefault(false), collector, 3);
   }

   @Test
   @DisplayName("Raw fields are normalized into a record")
   void testPrepare() {
      LocationRecord record = resolver.prepare("USA", " Pennsylvania", "Warminster ", "18974-1234", "frc100");
      assertEquals("frc100", record.getKey());
      assertEquals("US", record.getCountryCode());
      assertEquals("PENNSYLVANIA", record.getDivision());
      assertEquals("WARMINSTER", record.getCity());
      assertEquals("18974-1234", record.getPostalCode());

      LocationRecord empty = resolver.prepare(null, null, null, null, null);
      assertEquals("", empty.getCountryCode());
      assertEquals(", , ", empty.getPlaceName());
   }

   @Test
   @DisplayName("Warminster resolves through the corrected city name")
   void testWarminsterEndToEnd() {
      LocationRecord record = resolver.prepare("USA", "PA", "Warminster", "18974", "frc100");
      ResolveResult result = resolver.resolveDetailed(record);

      assertEquals(Tier.CITY, result.getTier());
      assertEquals(new Coordinate(40.198, -75.085), result.getCoordinate());
      assertEquals("WARMINSTER HEIGHTS, PA 18974, US", result.getPlaceName());
      assertTrue(unresolved.isEmpty());
   }

   @Test
   @DisplayName("Postal match wins over a city match")
   void testPostalBeforeCity() {
      ResolveResult result = resolver.locate("USA", "New Hampshire", "Manchester", "03101", "frc1");

      assertEquals(Tier.POSTAL, result.getTier());
      assertEquals(new Coordinate(42.992, -71.463), result.getCoordinate());
   }

   @Test
   @DisplayName("City lookup is used when the postal code is unknown")
   void testCityFallback() {
      ResolveResult result = resolver.locate("USA", "New Hampshire", "Manchester", "03999", "frc2");

      assertEquals(Tier.CITY, result.getTier());
      assertEquals(new Coordinate(42.996, -71.455), result.getCoordinate());
   }

   @Test
   @DisplayName("Accented team fields match the ASCII gazetteer names")
   void testAccentedFields() {
      ResolveResult result = resolver.locate("Brazil", "São Paulo", "São Paulo", "", "frc1156");

      assertEquals(Tier.CITY, result.getTier());
      assertEquals(new Coordinate(-23.547, -46.636), result.getCoordinate());
   }

   @Test
   @DisplayName("Manual locations are used when both automatic lookups miss")
   void testManualFallback() {
      ResolveResult result = resolver.locate("USA", "DC", "Washington", "20001", "frc1418");

      assertEquals(Tier.MANUAL, result.getTier());
      assertEquals(new Coordinate(38.895, -77.036), result.getCoordinate());
      assertTrue(unresolved.isEmpty());
   }

   @Test
   @DisplayName("Unknown places resolve to (0, 0) and are reported once")
   void testUnresolved() {
      LocationRecord record = new LocationRecord("frc9999", "ZZ", "NOWHERE", "GHOST TOWN", "00000");
      Coordinate coordinate = resolver.resolve(record);

      assertEquals(0.0, coordinate.getLatitude(), 0.0);
      assertEquals(0.0, coordinate.getLongitude(), 0.0);
      assertEquals(1, unresolved.size());
      assertEquals("frc9999|GHOST TOWN, NOWHERE 00000, ZZ", unresolved.get(0));
   }

   @Test
   @DisplayName("A manual row with a NaN coordinate is ignored instead of failing resolution")
   void testNonFiniteManualRow() throws IOException {
      Gazetteer gazetteer = GazetteerFixtures.builder()
            .readManualLocations(new StringReader("X, Y , ZZ|NaN|1.0\n"))
            .build();
      LocationResolver nanResolver = new LocationResolver(gazetteer, CorrectionRules.getDefault(false), collector, 3);

      ResolveResult result = nanResolver.resolveDetailed(new LocationRecord("k", "ZZ", "Y", "X", ""));

      assertEquals(Tier.UNRESOLVED, result.getTier());
      assertEquals(Coordinate.ORIGIN, result.getCoordinate());
      assertEquals(1, unresolved.size());
   }

   @Test
   @DisplayName("Records with every field missing still get a coordinate")
   void testAllFieldsMissing() {
      ResolveResult result = resolver.locate(null, null, null, null, null);

      assertEquals(Tier.UNRESOLVED, result.getTier());
      assertFalse(result.isResolved());
      assertEquals(Coordinate.ORIGIN, result.getCoordinate());
      assertEquals(1, unresolved.size());

      Coordinate coordinate = resolver.resolve(new LocationRecord());
      assertEquals(Coordinate.ORIGIN, coordinate);
      assertEquals(2, unresolved.size());
   }

   @Test
   @DisplayName("Canadian postal codes are looked up by their first three characters")
   void testCanadaPostal() {
      ResolveResult result = resolver.locate("Canada", "Ontario", "Ottawa", "k1a0b1", "frc188");

      assertEquals(Tier.POSTAL, result.getTier());
      assertEquals(new Coordinate(45.421, -75.7), result.getCoordinate());
   }

   @Test
   @DisplayName("Israeli teams resolve by alternate city name whatever their district")
   void testIsraelAlternateName() {
      ResolveResult result = resolver.locate("Israel", "Northern District", "Hefa", "", "frc1690");

      assertEquals(Tier.CITY, result.getTier());
      assertEquals("HEFA, IL , IL", result.getPlaceName());
      assertEquals(new Coordinate(32.818, 34.989), result.getCoordinate());
   }

   @Test
   @DisplayName("Taiwanese teams resolve with the city as division")
   void testTaiwan() {
      ResolveResult result = resolver.locate("Chinese Taipei", "Hsinchu Municipality", "Hsinchu", "", "frc7130");

      assertEquals(Tier.CITY, result.getTier());
      assertEquals(new Coordinate(24.804, 120.969), result.getCoordinate());
   }

   @Test
   @DisplayName("Swedish postal codes resolve after the space is inserted")
   void testSwedenPostal() {
      ResolveResult result = resolver.locate("Sweden", "Stockholm", "Farsta", "12345", "frc2056");

      assertEquals(Tier.POSTAL, result.getTier());
      assertEquals(new Coordinate(59.244, 18.091), result.getCoordinate());
   }

   @Test
   @DisplayName("Japanese postal codes only match the dashed gazetteer key with the dash option")
   void testJapanOption() throws IOException {
      ResolveResult plain = resolver.locate("Japan", "Tokyo", "Chiyoda", "1000001", "frc3000");
      assertEquals(Tier.UNRESOLVED, plain.getTier());

      LocationResolver dashing = new LocationResolver(GazetteerFixtures.gazetteer(), CorrectionRules.getDefault(true), collector, 3);
      ResolveResult dashed = dashing.locate("Japan", "Tokyo", "Chiyoda", "1000001", "frc3000");
      assertEquals(Tier.POSTAL, dashed.getTier());
      assertEquals(new Coordinate(35.684, 139.756), dashed.getCoordinate());
   }

   @Test
   @DisplayName("Rounding happens only on the returned coordinate")
   void testRoundingAtOutput() throws IOException {
      Gazetteer gazetteer = new GazetteerBuilder()
            .readCountryInfo(new StringReader("US\tUSA\t840\tUS\tUnited States\n"))
            .readPostalCodes(new StringReader("US\t12345\tX\tX\tX\t\t\t\t\t10.12345678\t-20.98765432\t4\n"))
            .build();
      assertEquals(new Coordinate(10.12345678, -20.98765432), gazetteer.postal("US", "12345"));

      LocationResolver coarse = new LocationResolver(gazetteer, CorrectionRules.getDefault(false), collector, 3);
      assertEquals(new Coordinate(10.123, -20.988), coarse.locate("United States", "", "", "12345", "frc1").getCoordinate());

      LocationResolver fine = new LocationResolver(gazetteer, CorrectionRules.getDefault(false), collector, 5);
      assertEquals(new Coordinate(10.12346, -20.98765), fine.locate("United States", "", "", "12345", "frc1").getCoordinate());
   }

   @Test
   @DisplayName("A resolver works without an unresolved place handler")
   void testNoHandler() throws IOException {
      LocationResolver quiet = new LocationResolver(GazetteerFixtures.gazetteer(), CorrectionRules.getDefault(false), null, 3);
      assertEquals(Coordinate.ORIGIN, quiet.resolve(new LocationRecord("frc1", "ZZ", "", "", "")));
   }

   @Test
   @DisplayName("Constructor rejects missing collaborators and negative scale")
   void testConstructorValidation() throws IOException {
      Gazetteer gazetteer = GazetteerFixtures.gazetteer();
      assertThrows(NullPointerException.class, () -> new LocationResolver(null, CorrectionRules.getDefault(false), null, 3));
      assertThrows(NullPointerException.class, () -> new LocationResolver(gazetteer, (CorrectionRules) null, null, 3));
      assertThrows(IllegalArgumentException.class, () -> new LocationResolver(gazetteer, CorrectionRules.getDefault(false), null, -1));
   }
}
