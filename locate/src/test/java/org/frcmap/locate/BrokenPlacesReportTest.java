package org.frcmap.locate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("BrokenPlacesReport Tests")
class BrokenPlacesReportTest {

   @TempDir
   File tempDir;

   @Test
   @DisplayName("Opening the report clears places left from an earlier run")
   void testClearedOnOpen() throws IOException {
      File file = new File(tempDir, "broken_places");
      Files.write(file.toPath(), Arrays.asList("OLD, PLACE 1, ZZ|frc1"), StandardCharsets.UTF_8);

      BrokenPlacesReport report = new BrokenPlacesReport(file);
      report.close();

      assertEquals(Collections.emptyList(), Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
   }

   @Test
   @DisplayName("Each unresolved place is appended as one line")
   void testAppend() throws IOException {
      File file = new File(tempDir, "broken_places");
      BrokenPlacesReport report = new BrokenPlacesReport(file);
      report.placeNotFound("frc9999", "GHOST TOWN, NOWHERE 00000, ZZ");
      report.placeNotFound("frc9998", ", , ");
      assertEquals(2, report.getCount());
      report.close();

      assertEquals(Arrays.asList("GHOST TOWN, NOWHERE 00000, ZZ|frc9999", ", , |frc9998"),
                   Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
   }

   @Test
   @DisplayName("Resolver failures reach the report")
   void testResolverWritesReport() throws IOException {
      File file = new File(tempDir, "broken_places");
      BrokenPlacesReport report = new BrokenPlacesReport(file);
      LocationResolver resolver = new LocationResolver(GazetteerFixtures.gazetteer(), CorrectionRules.getDefault(false), report, 3);

      resolver.locate("Atlantis", "Deep", "Sunken City", "", "frc404");
      resolver.locate("USA", "New Hampshire", "Manchester", "03101", "frc405");
      report.close();

      assertEquals(Arrays.asList("SUNKEN CITY, DEEP , |frc404"), Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
   }
}
