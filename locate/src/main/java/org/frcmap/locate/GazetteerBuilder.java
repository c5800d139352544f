/*
 * Copyright 2026 The FRC Team Map Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.frcmap.locate;

import java.io.*;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Build a {@link Gazetteer} from the GeoNames dump files.
 *
 * Read the admin division names before the cities; city rows whose division has no name are dropped.
 * Rows that are too short or have unparseable coordinates are skipped.
 */
public class GazetteerBuilder {
   private static Logger logger = Logger.getLogger("org.frcmap.locate");

   private static final Pattern TAB = Pattern.compile("\t");
   private static final Pattern PIPE = Pattern.compile("\\|");

   private final Normalizer normalizer = Normalizer.getInstance();
   private final Map<String,String> countryCodes = new HashMap<String,String>();
   private final Map<String,String> extraCountryCodes = new LinkedHashMap<String,String>();
   private final Map<String,Map<String,Coordinate>> postalCodes = new HashMap<String,Map<String,Coordinate>>();
   private final Map<String,String> adminDivisions = new HashMap<String,String>();
   private final Map<CityKey,Coordinate> cities = new HashMap<CityKey,Coordinate>();
   private final Map<String,Coordinate> manualLocations = new HashMap<String,Coordinate>();

   private interface RowHandler {
      void row(String[] fields);
   }

   /**
    * Load all tables from a directory holding the extracted GeoNames files.
    * @param dataDir directory with countryInfo.txt, allCountries.txt, admin1CodesASCII.txt and cities1000.txt
    * @param manualLocationsFile place|lat|lng file; skipped if it does not exist
    */
   public static Gazetteer fromDirectory(File dataDir, File manualLocationsFile, LocatorConfig config) throws IOException {
      GazetteerBuilder builder = new GazetteerBuilder();
      builder.addCountryCodes(config.getExtraCountryCodes());

      logger.info("Loading country code mappings...");
      builder.readCountryInfo(open(new File(dataDir, config.getCountryInfoFile())));

      logger.info("Loading zip code locations...");
      builder.readPostalCodes(open(new File(dataDir, config.getPostalCodesFile())));

      logger.info("Loading administrative division names...");
      builder.readAdminDivisions(open(new File(dataDir, config.getAdminDivisionsFile())));

      logger.info("Loading city locations...");
      builder.readCities(open(new File(dataDir, config.getCitiesFile())));

      if (manualLocationsFile != null && manualLocationsFile.exists()) {
         logger.info("Loading manually cached locations...");
         builder.readManualLocations(open(manualLocationsFile));
      }
      else {
         logger.warning("Manual location file not found: " + manualLocationsFile);
      }

      Gazetteer gazetteer = builder.build();
      logger.info("Loaded " + gazetteer.getCountryCount() + " countries, " +
                  gazetteer.getPostalCodeCount() + " postal codes, " +
                  gazetteer.getCityCount() + " cities, " +
                  gazetteer.getManualLocationCount() + " manual locations");
      return gazetteer;
   }

   private static Reader open(File file) throws IOException {
      return new InputStreamReader(new FileInputStream(file), "UTF8");
   }

   // calls handler with the columns of each non-blank, non-comment line; closes the reader
   private void readRows(Reader reader, Pattern separator, RowHandler handler) throws IOException {
      BufferedReader r = new BufferedReader(reader);
      try {
         String line;
         while ((line = r.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.length() == 0 || trimmed.startsWith("#")) {
               continue;
            }
            handler.row(separator.split(line, -1));
         }
      } finally {
         r.close();
      }
   }

   private Coordinate parseCoordinate(String[] fields, int latIndex, int lngIndex) {
      try {
         return Coordinate.parse(fields[latIndex], fields[lngIndex]);
      } catch (NumberFormatException e) {
         logger.fine("Skipping row with bad coordinates: " + fields[latIndex] + "," + fields[lngIndex]);
         return null;
      }
   }

   /**
    * Add country name to code mappings that replace whatever countryInfo.txt says
    */
   public GazetteerBuilder addCountryCodes(Map<String,String> mappings) {
      extraCountryCodes.putAll(mappings);
      return this;
   }

   /**
    * countryInfo.txt: ISO code in column 0, country name in column 4
    */
   public GazetteerBuilder readCountryInfo(Reader reader) throws IOException {
      readRows(reader, TAB, new RowHandler() {
         @Override
         public void row(String[] fields) {
            if (fields.length < 5) {
               logger.fine("Skipping short country row: " + fields[0]);
               return;
            }
            countryCodes.put(fields[4], fields[0]);
         }
      });
      return this;
   }

   /**
    * allCountries.txt from the zip export: country code in column 0, postal code in column 1,
    * latitude and longitude in columns 9 and 10
    */
   public GazetteerBuilder readPostalCodes(Reader reader) throws IOException {
      readRows(reader, TAB, new RowHandler() {
         @Override
         public void row(String[] fields) {
            if (fields.length < 11) {
               logger.fine("Skipping short postal row: " + fields[0]);
               return;
            }
            String countryCode = fields[0].toUpperCase();
            Map<String,Coordinate> country = postalCodes.get(countryCode);
            if (country == null) {
               country = new HashMap<String,Coordinate>();
               postalCodes.put(countryCode, country);
            }
            Coordinate coordinate = parseCoordinate(fields, 9, 10);
            if (coordinate != null) {
               country.put(normalizer.normalizePostalCode(fields[1]), coordinate);
            }
         }
      });
      return this;
   }

   /**
    * admin1CodesASCII.txt: CC.ADM1 code in column 0, ASCII name in column 2
    */
   public GazetteerBuilder readAdminDivisions(Reader reader) throws IOException {
      readRows(reader, TAB, new RowHandler() {
         @Override
         public void row(String[] fields) {
            if (fields.length < 3) {
               logger.fine("Skipping short admin division row: " + fields[0]);
               return;
            }
            adminDivisions.put(fields[0], normalizer.normalize(fields[2]));
         }
      });
      return this;
   }

   /**
    * cities1000.txt: ASCII name in column 2, alternate names in column 3, latitude and longitude
    * in columns 4 and 5, country code in column 8, admin1 code in column 10
    */
   public GazetteerBuilder readCities(Reader reader) throws IOException {
      readRows(reader, TAB, new RowHandler() {
         @Override
         public void row(String[] fields) {
            if (fields.length < 11) {
               logger.fine("Skipping short city row: " + fields[0]);
               return;
            }
            String city = normalizer.normalize(fields[2]);
            String countryCode = fields[8];
            String division = adminDivisions.get(countryCode + "." + fields[10]);
            // gazetteer gap
            if (division == null || division.length() == 0) {
               return;
            }
            Coordinate coordinate = parseCoordinate(fields, 4, 5);
            if (coordinate == null) {
               return;
            }

            cities.put(new CityKey(countryCode, division, city), coordinate);

            if ("TW".equals(countryCode)) {
               // Taiwanese teams give the city as their division
               cities.put(new CityKey(countryCode, city, city), coordinate);
            }
            else if ("IL".equals(countryCode)) {
               // Israeli division names are unreliable and teams often use alternate city names,
               // so the country code stands in for the division
               for (String altName : fields[3].split(",")) {
                  String name = normalizer.normalize(altName);
                  if (name.length() > 0) {
                     cities.put(new CityKey(countryCode, countryCode, name), coordinate);
                  }
               }
            }
         }
      });
      return this;
   }

   /**
    * geo_cache: place|latitude|longitude, maintained by hand from the broken places report
    */
   public GazetteerBuilder readManualLocations(Reader reader) throws IOException {
      readRows(reader, PIPE, new RowHandler() {
         @Override
         public void row(String[] fields) {
            if (fields.length < 3) {
               logger.fine("Skipping short manual location row: " + fields[0]);
               return;
            }
            Coordinate coordinate = parseCoordinate(fields, 1, 2);
            if (coordinate != null) {
               manualLocations.put(fields[0], coordinate);
            }
         }
      });
      return this;
   }

   public Gazetteer build() {
      Map<String,String> codes = new HashMap<String,String>(countryCodes);
      codes.putAll(extraCountryCodes);
      codes.remove("");
      return new Gazetteer(codes, postalCodes, adminDivisions, cities, manualLocations);
   }
}
