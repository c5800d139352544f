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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only lookup tables built from the GeoNames files and the manual location file.
 * Every lookup returns null when the key is missing at any level.
 *
 * Instances are created by {@link GazetteerBuilder} and are safe to share between threads.
 */
public class Gazetteer {
   private final Map<String,String> countryCodes;
   private final Map<String,Map<String,Coordinate>> postalCodes;
   private final Map<String,String> adminDivisions;
   private final Map<CityKey,Coordinate> cities;
   private final Map<String,Coordinate> manualLocations;

   Gazetteer(Map<String,String> countryCodes,
             Map<String,Map<String,Coordinate>> postalCodes,
             Map<String,String> adminDivisions,
             Map<CityKey,Coordinate> cities,
             Map<String,Coordinate> manualLocations) {
      this.countryCodes = Collections.unmodifiableMap(new HashMap<String,String>(countryCodes));
      Map<String,Map<String,Coordinate>> postal = new HashMap<String,Map<String,Coordinate>>();
      for (Map.Entry<String,Map<String,Coordinate>> entry : postalCodes.entrySet()) {
         postal.put(entry.getKey(), Collections.unmodifiableMap(new HashMap<String,Coordinate>(entry.getValue())));
      }
      this.postalCodes = Collections.unmodifiableMap(postal);
      this.adminDivisions = Collections.unmodifiableMap(new HashMap<String,String>(adminDivisions));
      this.cities = Collections.unmodifiableMap(new HashMap<CityKey,Coordinate>(cities));
      this.manualLocations = Collections.unmodifiableMap(new HashMap<String,Coordinate>(manualLocations));
   }

   /**
    * @param countryName country name as the team source spells it, e.g. "USA"
    * @return two-letter country code or null
    */
   public String countryCode(String countryName) {
      if (countryName == null) {
         return null;
      }
      return countryCodes.get(countryName);
   }

   public Coordinate postal(String countryCode, String postalCode) {
      Map<String,Coordinate> country = postalCodes.get(countryCode);
      if (country == null) {
         return null;
      }
      return country.get(postalCode);
   }

   public Coordinate city(String countryCode, String division, String city) {
      if (countryCode == null || division == null || city == null) {
         return null;
      }
      return cities.get(new CityKey(countryCode, division, city));
   }

   public Coordinate manual(String placeName) {
      return manualLocations.get(placeName);
   }

   /**
    * @param code admin1 code in the form <code>CC.ADM1</code>
    * @return normalized division name or null
    */
   public String adminDivisionName(String code) {
      return adminDivisions.get(code);
   }

   public boolean hasPostalCountry(String countryCode) {
      return postalCodes.containsKey(countryCode);
   }

   public int getCountryCount() {
      return countryCodes.size();
   }

   public int getPostalCodeCount() {
      int count = 0;
      for (Map<String,Coordinate> country : postalCodes.values()) {
         count += country.size();
      }
      return count;
   }

   public int getCityCount() {
      return cities.size();
   }

   public int getManualLocationCount() {
      return manualLocations.size();
   }
}
