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

import java.util.List;
import java.util.logging.Logger;

/**
 * Resolve a team's location fields to a coordinate.
 *
 * Lookups are tried in order and the first hit wins:
 * <ol>
 *    <li>postal code within the country</li>
 *    <li>country, division and city</li>
 *    <li>the manual location file, keyed by the composite place string</li>
 * </ol>
 * If all three miss, the place is reported to the {@link UnresolvedPlaceHandler} and (0, 0) is returned.
 * Coordinates are rounded only once, on the way out.
 */
public class LocationResolver {
   private static Logger logger = Logger.getLogger("org.frcmap.locate");

   private final Gazetteer gazetteer;
   private final CorrectionRules correctionRules;
   private final UnresolvedPlaceHandler unresolvedPlaceHandler;
   private final int coordinateScale;
   private final Normalizer normalizer = Normalizer.getInstance();

   public LocationResolver(Gazetteer gazetteer, CorrectionRules correctionRules,
                           UnresolvedPlaceHandler unresolvedPlaceHandler, int coordinateScale) {
      if (gazetteer == null || correctionRules == null) {
         throw new NullPointerException("gazetteer and correction rules are required");
      }
      if (coordinateScale < 0) {
         throw new IllegalArgumentException("coordinateScale must not be negative: " + coordinateScale);
      }
      this.gazetteer = gazetteer;
      this.correctionRules = correctionRules;
      this.unresolvedPlaceHandler = unresolvedPlaceHandler;
      this.coordinateScale = coordinateScale;
   }

   public LocationResolver(Gazetteer gazetteer, LocatorConfig config, UnresolvedPlaceHandler unresolvedPlaceHandler) {
      this(gazetteer, CorrectionRules.getDefault(config), unresolvedPlaceHandler, config.getCoordinateScale());
   }

   public Gazetteer getGazetteer() {
      return gazetteer;
   }

   /**
    * Build a normalized record from a team's raw location fields; null fields become empty strings
    * @param countryName country name as the team source spells it
    */
   public LocationRecord prepare(String countryName, String division, String city, String postalCode, String key) {
      LocationRecord record = new LocationRecord();
      record.setKey(key);
      String countryCode = gazetteer.countryCode(countryName);
      record.setCountryCode(countryCode == null ? "" : countryCode);
      record.setDivision(normalizer.normalize(division));
      record.setCity(normalizer.normalize(city));
      record.setPostalCode(normalizer.normalizePostalCode(postalCode));
      return record;
   }

   /**
    * Prepare, correct and resolve a team's raw location fields
    */
   public ResolveResult locate(String countryName, String division, String city, String postalCode, String key) {
      return resolveDetailed(prepare(countryName, division, city, postalCode, key));
   }

   /**
    * Apply the correction rules to a prepared record, then look it up
    * @return rounded coordinate; (0, 0) if the place was not found
    */
   public Coordinate resolve(LocationRecord record) {
      return resolveDetailed(record).getCoordinate();
   }

   public ResolveResult resolveDetailed(LocationRecord record) {
      List<String> fired = correctionRules.apply(record);
      if (!fired.isEmpty()) {
         logger.fine("Corrections " + fired + " applied to " + record);
      }

      Tier tier = Tier.POSTAL;
      Coordinate coordinate = gazetteer.postal(record.getCountryCode(), record.getPostalCode());

      if (coordinate == null) {
         tier = Tier.CITY;
         coordinate = gazetteer.city(record.getCountryCode(), record.getDivision(), record.getCity());
      }

      String placeName = record.getPlaceName();
      if (coordinate == null) {
         tier = Tier.MANUAL;
         coordinate = gazetteer.manual(placeName);
      }

      if (coordinate == null) {
         tier = Tier.UNRESOLVED;
         coordinate = Coordinate.ORIGIN;
         logger.warning("Did not find team " + record.getKey() + " @ place " + placeName);
         if (unresolvedPlaceHandler != null) {
            unresolvedPlaceHandler.placeNotFound(record.getKey(), placeName);
         }
      }

      return new ResolveResult(record.getKey(), placeName, tier, coordinate.round(coordinateScale));
   }
}
