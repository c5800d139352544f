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

/**
 * One team's location fields, normalized and then rewritten in place by the correction rules
 * before the resolver looks it up.
 */
public class LocationRecord {
   private String key = "";
   private String countryCode = "";
   private String division = "";
   private String city = "";
   private String postalCode = "";

   public LocationRecord() {
   }

   public LocationRecord(String key, String countryCode, String division, String city, String postalCode) {
      setKey(key);
      setCountryCode(countryCode);
      setDivision(division);
      setCity(city);
      setPostalCode(postalCode);
   }

   public String getKey() {
      return key;
   }

   public void setKey(String key) {
      this.key = key == null ? "" : key;
   }

   public String getCountryCode() {
      return countryCode;
   }

   public void setCountryCode(String countryCode) {
      this.countryCode = countryCode == null ? "" : countryCode;
   }

   /**
    * State, province or other first-level administrative division
    */
   public String getDivision() {
      return division;
   }

   public void setDivision(String division) {
      this.division = division == null ? "" : division;
   }

   public String getCity() {
      return city;
   }

   public void setCity(String city) {
      this.city = city == null ? "" : city;
   }

   public String getPostalCode() {
      return postalCode;
   }

   public void setPostalCode(String postalCode) {
      this.postalCode = postalCode == null ? "" : postalCode;
   }

   /**
    * Composite place string used as the key of the manual location table:
    * <code>city, division postal, countryCode</code>
    */
   public String getPlaceName() {
      return city + ", " + division + " " + postalCode + ", " + countryCode;
   }

   @Override
   public String toString() {
      return key + " @ " + getPlaceName();
   }
}
