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
 * Country code, division name and city name of a city in the gazetteer
 */
public final class CityKey {
   private final String countryCode;
   private final String division;
   private final String city;

   public CityKey(String countryCode, String division, String city) {
      if (countryCode == null || division == null || city == null) {
         throw new NullPointerException("city key fields must not be null");
      }
      this.countryCode = countryCode;
      this.division = division;
      this.city = city;
   }

   public String getCountryCode() {
      return countryCode;
   }

   public String getDivision() {
      return division;
   }

   public String getCity() {
      return city;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof CityKey)) {
         return false;
      }
      CityKey that = (CityKey) o;
      return countryCode.equals(that.countryCode) && division.equals(that.division) && city.equals(that.city);
   }

   @Override
   public int hashCode() {
      int result = countryCode.hashCode();
      result = 31 * result + division.hashCode();
      return 31 * result + city.hashCode();
   }

   @Override
   public String toString() {
      return countryCode + "/" + division + "/" + city;
   }
}
