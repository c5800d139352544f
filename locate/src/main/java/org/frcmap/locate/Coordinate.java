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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Latitude/longitude pair in decimal degrees
 */
public final class Coordinate {
   public static final Coordinate ORIGIN = new Coordinate(0.0, 0.0);

   private final double latitude;
   private final double longitude;

   public Coordinate(double latitude, double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
   }

   /**
    * Parse a coordinate from the text columns of a gazetteer row
    * @throws NumberFormatException if either column is not a finite number
    */
   public static Coordinate parse(String latitude, String longitude) {
      return new Coordinate(parseDegrees(latitude), parseDegrees(longitude));
   }

   private static double parseDegrees(String text) {
      double value = Double.parseDouble(text.trim());
      if (Double.isNaN(value) || Double.isInfinite(value)) {
         throw new NumberFormatException("Not a finite number: " + text);
      }
      return value;
   }

   public double getLatitude() {
      return latitude;
   }

   public double getLongitude() {
      return longitude;
   }

   /**
    * Round both components to the given number of decimal places, ties to even
    */
   public Coordinate round(int scale) {
      return new Coordinate(round(latitude, scale), round(longitude, scale));
   }

   private static double round(double value, int scale) {
      return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Coordinate)) {
         return false;
      }
      Coordinate that = (Coordinate) o;
      return Double.compare(latitude, that.latitude) == 0 && Double.compare(longitude, that.longitude) == 0;
   }

   @Override
   public int hashCode() {
      long bits = Double.doubleToLongBits(latitude);
      int result = (int) (bits ^ (bits >>> 32));
      bits = Double.doubleToLongBits(longitude);
      return 31 * result + (int) (bits ^ (bits >>> 32));
   }

   @Override
   public String toString() {
      return "(" + latitude + ", " + longitude + ")";
   }
}
