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
 * Result from resolve
 */
public class ResolveResult {
   private final String key;
   private final String placeName;
   private final Tier tier;
   private final Coordinate coordinate;

   public ResolveResult(String key, String placeName, Tier tier, Coordinate coordinate) {
      this.key = key;
      this.placeName = placeName;
      this.tier = tier;
      this.coordinate = coordinate;
   }

   public String getKey() {
      return key;
   }

   public String getPlaceName() {
      return placeName;
   }

   public Tier getTier() {
      return tier;
   }

   public Coordinate getCoordinate() {
      return coordinate;
   }

   public boolean isResolved() {
      return tier != Tier.UNRESOLVED;
   }

   @Override
   public String toString() {
      return key + " @ " + placeName + " -> " + coordinate + " (" + tier + ")";
   }
}
