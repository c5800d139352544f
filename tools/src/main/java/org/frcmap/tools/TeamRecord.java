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

package org.frcmap.tools;

import org.frcmap.locate.Coordinate;

import java.util.*;

/**
 * One team as returned by The Blue Alliance, kept as its JSON attributes
 */
public class TeamRecord {
   /**
    * Attributes copied into teamFullInfo.json, in output order
    */
   public static final List<String> FULL_INFO_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList(
         "address",
         "city",
         "country",
         "gmaps_place_id",
         "gmaps_url",
         "home_championship",
         "key",
         "lat",
         "lng",
         "location_name",
         "motto",
         "name",
         "nickname",
         "postal_code",
         "rookie_year",
         "state_prov",
         "team_number",
         "website"));

   private final Map<String,Object> attributes;

   public TeamRecord(Map<String,Object> attributes) {
      this.attributes = new LinkedHashMap<String,Object>(attributes);
   }

   public Map<String,Object> getAttributes() {
      return Collections.unmodifiableMap(attributes);
   }

   public Object get(String name) {
      return attributes.get(name);
   }

   // null when absent or JSON null
   private String getString(String name) {
      Object value = attributes.get(name);
      return value == null ? null : value.toString();
   }

   public String getKey() {
      return getString("key");
   }

   public Object getTeamNumber() {
      return attributes.get("team_number");
   }

   public String getCountry() {
      return getString("country");
   }

   public String getStateProv() {
      return getString("state_prov");
   }

   public String getCity() {
      return getString("city");
   }

   public String getPostalCode() {
      return getString("postal_code");
   }

   /**
    * Replace the per-year home championship map with the entry for one year
    */
   public void collapseHomeChampionship(String year) {
      Object homeChampionship = attributes.get("home_championship");
      if (homeChampionship instanceof Map && !((Map<?,?>) homeChampionship).isEmpty()) {
         attributes.put("home_championship", ((Map<?,?>) homeChampionship).get(year));
      }
   }

   public void setLocation(Coordinate coordinate) {
      attributes.put("lat", coordinate.getLatitude());
      attributes.put("lng", coordinate.getLongitude());
   }

   /**
    * team_number, lat and lng for teams.json
    */
   public Map<String,Object> toLocationInfo() {
      Map<String,Object> info = new LinkedHashMap<String,Object>();
      info.put("team_number", attributes.get("team_number"));
      info.put("lat", attributes.get("lat"));
      info.put("lng", attributes.get("lng"));
      return info;
   }

   /**
    * Every attribute in {@link #FULL_INFO_ATTRIBUTES}, null where the team has none
    */
   public Map<String,Object> toFullInfo() {
      Map<String,Object> info = new LinkedHashMap<String,Object>();
      for (String name : FULL_INFO_ATTRIBUTES) {
         info.put(name, attributes.get(name));
      }
      return info;
   }

   @Override
   public String toString() {
      return String.valueOf(getKey());
   }
}
