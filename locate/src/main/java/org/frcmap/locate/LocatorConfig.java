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

import org.apache.commons.lang.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Settings read from locator.properties
 */
public class LocatorConfig {
   public static final String PROPERTIES_FILE = "locator.properties";

   private static LocatorConfig config = null;

   public static synchronized LocatorConfig getInstance() {
      if (config == null) {
         config = new LocatorConfig(loadProperties());
      }
      return config;
   }

   private static Properties loadProperties() {
      InputStream in = LocatorConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE);
      if (in == null) {
         throw new RuntimeException(PROPERTIES_FILE + " not found");
      }
      try {
         Properties props = new Properties();
         props.load(new InputStreamReader(in, "UTF8"));
         in.close();
         return props;
      } catch (IOException e) {
         throw new RuntimeException("Error reading " + PROPERTIES_FILE + ": " + e.getMessage());
      }
   }

   private final Map<String,String> extraCountryCodes;
   private final boolean japanPostalDash;
   private final int coordinateScale;
   private final String countryInfoFile;
   private final String postalCodesFile;
   private final String adminDivisionsFile;
   private final String citiesFile;
   private final String manualLocationsFile;

   public LocatorConfig(Properties props) {
      extraCountryCodes = new LinkedHashMap<String,String>();
      String extra = props.getProperty("extraCountryCodes", "");
      for (String mapping : StringUtils.split(extra, ',')) {
         String[] fields = mapping.split("=");
         if (fields.length != 2 || fields[0].trim().length() == 0 || fields[1].trim().length() == 0) {
            throw new RuntimeException("Invalid extraCountryCodes entry: " + mapping);
         }
         extraCountryCodes.put(fields[0].trim(), fields[1].trim());
      }
      japanPostalDash = Boolean.parseBoolean(props.getProperty("correction.japanPostalDash", "false").trim());
      coordinateScale = Integer.parseInt(props.getProperty("coordinateScale", "3").trim());
      countryInfoFile = props.getProperty("file.countryInfo", "countryInfo.txt");
      postalCodesFile = props.getProperty("file.postalCodes", "allCountries.txt");
      adminDivisionsFile = props.getProperty("file.adminDivisions", "admin1CodesASCII.txt");
      citiesFile = props.getProperty("file.cities", "cities1000.txt");
      manualLocationsFile = props.getProperty("file.manualLocations", "geo_cache");
   }

   /**
    * Country names used by the team source that GeoNames spells differently
    */
   public Map<String,String> getExtraCountryCodes() {
      return Collections.unmodifiableMap(extraCountryCodes);
   }

   public boolean isJapanPostalDash() {
      return japanPostalDash;
   }

   /**
    * Number of decimal places kept in resolved coordinates
    */
   public int getCoordinateScale() {
      return coordinateScale;
   }

   public String getCountryInfoFile() {
      return countryInfoFile;
   }

   public String getPostalCodesFile() {
      return postalCodesFile;
   }

   public String getAdminDivisionsFile() {
      return adminDivisionsFile;
   }

   public String getCitiesFile() {
      return citiesFile;
   }

   public String getManualLocationsFile() {
      return manualLocationsFile;
   }
}
