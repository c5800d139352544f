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

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Minimal client for the team listing of The Blue Alliance read API (v3)
 */
public class TbaClient {
   private static Logger logger = Logger.getLogger("org.frcmap.tools");

   public static final String DEFAULT_BASE_URL = "https://www.thebluealliance.com/api/v3";
   public static final String AUTH_HEADER = "X-TBA-Auth-Key";

   private static final TypeReference<List<Map<String,Object>>> TEAM_LIST = new TypeReference<List<Map<String,Object>>>() {};

   private final String baseUrl;
   private final String authKey;

   public TbaClient(String authKey) {
      this(DEFAULT_BASE_URL, authKey);
   }

   public TbaClient(String baseUrl, String authKey) {
      if (authKey == null || authKey.length() == 0) {
         throw new IllegalArgumentException("TBA auth key is required");
      }
      this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
      this.authKey = authKey;
   }

   URL teamsUrl(String year, int page) throws IOException {
      return new URL(baseUrl + "/teams/" + year + "/" + page);
   }

   /**
    * @return the teams on one page of the listing; empty past the last page
    * @throws IOException on a non-200 response
    */
   public List<Map<String,Object>> getTeamsPage(String year, int page) throws IOException {
      URL url = teamsUrl(year, page);
      HttpURLConnection connection = (HttpURLConnection) url.openConnection();
      try {
         connection.setRequestProperty(AUTH_HEADER, authKey);
         connection.setRequestProperty("Accept", "application/json");
         int status = connection.getResponseCode();
         if (status != HttpURLConnection.HTTP_OK) {
            throw new IOException("GET " + url + " returned " + status);
         }
         InputStream in = connection.getInputStream();
         try {
            return TeamFiles.MAPPER.readValue(in, TEAM_LIST);
         } finally {
            in.close();
         }
      } finally {
         connection.disconnect();
      }
   }

   /**
    * Page through every team active in a year
    */
   public List<TeamRecord> getTeams(String year) throws IOException {
      List<Map<String,Object>> rows = new ArrayList<Map<String,Object>>();
      int page = 0;
      while (true) {
         List<Map<String,Object>> teams = getTeamsPage(year, page);
         if (teams.isEmpty()) {
            break;
         }
         logger.fine("Page " + page + ": " + teams.size() + " teams");
         rows.addAll(teams);
         page++;
      }
      logger.info("Downloaded " + rows.size() + " teams for " + year);
      return TeamFiles.toTeams(rows);
   }
}
