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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read and write the team JSON files
 */
public class TeamFiles {
   static final ObjectMapper MAPPER = new ObjectMapper();

   private static final TypeReference<List<Map<String,Object>>> TEAM_LIST = new TypeReference<List<Map<String,Object>>>() {};

   private TeamFiles() {
   }

   public static List<TeamRecord> readTeams(File file) throws IOException {
      return toTeams(MAPPER.readValue(file, TEAM_LIST));
   }

   public static List<TeamRecord> readTeams(InputStream in) throws IOException {
      return toTeams(MAPPER.readValue(in, TEAM_LIST));
   }

   static List<TeamRecord> toTeams(List<Map<String,Object>> rows) {
      List<TeamRecord> teams = new ArrayList<TeamRecord>(rows.size());
      for (Map<String,Object> row : rows) {
         teams.add(new TeamRecord(row));
      }
      return teams;
   }

   /**
    * Write teams as they came from the API so a later run can locate them without refetching
    */
   public static void writeRawTeams(List<TeamRecord> teams, File file) throws IOException {
      List<Map<String,Object>> rows = new ArrayList<Map<String,Object>>(teams.size());
      for (TeamRecord team : teams) {
         rows.add(team.getAttributes());
      }
      MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(file, rows);
   }

   /**
    * Write teams.json: a JSON array with one {team_number, lat, lng} object per line
    */
   public static void writeLocations(List<TeamRecord> teams, File file) throws IOException {
      Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);
      try {
         writer.write("[");
         for (int i = 0; i < teams.size(); i++) {
            writer.write(i == 0 ? "\n\t" : ",\n\t");
            writer.write(MAPPER.writeValueAsString(teams.get(i).toLocationInfo()));
         }
         writer.write(teams.isEmpty() ? "]" : "\n]");
      } finally {
         writer.close();
      }
   }

   /**
    * Write teamFullInfo.json: the whitelisted attributes of every team, pretty printed
    */
   public static void writeFullInfo(List<TeamRecord> teams, File file) throws IOException {
      List<Map<String,Object>> rows = new ArrayList<Map<String,Object>>(teams.size());
      for (TeamRecord team : teams) {
         rows.add(team.toFullInfo());
      }
      MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(file, rows);
   }

   /**
    * @return trimmed contents of a one-line settings file such as YEAR or tba_token.txt
    */
   public static String readSetting(File file) throws IOException {
      return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8).trim();
   }
}
