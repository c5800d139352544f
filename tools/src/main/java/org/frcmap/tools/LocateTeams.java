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

import org.frcmap.locate.*;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.io.*;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Locate every team in a team file and write teams.json, teamFullInfo.json and the broken places report
 */
public class LocateTeams {
   private static Logger logger = Logger.getLogger("org.frcmap.tools");

   @Option(name = "-i", required = true, usage = "teams file in, as downloaded by FetchTeams")
   private File teamsIn;

   @Option(name = "-d", required = false, usage = "directory holding the extracted GeoNames files")
   private File dataDir = new File("cache");

   @Option(name = "-m", required = false, usage = "manually located places file in")
   private File manualIn = null;

   @Option(name = "-o", required = false, usage = "team locations out")
   private File locationsOut = new File("teams.json");

   @Option(name = "-f", required = false, usage = "full team info out")
   private File fullInfoOut = new File("teamFullInfo.json");

   @Option(name = "-b", required = false, usage = "broken places out; defaults to broken_places in the data directory")
   private File brokenOut = null;

   @Option(name = "-y", required = false, usage = "season year for home championships; read from the YEAR file if not given")
   private String year = null;

   @Option(name = "-so", required = false, usage = "per-country lookup tier counts out")
   private File statsOut = null;

   @Option(name = "-n", required = false, usage = "number of teams to locate")
   private int maxTeams = 0;

   static class TierCount {
      int[] tierCounts = new int[Tier.values().length];

      void add(Tier tier) {
         tierCounts[tier.ordinal()]++;
      }

      int total() {
         int total = 0;
         for (int count : tierCounts) {
            total += count;
         }
         return total;
      }
   }

   private final Map<String,TierCount> tierCounts = new TreeMap<String,TierCount>();

   private String resolveYear() throws IOException {
      if (year != null) {
         return year;
      }
      File yearFile = new File("YEAR");
      if (yearFile.exists()) {
         return TeamFiles.readSetting(yearFile);
      }
      return null;
   }

   /**
    * Locate each team in place and count the tier that located it
    */
   void locateTeams(List<TeamRecord> teams, LocationResolver resolver, String year) {
      int teamCount = 0;
      for (TeamRecord team : teams) {
         if (year != null) {
            team.collapseHomeChampionship(year);
         }

         ResolveResult result = resolver.locate(team.getCountry(), team.getStateProv(), team.getCity(),
                                                team.getPostalCode(), team.getKey());
         team.setLocation(result.getCoordinate());

         String countryCode = resolver.getGazetteer().countryCode(team.getCountry());
         String countryKey = countryCode == null ? "??" : countryCode;
         TierCount tierCount = tierCounts.get(countryKey);
         if (tierCount == null) {
            tierCount = new TierCount();
            tierCounts.put(countryKey, tierCount);
         }
         tierCount.add(result.getTier());

         if (++teamCount % 1000 == 0) {
            System.out.print(".");
         }
      }
   }

   Map<String,TierCount> getTierCounts() {
      return tierCounts;
   }

   void writeTierCounts(PrintWriter writer) {
      StringBuilder header = new StringBuilder("country,total");
      for (Tier tier : Tier.values()) {
         header.append(",");
         header.append(tier.name().toLowerCase());
      }
      writer.println(header);
      for (String countryCode : tierCounts.keySet()) {
         TierCount tc = tierCounts.get(countryCode);
         StringBuilder buf = new StringBuilder();
         for (int count : tc.tierCounts) {
            buf.append(",");
            buf.append(count);
         }
         writer.println(countryCode + "," + tc.total() + buf.toString());
      }
   }

   void doMain() throws IOException {
      LocatorConfig config = LocatorConfig.getInstance();
      File manual = manualIn != null ? manualIn : new File(config.getManualLocationsFile());
      File broken = brokenOut != null ? brokenOut : new File(dataDir, "broken_places");

      logger.info("Loading GeoNames data...");
      Gazetteer gazetteer = GazetteerBuilder.fromDirectory(dataDir, manual, config);

      List<TeamRecord> teams = TeamFiles.readTeams(teamsIn);
      if (maxTeams > 0 && teams.size() > maxTeams) {
         teams = teams.subList(0, maxTeams);
      }
      String seasonYear = resolveYear();
      if (seasonYear == null) {
         logger.warning("No season year given; home championships are left as is");
      }

      logger.info("Processing and writing team info...");
      BrokenPlacesReport report = new BrokenPlacesReport(broken);
      try {
         LocationResolver resolver = new LocationResolver(gazetteer, config, report);
         locateTeams(teams, resolver, seasonYear);
      } finally {
         report.close();
      }

      TeamFiles.writeLocations(teams, locationsOut);
      TeamFiles.writeFullInfo(teams, fullInfoOut);

      if (statsOut != null) {
         PrintWriter writer = new PrintWriter(statsOut, "UTF-8");
         try {
            writeTierCounts(writer);
         } finally {
            writer.close();
         }
      }

      logger.info("Located " + (teams.size() - report.getCount()) + " of " + teams.size() + " teams; " +
                  report.getCount() + " places written to " + broken);
   }

   public static void main(String[] args) throws IOException {
      LocateTeams self = new LocateTeams();
      CmdLineParser parser = new CmdLineParser(self);
      try {
         parser.parseArgument(args);
         self.doMain();
      } catch (CmdLineException e) {
         System.err.println(e.getMessage());
         parser.printUsage(System.err);
      }
   }
}
