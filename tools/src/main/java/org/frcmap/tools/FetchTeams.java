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

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.io.*;
import java.util.List;
import java.util.logging.Logger;

/**
 * Download every team for a year from The Blue Alliance into a JSON file
 */
public class FetchTeams {
   private static Logger logger = Logger.getLogger("org.frcmap.tools");

   @Option(name = "-t", required = false, usage = "file holding the TBA read API key")
   private File tokenFile = new File("tba_token.txt");

   @Option(name = "-y", required = false, usage = "season year; read from the YEAR file if not given")
   private String year = null;

   @Option(name = "-o", required = false, usage = "teams file out")
   private File teamsOut = new File("cache", "tba_teams.json");

   @Option(name = "-u", required = false, usage = "API base url")
   private String baseUrl = TbaClient.DEFAULT_BASE_URL;

   private void doMain() throws IOException {
      if (!tokenFile.exists()) {
         System.err.println("Error: " + tokenFile + " does not exist! Generate a Read API key at " +
                            "https://www.thebluealliance.com/account and put it in " + tokenFile);
         return;
      }
      if (year == null) {
         year = TeamFiles.readSetting(new File("YEAR"));
      }

      TbaClient client = new TbaClient(baseUrl, TeamFiles.readSetting(tokenFile));
      logger.info("Downloading team data for " + year + " from The Blue Alliance...");
      List<TeamRecord> teams = client.getTeams(year);

      File dir = teamsOut.getAbsoluteFile().getParentFile();
      if (dir != null && !dir.exists() && !dir.mkdirs()) {
         throw new IOException("Unable to create directory " + dir);
      }
      TeamFiles.writeRawTeams(teams, teamsOut);
      logger.info("Wrote " + teams.size() + " teams to " + teamsOut);
   }

   public static void main(String[] args) throws IOException {
      FetchTeams self = new FetchTeams();
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
