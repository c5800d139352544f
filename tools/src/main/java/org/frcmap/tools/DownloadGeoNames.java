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
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Download the GeoNames files the gazetteer is built from and extract the zip archives
 */
public class DownloadGeoNames {
   private static Logger logger = Logger.getLogger("org.frcmap.tools");

   public static final String DEFAULT_BASE_URL = "https://download.geonames.org/export";

   static class GeoNamesFile {
      final String path;
      final String name;
      final boolean unzip;

      GeoNamesFile(String path, String name, boolean unzip) {
         this.path = path;
         this.name = name;
         this.unzip = unzip;
      }
   }

   static final List<GeoNamesFile> FILES = Arrays.asList(
         new GeoNamesFile("zip/allCountries.zip", "allCountries.zip", true),
         new GeoNamesFile("dump/readme.txt", "allCountries.readme", false),
         new GeoNamesFile("dump/cities1000.zip", "cities1000.zip", true),
         new GeoNamesFile("dump/readme.txt", "cities1000.readme", false),
         new GeoNamesFile("dump/admin1CodesASCII.txt", "admin1CodesASCII.txt", false),
         new GeoNamesFile("dump/countryInfo.txt", "countryInfo.txt", false));

   @Option(name = "-d", required = false, usage = "directory to download into")
   private File dataDir = new File("cache");

   @Option(name = "-u", required = false, usage = "GeoNames export base url")
   private String baseUrl = DEFAULT_BASE_URL;

   /**
    * Extract every entry of a zip archive into a directory
    */
   static void unzip(File archive, File dir) throws IOException {
      ZipFile zip = new ZipFile(archive);
      try {
         Enumeration<? extends ZipEntry> entries = zip.entries();
         while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            File target = new File(dir, entry.getName());
            if (!target.getCanonicalPath().startsWith(dir.getCanonicalPath() + File.separator)) {
               throw new IOException("Zip entry outside target directory: " + entry.getName());
            }
            if (entry.isDirectory()) {
               target.mkdirs();
               continue;
            }
            target.getParentFile().mkdirs();
            InputStream in = zip.getInputStream(entry);
            try {
               Files.copy(in, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            } finally {
               in.close();
            }
         }
      } finally {
         zip.close();
      }
   }

   static void download(URL url, File target) throws IOException {
      InputStream in = url.openStream();
      try {
         Files.copy(in, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
      } finally {
         in.close();
      }
   }

   void doMain() throws IOException {
      if (dataDir.isFile()) {
         throw new IOException("File " + dataDir + " exists where the data directory should be; please delete it");
      }
      if (!dataDir.exists() && !dataDir.mkdirs()) {
         throw new IOException("Unable to create directory " + dataDir);
      }

      String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
      for (GeoNamesFile file : FILES) {
         URL url = new URL(base + file.path);
         File target = new File(dataDir, file.name);
         logger.info("Downloading " + url + "...");
         download(url, target);
         if (file.unzip) {
            logger.info("Unzipping " + target + "...");
            unzip(target, dataDir);
         }
      }
   }

   public static void main(String[] args) throws IOException {
      DownloadGeoNames self = new DownloadGeoNames();
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
