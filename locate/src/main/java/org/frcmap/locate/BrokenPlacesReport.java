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

import java.io.*;

/**
 * Writes places that could not be located to a file, one per line as <code>place|key</code>.
 * The file is emptied when the report is opened so it only lists the current run's gaps.
 */
public class BrokenPlacesReport implements UnresolvedPlaceHandler, Closeable {
   private final File file;
   private final PrintWriter writer;
   private int count = 0;

   public BrokenPlacesReport(File file) throws IOException {
      this.file = file;
      this.writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(file, false), "UTF8"));
   }

   @Override
   public synchronized void placeNotFound(String key, String placeName) {
      writer.println(placeName + "|" + key);
      writer.flush();
      count++;
   }

   public synchronized int getCount() {
      return count;
   }

   public File getFile() {
      return file;
   }

   @Override
   public synchronized void close() throws IOException {
      writer.close();
      if (writer.checkError()) {
         throw new IOException("Error writing " + file);
      }
   }
}
