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

import java.text.Normalizer.Form;
import java.util.Locale;

/**
 * Normalize place text so team fields and gazetteer names compare equal:
 * uppercase, no surrounding spaces, ASCII only.
 */
public class Normalizer {
   private static Normalizer normalizer = new Normalizer();

   public static Normalizer getInstance() {
      return normalizer;
   }

   private Normalizer() {
   }

   /**
    * Uppercase, trim spaces and strip accents and any other non-ASCII characters
    * @param text place text, may be null
    * @return normalized text, never null
    */
   public String normalize(String text) {
      if (StringUtils.isEmpty(text)) {
         return "";
      }
      String upper = text.toUpperCase(Locale.ROOT);
      // decompose accented letters so the base letter survives when the marks are dropped
      String decomposed = java.text.Normalizer.normalize(upper, Form.NFD);
      StringBuilder buf = new StringBuilder(decomposed.length());
      for (int i = 0; i < decomposed.length(); i++) {
         char c = decomposed.charAt(i);
         if (c < 128) {
            buf.append(c);
         }
      }
      return StringUtils.strip(buf.toString(), " ");
   }

   /**
    * Postal codes are only uppercased; some countries use letters
    */
   public String normalizePostalCode(String postalCode) {
      if (StringUtils.isEmpty(postalCode)) {
         return "";
      }
      return postalCode.toUpperCase(Locale.ROOT);
   }
}
