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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A guarded rewrite of a {@link LocationRecord} that repairs a known mismatch between
 * the team source and GeoNames.
 */
public abstract class CorrectionRule {
   private final String name;

   protected CorrectionRule(String name) {
      this.name = name;
   }

   public String getName() {
      return name;
   }

   public abstract boolean appliesTo(LocationRecord record);

   public abstract void rewrite(LocationRecord record);

   /**
    * Rewrite the record if the guard holds
    * @return true if the rule fired
    */
   public boolean apply(LocationRecord record) {
      if (appliesTo(record)) {
         rewrite(record);
         return true;
      }
      return false;
   }

   /**
    * Combine rules so that only the first one whose guard holds fires
    */
   public static CorrectionRule firstOf(String name, CorrectionRule... alternatives) {
      return new FirstMatchRule(name, Arrays.asList(alternatives));
   }

   private static class FirstMatchRule extends CorrectionRule {
      private final List<CorrectionRule> alternatives;

      FirstMatchRule(String name, List<CorrectionRule> alternatives) {
         super(name);
         this.alternatives = Collections.unmodifiableList(new ArrayList<CorrectionRule>(alternatives));
      }

      @Override
      public boolean appliesTo(LocationRecord record) {
         for (CorrectionRule rule : alternatives) {
            if (rule.appliesTo(record)) {
               return true;
            }
         }
         return false;
      }

      @Override
      public void rewrite(LocationRecord record) {
         for (CorrectionRule rule : alternatives) {
            if (rule.apply(record)) {
               return;
            }
         }
      }
   }

   @Override
   public String toString() {
      return name;
   }
}
