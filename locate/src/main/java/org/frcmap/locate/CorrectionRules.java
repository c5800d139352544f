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

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Ordered table of {@link CorrectionRule}s applied to a record before lookup.
 * Order matters: the postal-code country inference runs first so that the country rules
 * after it see the inferred code.
 */
public class CorrectionRules {
   private static Logger logger = Logger.getLogger("org.frcmap.locate");

   public static final String POSTAL_COUNTRY = "postal-country";
   public static final String SWEDEN_POSTAL = "se-postal";
   public static final String UNITED_STATES = "us";
   public static final String CHILE_SANTIAGO = "cl-santiago";
   public static final String GREECE_THESSALY = "gr-thessaly";
   public static final String MEXICO_SAN_LUIS_POTOSI = "mx-san-luis-potosi";
   public static final String MEXICO_CITY = "mx-mexico-city";
   public static final String TURKEY_CEKMEKOY = "tr-cekmekoy";
   public static final String NETHERLANDS_NORTH_BRABANT = "nl-north-brabant";
   public static final String DOMINICAN_SANTO_DOMINGO = "do-santo-domingo";
   public static final String ISRAEL_DIVISION = "il-division";
   public static final String JAPAN_POSTAL = "jp-postal";
   public static final String CANADA_POSTAL = "ca-postal";
   public static final String TAIWAN_MUNICIPALITY = "tw-municipality";

   // postal codes seen with no country, in the order they are tried
   private static final Map<String,String> POSTAL_CODE_COUNTRIES = new LinkedHashMap<String,String>();
   private static final Map<Pattern,String> POSTAL_FORMAT_COUNTRIES = new LinkedHashMap<Pattern,String>();
   static {
      POSTAL_CODE_COUNTRIES.put("11073", "TW");
      POSTAL_CODE_COUNTRIES.put("34912", "TR");
      POSTAL_CODE_COUNTRIES.put("34469", "TR");
      POSTAL_CODE_COUNTRIES.put("93810", "IL");

      POSTAL_FORMAT_COUNTRIES.put(Pattern.compile("[0-9]{4}"), "AU");
      POSTAL_FORMAT_COUNTRIES.put(Pattern.compile("[0-9]{5}(-[0-9]{4})?"), "US");
      POSTAL_FORMAT_COUNTRIES.put(Pattern.compile("[0-9]{5}-[0-9]{3}"), "BR");
      POSTAL_FORMAT_COUNTRIES.put(Pattern.compile("[A-Z][0-9][A-Z] [0-9][A-Z][0-9]"), "CA");
      POSTAL_FORMAT_COUNTRIES.put(Pattern.compile("[0-9]{7}"), "IL");
   }

   private static final Pattern SWEDEN_POSTAL_PREFIX = Pattern.compile("^[0-9]{5}");
   private static final String[] TAIWAN_DIVISION_SUFFIXES = {" SPECIAL MUNICIPALITY", " MUNICIPALITY"};

   private final List<CorrectionRule> rules;

   public CorrectionRules(List<CorrectionRule> rules) {
      this.rules = Collections.unmodifiableList(new ArrayList<CorrectionRule>(rules));
   }

   public static CorrectionRules getDefault(LocatorConfig config) {
      return getDefault(config.isJapanPostalDash());
   }

   /**
    * @param japanPostalDash rewrite 7-digit Japanese postal codes as 123-4567; when false the
    *                        Japan rule matches but leaves the record unchanged
    */
   public static CorrectionRules getDefault(boolean japanPostalDash) {
      List<CorrectionRule> rules = new ArrayList<CorrectionRule>();
      rules.add(inferCountryFromPostalCode());
      rules.add(swedishPostalCode());
      rules.add(CorrectionRule.firstOf(UNITED_STATES,
            divisionToCountry("us-guam", "US", "GUAM", "GU"),
            divisionToCountry("us-puerto-rico", "US", "PUERTO RICO", "PR"),
            replaceCity("us-new-york", "US", null, "NEW YORK", "NEW YORK CITY"),
            replaceCity("us-warminster", "US", "PA", "WARMINSTER", "WARMINSTER HEIGHTS"),
            replaceCity("us-lees-summit", "US", "MO", "LEES SUMMIT", "LEE'S SUMMIT")));
      rules.add(replaceDivision(CHILE_SANTIAGO, "CL", "REGION METROPOLITANA DE SANTIAGO", "SANTIAGO METROPOLITAN"));
      rules.add(replaceDivision(GREECE_THESSALY, "GR", "THESSALIA", "THESSALY"));
      rules.add(replaceCity(MEXICO_SAN_LUIS_POTOSI, "MX", null, "SAN LUIS POTOTOSI", "SAN LUIS POTOSI"));
      rules.add(replaceDivision(MEXICO_CITY, "MX", "DISTRITO FEDERAL", "MEXICO CITY"));
      rules.add(replaceCity(TURKEY_CEKMEKOY, "TR", null, "CEKMEKOY", "CEKMEKOEY"));
      rules.add(replaceDivision(NETHERLANDS_NORTH_BRABANT, "NL", "NOORD-BRABANT", "NORTH BRABANT"));
      rules.add(new CorrectionRule(DOMINICAN_SANTO_DOMINGO) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return "DO".equals(record.getCountryCode()) && "SANTO DOMINGO".equals(record.getDivision()) &&
                   record.getCity().equals(record.getDivision());
         }

         @Override
         public void rewrite(LocationRecord record) {
            record.setDivision("NACIONAL");
         }
      });
      rules.add(new CorrectionRule(ISRAEL_DIVISION) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return "IL".equals(record.getCountryCode());
         }

         @Override
         public void rewrite(LocationRecord record) {
            record.setDivision("IL");
         }
      });
      rules.add(japanesePostalCode(japanPostalDash));
      rules.add(new CorrectionRule(CANADA_POSTAL) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return "CA".equals(record.getCountryCode());
         }

         // GeoNames only has the forward sortation area
         @Override
         public void rewrite(LocationRecord record) {
            record.setPostalCode(StringUtils.left(record.getPostalCode(), 3));
         }
      });
      rules.add(new CorrectionRule(TAIWAN_MUNICIPALITY) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            if (!"TW".equals(record.getCountryCode())) {
               return false;
            }
            for (String suffix : TAIWAN_DIVISION_SUFFIXES) {
               if (record.getDivision().endsWith(suffix)) {
                  return true;
               }
            }
            return false;
         }

         @Override
         public void rewrite(LocationRecord record) {
            for (String suffix : TAIWAN_DIVISION_SUFFIXES) {
               if (record.getDivision().endsWith(suffix)) {
                  record.setDivision(StringUtils.removeEnd(record.getDivision(), suffix));
                  return;
               }
            }
         }
      });
      return new CorrectionRules(rules);
   }

   private static CorrectionRule inferCountryFromPostalCode() {
      return new CorrectionRule(POSTAL_COUNTRY) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return record.getCountryCode().length() == 0 && record.getPostalCode().length() > 0;
         }

         @Override
         public void rewrite(LocationRecord record) {
            String postalCode = record.getPostalCode();
            String countryCode = POSTAL_CODE_COUNTRIES.get(postalCode);
            if (countryCode == null) {
               for (Map.Entry<Pattern,String> format : POSTAL_FORMAT_COUNTRIES.entrySet()) {
                  if (format.getKey().matcher(postalCode).matches()) {
                     countryCode = format.getValue();
                     break;
                  }
               }
            }
            if (countryCode != null) {
               record.setCountryCode(countryCode);
            }
         }
      };
   }

   private static CorrectionRule swedishPostalCode() {
      return new CorrectionRule(SWEDEN_POSTAL) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return "SE".equals(record.getCountryCode()) && SWEDEN_POSTAL_PREFIX.matcher(record.getPostalCode()).find();
         }

         // 12345 -> 123 45
         @Override
         public void rewrite(LocationRecord record) {
            String postalCode = record.getPostalCode();
            record.setPostalCode(postalCode.substring(0, 3) + " " + postalCode.substring(3, 5));
         }
      };
   }

   private static CorrectionRule japanesePostalCode(final boolean insertDash) {
      return new CorrectionRule(JAPAN_POSTAL) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return "JP".equals(record.getCountryCode()) && record.getPostalCode().length() == 7;
         }

         @Override
         public void rewrite(LocationRecord record) {
            String postalCode = record.getPostalCode();
            String dashed = postalCode.substring(0, 3) + "-" + postalCode.substring(3, 7);
            if (insertDash) {
               record.setPostalCode(dashed);
            }
            else {
               logger.fine("Leaving Japanese postal code " + postalCode + " as is, not " + dashed);
            }
         }
      };
   }

   private static CorrectionRule divisionToCountry(String name, final String countryCode, final String division, final String newCountryCode) {
      return new CorrectionRule(name) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return countryCode.equals(record.getCountryCode()) && division.equals(record.getDivision());
         }

         @Override
         public void rewrite(LocationRecord record) {
            record.setCountryCode(newCountryCode);
         }
      };
   }

   private static CorrectionRule replaceDivision(String name, final String countryCode, final String division, final String newDivision) {
      return new CorrectionRule(name) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return countryCode.equals(record.getCountryCode()) && division.equals(record.getDivision());
         }

         @Override
         public void rewrite(LocationRecord record) {
            record.setDivision(newDivision);
         }
      };
   }

   /**
    * @param division required division, or null to match any
    */
   private static CorrectionRule replaceCity(String name, final String countryCode, final String division, final String city, final String newCity) {
      return new CorrectionRule(name) {
         @Override
         public boolean appliesTo(LocationRecord record) {
            return countryCode.equals(record.getCountryCode()) &&
                   (division == null || division.equals(record.getDivision())) &&
                   city.equals(record.getCity());
         }

         @Override
         public void rewrite(LocationRecord record) {
            record.setCity(newCity);
         }
      };
   }

   public List<CorrectionRule> getRules() {
      return rules;
   }

   /**
    * @return the rule with the given name, or null
    */
   public CorrectionRule getRule(String name) {
      for (CorrectionRule rule : rules) {
         if (rule.getName().equals(name)) {
            return rule;
         }
      }
      return null;
   }

   /**
    * Run every rule in order against the record, rewriting it in place
    * @return names of the rules that fired
    */
   public List<String> apply(LocationRecord record) {
      List<String> fired = new ArrayList<String>();
      for (CorrectionRule rule : rules) {
         if (rule.apply(record)) {
            fired.add(rule.getName());
         }
      }
      return fired;
   }
}
