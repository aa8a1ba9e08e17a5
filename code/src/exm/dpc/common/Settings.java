/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.dpc.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.dpc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Defaults are set here and can be
 * overridden with Java system properties of the same name.
 *
 * Passes never read this class directly: the driver takes a snapshot
 * with {@link CompileOptions#fromSettings()} and hands that down.
 * */
public class Settings
{
  public static final String LAYOUT_STAGES = "dpc.layout.stages";
  public static final String LAYOUT_MAX_TABLES = "dpc.layout.max-tables";
  public static final String LAYOUT_MAX_ALU = "dpc.layout.max-alu";
  public static final String LAYOUT_MAX_KEY_WIDTH = "dpc.layout.max-key-width";
  public static final String LAYOUT_MAX_HASH = "dpc.layout.max-hash";
  /* Which layout strategy: "current" or "legacy" */
  public static final String LAYOUT_STRATEGY = "dpc.layout.strategy";
  /* Max branch decisions that may guard a table call */
  public static final String LAYOUT_MAX_CALL_DEPTH =
                                          "dpc.layout.max-call-depth";
  public static final String LAYOUT_REPORT_FILE = "dpc.layout.report-file";

  public static final String OPT_CONST_BRANCH_VARS =
                                          "dpc.opt.const-branch-vars";
  public static final String OPT_DEDUP = "dpc.opt.dedup";
  // Dedup all actions, not just those with scarce operations
  public static final String OPT_DEDUP_ALL = "dpc.opt.dedup-all";

  public static final String IC_OUTPUT_FILE = "dpc.ic.output-file";
  public static final String GRAPH_DIR = "dpc.graph-dir";

  public static final String INPUT_FILENAME = "dpc.input_filename";
  public static final String OUTPUT_FILENAME = "dpc.output_filename";

  public static final String LOG_FILE = "dpc.log.file";
  public static final String LOG_TRACE = "dpc.log.trace";
  public static final String COMPILER_DEBUG = "dpc.compiler-debug";

  public static final String STRATEGY_CURRENT = "current";
  public static final String STRATEGY_LEGACY = "legacy";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    // Resource model: roughly a Tofino ingress pipeline
    defaults.setProperty(LAYOUT_STAGES, "12");
    defaults.setProperty(LAYOUT_MAX_TABLES, "16");
    defaults.setProperty(LAYOUT_MAX_ALU, "4");
    defaults.setProperty(LAYOUT_MAX_KEY_WIDTH, "512");
    defaults.setProperty(LAYOUT_MAX_HASH, "6");
    defaults.setProperty(LAYOUT_STRATEGY, STRATEGY_CURRENT);
    defaults.setProperty(LAYOUT_MAX_CALL_DEPTH, "2");
    defaults.setProperty(LAYOUT_REPORT_FILE, "");

    defaults.setProperty(OPT_CONST_BRANCH_VARS, "true");
    defaults.setProperty(OPT_DEDUP, "true");
    defaults.setProperty(OPT_DEDUP_ALL, "false");

    defaults.setProperty(IC_OUTPUT_FILE, "");
    defaults.setProperty(GRAPH_DIR, "");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(COMPILER_DEBUG, "true");

    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initDPCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties(properties);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * @return flat copy of current values
   */
  static Properties snapshot() {
    return flatten(properties);
  }

  /**
   * @return flat copy of default values
   */
  static Properties defaultSnapshot() {
    return flatten(defaults);
  }

  private static Properties flatten(Properties props) {
    Properties copy = new Properties();
    for (String key: props.stringPropertyNames()) {
      copy.setProperty(key, props.getProperty(key));
    }
    return copy;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  static void validateProperties(Properties props)
                                        throws InvalidOptionException {
    checkPositive(props, LAYOUT_STAGES);
    checkPositive(props, LAYOUT_MAX_TABLES);
    getInt(props, LAYOUT_MAX_ALU);
    getInt(props, LAYOUT_MAX_KEY_WIDTH);
    getInt(props, LAYOUT_MAX_HASH);
    getInt(props, LAYOUT_MAX_CALL_DEPTH);
    getBoolean(props, OPT_CONST_BRANCH_VARS);
    getBoolean(props, OPT_DEDUP);
    getBoolean(props, OPT_DEDUP_ALL);
    getBoolean(props, LOG_TRACE);
    getBoolean(props, COMPILER_DEBUG);

    checkOneOf(props, LAYOUT_STRATEGY,
               Arrays.asList(STRATEGY_CURRENT, STRATEGY_LEGACY));
  }

  private static void checkPositive(Properties props, String key)
      throws InvalidOptionException {
    if (getInt(props, key) <= 0) {
      throw new InvalidOptionException("Expected property " + key +
            " to be positive but was " + props.getProperty(key));
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(Properties props, String key,
            List<String> validVals) throws InvalidOptionException {
    String val = props.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + validVals + " but was '" + val + "'");
  }

  public static int getInt(String key) throws InvalidOptionException {
    return getInt(properties, key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    return getBoolean(properties, key);
  }

  static int getInt(Properties props, String key)
                                throws InvalidOptionException {
    String strVal = props.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  static boolean getBoolean(Properties props, String key)
                  throws InvalidOptionException {
    String strVal = props.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
