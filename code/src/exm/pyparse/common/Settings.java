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

package exm.pyparse.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.pyparse.common.exceptions.InvalidOptionException;

/**
 * General parser settings.  Defaults are set here and can be
 * overridden with Java system properties of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "pyparse.log.file";
  public static final String LOG_TRACE = "pyparse.log.trace";

  /** Packrat memo cache in the parser */
  public static final String PARSER_MEMOIZE = "pyparse.parser.memoize";
  /** Column width of a tab stop when measuring indentation */
  public static final String TAB_SIZE = "pyparse.tokenizer.tab-size";

  /** Default indent for tree dumps: negative means single line */
  public static final String DUMP_INDENT = "pyparse.dump.indent";
  public static final String DUMP_ATTRIBUTES = "pyparse.dump.attributes";

  public static final int MAX_TAB_SIZE = 100;
  public static final int MIN_DUMP_INDENT = -1;
  public static final int MAX_DUMP_INDENT = 100;

  public static final String INPUT_FILENAME = "pyparse.input_filename";
  public static final String OUTPUT_FILENAME = "pyparse.output_filename";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PARSER_MEMOIZE, "true");
    defaults.setProperty(TAB_SIZE, "8");
    defaults.setProperty(DUMP_INDENT, "-1");
    defaults.setProperty(DUMP_ATTRIBUTES, "false");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Restore the default for a key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PARSER_MEMOIZE);
    getBoolean(DUMP_ATTRIBUTES);
    getInt(DUMP_INDENT, MIN_DUMP_INDENT, MAX_DUMP_INDENT);
    getInt(TAB_SIZE, 1, MAX_TAB_SIZE);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    val = val.trim();
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
                          key + ": " + val);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    try {
      return Long.parseLong(val.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Expected integer value for " +
          "option " + key + " but got: " + val);
    }
  }

  /**
   * Integer option within the given inclusive bounds
   * @throws InvalidOptionException if malformed or out of range
   */
  public static int getInt(String key, int min, int max)
                                    throws InvalidOptionException {
    long val = getLong(key);
    if (val < min || val > max) {
      throw new InvalidOptionException("Option " + key + " must be " +
          "between " + min + " and " + max + ", was: " + get(key).trim());
    }
    return (int) val;
  }
}
