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
package exm.sweep.common;

import java.util.Properties;

import exm.sweep.common.exceptions.InvalidOptionException;

/**
 * General engine settings.
 *
 * Defaults are set here and can be overridden by Java system properties
 * of the same name, or programmatically with {@link #set(String, String)}.
 */
public class Settings
{
  public static final String MAX_ITERATIONS = "sweep.max-iterations";
  /** Deadline for one file in milliseconds, 0 for none */
  public static final String DEADLINE_MILLIS = "sweep.deadline-ms";
  public static final String THREADS = "sweep.threads";

  public static final String SIMPLIFY_MAX_PASSES = "sweep.simplify.max-passes";
  public static final String SIMPLIFY_CONSTANT_FOLD =
                                      "sweep.simplify.constant-fold";
  public static final String SIMPLIFY_BRANCH_PRUNE =
                                      "sweep.simplify.branch-prune";
  public static final String SIMPLIFY_UNREACHABLE =
                                      "sweep.simplify.unreachable";
  public static final String SIMPLIFY_UNUSED_BINDINGS =
                                      "sweep.simplify.unused-bindings";

  public static final String LOG_FILE = "sweep.log.file";
  public static final String LOG_TRACE = "sweep.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(MAX_ITERATIONS, "100");
    defaults.setProperty(DEADLINE_MILLIS, "0");
    defaults.setProperty(THREADS, "4");

    defaults.setProperty(SIMPLIFY_MAX_PASSES, "10");
    defaults.setProperty(SIMPLIFY_CONSTANT_FOLD, "true");
    defaults.setProperty(SIMPLIFY_BRANCH_PRUNE, "true");
    defaults.setProperty(SIMPLIFY_UNREACHABLE, "true");
    defaults.setProperty(SIMPLIFY_UNUSED_BINDINGS, "true");

    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static synchronized void initSweepProperties()
                                      throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static synchronized void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Restore a key to its default value
   */
  public static synchronized void reset(String key) {
    properties.remove(key);
  }

  private static void validateProperties() throws InvalidOptionException {
    getPositiveLong(MAX_ITERATIONS);
    getPositiveLong(SIMPLIFY_MAX_PASSES);
    getPositiveLong(THREADS);
    getLong(DEADLINE_MILLIS);
  }

  public static synchronized String get(String key) {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) {
    String val = get(key);
    if (val == null) {
      return false;
    }
    val = val.trim();
    return val.equalsIgnoreCase("true") || val.equals("1")
        || val.equalsIgnoreCase("yes");
  }

  public static long getLong(String key) throws InvalidOptionException {
    String val = get(key);
    if (val == null) {
      throw new InvalidOptionException("Option " + key + " was not set");
    }
    try {
      return Long.parseLong(val.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Invalid integer value for " + key
                                       + ": \"" + val + "\"");
    }
  }

  public static long getPositiveLong(String key)
                                      throws InvalidOptionException {
    long val = getLong(key);
    if (val <= 0) {
      throw new InvalidOptionException("Option " + key
                        + " must be positive, but was " + val);
    }
    return val;
  }
}
