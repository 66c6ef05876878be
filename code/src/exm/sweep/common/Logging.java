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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sweep.common.util.Pair;

public class Logging {
  private static final String SWEEP_LOGGER_NAME = "exm.sweep";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getSweepLogger() {
    return Logger.getLogger(SWEEP_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  With no log file, only warnings and
   * above go to stderr.
   * @param logfile file to log to, may be null or empty
   * @param trace if true, log at trace level to the file
   * @return the configured logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace) {
    Logger sweepLogger = getSweepLogger();
    sweepLogger.removeAllAppenders();
    sweepLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    ConsoleAppender console = new ConsoleAppender(layout,
                                        ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    sweepLogger.addAppender(console);

    if (StringUtils.isBlank(logfile)) {
      sweepLogger.setLevel(Level.WARN);
      return sweepLogger;
    }

    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      sweepLogger.addAppender(appender);
      sweepLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } catch (IOException e) {
      sweepLogger.setLevel(Level.WARN);
      sweepLogger.warn("Could not open log file " + logfile + ": "
                       + e.getMessage());
    }
    return sweepLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getSweepLogger().warn(msg);
    } else {
      Logging.getSweepLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
