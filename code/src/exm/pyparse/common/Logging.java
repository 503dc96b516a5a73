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

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

public class Logging
{
  private static final String PYPARSE_LOGGER_NAME = "exm.pyparse";

  private static final String FILE_PATTERN = "%-5p %c{1} %m%n";
  private static final String CONSOLE_PATTERN = "%p: %m%n";

  /**
   * Messages already emitted.
   */
  static final SetMultimap<Level, String> emitted = HashMultimap.create();

  public static Logger getLogger()
  {
    return Logger.getLogger(PYPARSE_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  Warnings always go to stderr;
   * debug output goes to the log file if one is given.
   * @param logfile log file path, or empty/null to disable file logging
   * @param trace if true, enable TRACE level
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger logger = getLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
                            new PatternLayout(CONSOLE_PATTERN),
                            ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        logger.addAppender(appender);
        logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
      } catch (IOException e) {
        logger.setLevel(Level.WARN);
        logger.warn("Could not open log file: " + logfile + ": " +
                    e.getMessage());
      }
    } else {
      // Even if logging is disabled, this must be valid:
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.put(level, msg);
    }
  }

  /**
   * Forget emitted messages, so that the next input warns afresh
   */
  public static void clearEmitted()
  {
    synchronized (emitted) {
      emitted.clear();
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLogger().warn(msg);
    else
      getLogger().debug("Duplicate Warning: " + msg);
  }
}
