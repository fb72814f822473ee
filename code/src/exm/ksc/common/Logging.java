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
package exm.ksc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.ksc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String KSC_LOGGER_NAME = "exm.ksc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getKSCLogger()
  {
    return Logger.getLogger(KSC_LOGGER_NAME);
  }

  /**
   * Direct compiler logging to a file.  If no file is given, the
   * configuration from log4j.properties on the classpath stays in effect.
   * @param logfile path of log file, may be empty
   * @param trace log at TRACE level rather than DEBUG
   * @return the compiler logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger kscLogger = getKSCLogger();
    if (StringUtils.isBlank(logfile)) {
      // Even if logging is disabled, this must be valid:
      return kscLogger;
    }

    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      kscLogger.removeAllAppenders();
      kscLogger.addAppender(appender);
      kscLogger.setAdditivity(false);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file \"" +
                                       logfile + "\": " + e.getMessage());
    }
    kscLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return kscLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.of(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getKSCLogger().warn(msg);
    else
      getKSCLogger().debug("Duplicate Warning: " + msg);
  }
}
