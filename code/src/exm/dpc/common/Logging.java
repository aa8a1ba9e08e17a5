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

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.dpc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String DPC_LOGGER_NAME = "exm.dpc";

  public static Logger getDPCLogger()
  {
    return Logger.getLogger(DPC_LOGGER_NAME);
  }

  /**
   * Warnings always go to stderr.  If a log file is given, debug
   * (or trace) output goes there too.
   * @param logfile log file name, or empty for none
   * @param trace enable trace level
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger dpcLogger = getDPCLogger();
    dpcLogger.removeAllAppenders();
    dpcLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
            new PatternLayout("%-5p %m%n"), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    dpcLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
            new PatternLayout("%-5p %c{1} - %m%n"), logfile, false);
        dpcLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                + logfile + ": " + e.getMessage());
      }
      dpcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      dpcLogger.setLevel(Level.WARN);
    }
    return dpcLogger;
  }
}
