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
package exm.pyparse.parser;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.pyparse.common.Logging;
import exm.pyparse.lexer.Token;

/**
 * Indented rule trace output.  Callers check
 * {@link #isTraceEnabled()} first so that disabled tracing does no
 * string building.
 */
public class LogHelper {
  static final Logger logger = Logger.getLogger(
                          Logging.getLogger().getName() + ".parser");

  public static String location(Token t) {
    return t.line + ":" + t.col + " ";
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, Token at, String msg) {
    log(indent, Level.TRACE, location(at), msg);
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, "", msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
