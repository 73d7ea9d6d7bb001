/*
 * Copyright (C) 2026 Paul Hodges
 *
 * This file is part of PolarDynamics.
 *
 * PolarDynamics is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PolarDynamics is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PolarDynamics. If not, see https://www.gnu.org/licenses/.
 */

package org.curtinfrc.polar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide log facade. Messages go to SLF4J by default, or straight to the console when a host
 * has no logging backend.
 */
public final class PolarLog {
  public static enum LogType {
    kSYSOUT,
    kSLF4J
  }

  private static final Logger LOGGER = LoggerFactory.getLogger("PolarDynamics");

  private static volatile LogType logType = LogType.kSLF4J;
  private static volatile boolean enabled = true;

  private PolarLog() {}

  public static void setLogType(LogType type) {
    logType = type;
  }

  public static LogType getLogType() {
    return logType;
  }

  public static void setEnabled(boolean enable) {
    enabled = enable;
  }

  public static boolean isEnabled() {
    return enabled;
  }

  public static void log(String message) {
    log(message, logType);
  }

  public static void log(String message, LogType type) {
    if (!enabled) {
      return;
    }
    switch (type) {
      case kSYSOUT:
        System.out.println(message);
        break;
      case kSLF4J:
        LOGGER.info(message);
        break;
      default:
        System.err.println("Unknown log type: " + type);
    }
  }

  public static void warn(String message) {
    if (!enabled) {
      return;
    }
    switch (logType) {
      case kSYSOUT:
        System.err.println("WARN " + message);
        break;
      case kSLF4J:
        LOGGER.warn(message);
        break;
      default:
        System.err.println("Unknown log type: " + logType);
    }
  }

  /** Reports an error. Errors are never suppressed by {@link #setEnabled}. */
  public static void error(String message, Throwable cause) {
    switch (logType) {
      case kSYSOUT:
        System.err.println("ERROR " + message);
        if (cause != null) {
          cause.printStackTrace(System.err);
        }
        break;
      case kSLF4J:
        LOGGER.error(message, cause);
        break;
      default:
        System.err.println("Unknown log type: " + logType);
    }
  }

  public static void error(String message) {
    error(message, null);
  }
}
