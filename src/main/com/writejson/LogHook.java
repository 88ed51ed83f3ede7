/*
 * Scalyr client library
 * Copyright 2012 Scalyr, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.writejson;

import java.util.Date;

import com.google.common.base.Throwables;
import com.writejson.internal.Logging;

/**
 * A LogHook receives all diagnostic messages logged by the write-json library.
 */
public abstract class LogHook {
  /**
   * Log a message regarding the internal functioning of the library.
   *
   * @param severity Severity / importance of this message.
   * @param tag An invariant identifier for this message.
   * @param message Human-readable message.
   * @param ex Exception associated with this message, or null.
   */
  public abstract void log(Severity severity, String tag, String message, Throwable ex);

  /**
   * Log a message regarding the internal functioning of the library. Messages with no
   * specific sender may be sent to the other overload of log().
   *
   * @param sender Scope writer (or other internal object) which generated this message, or null.
   * @param severity Severity / importance of this message.
   * @param tag An invariant identifier for this message.
   * @param message Human-readable message.
   * @param ex Exception associated with this message, or null.
   */
  public void log(Object sender, Severity severity, String tag, String message, Throwable ex) {
    log(severity, tag, message, ex);
  }

  /**
   * Default hook: prints messages at or above a minimum severity to stdout. Output is limited
   * to one line per minIntervalMs; when messages are dropped, a warning says so (at most once
   * per DIAGNOSTIC_OVERFLOW_WARNING_INTERVAL_MS).
   */
  public static class ThresholdLogger extends LogHook {
    private final Severity minSeverity;

    private final long minIntervalMs;

    private final Logging.LogLimiter outputLimiter = new Logging.LogLimiter();

    private final Logging.LogLimiter overflowLimiter = new Logging.LogLimiter();

    /**
     * Printed between the date and the tag.
     */
    private final String prefix;

    public ThresholdLogger(Severity minSeverity) {
      this(minSeverity, TuningConstants.MIN_DIAGNOSTIC_MESSAGE_INTERVAL_MS);
    }

    public ThresholdLogger(Severity minSeverity, long minIntervalMs) {
      this(minSeverity, minIntervalMs, ": ");
    }

    public ThresholdLogger(Severity minSeverity, long minIntervalMs, String prefix) {
      this.minSeverity = minSeverity;
      this.minIntervalMs = minIntervalMs;
      this.prefix = prefix;
    }

    @Override public void log(Severity severity, String tag, String message, Throwable ex) {
      if (severity.ordinal() < minSeverity.ordinal())
        return;

      if (outputLimiter.allow(minIntervalMs)) {
        System.out.println(new Date() + prefix + tag + " (" + message + ")");
        if (ex != null)
          System.out.print(Throwables.getStackTraceAsString(ex));
      } else if (overflowLimiter.allow(TuningConstants.DIAGNOSTIC_OVERFLOW_WARNING_INTERVAL_MS)) {
        System.out.println(new Date() + ": WARNING -- diagnostic messages are arriving more often than once per "
            + minIntervalMs + " ms; temporarily throttling output");
      }
    }
  }

  /**
   * Specify the LogHook object to process diagnostic messages logged by the library.
   * Replaces any previous hook.
   */
  public static void setHook(LogHook value) {
    Logging.setHook(value);
  }
}
