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

package com.writejson.internal;

import com.writejson.LogHook;
import com.writejson.Severity;

/**
 * WARNING: this class, and all classes in the .internal package, should not be
 * used by client code. We reserve the right to make incompatible changes to the
 * .internal package at any time.
 */
public class Logging {
  /**
   * Hook which receives all diagnostic messages logged by the library.
   */
  private static volatile LogHook hook = new LogHook.ThresholdLogger(Severity.info);

  /**
   * Specify the LogHook object to process diagnostic messages. Replaces any previous hook.
   */
  public static void setHook(LogHook value) {
    hook = value;
  }

  /**
   * Return the LogHook currently in effect.
   */
  public static LogHook getHook() {
    return hook;
  }

  public static void log(Severity severity, String tag, String message) {
    log(severity, tag, message, null);
  }

  public static void log(Object sender, Severity severity, String tag, String message) {
    log(sender, severity, tag, message, null);
  }

  /**
   * Log a message regarding the internal functioning of the library.
   *
   * @param severity Severity / importance of this message.
   * @param tag An invariant identifier for this message; taken from one of the string
   *     constants below.
   * @param message Human-readable message.
   * @param ex Exception associated with this message, or null.
   */
  public static void log(Severity severity, String tag, String message, Throwable ex) {
    hook.log(severity, tag, message, ex);
  }

  public static void log(Object sender, Severity severity, String tag, String message, Throwable ex) {
    hook.log(sender, severity, tag, message, ex);
  }

  /**
   * Utility class used to limit log messages to a specified rate.
   */
  public static class LogLimiter {
    /**
     * Millisecond timestamp when this limiter last allowed a log event to go through,
     * or null if we never have.
     */
    private Long lastLogTimeMs = null;

    /**
     * Return true if it has been at least minIntervalMs since we last returned true.
     */
    public synchronized boolean allow(long minIntervalMs) {
      long nowMs = WriteJsonUtil.currentTimeMillis();
      if (lastLogTimeMs == null || nowMs >= lastLogTimeMs + minIntervalMs) {
        lastLogTimeMs = nowMs;
        return true;
      } else {
        return false;
      }
    }
  }


  // These constants are used for the tag attribute to log().

  /**
   * A non-finite number was rejected and the enclosing scopes were poisoned.
   */
  public static final String tagScopePoisoned = "user/error/nonFiniteNumber";

  /**
   * A scope was closed while one of its nested scopes was still open. The nested scope
   * was closed first.
   */
  public static final String tagUnclosedChild = "user/error/unclosedChild";

  /**
   * An entry was discarded because its scope had been poisoned.
   */
  public static final String tagSuppressedWrite = "user/info/suppressedWrite";
}
