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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Miscellaneous utility methods.
 */
public class WriteJsonUtil {
  public static final Charset utf8 = StandardCharsets.UTF_8;

  /**
   * Most recent value passed to setCustomTimeMs, or -1 if no override is in effect.
   */
  private static final AtomicLong customTimeMs = new AtomicLong(-1);

  /**
   * Equivalent to System.currentTimeMillis(), but the return value can be overridden for
   * testing purposes.
   */
  public static long currentTimeMillis() {
    long custom = customTimeMs.get();
    if (custom == -1)
      return System.currentTimeMillis();
    else
      return custom;
  }

  /**
   * Specify the value to be returned by subsequent calls to currentTimeMillis.
   */
  public static void setCustomTimeMs(long value) {
    customTimeMs.set(value);
  }

  /**
   * Advance the current custom time by the specified delta.
   */
  public static void advanceCustomTimeMs(long delta) {
    customTimeMs.addAndGet(delta);
  }

  /**
   * Clear any outstanding setCustomTimeMs override, so that subsequent calls to
   * currentTimeMillis() will return the actual system clock.
   */
  public static void removeCustomTime() {
    customTimeMs.set(-1);
  }
}
