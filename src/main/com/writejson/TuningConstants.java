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

/**
 * Tunable parameters.
 */
public class TuningConstants {
  /**
   * Minimum interval between lines printed to stdout by the default LogHook.
   */
  public static final long MIN_DIAGNOSTIC_MESSAGE_INTERVAL_MS = 100;

  /**
   * Minimum interval between warnings that diagnostic output is being throttled.
   */
  public static final long DIAGNOSTIC_OVERFLOW_WARNING_INTERVAL_MS = 60000;

  /**
   * Minimum interval between "write suppressed" messages issued by a single poisoned scope
   * tree. Callers that ignore a NonFiniteNumberException can keep writing into a dead
   * document for a long time; we only need to tell them once in a while.
   */
  public static final long SUPPRESSED_WRITE_LOG_INTERVAL_MS = 10000;
}
