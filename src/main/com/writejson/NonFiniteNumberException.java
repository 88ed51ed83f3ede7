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
 * Thrown when a NaN or infinite number is written. JSON has no representation for these
 * values; rather than coercing them to null or 0 we refuse to write them.
 *
 * When thrown from a scope writer, the scope (and every enclosing scope) has been poisoned:
 * further entries are discarded, and the finished document should be treated as invalid.
 */
public class NonFiniteNumberException extends WriteJsonException {
  private final double value;

  public NonFiniteNumberException(double value) {
    super("Cannot encode non-finite number " + value + " as JSON");
    this.value = value;
  }

  /**
   * The rejected value: NaN, positive infinity, or negative infinity.
   */
  public double getValue() {
    return value;
  }
}
