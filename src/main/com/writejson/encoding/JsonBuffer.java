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

package com.writejson.encoding;

import java.io.ByteArrayOutputStream;

/**
 * Append-only destination for JSON text. The buffer itself belongs to the caller; a
 * JsonBuffer only ever appends to it, and never reads back what was written.
 *
 * Implementations are not thread-safe.
 */
public abstract class JsonBuffer {
  /**
   * Append a single character.
   */
  public abstract void append(char c);

  /**
   * Append the characters text[start, end).
   */
  public abstract void append(CharSequence text, int start, int end);

  /**
   * Append the decimal representation of a long.
   */
  public abstract void appendLong(long value);

  public void append(CharSequence text) {
    append(text, 0, text.length());
  }

  /**
   * Return a JsonBuffer which appends characters to the given StringBuilder.
   */
  public static JsonBuffer of(StringBuilder builder) {
    return new CharJsonBuffer(builder);
  }

  /**
   * Return a JsonBuffer which appends UTF-8 encoded bytes to the given stream.
   */
  public static JsonBuffer of(ByteArrayOutputStream stream) {
    return new Utf8JsonBuffer(stream);
  }
}
