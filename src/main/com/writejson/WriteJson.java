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

import java.io.ByteArrayOutputStream;

import com.google.common.base.Preconditions;
import com.writejson.encoding.JsonBuffer;
import com.writejson.encoding.JsonEscaper;
import com.writejson.encoding.JsonNumbers;

/**
 * Entry points for writing JSON into a caller-owned buffer.
 * <p>
 * object() and array() write the opening delimiter immediately and return the root scope:
 *
 * <pre>
 *   StringBuilder buf = new StringBuilder();
 *   try (JsonObjectWriter obj = WriteJson.object(buf)) {
 *     obj.string("name", "Peter").number("favorite number", 92.0);
 *   }
 *   // buf is now {"name":"Peter","favorite number":92}
 * </pre>
 *
 * Output is compact RFC 8259 JSON: no whitespace, no trailing newline. Byte buffers receive
 * UTF-8 with no byte order mark.
 */
public final class WriteJson {
  private WriteJson() {
  }

  public static JsonObjectWriter object(StringBuilder buf) {
    return object(JsonBuffer.of(buf), JsonOptions.DEFAULT);
  }

  public static JsonObjectWriter object(StringBuilder buf, JsonOptions options) {
    return object(JsonBuffer.of(buf), options);
  }

  public static JsonObjectWriter object(ByteArrayOutputStream buf) {
    return object(JsonBuffer.of(buf), JsonOptions.DEFAULT);
  }

  public static JsonObjectWriter object(ByteArrayOutputStream buf, JsonOptions options) {
    return object(JsonBuffer.of(buf), options);
  }

  public static JsonObjectWriter object(JsonBuffer buf) {
    return object(buf, JsonOptions.DEFAULT);
  }

  public static JsonObjectWriter object(JsonBuffer buf, JsonOptions options) {
    return new JsonObjectWriter(buf, options, null);
  }

  public static JsonArrayWriter array(StringBuilder buf) {
    return array(JsonBuffer.of(buf), JsonOptions.DEFAULT);
  }

  public static JsonArrayWriter array(StringBuilder buf, JsonOptions options) {
    return array(JsonBuffer.of(buf), options);
  }

  public static JsonArrayWriter array(ByteArrayOutputStream buf) {
    return array(JsonBuffer.of(buf), JsonOptions.DEFAULT);
  }

  public static JsonArrayWriter array(ByteArrayOutputStream buf, JsonOptions options) {
    return array(JsonBuffer.of(buf), options);
  }

  public static JsonArrayWriter array(JsonBuffer buf) {
    return array(buf, JsonOptions.DEFAULT);
  }

  public static JsonArrayWriter array(JsonBuffer buf, JsonOptions options) {
    return new JsonArrayWriter(buf, options, null);
  }

  // Top-level scalars. These write a complete JSON document consisting of a single value.

  public static void nullValue(StringBuilder buf) {
    buf.append("null");
  }

  public static void bool(StringBuilder buf, boolean value) {
    buf.append(value ? "true" : "false");
  }

  public static void number(StringBuilder buf, long value) {
    JsonNumbers.write(JsonBuffer.of(buf), value);
  }

  /**
   * @throws NonFiniteNumberException if value is NaN or infinite; nothing is written.
   */
  public static void number(StringBuilder buf, double value) {
    JsonNumbers.write(JsonBuffer.of(buf), value);
  }

  /**
   * Write a string literal. A null value is written as JSON null.
   */
  public static void string(StringBuilder buf, String value) {
    if (value == null)
      nullValue(buf);
    else
      JsonEscaper.writeQuoted(JsonBuffer.of(buf), value, JsonOptions.DEFAULT);
  }

  /**
   * Convert a value to JSON text. Accepts the same types as JsonObjectWriter.entry().
   *
   * @throws IllegalArgumentException if the value is, or contains, an unsupported type.
   * @throws NonFiniteNumberException if the value is, or contains, NaN or an infinity.
   */
  public static String toJsonString(Object value) {
    return toJsonString(value, JsonOptions.DEFAULT);
  }

  public static String toJsonString(Object value, JsonOptions options) {
    Preconditions.checkNotNull(options, "options");
    StringBuilder buf = new StringBuilder();
    JsonScope.writeValue(JsonBuffer.of(buf), options, null, value);
    return buf.toString();
  }
}
