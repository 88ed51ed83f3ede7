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

import com.google.common.base.Preconditions;
import com.writejson.encoding.JsonBuffer;
import com.writejson.encoding.JsonEscaper;
import com.writejson.encoding.JsonNumbers;

/**
 * Writes the entries of a JSON object. Each entry is a key followed by one value; entries are
 * written in call order, and duplicate keys are written as given.
 * <p>
 * Methods return this object, so calls can be chained. See JsonScope for the nesting and
 * error-handling rules.
 */
public class JsonObjectWriter extends JsonScope {
  JsonObjectWriter(JsonBuffer buffer, JsonOptions options, JsonScope parent) {
    super(buffer, options, parent, "object", '{', '}');
  }

  public JsonObjectWriter nullValue(String key) {
    if (startField(key)) {
      writeKey(key);
      buffer.append("null");
    }
    return this;
  }

  public JsonObjectWriter bool(String key, boolean value) {
    if (startField(key)) {
      writeKey(key);
      buffer.append(value ? "true" : "false");
    }
    return this;
  }

  public JsonObjectWriter number(String key, long value) {
    if (startField(key)) {
      writeKey(key);
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  /**
   * Write a numeric entry.
   *
   * @throws NonFiniteNumberException if value is NaN or infinite. Nothing is written, and this
   *     scope is poisoned.
   */
  public JsonObjectWriter number(String key, double value) {
    if (startField(key)) {
      checkFinite(value);
      writeKey(key);
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  public JsonObjectWriter number(String key, float value) {
    if (startField(key)) {
      checkFinite(value);
      writeKey(key);
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  /**
   * Write a string entry. A null value is written as JSON null.
   */
  public JsonObjectWriter string(String key, String value) {
    if (startField(key)) {
      writeKey(key);
      writeString(value);
    }
    return this;
  }

  /**
   * Write an entry whose value is already-serialized JSON, copied verbatim.
   */
  public JsonObjectWriter raw(String key, RawJson value) {
    Preconditions.checkNotNull(value, "value");
    if (startField(key)) {
      writeKey(key);
      buffer.append(value.getJson());
    }
    return this;
  }

  public JsonObjectWriter raw(String key, String json) {
    return raw(key, new RawJson(json));
  }

  /**
   * Write an entry of any supported type: null, Boolean, String (or other CharSequence),
   * Character, RawJson, Double, Float, Integer, Long, Short, Byte, AtomicInteger, AtomicLong,
   * or a Map, Iterable or array of supported values. Map keys are converted with
   * String.valueOf.
   *
   * @throws IllegalArgumentException if the value's type is not supported.
   * @throws NonFiniteNumberException if the value is, or contains, NaN or an infinity.
   */
  public JsonObjectWriter entry(String key, Object value) {
    if (startField(key)) {
      checkValue(value);
      writeKey(key);
      writeValue(value);
    }
    return this;
  }

  /**
   * Begin a nested object under the given key. This object accepts no further calls until the
   * returned writer is closed.
   */
  public JsonObjectWriter object(String key) {
    if (startField(key))
      writeKey(key);
    return new JsonObjectWriter(buffer, options, this);
  }

  /**
   * Begin a nested array under the given key. This object accepts no further calls until the
   * returned writer is closed.
   */
  public JsonArrayWriter array(String key) {
    if (startField(key))
      writeKey(key);
    return new JsonArrayWriter(buffer, options, this);
  }

  /**
   * Write a nested object under the given key, filled in by body. The nested object is closed
   * when body returns or throws.
   */
  public JsonObjectWriter object(String key, Callback<JsonObjectWriter> body) {
    Preconditions.checkNotNull(body, "body");
    JsonObjectWriter child = object(key);
    try {
      body.run(child);
    } finally {
      child.close();
    }
    return this;
  }

  /**
   * Write a nested array under the given key, filled in by body. The nested array is closed
   * when body returns or throws.
   */
  public JsonObjectWriter array(String key, Callback<JsonArrayWriter> body) {
    Preconditions.checkNotNull(body, "body");
    JsonArrayWriter child = array(key);
    try {
      body.run(child);
    } finally {
      child.close();
    }
    return this;
  }

  private boolean startField(String key) {
    Preconditions.checkNotNull(key, "key");
    return startEntry();
  }

  private void writeKey(String key) {
    writeSeparator();
    JsonEscaper.writeQuoted(buffer, key, options);
    buffer.append(':');
  }
}
