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
import com.writejson.encoding.JsonNumbers;

/**
 * Writes the elements of a JSON array, in call order.
 * <p>
 * Methods return this object, so calls can be chained. See JsonScope for the nesting and
 * error-handling rules.
 */
public class JsonArrayWriter extends JsonScope {
  JsonArrayWriter(JsonBuffer buffer, JsonOptions options, JsonScope parent) {
    super(buffer, options, parent, "array", '[', ']');
  }

  public JsonArrayWriter nullValue() {
    if (startEntry()) {
      writeSeparator();
      buffer.append("null");
    }
    return this;
  }

  public JsonArrayWriter bool(boolean value) {
    if (startEntry()) {
      writeSeparator();
      buffer.append(value ? "true" : "false");
    }
    return this;
  }

  public JsonArrayWriter number(long value) {
    if (startEntry()) {
      writeSeparator();
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  /**
   * Write a numeric element.
   *
   * @throws NonFiniteNumberException if value is NaN or infinite. Nothing is written, and this
   *     scope is poisoned.
   */
  public JsonArrayWriter number(double value) {
    if (startEntry()) {
      checkFinite(value);
      writeSeparator();
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  public JsonArrayWriter number(float value) {
    if (startEntry()) {
      checkFinite(value);
      writeSeparator();
      JsonNumbers.write(buffer, value);
    }
    return this;
  }

  /**
   * Write a string element. A null value is written as JSON null.
   */
  public JsonArrayWriter string(String value) {
    if (startEntry()) {
      writeSeparator();
      writeString(value);
    }
    return this;
  }

  public JsonArrayWriter raw(RawJson value) {
    Preconditions.checkNotNull(value, "value");
    if (startEntry()) {
      writeSeparator();
      buffer.append(value.getJson());
    }
    return this;
  }

  public JsonArrayWriter raw(String json) {
    return raw(new RawJson(json));
  }

  /**
   * Write an element of any type supported by JsonObjectWriter.entry().
   */
  public JsonArrayWriter value(Object value) {
    if (startEntry()) {
      checkValue(value);
      writeSeparator();
      writeValue(value);
    }
    return this;
  }

  public JsonObjectWriter object() {
    if (startEntry())
      writeSeparator();
    return new JsonObjectWriter(buffer, options, this);
  }

  public JsonArrayWriter array() {
    if (startEntry())
      writeSeparator();
    return new JsonArrayWriter(buffer, options, this);
  }

  public JsonArrayWriter object(Callback<JsonObjectWriter> body) {
    Preconditions.checkNotNull(body, "body");
    JsonObjectWriter child = object();
    try {
      body.run(child);
    } finally {
      child.close();
    }
    return this;
  }

  public JsonArrayWriter array(Callback<JsonArrayWriter> body) {
    Preconditions.checkNotNull(body, "body");
    JsonArrayWriter child = array();
    try {
      body.run(child);
    } finally {
      child.close();
    }
    return this;
  }
}
