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

import com.google.common.base.MoreObjects;

/**
 * Escaping options for string literals. The default writes every character that JSON permits
 * unescaped as-is; the optional escapes make output safe to embed in other contexts (HTML
 * script blocks, JavaScript source, terminals).
 *
 * Nested scopes use the options of the scope that opened them.
 */
public final class JsonOptions {
  public static final JsonOptions DEFAULT = builder().build();

  /**
   * If true, DEL and the C1 control characters (U+007F through U+009F) are written as
   * unicode escapes.
   */
  public final boolean escapeC1Controls;

  /**
   * If true, U+2028 and U+2029 are written as unicode escapes. These are legal in JSON
   * strings but terminate a line in older JavaScript engines.
   */
  public final boolean escapeLineSeparators;

  /**
   * If true, '/' is written as \/, so that "</script>" can never appear in the output.
   */
  public final boolean escapeSlash;

  private JsonOptions(Builder builder) {
    this.escapeC1Controls = builder.escapeC1Controls;
    this.escapeLineSeparators = builder.escapeLineSeparators;
    this.escapeSlash = builder.escapeSlash;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Return a builder initialized with this object's settings.
   */
  public Builder toBuilder() {
    return new Builder()
        .escapeC1Controls(escapeC1Controls)
        .escapeLineSeparators(escapeLineSeparators)
        .escapeSlash(escapeSlash);
  }

  @Override public boolean equals(Object obj) {
    if (!(obj instanceof JsonOptions))
      return false;

    JsonOptions other = (JsonOptions) obj;
    return escapeC1Controls == other.escapeC1Controls
        && escapeLineSeparators == other.escapeLineSeparators
        && escapeSlash == other.escapeSlash;
  }

  @Override public int hashCode() {
    return (escapeC1Controls ? 1 : 0) | (escapeLineSeparators ? 2 : 0) | (escapeSlash ? 4 : 0);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("escapeC1Controls", escapeC1Controls)
        .add("escapeLineSeparators", escapeLineSeparators)
        .add("escapeSlash", escapeSlash)
        .toString();
  }

  public static class Builder {
    private boolean escapeC1Controls;
    private boolean escapeLineSeparators;
    private boolean escapeSlash;

    public Builder escapeC1Controls(boolean value) {
      escapeC1Controls = value;
      return this;
    }

    public Builder escapeLineSeparators(boolean value) {
      escapeLineSeparators = value;
      return this;
    }

    public Builder escapeSlash(boolean value) {
      escapeSlash = value;
      return this;
    }

    public JsonOptions build() {
      return new JsonOptions(this);
    }
  }
}
