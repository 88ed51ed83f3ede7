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

import com.google.common.base.Preconditions;

/**
 * JsonBuffer backed by a caller-owned StringBuilder.
 */
public class CharJsonBuffer extends JsonBuffer {
  private final StringBuilder builder;

  public CharJsonBuffer(StringBuilder builder) {
    this.builder = Preconditions.checkNotNull(builder, "builder");
  }

  @Override public void append(char c) {
    builder.append(c);
  }

  @Override public void append(CharSequence text, int start, int end) {
    builder.append(text, start, end);
  }

  @Override public void appendLong(long value) {
    builder.append(value);
  }
}
