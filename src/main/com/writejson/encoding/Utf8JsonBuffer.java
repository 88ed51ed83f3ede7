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

import com.google.common.base.Preconditions;
import com.writejson.internal.WriteJsonUtil;

/**
 * JsonBuffer backed by a caller-owned ByteArrayOutputStream. Text is written in UTF-8, with no
 * byte order mark.
 */
public class Utf8JsonBuffer extends JsonBuffer {
  private final ByteArrayOutputStream out;

  public Utf8JsonBuffer(ByteArrayOutputStream out) {
    this.out = Preconditions.checkNotNull(out, "out");
  }

  @Override public void append(char c) {
    if (c < 0x80)
      out.write(c);
    else
      writeUTF8(String.valueOf(c));
  }

  @Override public void append(CharSequence text, int start, int end) {
    // ASCII is copied byte-for-byte; anything else goes through the charset encoder so that
    // surrogate pairs come out as a single 4-byte sequence.
    int runStart = start;
    while (runStart < end) {
      int pos = runStart;
      while (pos < end && text.charAt(pos) < 0x80)
        out.write(text.charAt(pos++));

      if (pos == end)
        return;

      int nonAsciiEnd = pos;
      while (nonAsciiEnd < end && text.charAt(nonAsciiEnd) >= 0x80)
        nonAsciiEnd++;

      writeUTF8(text.subSequence(pos, nonAsciiEnd).toString());
      runStart = nonAsciiEnd;
    }
  }

  @Override public void appendLong(long value) {
    // Digits and '-' are all ASCII.
    String digits = Long.toString(value);
    for (int i = 0; i < digits.length(); i++)
      out.write(digits.charAt(i));
  }

  private void writeUTF8(String text) {
    out.writeBytes(text.getBytes(WriteJsonUtil.utf8));
  }
}
