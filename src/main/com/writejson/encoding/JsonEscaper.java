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

import com.writejson.JsonOptions;

/**
 * Encodes text as a JSON string literal.
 */
public class JsonEscaper {
  private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

  /**
   * Return the given text as a double-quoted JSON string literal, using default options.
   */
  public static String quote(CharSequence text) {
    return quote(text, JsonOptions.DEFAULT);
  }

  public static String quote(CharSequence text, JsonOptions options) {
    StringBuilder sb = new StringBuilder(text.length() + 2);
    writeQuoted(JsonBuffer.of(sb), text, options);
    return sb.toString();
  }

  /**
   * Append text to out as a double-quoted JSON string literal. Characters which need no
   * escaping are copied in runs, so text with nothing to escape costs a single append.
   */
  public static void writeQuoted(JsonBuffer out, CharSequence text, JsonOptions options) {
    out.append('"');

    int runStart = 0;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      if (!needsEscape(c, options))
        continue;

      if (runStart < i)
        out.append(text, runStart, i);
      writeEscape(out, c);
      runStart = i + 1;
    }

    if (runStart < length)
      out.append(text, runStart, length);

    out.append('"');
  }

  /**
   * Return true if c may not appear literally in a string literal written with the given options.
   */
  public static boolean needsEscape(char c, JsonOptions options) {
    if (c < 0x20 || c == '"' || c == '\\')
      return true;
    if (c < 0x7F)
      return c == '/' && options.escapeSlash;
    if (c <= 0x9F)
      return options.escapeC1Controls;
    if (c == '\u2028' || c == '\u2029')
      return options.escapeLineSeparators;
    return false;
  }

  private static void writeEscape(JsonBuffer out, char c) {
    out.append('\\');
    switch (c) {
    case '"':
      out.append('"');
      break;
    case '\\':
      out.append('\\');
      break;
    case '/':
      out.append('/');
      break;
    case '\b':
      out.append('b');
      break;
    case '\f':
      out.append('f');
      break;
    case '\n':
      out.append('n');
      break;
    case '\r':
      out.append('r');
      break;
    case '\t':
      out.append('t');
      break;
    default:
      out.append('u');
      out.append(HEX_DIGITS[(c >> 12) & 0xF]);
      out.append(HEX_DIGITS[(c >> 8) & 0xF]);
      out.append(HEX_DIGITS[(c >> 4) & 0xF]);
      out.append(HEX_DIGITS[c & 0xF]);
    }
  }
}
