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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.writejson.NonFiniteNumberException;

/**
 * Encodes numbers as JSON numeric literals.
 *
 * Integral values that fit in a long are written as plain integers (92.0 becomes 92). Other
 * values use the shortest digit string that reads back as the same double (or float), written
 * in plain decimal notation without an exponent. NaN and the infinities have no JSON form and
 * are rejected with a NonFiniteNumberException before anything is written.
 */
public class JsonNumbers {
  /**
   * 2^63. Integral doubles with a smaller magnitude convert to long exactly.
   */
  private static final double LONG_LIMIT = 0x1p63;

  /**
   * Significant digits which always suffice to identify a double (or float).
   */
  private static final int MAX_DOUBLE_DIGITS = 17;
  private static final int MAX_FLOAT_DIGITS = 9;

  public static void write(JsonBuffer out, long value) {
    out.appendLong(value);
  }

  public static void write(JsonBuffer out, double value) {
    checkFinite(value);
    if (!writeIntegral(out, value))
      out.append(shortestDecimal(value, false).toPlainString());
  }

  public static void write(JsonBuffer out, float value) {
    checkFinite(value);
    if (!writeIntegral(out, value))
      out.append(shortestDecimal(value, true).toPlainString());
  }

  public static String format(long value) {
    return Long.toString(value);
  }

  public static String format(double value) {
    StringBuilder sb = new StringBuilder();
    write(JsonBuffer.of(sb), value);
    return sb.toString();
  }

  public static String format(float value) {
    StringBuilder sb = new StringBuilder();
    write(JsonBuffer.of(sb), value);
    return sb.toString();
  }

  /**
   * Throw NonFiniteNumberException if value is NaN or infinite.
   */
  public static void checkFinite(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value))
      throw new NonFiniteNumberException(value);
  }

  /**
   * If value is a whole number in long range, write it as an integer and return true.
   */
  private static boolean writeIntegral(JsonBuffer out, double value) {
    if (value != Math.rint(value) || Math.abs(value) >= LONG_LIMIT)
      return false;

    if (value == 0 && Double.doubleToRawLongBits(value) != 0L)
      out.append("-0");
    else
      out.appendLong((long) value);
    return true;
  }

  /**
   * Return the decimal with the fewest significant digits which parses back to value (as a
   * float if singlePrecision is set). Among candidates of equal length, the one nearest to
   * value wins.
   */
  static BigDecimal shortestDecimal(double value, boolean singlePrecision) {
    BigDecimal exact = new BigDecimal(value);
    int maxDigits = singlePrecision ? MAX_FLOAT_DIGITS : MAX_DOUBLE_DIGITS;
    for (int digits = 1; digits <= maxDigits; digits++) {
      BigDecimal nearest = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
      if (readsBackAs(nearest, value, singlePrecision))
        return nearest.stripTrailingZeros();

      // Next to a power of two the rounding interval is lopsided, so the nearest candidate can
      // miss while its neighbor on the wider side still reads back.
      BigDecimal best = null;
      for (BigDecimal candidate : new BigDecimal[]{nearest.subtract(nearest.ulp()), nearest.add(nearest.ulp())}) {
        if (readsBackAs(candidate, value, singlePrecision) && (best == null
            || candidate.subtract(exact).abs().compareTo(best.subtract(exact).abs()) < 0))
          best = candidate;
      }
      if (best != null)
        return best.stripTrailingZeros();
    }
    return exact.stripTrailingZeros();
  }

  private static boolean readsBackAs(BigDecimal candidate, double value, boolean singlePrecision) {
    if (singlePrecision)
      return candidate.floatValue() == (float) value;
    return candidate.doubleValue() == value;
  }
}
