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

package com.writejson.tests;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Random;

import org.junit.Test;

import com.writejson.NonFiniteNumberException;
import com.writejson.encoding.JsonBuffer;
import com.writejson.encoding.JsonNumbers;

/**
 * Tests for JsonNumbers.
 */
public class JsonNumbersTest {
  @Test public void testIntegralDoubles() {
    assertEquals("92", JsonNumbers.format(92.0));
    assertEquals("0", JsonNumbers.format(0.0));
    assertEquals("-0", JsonNumbers.format(-0.0));
    assertEquals("-17", JsonNumbers.format(-17.0));
    assertEquals("10000000", JsonNumbers.format(1e7));
    assertEquals("4503599627370496", JsonNumbers.format(4503599627370496.0));
    assertEquals("100000000000000000000", JsonNumbers.format(1e20));
    assertEquals("9223372036854776000", JsonNumbers.format((double) Long.MAX_VALUE));
  }

  @Test public void testFractionalDoubles() {
    assertEquals("0.5", JsonNumbers.format(0.5));
    assertEquals("-2.25", JsonNumbers.format(-2.25));
    assertEquals("0.1", JsonNumbers.format(0.1));
    assertEquals("0.001", JsonNumbers.format(0.001));
    assertEquals("0.00001", JsonNumbers.format(1e-5));
    assertEquals("0.00000015", JsonNumbers.format(1.5e-7));
    assertEquals("123456789.125", JsonNumbers.format(123456789.125));
  }

  /**
   * Large values whose shortest representation Double.toString misses on some JDKs.
   */
  @Test public void testShortestDigitsForLargeDoubles() {
    assertEquals("100000000000000000000000", JsonNumbers.format(1e23));
    assertEquals("8410000000000000000000", JsonNumbers.format(8.41e21));
    assertEquals("-100000000000000000000000", JsonNumbers.format(-1e23));
    assertEquals("20000000000000000000", JsonNumbers.format(2e19));
  }

  @Test public void testFloats() {
    assertEquals("0.1", JsonNumbers.format(0.1f));
    assertEquals("3", JsonNumbers.format(3.0f));
    assertEquals("-0", JsonNumbers.format(-0.0f));
    assertEquals("0.0000000001", JsonNumbers.format(1.0e-10f));
    assertEquals("340282350000000000000000000000000000000", JsonNumbers.format(Float.MAX_VALUE));
  }

  @Test public void testLongs() {
    assertEquals("0", JsonNumbers.format(0L));
    assertEquals("-9223372036854775808", JsonNumbers.format(Long.MIN_VALUE));
    assertEquals("9223372036854775807", JsonNumbers.format(Long.MAX_VALUE));
  }

  @Test public void testNonFiniteRejected() {
    double[] values = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
    for (double value : values) {
      StringBuilder sb = new StringBuilder();
      try {
        JsonNumbers.write(JsonBuffer.of(sb), value);
        fail("NonFiniteNumberException expected for " + value);
      } catch (NonFiniteNumberException ex) {
        assertEquals(Double.valueOf(value), Double.valueOf(ex.getValue()));
      }
      assertEquals("", sb.toString());
    }

    try {
      JsonNumbers.format(Float.NaN);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      // expected
    }
  }

  /**
   * Random bit patterns: every finite double must be written as a valid JSON number which
   * reads back as exactly the same value.
   */
  @Test public void testRoundTripRandomDoubles() {
    Random random = new Random(92);
    int checked = 0;
    while (checked < 2000) {
      double value = Double.longBitsToDouble(random.nextLong());
      if (Double.isNaN(value) || Double.isInfinite(value))
        continue;

      String text = JsonNumbers.format(value);
      Object parsed = TestUtils.parseStrict(text);
      assertEquals(text, Double.doubleToLongBits(value), Double.doubleToLongBits((Double) parsed));
      checked++;
    }
  }

  @Test public void testRoundTripRandomFloats() {
    Random random = new Random(29);
    for (int i = 0; i < 2000; i++) {
      float value = random.nextFloat() * (float) Math.pow(10, random.nextInt(40) - 20);
      String text = JsonNumbers.format(value);
      assertEquals(text, value, Float.parseFloat(text), 0.0f);
    }
  }
}
