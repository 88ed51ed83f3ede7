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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.writejson.JsonArrayWriter;
import com.writejson.JsonObjectWriter;
import com.writejson.NonFiniteNumberException;
import com.writejson.TuningConstants;
import com.writejson.WriteJson;
import com.writejson.internal.Logging;
import com.writejson.internal.WriteJsonUtil;

/**
 * Tests for the handling of non-finite numbers: rejection, poisoning of enclosing scopes, and
 * suppression of later writes.
 */
public class PoisonedScopeTest extends WriteJsonTestBase {
  @Test public void testNonFiniteNumberPoisonsObject() {
    StringBuilder buf = new StringBuilder();
    JsonObjectWriter object = WriteJson.object(buf);
    object.number("a", 1);

    try {
      object.number("b", Double.NaN);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      assertTrue(Double.isNaN(ex.getValue()));
    }
    assertTrue(object.isPoisoned());
    assertEquals("{\"a\":1", buf.toString());

    // Later writes are discarded without error.
    object.number("c", 2).string("d", "x").number("e", Double.POSITIVE_INFINITY);
    object.close();
    assertEquals("{\"a\":1}", buf.toString());
    TestUtils.parseStrict(buf.toString());
  }

  @Test public void testAllNonFiniteValuesRejected() {
    double[] values = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
    for (double value : values) {
      StringBuilder buf = new StringBuilder();
      try (JsonArrayWriter array = WriteJson.array(buf)) {
        array.number(value);
        fail("NonFiniteNumberException expected for " + value);
      } catch (NonFiniteNumberException ex) {
        // expected
      }
      assertEquals("[]", buf.toString());
      assertFalse(buf.toString().contains("NaN"));
      assertFalse(buf.toString().contains("Infinity"));
    }
  }

  @Test public void testFloatAndBoxedNonFiniteValues() {
    StringBuilder buf = new StringBuilder();
    JsonObjectWriter object = WriteJson.object(buf);
    try {
      object.number("f", Float.NEGATIVE_INFINITY);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      assertEquals(Double.NEGATIVE_INFINITY, ex.getValue(), 0.0);
    }
    object.close();
    assertEquals("{}", buf.toString());

    buf = new StringBuilder();
    JsonArrayWriter array = WriteJson.array(buf);
    try {
      array.value(Float.valueOf(Float.NaN));
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      // expected
    }
    assertTrue(array.isPoisoned());
    array.close();
    assertEquals("[]", buf.toString());
  }

  @Test public void testPoisonPropagatesToEnclosingScopes() {
    StringBuilder buf = new StringBuilder();
    JsonObjectWriter object = WriteJson.object(buf);
    object.string("first", "v");
    JsonArrayWriter list = object.array("list");
    list.number(1);
    try {
      list.number(Double.POSITIVE_INFINITY);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      // expected
    }
    list.close();

    assertTrue(list.isPoisoned());
    assertTrue(object.isPoisoned());

    object.string("after", "x");
    object.close();
    assertEquals("{\"first\":\"v\",\"list\":[1]}", buf.toString());
  }

  @Test public void testScopeOpenedInPoisonedScopeIsSilent() {
    StringBuilder buf = new StringBuilder();
    JsonArrayWriter array = WriteJson.array(buf);
    array.number(1);
    try {
      array.number(Double.NaN);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      // expected
    }

    JsonObjectWriter child = array.object();
    assertTrue(child.isPoisoned());

    // Still one scope at a time, even though nothing is being written.
    try {
      array.number(2);
      fail("IllegalStateException expected");
    } catch (IllegalStateException ex) {
      // expected
    }

    child.string("a", "b");
    child.array("nested").close();
    child.close();
    array.close();
    assertEquals("[1]", buf.toString());
  }

  @Test public void testNonFiniteNumberInsideMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("ok", 1);
    map.put("bad", Double.NaN);
    map.put("never", 3);

    StringBuilder buf = new StringBuilder();
    JsonObjectWriter object = WriteJson.object(buf);
    try {
      object.entry("m", map);
      fail("NonFiniteNumberException expected");
    } catch (NonFiniteNumberException ex) {
      // expected
    }
    object.number("later", 4);
    object.close();

    assertEquals("{\"m\":{\"ok\":1}}", buf.toString());
    assertTrue(object.isPoisoned());
    TestUtils.parseStrict(buf.toString());
  }

  @Test public void testPoisoningIsLogged() {
    StringBuilder buf = new StringBuilder();
    JsonArrayWriter array = WriteJson.array(buf);
    try {
      array.number(Double.NaN);
    } catch (NonFiniteNumberException ex) {
      // expected
    }
    assertEquals(1, countLogged(Logging.tagScopePoisoned));
    assertTrue(logged.get(0).message.contains("NaN"));
  }

  @Test public void testSuppressedWritesAreThrottled() {
    WriteJsonUtil.setCustomTimeMs(1000000);

    StringBuilder buf = new StringBuilder();
    JsonObjectWriter object = WriteJson.object(buf);
    try {
      object.number("x", Double.NaN);
    } catch (NonFiniteNumberException ex) {
      // expected
    }

    object.number("a", 1).number("b", 2);
    JsonArrayWriter child = object.array("c");
    child.bool(true);
    child.close();
    assertEquals(1, countLogged(Logging.tagSuppressedWrite));

    WriteJsonUtil.advanceCustomTimeMs(TuningConstants.SUPPRESSED_WRITE_LOG_INTERVAL_MS);
    object.nullValue("d");
    assertEquals(2, countLogged(Logging.tagSuppressedWrite));

    object.close();
    assertEquals("{}", buf.toString());
  }
}
