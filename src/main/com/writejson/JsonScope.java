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

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.writejson.encoding.JsonBuffer;
import com.writejson.encoding.JsonEscaper;
import com.writejson.encoding.JsonNumbers;
import com.writejson.internal.Logging;

/**
 * An open JSON object or array, writing directly into a caller-owned buffer.
 * <p>
 * The opening delimiter is written when the scope is created, and the closing delimiter when
 * it is closed. Scopes nest: opening a child scope hands the buffer to the child, and the
 * parent rejects all calls (with IllegalStateException) until the child has been closed. Use
 * try-with-resources, or the Callback overloads, so that every scope is closed even when the
 * code filling it in throws:
 *
 * <pre>
 *   try (JsonObjectWriter obj = WriteJson.object(buf)) {
 *     obj.string("name", "Peter").number("favorite number", 92.0);
 *     try (JsonArrayWriter films = obj.array("films")) {
 *       films.string("Drowning By Numbers").string("A Zed &amp; Two Noughts");
 *     }
 *     obj.nullValue("suitcase");
 *   }
 * </pre>
 *
 * The only write that can fail is a non-finite number. It throws NonFiniteNumberException and
 * poisons this scope and every enclosing scope: later entries are silently discarded, while
 * close() still writes the closing delimiters. The result is well-formed but incomplete, and
 * should be discarded.
 * <p>
 * Scopes are not thread-safe.
 */
public abstract class JsonScope implements AutoCloseable {
  private enum State {
    EMPTY,
    NON_EMPTY,
    CLOSED
  }

  protected final JsonBuffer buffer;

  protected final JsonOptions options;

  /**
   * The scope which opened this one, or null for a root scope.
   */
  private final JsonScope parent;

  /**
   * "object" or "array"; used in diagnostics.
   */
  private final String kind;

  private final char closingDelimiter;

  /**
   * True if this scope was opened inside a poisoned scope. A silent scope writes nothing at all,
   * not even its delimiters.
   */
  private final boolean silent;

  /**
   * Throttles tagSuppressedWrite messages. Shared by all scopes in a tree.
   */
  private final Logging.LogLimiter suppressedWriteLimiter;

  private State state = State.EMPTY;

  private boolean poisoned;

  /**
   * Set when the first entry is written. Unlike state, it survives close().
   */
  private boolean wroteEntry;

  /**
   * The nested scope which currently owns the buffer, or null.
   */
  private JsonScope openChild;

  JsonScope(JsonBuffer buffer, JsonOptions options, JsonScope parent, String kind,
      char openingDelimiter, char closingDelimiter) {
    this.buffer = Preconditions.checkNotNull(buffer, "buffer");
    this.options = Preconditions.checkNotNull(options, "options");
    this.parent = parent;
    this.kind = kind;
    this.closingDelimiter = closingDelimiter;

    if (parent != null) {
      silent = parent.poisoned;
      suppressedWriteLimiter = parent.suppressedWriteLimiter;
      parent.openChild = this;
    } else {
      silent = false;
      suppressedWriteLimiter = new Logging.LogLimiter();
    }
    poisoned = silent;

    if (!silent)
      buffer.append(openingDelimiter);
  }

  /**
   * Return true once close() has been called.
   */
  public boolean isClosed() {
    return state == State.CLOSED;
  }

  /**
   * Return true if a non-finite number was written to this scope, or to a scope nested in it
   * or enclosing it.
   */
  public boolean isPoisoned() {
    return poisoned;
  }

  /**
   * Return true if no entry has been written to this scope.
   */
  public boolean isEmpty() {
    return !wroteEntry;
  }

  /**
   * Write the closing delimiter. If a nested scope is still open, it is closed first. Calling
   * close() on a closed scope does nothing.
   */
  @Override public void close() {
    if (state == State.CLOSED)
      return;

    if (openChild != null) {
      Logging.log(this, Severity.warning, Logging.tagUnclosedChild,
          "Closing " + kind + " while a nested " + openChild.kind + " is still open");
      openChild.close();
    }

    state = State.CLOSED;
    if (!silent)
      buffer.append(closingDelimiter);

    if (parent != null && parent.openChild == this)
      parent.openChild = null;
  }

  /**
   * Called before writing an entry. Throws IllegalStateException if the scope is closed or a
   * nested scope is open. Returns false if the entry must be discarded because the scope is
   * poisoned.
   */
  final boolean startEntry() {
    Preconditions.checkState(state != State.CLOSED, "This %s has already been closed", kind);
    if (openChild != null)
      throw new IllegalStateException("This " + kind + " has an open nested " + openChild.kind
          + "; close it before writing further entries");

    if (poisoned) {
      if (suppressedWriteLimiter.allow(TuningConstants.SUPPRESSED_WRITE_LOG_INTERVAL_MS))
        Logging.log(this, Severity.fine, Logging.tagSuppressedWrite,
            "Discarding entry written to a poisoned " + kind);
      return false;
    }
    return true;
  }

  /**
   * Write the comma preceding an entry, if one is needed, and mark the scope non-empty.
   */
  final void writeSeparator() {
    if (state == State.NON_EMPTY)
      buffer.append(',');
    else
      state = State.NON_EMPTY;
    wroteEntry = true;
  }

  /**
   * Reject a non-finite number, poisoning this scope and its ancestors.
   */
  final void checkFinite(double value) {
    try {
      JsonNumbers.checkFinite(value);
    } catch (NonFiniteNumberException ex) {
      poison(ex);
      throw ex;
    }
  }

  private void poison(NonFiniteNumberException ex) {
    for (JsonScope scope = this; scope != null; scope = scope.parent)
      scope.poisoned = true;

    Logging.log(this, Severity.fine, Logging.tagScopePoisoned,
        ex.getMessage() + "; discarding further entries", ex);
  }

  /**
   * Validate a value passed to entry() or value(), before anything is written for it. Throws
   * IllegalArgumentException for unsupported types, and NonFiniteNumberException (poisoning
   * this scope) for NaN and infinities. Contents of maps, iterables and arrays are checked as
   * they are written.
   */
  final void checkValue(Object value) {
    if (value instanceof Double || value instanceof Float) {
      checkFinite(((Number) value).doubleValue());
      return;
    }

    checkSupportedType(value);
  }

  private static void checkSupportedType(Object value) {
    if (!isSupportedType(value))
      throw new IllegalArgumentException("Cannot write a " + value.getClass().getName() + " as JSON");
  }

  private static boolean isSupportedType(Object value) {
    return value == null
        || value instanceof Boolean
        || value instanceof CharSequence
        || value instanceof Character
        || value instanceof RawJson
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof AtomicInteger
        || value instanceof AtomicLong
        || value instanceof Map
        || value instanceof Iterable
        || isArray(value);
  }

  private static boolean isArray(Object value) {
    return value instanceof Object[]
        || value instanceof int[]
        || value instanceof long[]
        || value instanceof short[]
        || value instanceof byte[]
        || value instanceof double[]
        || value instanceof float[]
        || value instanceof boolean[]
        || value instanceof char[];
  }

  /**
   * Write a string literal, or null.
   */
  final void writeString(String value) {
    if (value == null)
      buffer.append("null");
    else
      JsonEscaper.writeQuoted(buffer, value, options);
  }

  /**
   * Write a value which has passed checkValue(). The separator (and key) must already have been
   * written.
   */
  final void writeValue(Object value) {
    writeValue(buffer, options, this, value);
  }

  /**
   * Write any supported value. parent is the scope the value belongs to, or null for a
   * top-level value; containers are written through nested scopes, which are always closed
   * before returning.
   */
  static void writeValue(JsonBuffer buffer, JsonOptions options, JsonScope parent, Object value) {
    if (parent == null)
      checkSupportedType(value);

    if (value == null) {
      buffer.append("null");
    } else if (value instanceof Boolean) {
      buffer.append((Boolean) value ? "true" : "false");
    } else if (value instanceof Double) {
      JsonNumbers.write(buffer, (Double) value);
    } else if (value instanceof Float) {
      JsonNumbers.write(buffer, (Float) value);
    } else if (value instanceof Number) {
      JsonNumbers.write(buffer, ((Number) value).longValue());
    } else if (value instanceof CharSequence) {
      JsonEscaper.writeQuoted(buffer, (CharSequence) value, options);
    } else if (value instanceof Character) {
      JsonEscaper.writeQuoted(buffer, String.valueOf(value), options);
    } else if (value instanceof RawJson) {
      buffer.append(((RawJson) value).getJson());
    } else if (value instanceof Map) {
      try (JsonObjectWriter object = new JsonObjectWriter(buffer, options, parent)) {
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
          object.entry(String.valueOf(entry.getKey()), entry.getValue());
      }
    } else if (value instanceof Iterable) {
      try (JsonArrayWriter array = new JsonArrayWriter(buffer, options, parent)) {
        for (Object element : (Iterable<?>) value)
          array.value(element);
      }
    } else {
      try (JsonArrayWriter array = new JsonArrayWriter(buffer, options, parent)) {
        writeArrayElements(array, value);
      }
    }
  }

  /**
   * Write each element of an object or primitive array. A char[] is written as an array of
   * one-character strings.
   */
  private static void writeArrayElements(JsonArrayWriter array, Object value) {
    if (value instanceof Object[]) {
      for (Object element : (Object[]) value)
        array.value(element);
    } else if (value instanceof int[]) {
      for (int element : (int[]) value)
        array.number(element);
    } else if (value instanceof long[]) {
      for (long element : (long[]) value)
        array.number(element);
    } else if (value instanceof short[]) {
      for (short element : (short[]) value)
        array.number(element);
    } else if (value instanceof byte[]) {
      for (byte element : (byte[]) value)
        array.number(element);
    } else if (value instanceof double[]) {
      for (double element : (double[]) value)
        array.number(element);
    } else if (value instanceof float[]) {
      for (float element : (float[]) value)
        array.number(element);
    } else if (value instanceof boolean[]) {
      for (boolean element : (boolean[]) value)
        array.bool(element);
    } else {
      for (char element : (char[]) value)
        array.string(String.valueOf(element));
    }
  }

  @Override public String toString() {
    return kind + "[" + state + (poisoned ? ", poisoned" : "") + "]";
  }
}
