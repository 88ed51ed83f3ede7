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

/**
 * A fragment of already-serialized JSON, written to the output verbatim.
 *
 * The text is not parsed or validated. It is the caller's responsibility to supply exactly
 * one well-formed JSON value; anything else will corrupt the surrounding document.
 */
public final class RawJson {
  private final String json;

  public RawJson(String json) {
    Preconditions.checkNotNull(json, "json");
    Preconditions.checkArgument(!json.isEmpty(), "raw JSON fragment may not be empty");
    this.json = json;
  }

  public String getJson() {
    return json;
  }

  @Override public boolean equals(Object obj) {
    return obj instanceof RawJson && ((RawJson) obj).json.equals(json);
  }

  @Override public int hashCode() {
    return json.hashCode();
  }

  @Override public String toString() {
    return json;
  }
}
