/**
 * Streaming JSON writer. {@link com.writejson.WriteJson} opens a root object or array scope
 * over a caller-owned buffer; scopes write entries directly into the buffer, with no
 * intermediate tree, and guarantee well-formed compact output.
 */
package com.writejson;
