/**
 * Low-level encoders for JSON string and number literals, and the buffer abstraction they
 * write into.
 */
package com.writejson.encoding;
