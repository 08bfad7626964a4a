package com.gentoro.rtmcp.config;

/** The single authentication scheme active for the lifetime of a client. */
public enum AuthScheme {
  /** {@code Authorization: token <value>}, RT's auth-token extension. */
  TOKEN,
  /** {@code Authorization: Basic base64(user:password)} per RFC 7617. */
  BASIC
}
