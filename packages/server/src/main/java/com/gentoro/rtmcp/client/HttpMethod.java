package com.gentoro.rtmcp.client;

/** HTTP verbs used by the RT REST2 API. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
