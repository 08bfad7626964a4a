package com.gentoro.rtmcp.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Stamps every outgoing request with the configured {@code Authorization} header and the JSON
 * {@code Accept} contract. Headers already present on the request are left alone.
 */
public class AuthInterceptor implements Interceptor {
  private final String authorization;

  public AuthInterceptor(String authorization) {
    this.authorization = authorization;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Request.Builder builder = original.newBuilder();
    if (original.header("Authorization") == null) {
      builder.header("Authorization", authorization);
    }
    if (original.header("Accept") == null) {
      builder.header("Accept", "application/json");
    }
    return chain.proceed(builder.build());
  }
}
