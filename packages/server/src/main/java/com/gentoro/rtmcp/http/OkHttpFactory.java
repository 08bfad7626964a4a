package com.gentoro.rtmcp.http;

import com.gentoro.rtmcp.config.RtConfig;
import com.gentoro.rtmcp.exception.ConfigException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;

/** Builds the single {@link OkHttpClient} owned by an {@code RtClient}. */
public class OkHttpFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(OkHttpFactory.class);

  private OkHttpFactory() {}

  public static OkHttpClient create(RtConfig config) {
    return builder(config).build();
  }

  /**
   * Pre-configured builder: timeouts from {@link RtConfig#timeout()}, auth and logging
   * interceptors, and relaxed TLS when {@code rt.verify-ssl} is off. No automatic retry on
   * connection failure.
   */
  public static OkHttpClient.Builder builder(RtConfig config) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(config.timeout())
            .readTimeout(config.timeout())
            .writeTimeout(config.timeout())
            .retryOnConnectionFailure(false)
            .addInterceptor(new AuthInterceptor(config.authorizationHeader()))
            .addInterceptor(new LoggingInterceptor());
    if (!config.verifySsl()) {
      log.warn("TLS certificate verification is disabled for {}", config.baseUrl());
      trustEverything(builder);
    }
    return builder;
  }

  private static void trustEverything(OkHttpClient.Builder builder) {
    X509TrustManager trustAll =
        new X509TrustManager() {
          @Override
          public void checkClientTrusted(X509Certificate[] chain, String authType) {}

          @Override
          public void checkServerTrusted(X509Certificate[] chain, String authType) {}

          @Override
          public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
          }
        };
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {trustAll}, new SecureRandom());
      builder.sslSocketFactory(context.getSocketFactory(), trustAll);
      builder.hostnameVerifier((hostname, session) -> true);
    } catch (GeneralSecurityException e) {
      throw new ConfigException("Could not initialize TLS context with verification disabled", e);
    }
  }
}
