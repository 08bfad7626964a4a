package com.gentoro.rtmcp.config;

import com.gentoro.rtmcp.ConfigurationProvider;
import com.gentoro.rtmcp.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.Configuration;

/**
 * Connection settings for the RT REST2 API.
 *
 * <p>Instances are validated on construction: a missing URL, or the absence of both a token and a
 * complete user/password pair, fails with {@link ConfigException} before any request is attempted.
 * When both schemes are configured the token wins.
 *
 * <p>Configuration keys (see {@code application.yaml}):
 *
 * <ul>
 *   <li><b>rt.url</b> – RT server URL (required)
 *   <li><b>rt.base-path</b> – REST sub-path; default "/REST/2.0"
 *   <li><b>rt.token</b> – auth token
 *   <li><b>rt.user</b>, <b>rt.password</b> – basic-auth credentials
 *   <li><b>rt.timeout-seconds</b> – request timeout; default 30
 *   <li><b>rt.verify-ssl</b> – verify TLS certificates; default true
 *   <li><b>rt.validate-on-startup</b> – probe the connection at startup; default true
 * </ul>
 */
public final class RtConfig {
  public static final String DEFAULT_BASE_PATH = "/REST/2.0";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final String url;
  private final String basePath;
  private final String token;
  private final String user;
  private final String password;
  private final Duration timeout;
  private final boolean verifySsl;
  private final boolean validateOnStartup;
  private final AuthScheme authScheme;

  private RtConfig(Builder b) {
    this.url = blankToNull(b.url);
    this.basePath = normalizeBasePath(b.basePath);
    this.token = blankToNull(b.token);
    this.user = blankToNull(b.user);
    this.password = blankToNull(b.password);
    this.timeout = b.timeout == null ? DEFAULT_TIMEOUT : b.timeout;
    this.verifySsl = b.verifySsl;
    this.validateOnStartup = b.validateOnStartup;

    if (url == null) {
      throw new ConfigException("Missing RT URL: set rt.url (RT_URL)");
    }
    if (HttpUrl.parse(url) == null) {
      throw new ConfigException("Invalid RT URL: " + url);
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new ConfigException("RT timeout must be positive, got " + timeout);
    }
    requireHeaderSafe("rt.token", token);
    requireHeaderSafe("rt.user", user);
    requireHeaderSafe("rt.password", password);
    if (token != null) {
      this.authScheme = AuthScheme.TOKEN;
    } else if (user != null && password != null) {
      this.authScheme = AuthScheme.BASIC;
    } else {
      throw new ConfigException("Either RT_TOKEN or both RT_USER and RT_PASSWORD must be set");
    }
  }

  /** Build from the {@code rt.*} section of the application configuration. */
  public static RtConfig from(Configuration cfg) {
    Builder b = builder();
    ConfigurationProvider.optionalString(cfg, "rt.url").ifPresent(b::url);
    ConfigurationProvider.optionalString(cfg, "rt.base-path").ifPresent(b::basePath);
    ConfigurationProvider.optionalString(cfg, "rt.token").ifPresent(b::token);
    ConfigurationProvider.optionalString(cfg, "rt.user").ifPresent(b::user);
    ConfigurationProvider.optionalString(cfg, "rt.password").ifPresent(b::password);
    ConfigurationProvider.optionalString(cfg, "rt.timeout-seconds")
        .map(v -> parseSeconds("rt.timeout-seconds", v))
        .ifPresent(b::timeout);
    ConfigurationProvider.optionalString(cfg, "rt.verify-ssl")
        .map(v -> parseBoolean("rt.verify-ssl", v))
        .ifPresent(b::verifySsl);
    ConfigurationProvider.optionalString(cfg, "rt.validate-on-startup")
        .map(v -> parseBoolean("rt.validate-on-startup", v))
        .ifPresent(b::validateOnStartup);
    return b.build();
  }

  /** Full base URL for the REST2 API: the server URL with the base path appended once. */
  public String baseUrl() {
    String trimmed = url;
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (basePath.isEmpty() || trimmed.endsWith(basePath)) {
      return trimmed;
    }
    return trimmed + basePath;
  }

  public AuthScheme authScheme() {
    return authScheme;
  }

  /** Value of the {@code Authorization} header for the active scheme. */
  public String authorizationHeader() {
    if (authScheme == AuthScheme.TOKEN) {
      return "token " + token;
    }
    String credentials = user + ":" + password;
    return "Basic "
        + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  public String url() {
    return url;
  }

  public String basePath() {
    return basePath;
  }

  public Duration timeout() {
    return timeout;
  }

  public boolean verifySsl() {
    return verifySsl;
  }

  public boolean validateOnStartup() {
    return validateOnStartup;
  }

  @Override
  public String toString() {
    return "RtConfig{url="
        + url
        + ", basePath="
        + basePath
        + ", auth="
        + authScheme
        + ", timeout="
        + timeout
        + ", verifySsl="
        + verifySsl
        + '}';
  }

  private static String normalizeBasePath(String basePath) {
    if (basePath == null) return DEFAULT_BASE_PATH;
    String p = basePath.trim();
    while (p.endsWith("/")) {
      p = p.substring(0, p.length() - 1);
    }
    if (p.isEmpty()) return "";
    return p.startsWith("/") ? p : "/" + p;
  }

  // The value ends up in the Authorization header; never echo it back.
  private static void requireHeaderSafe(String key, String value) {
    if (value == null) {
      return;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new ConfigException(
            "Invalid %s: only printable ASCII is allowed (position %d)".formatted(key, i));
      }
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static Duration parseSeconds(String key, String value) {
    try {
      return Duration.ofSeconds(Long.parseLong(value));
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid " + key + ": '" + value + "' is not a number", e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
      case "1":
      case "yes":
        return true;
      case "false":
      case "0":
      case "no":
        return false;
      default:
        throw new ConfigException("Invalid " + key + ": '" + value + "' is not a boolean");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String url;
    private String basePath;
    private String token;
    private String user;
    private String password;
    private Duration timeout;
    private boolean verifySsl = true;
    private boolean validateOnStartup = true;

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder basePath(String basePath) {
      this.basePath = basePath;
      return this;
    }

    public Builder token(String token) {
      this.token = token;
      return this;
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder verifySsl(boolean verifySsl) {
      this.verifySsl = verifySsl;
      return this;
    }

    public Builder validateOnStartup(boolean validateOnStartup) {
      this.validateOnStartup = validateOnStartup;
      return this;
    }

    public RtConfig build() {
      return new RtConfig(this);
    }
  }
}
