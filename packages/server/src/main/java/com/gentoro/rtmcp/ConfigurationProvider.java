package com.gentoro.rtmcp;

import com.gentoro.rtmcp.exception.ConfigException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Loads the YAML configuration of the server.
 *
 * <p>A location is one of {@code classpath:<resource>}, a {@code file:} URI or a filesystem path.
 * A classpath resource that does not exist yields an empty configuration, so every key falls back
 * to its default; a missing file is an error.
 *
 * <p>Values may reference environment variables as {@code ${env:NAME}}, resolved by {@link
 * DotEnvLookup}. A placeholder that resolves to nothing stays in the raw value, so optional keys
 * should be read through {@link #optionalString(Configuration, String)}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private static final String CLASSPATH = "classpath:";
  private static final Pattern UNRESOLVED = Pattern.compile("\\$\\{[^${}]+}");

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String target =
        location == null || location.isBlank() ? StartupParameters.DEFAULT_CONFIG : location.trim();
    YAMLConfiguration yaml = load(target);
    yaml.getInterpolator().registerLookup("env", new DotEnvLookup());
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  /**
   * Read a key as a trimmed string. Blank values count as absent, and so does a value that is
   * nothing but an unresolved {@code ${...}} placeholder.
   */
  public static Optional<String> optionalString(Configuration cfg, String key) {
    String value;
    try {
      value = cfg.getString(key, null);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve configuration key: " + key, e);
    }
    return Optional.ofNullable(value)
        .map(String::trim)
        .filter(v -> !v.isEmpty() && !UNRESOLVED.matcher(v).matches());
  }

  private static YAMLConfiguration load(String location) {
    if (location.startsWith(CLASSPATH)) {
      String resource = location.substring(CLASSPATH.length());
      URL url = Thread.currentThread().getContextClassLoader().getResource(resource);
      if (url == null) {
        log.warn("Configuration resource {} not found on classpath, using defaults", resource);
        return new YAMLConfiguration();
      }
      return read(url);
    }

    Path path;
    try {
      path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration location: " + location, e);
    }
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    try {
      return read(path.toUri().toURL());
    } catch (MalformedURLException e) {
      throw new ConfigException("Invalid configuration location: " + location, e);
    }
  }

  private static YAMLConfiguration read(URL url) {
    log.info("Loading configuration from {}", url);
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      new FileHandler(yaml).load(url);
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to parse YAML configuration at " + url, e);
    }
    return yaml;
  }
}
