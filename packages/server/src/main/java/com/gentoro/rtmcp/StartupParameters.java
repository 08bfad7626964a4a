package com.gentoro.rtmcp;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command line of the server: {@code [--mode server|check] [--config-file <location>]}.
 *
 * <p>{@code check} validates configuration, probes RT once and exits. The config location accepts
 * whatever {@link ConfigurationProvider} does.
 */
public class StartupParameters {
  public static final String MODE_SERVER = "server";
  public static final String MODE_CHECK = "check";
  public static final String DEFAULT_CONFIG = "classpath:application.yaml";

  private static final Set<String> OPTIONS = Set.of("mode", "config-file");
  private static final Set<String> MODES = Set.of(MODE_SERVER, MODE_CHECK);

  private final String mode;
  private final String configFile;

  public StartupParameters(String[] arguments) {
    Map<String, String> options = parse(arguments == null ? new String[0] : arguments);
    this.mode = require(options, "mode", MODE_SERVER).toLowerCase(Locale.ROOT);
    this.configFile = require(options, "config-file", DEFAULT_CONFIG);
    if (!MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode + ", expected one of " + MODES);
    }
  }

  // A flag directly followed by another flag is recorded with a null value.
  private static Map<String, String> parse(String[] arguments) {
    Map<String, String> options = new HashMap<>();
    int i = 0;
    while (i < arguments.length) {
      String token = arguments[i++];
      if (!token.startsWith("--")) {
        throw new IllegalArgumentException("Unexpected argument: " + token);
      }
      String name = token.substring(2);
      if (!OPTIONS.contains(name)) {
        throw new IllegalArgumentException("Unknown option: " + token);
      }
      String value = null;
      if (i < arguments.length && !arguments[i].startsWith("--")) {
        value = arguments[i++];
      }
      options.put(name, value);
    }
    return options;
  }

  private static String require(Map<String, String> options, String name, String fallback) {
    if (!options.containsKey(name)) {
      return fallback;
    }
    String value = options.get(name);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Option --" + name + " needs a value");
    }
    return value.trim();
  }

  public String configFile() {
    return configFile;
  }

  public String mode() {
    return mode;
  }

  public boolean checkOnly() {
    return MODE_CHECK.equals(mode);
  }
}
