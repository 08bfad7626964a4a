package com.gentoro.rtmcp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * {@code ${env:NAME}} lookup. The process environment wins; otherwise the first {@code .env.local}
 * found in the working directory or in {@code packages/server} is consulted. The file is read
 * once, on the first miss.
 */
class DotEnvLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(DotEnvLookup.class);

  static final List<Path> CANDIDATES =
      List.of(Path.of(".env.local"), Path.of("packages", "server", ".env.local"));

  private final List<Path> candidates;
  private Map<String, String> fileValues;

  DotEnvLookup() {
    this(CANDIDATES);
  }

  DotEnvLookup(List<Path> candidates) {
    this.candidates = candidates;
  }

  @Override
  public Object lookup(String key) {
    String value = System.getenv(key);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    return fileValues().get(key);
  }

  private synchronized Map<String, String> fileValues() {
    if (fileValues == null) {
      fileValues =
          candidates.stream()
              .filter(Files::isRegularFile)
              .findFirst()
              .map(DotEnvLookup::read)
              .orElseGet(Map::of);
    }
    return fileValues;
  }

  static Map<String, String> read(Path path) {
    log.info("Reading environment fallbacks from {}", path.toAbsolutePath());
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Could not read {}, ignoring it", path.toAbsolutePath(), e);
      return Map.of();
    }
    Map<String, String> values = new HashMap<>();
    for (String raw : lines) {
      String line = raw.strip();
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).strip();
      }
      int eq = line.indexOf('=');
      if (line.startsWith("#") || eq <= 0) {
        continue;
      }
      values.put(line.substring(0, eq).strip(), unquote(line.substring(eq + 1).strip()));
    }
    return values;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
