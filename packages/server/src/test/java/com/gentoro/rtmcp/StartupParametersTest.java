package com.gentoro.rtmcp;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToServerModeAndBundledConfiguration() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesNamedArguments() {
    StartupParameters params =
        new StartupParameters(new String[] {"--mode", "check", "--config-file", "/etc/rt.yaml"});

    assertEquals("check", params.mode());
    assertEquals("/etc/rt.yaml", params.configFile());
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"--mode", "x"}));
  }

  @Test
  void flagWithoutValueIsRejectedForRequiredParameters() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--mode", "server"}));
  }

  @Test
  void checkModeIsCaseInsensitive() {
    StartupParameters params = new StartupParameters(new String[] {"--mode", "CHECK"});

    assertTrue(params.checkOnly());
  }

  @Test
  void rejectsUnknownOptionsAndStrayArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--port", "9000"}));
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"check"}));
  }
}
