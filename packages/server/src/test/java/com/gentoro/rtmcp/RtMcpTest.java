package com.gentoro.rtmcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.rtmcp.actuator.ActuatorService;
import com.gentoro.rtmcp.exception.ConfigException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RtMcpTest {

  private RtMcp app;

  @AfterEach
  void tearDown() {
    if (app != null) {
      app.shutdown();
    }
  }

  @Test
  void configurationIsUnavailableBeforeInitialize() {
    app = new RtMcp(new String[0]);

    assertThrows(IllegalStateException.class, () -> app.configuration());
  }

  @Test
  @DisplayName("Check mode probes RT and starts no listener")
  void checkModeOnlyProbes() {
    app =
        new RtMcp(
            new String[] {"--mode", "check", "--config-file", "classpath:application-test.yaml"});

    app.initialize();

    assertTrue(app.isCheckMode());
    assertFalse(app.isConnectionValidated());
    assertNotNull(app.rtClient());
    assertNull(app.httpServer());
    assertNull(app.toolRegistry());
  }

  @Test
  void missingUrlFailsBeforeAnyRequest() {
    app = new RtMcp(new String[] {"--config-file", "classpath:application-missing-url.yaml"});

    ConfigException e = assertThrows(ConfigException.class, () -> app.initialize());

    assertTrue(e.getMessage().contains("RT URL"));
    assertNull(app.rtClient());
  }

  @Test
  @DisplayName("Server mode serves the health endpoint and shuts down once")
  void serverModeLifecycle() throws Exception {
    app = new RtMcp(new String[] {"--config-file", "classpath:application-test.yaml"});

    app.initialize();

    assertTrue(app.httpServer().isRunning());
    assertEquals(72, app.toolRegistry().size());
    assertFalse(app.isConnectionValidated());

    OkHttpClient http = new OkHttpClient();
    Request health =
        new Request.Builder()
            .url("http://127.0.0.1:" + app.httpServer().localPort() + ActuatorService.PATH)
            .build();
    try (Response response = http.newCall(health).execute()) {
      assertEquals(200, response.code());
      assertTrue(response.body().string().contains("\"UP\""));
    } finally {
      http.dispatcher().executorService().shutdown();
      http.connectionPool().evictAll();
    }

    app.shutdown();
    app.shutdown();

    assertTrue(app.isShutdown());
    assertFalse(app.httpServer().isRunning());
  }
}
