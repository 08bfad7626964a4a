package com.gentoro.rtmcp;

public class RtMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(RtMcpApp.class);

  public static void main(String[] args) {
    RtMcp app;
    try {
      app = new RtMcp(args);
    } catch (IllegalArgumentException e) {
      log.error("Invalid startup parameters: {}", e.getMessage());
      System.exit(2);
      return;
    }

    try {
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
      return;
    }

    if (app.isCheckMode()) {
      boolean ok = app.isConnectionValidated();
      if (!ok) {
        log.error("RT server not reachable at {}", app.rtConfig().baseUrl());
      }
      app.shutdown();
      System.exit(ok ? 0 : 1);
      return;
    }

    app.waitShutdownSignal();
  }
}
