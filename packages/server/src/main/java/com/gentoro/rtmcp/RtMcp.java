package com.gentoro.rtmcp;

import com.gentoro.rtmcp.actuator.ActuatorService;
import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.config.RtConfig;
import com.gentoro.rtmcp.exception.RtMcpException;
import com.gentoro.rtmcp.http.EmbeddedJettyServer;
import com.gentoro.rtmcp.logging.LoggingService;
import com.gentoro.rtmcp.mcp.McpResources;
import com.gentoro.rtmcp.mcp.McpServer;
import com.gentoro.rtmcp.tools.ToolRegistry;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Process lifecycle: configuration, the shared {@link RtClient}, the tool registry and the HTTP
 * listener serving MCP and the health endpoint.
 *
 * <p>In {@code check} mode only configuration is validated and the RT connection probed; no
 * listener is started. {@link #shutdown()} is idempotent and releases every component that was
 * created, whichever step failed.
 */
public class RtMcp {
  private static final org.slf4j.Logger log = LoggingService.getLogger(RtMcp.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private RtConfig rtConfig;
  private RtClient rtClient;
  private ToolRegistry toolRegistry;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private boolean connectionValidated;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public RtMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public boolean isCheckMode() {
    return startupParameters.checkOnly();
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    this.rtConfig = RtConfig.from(configuration());
    log.info(
        "RT MCP Server starting: url={}, auth={}, verifySsl={}",
        rtConfig.baseUrl(),
        rtConfig.authScheme(),
        rtConfig.verifySsl());
    this.rtClient = new RtClient(rtConfig);

    if (isCheckMode()) {
      this.connectionValidated = probeConnection();
      return;
    }
    if (rtConfig.validateOnStartup()) {
      this.connectionValidated = probeConnection();
    }

    this.toolRegistry = ToolRegistry.standard(rtClient);
    try {
      this.httpServer = new EmbeddedJettyServer(configuration());
      httpServer.prepare();
      new ActuatorService(httpServer).register();
      this.mcpServer =
          new McpServer(configuration(), toolRegistry, new McpResources(rtClient), httpServer);
      mcpServer.register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
    log.info("RT MCP Server ready");
  }

  /** Non-fatal connection probe; tools fail individually later if RT stays unreachable. */
  private boolean probeConnection() {
    try {
      rtClient.validateConnection();
      log.info("RT connection validated");
      return true;
    } catch (RtMcpException e) {
      log.warn(
          "RT connection not available: {}. Server will start anyway, tools will fail if RT is"
              + " unreachable",
          e.getMessage());
      return false;
    }
  }

  /** Block until JVM shutdown or an explicit {@link #shutdown()}. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "rtmcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("RT MCP Server shutting down");
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        closeQuietly(rtClient);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new IllegalStateException("RtMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public RtConfig rtConfig() {
    return rtConfig;
  }

  public RtClient rtClient() {
    return rtClient;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  /** Whether the last startup probe reached RT. */
  public boolean isConnectionValidated() {
    return connectionValidated;
  }

  public boolean isShutdown() {
    return shuttingDown.get();
  }
}
