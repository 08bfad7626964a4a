package com.gentoro.rtmcp.http;

import com.gentoro.rtmcp.ConfigurationProvider;
import com.gentoro.rtmcp.exception.ConfigException;
import com.gentoro.rtmcp.exception.ExceptionUtil;
import com.gentoro.rtmcp.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * The single HTTP listener of the process: one connector bound to {@code http.hostname} and
 * {@code http.port}, and one root servlet context where the MCP transport and the health endpoint
 * are mounted.
 *
 * <p>Servlets must be added between {@link #prepare()} and {@link #start()}. Stopping releases the
 * listener; a stopped instance can be prepared again.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final String DEFAULT_HOSTNAME = "127.0.0.1";
  public static final int DEFAULT_PORT = 8000;

  private final String hostname;
  private final int port;
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.hostname =
        ConfigurationProvider.optionalString(configuration, "http.hostname")
            .orElse(DEFAULT_HOSTNAME);
    this.port = parsePort(configuration);
  }

  /** Build the server, connector and root context without binding the port. */
  public synchronized void prepare() {
    if (server != null) {
      return;
    }
    Server prepared = new Server();
    ServerConnector listener = new ServerConnector(prepared);
    listener.setHost(hostname);
    listener.setPort(port);
    prepared.addConnector(listener);

    ServletContextHandler context = new ServletContextHandler();
    context.setContextPath("/");
    prepared.setHandler(context);

    this.server = prepared;
    this.connector = listener;
    this.contextHandler = context;
    log.debug("HTTP listener prepared for {}:{}", hostname, port);
  }

  /** Bind and start serving. Prepares first when {@link #prepare()} was not called. */
  public synchronized void start() {
    prepare();
    if (server.isStarted()) {
      return;
    }
    try {
      server.start();
      log.info("Listening on http://{}:{}", hostname, connector.getLocalPort());
    } catch (Exception e) {
      throw ExceptionUtil.wrap(
          e,
          cause ->
              new NetworkException(
                  "Could not bind the HTTP listener to %s:%d".formatted(hostname, port), cause));
    }
  }

  public synchronized void stop() {
    if (server == null) {
      return;
    }
    try {
      server.stop();
      log.info("HTTP listener stopped");
    } catch (Exception e) {
      // the rest of the shutdown sequence still runs
      log.error("Failed to stop the HTTP listener cleanly", e);
    } finally {
      server = null;
      connector = null;
      contextHandler = null;
    }
  }

  public void join() throws InterruptedException {
    Server running;
    synchronized (this) {
      running = server;
    }
    if (running != null) {
      running.join();
    }
  }

  public synchronized boolean isRunning() {
    return server != null && server.isRunning();
  }

  /** Root context, or null before {@link #prepare()} and after {@link #stop()}. */
  public synchronized ServletContextHandler getContextHandler() {
    return contextHandler;
  }

  /** Port actually bound, which differs from the configured one when that is 0; -1 if stopped. */
  public synchronized int localPort() {
    return isRunning() ? connector.getLocalPort() : -1;
  }

  private static int parsePort(Configuration configuration) {
    String raw =
        ConfigurationProvider.optionalString(configuration, "http.port")
            .orElse(String.valueOf(DEFAULT_PORT));
    try {
      int value = Integer.parseInt(raw);
      if (value < 0 || value > 65535) {
        throw new ConfigException("Invalid http.port: " + raw + " is out of range");
      }
      return value;
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid http.port: '" + raw + "' is not a number", e);
    }
  }

  @Override
  public void close() {
    stop();
  }
}
