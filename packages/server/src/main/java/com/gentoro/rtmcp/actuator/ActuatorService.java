package com.gentoro.rtmcp.actuator;

import com.gentoro.rtmcp.http.EmbeddedJettyServer;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Liveness endpoint in the style of Spring Boot's actuator.
 *
 * <p>Registers a servlet at {@value #PATH} answering {@code {"status": "UP"}}. It does not probe
 * RT, so it stays UP while the RT server is unreachable.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String PATH = "/actuator/health";

  private final EmbeddedJettyServer httpServer;

  public ActuatorService(EmbeddedJettyServer httpServer) {
    this.httpServer = Objects.requireNonNull(httpServer, "httpServer");
  }

  /** Mount the health servlet; the listener must be prepared. */
  public void register() {
    ServletContextHandler context = httpServer.getContextHandler();
    if (context == null) {
      throw new IllegalStateException("HTTP listener not prepared");
    }
    context.addServlet(new ServletHolder("health", new HealthServlet()), PATH);
    log.debug("Health endpoint mounted at {}", PATH);
  }

  static class HealthServlet extends HttpServlet {
    static final String PAYLOAD = "{\"status\": \"UP\"}";

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(HttpServletResponse.SC_OK);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      resp.setHeader("Cache-Control", "no-store");
      resp.getWriter().write(PAYLOAD);
    }
  }
}
