package com.gentoro.rtmcp.client;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.rtmcp.config.RtConfig;
import com.gentoro.rtmcp.exception.ApiException;
import com.gentoro.rtmcp.exception.ConflictException;
import com.gentoro.rtmcp.exception.NetworkException;
import com.gentoro.rtmcp.exception.NotFoundException;
import com.gentoro.rtmcp.http.OkHttpFactory;
import com.gentoro.rtmcp.utility.JacksonUtility;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import okhttp3.Request;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RtClientTest {

  private StubInterceptor stub;
  private RtClient client;

  @BeforeEach
  void setUp() {
    RtConfig config = RtConfig.builder().url("https://rt.test").token("secret-token").build();
    stub = new StubInterceptor();
    client = new RtClient(config, OkHttpFactory.builder(config).addInterceptor(stub).build());
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void everyRequestCarriesCredentialsAndAcceptHeader() {
    stub.respond(200, "{\"id\": 1}");

    client.getTicket(1);

    Request request = stub.lastRequest();
    assertEquals("GET", request.method());
    assertEquals("https://rt.test/REST/2.0/ticket/1", request.url().toString());
    assertEquals("token secret-token", request.header("Authorization"));
    assertEquals("application/json", request.header("Accept"));
  }

  @Test
  void basicCredentialsAreSentWhenNoTokenIsConfigured() {
    RtConfig config =
        RtConfig.builder().url("https://rt.test").user("alice").password("pw").build();
    StubInterceptor basicStub = new StubInterceptor().respond(200, "{}");
    try (RtClient basic =
        new RtClient(config, OkHttpFactory.builder(config).addInterceptor(basicStub).build())) {
      basic.listQueues();
    }

    assertTrue(basicStub.lastRequest().header("Authorization").startsWith("Basic "));
  }

  @Test
  void pathSegmentsAndQueryAreEncoded() {
    stub.respond(200, "{\"items\": []}");

    client.getUser("jane doe/admin");
    assertEquals("/REST/2.0/user/jane%20doe%2Fadmin", stub.lastRequest().url().encodedPath());

    stub.respond(200, "{\"items\": []}");
    client.searchTickets("Queue = 'General' AND Status = 'open'", 2, 50);
    Request search = stub.lastRequest();
    assertEquals("/REST/2.0/tickets", search.url().encodedPath());
    assertEquals("Queue = 'General' AND Status = 'open'", search.url().queryParameter("query"));
    assertEquals("2", search.url().queryParameter("page"));
    assertEquals("50", search.url().queryParameter("per_page"));
  }

  @Test
  void serverInfoTargetsTheBasePathWithTrailingSlash() {
    stub.respond(200, "{\"Version\": \"5.0.5\"}");

    Map<String, Object> info = client.serverInfo();

    assertEquals("5.0.5", info.get("Version"));
    assertEquals("https://rt.test/REST/2.0/", stub.lastRequest().url().toString());
  }

  @Test
  void globalSearchOmitsTypeWhenAbsent() {
    stub.respond(200, "{}");

    client.searchAll("printer", null, 1, 20);

    assertNull(stub.lastRequest().url().queryParameter("type"));
    assertEquals("printer", stub.lastRequest().url().queryParameter("query"));
  }

  @Test
  void updateSendsJsonBodyAndOptionalIfMatch() {
    stub.respond(200, "[\"Ticket 5: Status changed\"]");

    client.updateTicket(5, Map.of("Status", "resolved"), "\"abc\"");

    Request request = stub.lastRequest();
    assertEquals("PUT", request.method());
    assertEquals("\"abc\"", request.header("If-Match"));
    assertEquals(Map.of("Status", "resolved"), parse(stub.lastBody()));

    stub.respond(200, "{}");
    client.updateTicket(5, Map.of("Status", "open"));
    assertNull(stub.lastRequest().header("If-Match"));
  }

  @Test
  void staleEtagSurfacesAsConflict() {
    stub.respond(412, "{\"message\": \"Precondition failed\"}");

    assertThrows(
        ConflictException.class,
        () -> client.updateTicket(5, Map.of("Status", "open"), "\"old\""));
  }

  @Test
  void bodilessPutStillSendsEmptyBody() {
    stub.respond(200, "[\"Owner changed\"]");

    client.takeTicket(9);

    Request request = stub.lastRequest();
    assertEquals("PUT", request.method());
    assertEquals("/REST/2.0/ticket/9/take", request.url().encodedPath());
    assertEquals("", stub.lastBody());
  }

  @Test
  void groupMembershipEndpoints() {
    stub.respond(200, "{}").respond(204, "");

    client.addGroupMember("Support", "jane");
    assertEquals("/REST/2.0/group/Support/member", stub.lastRequest().url().encodedPath());
    assertEquals(Map.of("UserId", "jane"), parse(stub.lastBody()));

    client.removeGroupMember("Support", "jane");
    assertEquals("DELETE", stub.lastRequest().method());
    assertEquals("/REST/2.0/group/Support/member/jane", stub.lastRequest().url().encodedPath());
  }

  @Test
  void mergeSendsTargetTicket() {
    stub.respond(200, "{}");

    client.mergeTickets(10, 20);

    assertEquals("/REST/2.0/ticket/10/merge", stub.lastRequest().url().encodedPath());
    assertEquals(Map.of("Into", 20), parse(stub.lastBody()));
  }

  @Test
  void notFoundIsMapped() {
    stub.respond(404, "{\"message\": \"Unknown ticket\"}");

    NotFoundException e = assertThrows(NotFoundException.class, () -> client.getTicket(404));
    assertEquals("Resource not found: Unknown ticket", e.getMessage());
  }

  @Test
  void uploadIsMultipartWithAttachmentPart() {
    stub.respond(201, "{\"id\": 77}");

    Map<String, Object> result =
        client.uploadAttachment(3, "notes.txt", "hello".getBytes(StandardCharsets.UTF_8));

    assertEquals(77, result.get("id"));
    Request request = stub.lastRequest();
    assertEquals("/REST/2.0/ticket/3/attach", request.url().encodedPath());
    assertTrue(request.body().contentType().toString().startsWith("multipart/form-data"));
    assertTrue(stub.lastBody().contains("name=\"attachment\"; filename=\"notes.txt\""));
    assertTrue(stub.lastBody().contains("hello"));
  }

  @Test
  void downloadReturnsRawBytes() {
    byte[] png = new byte[] {(byte) 0x89, 'P', 'N', 'G'};
    stub.respondBytes(200, png);

    assertArrayEquals(png, client.getAttachmentContent(12));
    assertEquals("/REST/2.0/attachment/12/content", stub.lastRequest().url().encodedPath());
  }

  @Test
  void downloadMapsErrorStatuses() {
    stub.respond(404, "{\"message\": \"gone\"}");
    assertThrows(NotFoundException.class, () -> client.getAttachmentContent(12));

    stub.respond(500, "oops");
    ApiException e = assertThrows(ApiException.class, () -> client.getAttachmentContent(12));
    assertEquals("oops", e.getApiMessage());
  }

  @Test
  void timeoutIsReportedAsNetworkTimeout() {
    stub.fail(new SocketTimeoutException("timeout"));

    NetworkException e = assertThrows(NetworkException.class, () -> client.listQueues());
    assertTrue(e.isTimeout());
    assertEquals("Request timeout", e.getMessage());
  }

  @Test
  void connectionFailureIsReportedAsNetworkError() {
    stub.fail(new ConnectException("Connection refused"));

    NetworkException e = assertThrows(NetworkException.class, () -> client.validateConnection());
    assertFalse(e.isTimeout());
    assertTrue(e.getMessage().startsWith("Network error: "));
  }

  @Test
  void interruptedCallIsNotATimeoutAndKeepsTheInterruptFlag() {
    stub.fail(new InterruptedIOException("interrupted"));

    try {
      NetworkException e = assertThrows(NetworkException.class, () -> client.listQueues());
      assertFalse(e.isTimeout());
      assertEquals("Request interrupted", e.getMessage());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  private static Map<String, Object> parse(String json) {
    return JacksonUtility.readMap(json);
  }
}
