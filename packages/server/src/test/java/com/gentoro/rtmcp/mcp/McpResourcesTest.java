package com.gentoro.rtmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.AuthenticationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpResourcesTest {

  @Mock RtClient client;

  @Test
  void publishesFourResources() {
    McpResources resources = new McpResources(client);

    assertEquals(
        List.of(
            McpResources.QUEUES,
            McpResources.CUSTOM_FIELDS,
            McpResources.CURRENT_USER,
            McpResources.SERVER_INFO),
        resources.uris());
    assertEquals(4, resources.specifications().size());
  }

  @Test
  void readRendersRtResponse() {
    when(client.listQueues()).thenReturn(Map.of("total", 2));

    String json = new McpResources(client).read(McpResources.QUEUES);

    assertTrue(json.contains("\"total\""));
    verify(client).listQueues();
  }

  @Test
  void failedReadRendersErrorDocument() {
    when(client.getCurrentUser())
        .thenThrow(new AuthenticationException("Authentication failed: expired", 401));

    String json = new McpResources(client).read(McpResources.CURRENT_USER);

    assertTrue(json.contains("\"error\""));
    assertTrue(json.contains("Authentication failed: expired"));
  }

  @Test
  void unknownResourceIsRejected() {
    McpResources resources = new McpResources(client);

    assertThrows(IllegalArgumentException.class, () -> resources.read("rt://nope"));
    verifyNoInteractions(client);
  }
}
