package com.gentoro.rtmcp.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.InvalidArgumentException;
import com.gentoro.rtmcp.progress.NoOpProgressSink;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AttachmentToolsTest {

  @Mock RtClient client;

  private ToolRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ToolRegistry(List.of(new AttachmentTools(client)));
  }

  private Object call(String tool, Map<String, Object> args) {
    return registry.find(tool).orElseThrow().execute(args, NoOpProgressSink.INSTANCE);
  }

  @Test
  void contentIsReturnedAsBase64WithSize() {
    when(client.getAttachmentContent(15L)).thenReturn("hello".getBytes(StandardCharsets.UTF_8));

    @SuppressWarnings("unchecked")
    Map<String, Object> result =
        (Map<String, Object>) call("get_attachment_content", Map.of("attachment_id", 15));

    assertEquals(15L, result.get("attachment_id"));
    assertEquals("aGVsbG8=", result.get("content_base64"));
    assertEquals(5, result.get("size_bytes"));
  }

  @Test
  void uploadDecodesBase64IgnoringLineBreaks() {
    when(client.uploadAttachment(anyLong(), anyString(), any())).thenReturn(Map.of("id", 3));

    call(
        "upload_attachment",
        Map.of("ticket_id", 4, "filename", "notes.txt", "content_base64", "aGVs\nbG8="));

    ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
    verify(client).uploadAttachment(eq(4L), eq("notes.txt"), bytes.capture());
    assertEquals("hello", new String(bytes.getValue(), StandardCharsets.UTF_8));
  }

  @Test
  void invalidBase64IsAnArgumentError() {
    InvalidArgumentException e =
        assertThrows(
            InvalidArgumentException.class,
            () ->
                call(
                    "upload_attachment",
                    Map.of("ticket_id", 4, "filename", "x.bin", "content_base64", "not*base64")));

    assertTrue(e.getMessage().startsWith("Invalid argument content_base64"));
    verifyNoInteractions(client);
  }
}
