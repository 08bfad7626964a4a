package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.InvalidArgumentException;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attachment metadata, content download and upload. Binary content crosses the tool boundary as
 * base64 text.
 */
public class AttachmentTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(AttachmentTools.class);

  private static final ToolProperty ATTACHMENT_ID =
      ToolProperty.required("attachment_id", INTEGER, "Numeric attachment ID");

  private final RtClient client;

  public AttachmentTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("get_attachment")
                .description("Get attachment metadata by ID")
                .tags("attachments", "read", "basic")
                .readOnly()
                .param(ATTACHMENT_ID)
                .build(),
            (args, progress) -> client.getAttachment(args.getLong("attachment_id"))),
        new HandlerTool(
            ToolDefinition.builder("get_attachment_content")
                .description("Get attachment content (binary data as base64)")
                .tags("attachments", "read", "basic")
                .readOnly()
                .param(ATTACHMENT_ID)
                .build(),
            this::getContent),
        new HandlerTool(
            ToolDefinition.builder("upload_attachment")
                .description("Upload an attachment to a ticket")
                .tags("attachments", "write", "basic")
                .param(ToolProperty.required("ticket_id", INTEGER, "Ticket to attach to"))
                .param(ToolProperty.required("filename", STRING, "File name shown in RT"))
                .param(
                    ToolProperty.required(
                        "content_base64", STRING, "File content, base64 encoded"))
                .build(),
            this::upload));
  }

  private Object getContent(ToolArguments args, ProgressSink progress) {
    long attachmentId = args.getLong("attachment_id");
    byte[] content = client.getAttachmentContent(attachmentId);
    log.info("Retrieved {} bytes for attachment {}", content.length, attachmentId);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("attachment_id", attachmentId);
    result.put("content_base64", Base64.getEncoder().encodeToString(content));
    result.put("size_bytes", content.length);
    return result;
  }

  private Object upload(ToolArguments args, ProgressSink progress) {
    byte[] content;
    try {
      content = Base64.getDecoder().decode(args.getString("content_base64").replaceAll("\\s", ""));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException(
          "Invalid argument content_base64: not valid base64 (" + e.getMessage() + ")", e);
    }
    return client.uploadAttachment(args.getLong("ticket_id"), args.getString("filename"), content);
  }
}
