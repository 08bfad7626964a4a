package com.gentoro.rtmcp.client;

import com.gentoro.rtmcp.config.RtConfig;
import com.gentoro.rtmcp.exception.NetworkException;
import com.gentoro.rtmcp.http.OkHttpFactory;
import com.gentoro.rtmcp.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Gateway to the RT REST2 API.
 *
 * <p>Owns one {@link OkHttpClient} for the lifetime of the process. Every call is dispatched
 * against {@link RtConfig#baseUrl()}, carries the configured credentials and {@code Accept:
 * application/json}, and has its status translated by {@link ResponseMapper}. Transport failures
 * surface as {@link NetworkException}; there is no automatic retry.
 *
 * <p>Instances are safe for concurrent use. Without an {@code If-Match} token, concurrent updates
 * to the same object are last-write-wins on the server.
 */
public class RtClient implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(RtClient.class);

  static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
  static final String ATTACHMENT_PART = "attachment";

  private final OkHttpClient http;
  private final HttpUrl baseUrl;

  public RtClient(RtConfig config) {
    this(config, OkHttpFactory.create(config));
  }

  public RtClient(RtConfig config, OkHttpClient http) {
    this.http = http;
    this.baseUrl = HttpUrl.get(config.baseUrl());
    log.debug("RT client bound to {} ({} auth)", baseUrl, config.authScheme());
  }

  public HttpUrl baseUrl() {
    return baseUrl;
  }

  // ---------------------------------------------------------------------------------------------
  // Dispatch
  // ---------------------------------------------------------------------------------------------

  /** Send a JSON request and return the mapped response body. */
  public Map<String, Object> execute(RtRequest request) {
    RequestBody body =
        request.body() == null
            ? null
            : RequestBody.create(JacksonUtility.toCompactJson(request.body()), JSON);
    return dispatch(request, body);
  }

  /** Fetch raw bytes. Error statuses are mapped exactly like {@link #execute(RtRequest)}. */
  public byte[] download(RtRequest request) {
    Request httpRequest = toHttpRequest(request, null);
    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody responseBody = response.body();
      byte[] bytes = responseBody == null ? new byte[0] : responseBody.bytes();
      if (response.isSuccessful()) {
        return bytes;
      }
      // throws for every error status; 304 falls through with no content
      ResponseMapper.map(response.code(), new String(bytes, StandardCharsets.UTF_8));
      return new byte[0];
    } catch (IOException e) {
      throw networkFailure(e);
    }
  }

  private Map<String, Object> dispatch(RtRequest request, RequestBody body) {
    Request httpRequest = toHttpRequest(request, body);
    log.trace("Dispatching {}", request);
    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody responseBody = response.body();
      String raw = responseBody == null ? "" : responseBody.string();
      return ResponseMapper.map(response.code(), raw);
    } catch (IOException e) {
      throw networkFailure(e);
    }
  }

  static NetworkException networkFailure(IOException e) {
    if (e instanceof SocketTimeoutException) {
      return new NetworkException("Request timeout", true, e);
    }
    if (e instanceof InterruptedIOException) {
      Thread.currentThread().interrupt();
      return new NetworkException("Request interrupted", e);
    }
    return new NetworkException("Network error: " + e.getMessage(), e);
  }

  private Request toHttpRequest(RtRequest request, RequestBody body) {
    HttpUrl.Builder url = baseUrl.newBuilder();
    if (request.pathSegments().isEmpty()) {
      url.addPathSegment("");
    } else {
      request.pathSegments().forEach(url::addPathSegment);
    }
    request.query().forEach(url::addQueryParameter);

    Request.Builder builder = new Request.Builder().url(url.build());
    request.headers().forEach(builder::header);

    RequestBody effective = body;
    if (effective == null
        && (request.method() == HttpMethod.POST || request.method() == HttpMethod.PUT)) {
      effective = RequestBody.create(new byte[0], null);
    }
    builder.method(request.method().name(), effective);
    return builder.build();
  }

  // ---------------------------------------------------------------------------------------------
  // Connection / global
  // ---------------------------------------------------------------------------------------------

  /** Cheap authenticated probe used at startup. */
  public void validateConnection() {
    execute(RtRequest.get("queues").build());
  }

  public Map<String, Object> serverInfo() {
    return execute(RtRequest.get().build());
  }

  /** Global search; {@code type} narrows the object type when non-null. */
  public Map<String, Object> searchAll(String query, String type, int page, int perPage) {
    return execute(
        RtRequest.get("search")
            .query("query", query)
            .query("page", page)
            .query("per_page", perPage)
            .query("type", type)
            .build());
  }

  /** Query one of the plural collection endpoints, e.g. {@code queues} or {@code customroles}. */
  public Map<String, Object> searchCollection(
      String collection, String query, int page, int perPage) {
    return execute(
        RtRequest.get(collection)
            .query("query", query)
            .query("page", page)
            .query("per_page", perPage)
            .build());
  }

  // ---------------------------------------------------------------------------------------------
  // Tickets
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> getTicket(long ticketId) {
    return execute(RtRequest.get("ticket", ticketId).build());
  }

  public Map<String, Object> createTicket(Map<String, Object> data) {
    return execute(RtRequest.post("ticket").body(data).build());
  }

  public Map<String, Object> updateTicket(long ticketId, Map<String, Object> data) {
    return updateTicket(ticketId, data, null);
  }

  /** Update with an optional {@code If-Match} token; a stale token yields a conflict. */
  public Map<String, Object> updateTicket(long ticketId, Map<String, Object> data, String etag) {
    return execute(
        RtRequest.put("ticket", ticketId).body(data).header("If-Match", etag).build());
  }

  public Map<String, Object> deleteTicket(long ticketId) {
    return execute(RtRequest.delete("ticket", ticketId).build());
  }

  public Map<String, Object> searchTickets(String query, int page, int perPage) {
    return searchCollection("tickets", query, page, perPage);
  }

  public Map<String, Object> correspondTicket(long ticketId, Map<String, Object> data) {
    return execute(RtRequest.post("ticket", ticketId, "correspond").body(data).build());
  }

  public Map<String, Object> commentTicket(long ticketId, Map<String, Object> data) {
    return execute(RtRequest.post("ticket", ticketId, "comment").body(data).build());
  }

  public Map<String, Object> takeTicket(long ticketId) {
    return execute(RtRequest.put("ticket", ticketId, "take").build());
  }

  public Map<String, Object> stealTicket(long ticketId) {
    return execute(RtRequest.put("ticket", ticketId, "steal").build());
  }

  public Map<String, Object> untakeTicket(long ticketId) {
    return execute(RtRequest.put("ticket", ticketId, "untake").build());
  }

  public Map<String, Object> getTicketHistory(long ticketId) {
    return execute(RtRequest.get("ticket", ticketId, "history").build());
  }

  public Map<String, Object> getTicketAttachments(long ticketId) {
    return execute(RtRequest.get("ticket", ticketId, "attachments").build());
  }

  public Map<String, Object> linkTickets(long ticketId, Map<String, Object> data) {
    return execute(RtRequest.post("ticket", ticketId, "links").body(data).build());
  }

  public Map<String, Object> mergeTickets(long ticketId, long intoTicketId) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Into", intoTicketId);
    return execute(RtRequest.post("ticket", ticketId, "merge").body(data).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Queues
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> listQueues() {
    return execute(RtRequest.get("queues").build());
  }

  public Map<String, Object> getQueue(String queueId) {
    return execute(RtRequest.get("queue", queueId).build());
  }

  public Map<String, Object> createQueue(Map<String, Object> data) {
    return execute(RtRequest.post("queue").body(data).build());
  }

  public Map<String, Object> updateQueue(String queueId, Map<String, Object> data) {
    return execute(RtRequest.put("queue", queueId).body(data).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Users
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> listUsers() {
    return execute(RtRequest.get("users").build());
  }

  public Map<String, Object> getUser(String userId) {
    return execute(RtRequest.get("user", userId).build());
  }

  public Map<String, Object> getCurrentUser() {
    return execute(RtRequest.get("user", "current").build());
  }

  public Map<String, Object> createUser(Map<String, Object> data) {
    return execute(RtRequest.post("user").body(data).build());
  }

  public Map<String, Object> updateUser(String userId, Map<String, Object> data) {
    return execute(RtRequest.put("user", userId).body(data).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Groups
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> listGroups() {
    return execute(RtRequest.get("groups").build());
  }

  public Map<String, Object> getGroup(String groupId) {
    return execute(RtRequest.get("group", groupId).build());
  }

  public Map<String, Object> createGroup(Map<String, Object> data) {
    return execute(RtRequest.post("group").body(data).build());
  }

  public Map<String, Object> updateGroup(String groupId, Map<String, Object> data) {
    return execute(RtRequest.put("group", groupId).body(data).build());
  }

  public Map<String, Object> deleteGroup(String groupId) {
    return execute(RtRequest.delete("group", groupId).build());
  }

  public Map<String, Object> addGroupMember(String groupId, String userId) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("UserId", userId);
    return execute(RtRequest.post("group", groupId, "member").body(data).build());
  }

  public Map<String, Object> removeGroupMember(String groupId, String userId) {
    return execute(RtRequest.delete("group", groupId, "member", userId).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Assets and catalogs
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> listAssets() {
    return execute(RtRequest.get("assets").build());
  }

  public Map<String, Object> getAsset(long assetId) {
    return execute(RtRequest.get("asset", assetId).build());
  }

  public Map<String, Object> createAsset(Map<String, Object> data) {
    return execute(RtRequest.post("asset").body(data).build());
  }

  public Map<String, Object> updateAsset(long assetId, Map<String, Object> data) {
    return execute(RtRequest.put("asset", assetId).body(data).build());
  }

  public Map<String, Object> deleteAsset(long assetId) {
    return execute(RtRequest.delete("asset", assetId).build());
  }

  public Map<String, Object> listCatalogs() {
    return execute(RtRequest.get("catalogs").build());
  }

  public Map<String, Object> getCatalog(String catalogId) {
    return execute(RtRequest.get("catalog", catalogId).build());
  }

  public Map<String, Object> createCatalog(Map<String, Object> data) {
    return execute(RtRequest.post("catalog").body(data).build());
  }

  public Map<String, Object> updateCatalog(String catalogId, Map<String, Object> data) {
    return execute(RtRequest.put("catalog", catalogId).body(data).build());
  }

  public Map<String, Object> deleteCatalog(String catalogId) {
    return execute(RtRequest.delete("catalog", catalogId).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Custom fields and custom roles
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> listCustomFields() {
    return execute(RtRequest.get("customfields").build());
  }

  public Map<String, Object> getCustomField(String fieldId) {
    return execute(RtRequest.get("customfield", fieldId).build());
  }

  public Map<String, Object> createCustomField(Map<String, Object> data) {
    return execute(RtRequest.post("customfield").body(data).build());
  }

  public Map<String, Object> updateCustomField(String fieldId, Map<String, Object> data) {
    return execute(RtRequest.put("customfield", fieldId).body(data).build());
  }

  public Map<String, Object> deleteCustomField(String fieldId) {
    return execute(RtRequest.delete("customfield", fieldId).build());
  }

  public Map<String, Object> listCustomRoles() {
    return execute(RtRequest.get("customroles").build());
  }

  public Map<String, Object> getCustomRole(String roleId) {
    return execute(RtRequest.get("customrole", roleId).build());
  }

  public Map<String, Object> createCustomRole(Map<String, Object> data) {
    return execute(RtRequest.post("customrole").body(data).build());
  }

  public Map<String, Object> updateCustomRole(String roleId, Map<String, Object> data) {
    return execute(RtRequest.put("customrole", roleId).body(data).build());
  }

  public Map<String, Object> deleteCustomRole(String roleId) {
    return execute(RtRequest.delete("customrole", roleId).build());
  }

  // ---------------------------------------------------------------------------------------------
  // Transactions and attachments
  // ---------------------------------------------------------------------------------------------

  public Map<String, Object> getTransaction(long transactionId) {
    return execute(RtRequest.get("transaction", transactionId).build());
  }

  public Map<String, Object> listTransactions() {
    return execute(RtRequest.get("transactions").build());
  }

  public Map<String, Object> searchTransactions(String query, int page, int perPage) {
    return searchCollection("transactions", query, page, perPage);
  }

  public Map<String, Object> getAttachment(long attachmentId) {
    return execute(RtRequest.get("attachment", attachmentId).build());
  }

  public byte[] getAttachmentContent(long attachmentId) {
    return download(RtRequest.get("attachment", attachmentId, "content").build());
  }

  /** Upload a file to a ticket as multipart/form-data. */
  public Map<String, Object> uploadAttachment(long ticketId, String filename, byte[] content) {
    RequestBody multipart =
        new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart(ATTACHMENT_PART, filename, RequestBody.create(content, OCTET_STREAM))
            .build();
    return dispatch(RtRequest.post("ticket", ticketId, "attach").build(), multipart);
  }

  @Override
  public void close() {
    log.debug("Releasing RT client resources");
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }
}
