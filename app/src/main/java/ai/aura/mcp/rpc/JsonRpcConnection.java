package ai.aura.mcp.rpc;

import ai.aura.mcp.McpException;
import ai.aura.mcp.McpException.BrokenPipeException;
import ai.aura.mcp.McpException.JsonRpcErrorException;
import ai.aura.mcp.McpException.RequestInterruptedException;
import ai.aura.mcp.McpException.RequestTimeoutException;
import ai.aura.mcp.model.JsonRpcError;
import ai.aura.mcp.model.JsonRpcRequest;
import ai.aura.mcp.model.JsonRpcResponse;
import ai.aura.mcp.transport.McpTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Request/response layer over a line-oriented {@link McpTransport}.
 *
 * <p>Each outgoing request gets the next id of a per-connection counter and a one-shot future. The transport's reader
 * thread hands every incoming line to {@link #onLine(String)}, which completes the future whose id matches; arrival
 * order does not matter.
 *
 * <p>One lock guards the id counter, the in-flight map and the write itself, so two concurrent callers can never
 * interleave bytes on the wire. The lock is never held while a caller waits for its response, and the reader thread
 * never takes it.
 */
public final class JsonRpcConnection {
    private static final Logger logger = LogManager.getLogger(JsonRpcConnection.class);
    private static final int MAX_LOGGED_LINE = 500;

    private record PendingRequest(long id, String method, CompletableFuture<JsonRpcResponse> future) {}

    private final String serverKey;
    private final ObjectMapper mapper;
    private final Duration defaultTimeout;

    private final Object lock = new Object();
    private final Map<Long, PendingRequest> inFlight = new HashMap<>();
    private long nextId = 1;
    private @Nullable McpTransport transport;
    private @Nullable String closedReason;

    private volatile @Nullable Consumer<JsonNode> notificationListener;

    // answers to server-initiated requests; its thread is created on first use
    private final ExecutorService replyWriter;

    public JsonRpcConnection(String serverKey, ObjectMapper mapper, Duration defaultTimeout) {
        this.serverKey = Objects.requireNonNull(serverKey);
        this.mapper = Objects.requireNonNull(mapper);
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
        this.replyWriter = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "mcp-" + serverKey + "-replies");
            t.setDaemon(true);
            return t;
        });
    }

    /** Bind the transport requests are written to. Must happen before the first request. */
    public void attach(McpTransport transport) {
        synchronized (lock) {
            if (this.transport != null) {
                throw new IllegalStateException("Connection " + serverKey + " already has a transport");
            }
            this.transport = transport;
        }
    }

    /** Receives server notifications (messages without an id). Called on the reader thread. */
    public void setNotificationListener(@Nullable Consumer<JsonNode> listener) {
        this.notificationListener = listener;
    }

    @Blocking
    public JsonNode request(String method, @Nullable JsonNode params) throws McpException {
        return request(method, params, null);
    }

    /**
     * Send a request and wait for its response.
     *
     * @param timeout bound on the wait; null means the connection default
     * @return the {@code result} member of the response, {@link NullNode} if the server sent none
     * @throws RequestTimeoutException if no response arrived in time; a later response for the id is discarded
     * @throws JsonRpcErrorException if the server answered with an error object
     * @throws BrokenPipeException if the write failed or the connection closed while waiting
     */
    @Blocking
    public JsonNode request(String method, @Nullable JsonNode params, @Nullable Duration timeout)
            throws McpException {
        var effectiveTimeout = timeout != null ? timeout : defaultTimeout;
        PendingRequest pending;
        synchronized (lock) {
            var out = requireOpen();
            long id = nextId++;
            pending = new PendingRequest(id, method, new CompletableFuture<>());
            inFlight.put(id, pending);
            try {
                out.writeLine(encode(JsonRpcRequest.request(id, method, params)));
            } catch (BrokenPipeException | RuntimeException e) {
                inFlight.remove(id);
                throw e;
            }
        }
        return await(pending, effectiveTimeout);
    }

    /** Send a notification: no id, no response expected. */
    public void notify(String method, @Nullable JsonNode params) throws BrokenPipeException {
        synchronized (lock) {
            requireOpen().writeLine(encode(JsonRpcRequest.notification(method, params)));
        }
    }

    /**
     * Handle one line read from the server. Never throws: malformed payloads and responses nobody waits for are logged
     * and dropped so the reader keeps running.
     */
    public void onLine(String raw) {
        try {
            JsonNode msg;
            try {
                msg = mapper.readTree(raw);
            } catch (JsonProcessingException e) {
                logger.warn("Malformed message from {}: {}", serverKey, abbreviate(raw));
                return;
            }
            if (msg == null || !msg.isObject()) {
                logger.warn("Ignoring non-object message from {}: {}", serverKey, abbreviate(raw));
                return;
            }

            var idNode = msg.get("id");
            boolean hasId = idNode != null && !idNode.isNull();
            if (hasId && msg.hasNonNull("method")) {
                rejectServerRequest(idNode, msg.get("method").asText());
            } else if (hasId) {
                handleResponse(idNode, msg);
            } else {
                handleNotification(msg);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to handle message from {}: {}", serverKey, abbreviate(raw), e);
        }
    }

    /**
     * Mark the connection closed and fail every waiter with {@link BrokenPipeException}. Later requests fail fast.
     * Idempotent.
     */
    public void close(String reason) {
        List<PendingRequest> orphaned;
        synchronized (lock) {
            if (closedReason != null) {
                return;
            }
            closedReason = reason;
            orphaned = new ArrayList<>(inFlight.values());
            inFlight.clear();
        }
        replyWriter.shutdown();
        if (!orphaned.isEmpty()) {
            logger.info("Connection {} closed ({}); failing {} pending request(s)", serverKey, reason, orphaned.size());
        }
        for (var pending : orphaned) {
            pending.future()
                    .completeExceptionally(new BrokenPipeException("Connection to MCP server " + serverKey
                            + " closed while waiting for " + pending.method() + ": " + reason));
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closedReason != null;
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    private JsonNode await(PendingRequest pending, Duration timeout) throws McpException {
        JsonRpcResponse response;
        try {
            response = pending.future().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!forget(pending) && pending.future().isDone()) {
                // settled between the timeout and the removal, either by a response or by close()
                return await(pending, Duration.ZERO);
            }
            logger.warn("Request {} (id={}) to {} timed out after {}ms",
                    pending.method(), pending.id(), serverKey, timeout.toMillis());
            throw new RequestTimeoutException(pending.method(), pending.id(), timeout);
        } catch (InterruptedException e) {
            forget(pending);
            Thread.currentThread().interrupt();
            throw new RequestInterruptedException(pending.method(), pending.id(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof McpException mcpException) {
                throw mcpException;
            }
            throw new BrokenPipeException("Request " + pending.method() + " failed: " + e.getCause(), e.getCause());
        }
        return unwrap(pending, response);
    }

    private JsonNode unwrap(PendingRequest pending, JsonRpcResponse response) throws JsonRpcErrorException {
        var error = response.error();
        if (error != null) {
            throw new JsonRpcErrorException(
                    pending.method() + " failed on " + serverKey + ": " + error.message() + " (code " + error.code()
                            + ")",
                    error);
        }
        return Objects.requireNonNull(response.result());
    }

    /** @return true if the entry was still registered and has now been removed */
    private boolean forget(PendingRequest pending) {
        synchronized (lock) {
            return inFlight.remove(pending.id(), pending);
        }
    }

    private void handleResponse(JsonNode idNode, JsonNode msg) {
        if (!idNode.canConvertToLong() || !idNode.isIntegralNumber()) {
            logger.warn("Discarding response from {} with non-integer id {}", serverKey, idNode);
            return;
        }
        long id = idNode.asLong();
        PendingRequest pending;
        synchronized (lock) {
            pending = inFlight.remove(id);
        }
        if (pending == null) {
            logger.warn("No pending request for id={} on {}; discarding late or unsolicited response", id, serverKey);
            return;
        }

        var errorNode = msg.get("error");
        JsonRpcResponse response;
        if (errorNode != null && !errorNode.isNull()) {
            if (msg.has("result")) {
                logger.warn("Response id={} from {} carries both result and error; using the error", id, serverKey);
            }
            response = JsonRpcResponse.failure(id, parseError(errorNode));
        } else {
            var result = msg.get("result");
            response = JsonRpcResponse.success(id, result != null ? result : NullNode.getInstance());
        }
        pending.future().complete(response);
    }

    private JsonRpcError parseError(JsonNode errorNode) {
        if (!errorNode.isObject()) {
            return new JsonRpcError(JsonRpcError.INTERNAL_ERROR, errorNode.asText(), null);
        }
        int code = errorNode.path("code").asInt(JsonRpcError.INTERNAL_ERROR);
        var message = errorNode.hasNonNull("message") ? errorNode.get("message").asText() : null;
        var data = errorNode.get("data");
        return new JsonRpcError(code, message, data == null || data.isNull() ? null : data);
    }

    private void handleNotification(JsonNode msg) {
        var method = msg.path("method").asText("");
        logger.debug("Notification from {}: {}", serverKey, method.isEmpty() ? abbreviate(msg.toString()) : method);
        var listener = notificationListener;
        if (listener != null) {
            listener.accept(msg);
        }
    }

    private void rejectServerRequest(JsonNode idNode, String method) {
        logger.debug("Rejecting server-initiated request {} (id={}) from {}", method, idNode, serverKey);
        ObjectNode reply = mapper.createObjectNode();
        reply.put("jsonrpc", JsonRpcRequest.VERSION);
        reply.set("id", idNode);
        reply.set("error", mapper.valueToTree(JsonRpcError.methodNotFound(method)));
        // the reader thread must never wait for the write lock: a caller may hold it while blocked on a full stdin
        try {
            replyWriter.execute(() -> writeReply(method, reply.toString()));
        } catch (RejectedExecutionException e) {
            logger.debug("Connection {} closed; not answering server request {}", serverKey, method);
        }
    }

    private void writeReply(String method, String reply) {
        try {
            synchronized (lock) {
                if (closedReason == null && transport != null) {
                    transport.writeLine(reply);
                }
            }
        } catch (BrokenPipeException e) {
            logger.debug("Could not answer server request {} on {}", method, serverKey, e);
        }
    }

    private McpTransport requireOpen() throws BrokenPipeException {
        if (closedReason != null) {
            throw new BrokenPipeException("Connection to MCP server " + serverKey + " is closed: " + closedReason);
        }
        if (transport == null) {
            throw new IllegalStateException("Connection " + serverKey + " has no transport attached");
        }
        return transport;
    }

    private String encode(JsonRpcRequest request) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + request.method() + " request", e);
        }
    }

    private static String abbreviate(String raw) {
        return raw.length() <= MAX_LOGGED_LINE ? raw : raw.substring(0, MAX_LOGGED_LINE) + "...";
    }
}
