package ai.aura.mcp;

import ai.aura.mcp.model.JsonRpcError;
import ai.aura.mcp.model.ServerStatus;
import java.time.Duration;
import org.jetbrains.annotations.Nullable;

/**
 * Base type for every failure the tool-server client reports to its callers.
 *
 * <p>Malformed lines from a server are never surfaced through this hierarchy; they are logged and dropped by the
 * connection that read them.
 */
public abstract class McpException extends Exception {

    protected McpException(String message) {
        super(message);
    }

    protected McpException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    /** The server process could not be launched. */
    public static final class SpawnException extends McpException {
        public SpawnException(String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /** The {@code initialize} handshake did not complete in time. */
    public static final class InitializationTimeoutException extends McpException {
        public InitializationTimeoutException(String serverName, Duration timeout, Throwable cause) {
            super("Initialization of MCP server '" + serverName + "' timed out after " + timeout.toMillis() + "ms",
                    cause);
        }
    }

    /** The {@code tools/list} discovery request did not complete in time. */
    public static final class DiscoveryTimeoutException extends McpException {
        public DiscoveryTimeoutException(String serverName, Duration timeout, Throwable cause) {
            super("Tool discovery on MCP server '" + serverName + "' timed out after " + timeout.toMillis() + "ms",
                    cause);
        }
    }

    /** A write failed because the process is gone, or the connection closed while a request was waiting. */
    public static final class BrokenPipeException extends McpException {
        public BrokenPipeException(String message) {
            super(message);
        }

        public BrokenPipeException(String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /** A single request exceeded its own timeout. The server stays usable. */
    public static final class RequestTimeoutException extends McpException {
        private final String method;
        private final long requestId;

        public RequestTimeoutException(String method, long requestId, Duration timeout) {
            super("Request " + method + " (id=" + requestId + ") timed out after " + timeout.toMillis() + "ms");
            this.method = method;
            this.requestId = requestId;
        }

        public String method() {
            return method;
        }

        public long requestId() {
            return requestId;
        }
    }

    /** The calling thread was interrupted while waiting for a response. The interrupt flag is restored. */
    public static final class RequestInterruptedException extends McpException {
        public RequestInterruptedException(String method, long requestId, InterruptedException cause) {
            super("Interrupted while waiting for " + method + " (id=" + requestId + ")", cause);
        }
    }

    /** The operation referenced a server id that the registry does not know. */
    public static final class UnknownServerException extends McpException {
        private final String serverId;

        public UnknownServerException(String serverId) {
            super("Unknown MCP server: " + serverId);
            this.serverId = serverId;
        }

        public String serverId() {
            return serverId;
        }
    }

    /** A tool call was rejected because the server is not {@link ServerStatus#READY}. */
    public static final class ServerNotReadyException extends McpException {
        private final ServerStatus status;

        public ServerNotReadyException(String serverId, ServerStatus status) {
            super("Server " + serverId + " is not ready (status=" + status + ")");
            this.status = status;
        }

        public ServerStatus status() {
            return status;
        }
    }

    /** The server answered a request with a JSON-RPC error object. */
    public static class JsonRpcErrorException extends McpException {
        private final JsonRpcError error;

        public JsonRpcErrorException(String message, JsonRpcError error) {
            super(message);
            this.error = error;
        }

        public JsonRpcError error() {
            return error;
        }
    }

    /** The server answered a {@code tools/call} request with a JSON-RPC error object. */
    public static final class ToolCallException extends JsonRpcErrorException {
        private final String toolName;

        public ToolCallException(String toolName, JsonRpcError error) {
            super("Tool call failed for " + toolName + ": " + error.message() + " (code " + error.code() + ")", error);
            this.toolName = toolName;
        }

        public String toolName() {
            return toolName;
        }
    }
}
