package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/**
 * Outgoing JSON-RPC 2.0 message. A null {@code id} makes it a notification.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JsonRpcRequest(String jsonrpc, @Nullable Long id, String method, @Nullable JsonNode params) {
    public static final String VERSION = "2.0";

    public static JsonRpcRequest request(long id, String method, @Nullable JsonNode params) {
        return new JsonRpcRequest(VERSION, id, method, params);
    }

    public static JsonRpcRequest notification(String method, @Nullable JsonNode params) {
        return new JsonRpcRequest(VERSION, null, method, params);
    }

    @JsonIgnore
    public boolean isNotification() {
        return id == null;
    }
}
