package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jetbrains.annotations.Nullable;

/**
 * JSON-RPC 2.0 response. Exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jsonrpc", "id", "result", "error"})
public record JsonRpcResponse(String jsonrpc, long id, @Nullable JsonNode result, @Nullable JsonRpcError error) {

    public JsonRpcResponse {
        if (result != null && error != null) {
            throw new IllegalArgumentException("response " + id + " carries both result and error");
        }
        if (result == null && error == null) {
            result = NullNode.getInstance();
        }
    }

    public static JsonRpcResponse success(long id, JsonNode result) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, id, result, null);
    }

    public static JsonRpcResponse failure(long id, JsonRpcError error) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, id, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
