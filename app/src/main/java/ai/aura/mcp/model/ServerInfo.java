package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of what the registry knows about one server.
 *
 * @param serverId opaque id minted by the registry
 * @param name human name taken from the server configuration
 * @param projectName project the server was started for, if any
 * @param status lifecycle state
 * @param pid process id; null until the process is spawned
 * @param tools tools discovered during startup
 * @param errorMessage reason for the last failure, if any
 * @param startedAt registration time, epoch milliseconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerInfo(
        @JsonProperty("server_id") String serverId,
        String name,
        @JsonProperty("project_name") @Nullable String projectName,
        ServerStatus status,
        @Nullable Long pid,
        List<Tool> tools,
        @JsonProperty("error_message") @Nullable String errorMessage,
        @JsonProperty("started_at") long startedAt) {

    public ServerInfo {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        if (startedAt < 0) {
            throw new IllegalArgumentException("startedAt must be non-negative, got: " + startedAt);
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ServerInfo starting(String serverId, String name, @Nullable String projectName) {
        return new ServerInfo(
                serverId, name, projectName, ServerStatus.STARTING, null, List.of(), null, System.currentTimeMillis());
    }

    public ServerInfo withStatus(ServerStatus newStatus, @Nullable String newErrorMessage) {
        return new ServerInfo(serverId, name, projectName, newStatus, pid, tools, newErrorMessage, startedAt);
    }

    public ServerInfo withPid(long newPid) {
        return new ServerInfo(serverId, name, projectName, status, newPid, tools, errorMessage, startedAt);
    }

    public ServerInfo withTools(List<Tool> newTools) {
        return new ServerInfo(serverId, name, projectName, status, pid, newTools, errorMessage, startedAt);
    }
}
