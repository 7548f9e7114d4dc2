package ai.aura.mcp;

import ai.aura.mcp.McpException.UnknownServerException;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Translates the tool-server actions other parts of the application issue into {@link McpClientService} calls.
 *
 * <p>Results are plain maps that serialize straight to the JSON shape the orchestration layer expects.
 */
public final class McpActionHandler {
    private final McpClientService client;
    private final McpServerTemplates templates;

    public McpActionHandler(McpClientService client, McpServerTemplates templates) {
        this.client = client;
        this.templates = templates;
    }

    @Blocking
    public Map<String, Object> startServer(
            String template,
            @Nullable Path root,
            @Nullable Map<String, ?> overrides,
            @Nullable String projectName)
            throws McpException {
        var config = templates.build(template, root, overrides);
        var serverId = client.startServer(config, projectName);
        return result("server_id", serverId, "info", client.getInfo(serverId));
    }

    @Blocking
    public Map<String, Object> stopServer(String serverId) throws UnknownServerException {
        client.stopServer(serverId);
        return result("server_id", serverId, "stopped", true);
    }

    public Map<String, Object> listTools(String serverId) throws UnknownServerException {
        return result("server_id", serverId, "tools", client.listTools(serverId));
    }

    @Blocking
    public Map<String, Object> callTool(
            String serverId, String toolName, Map<String, ?> arguments, @Nullable Duration timeout)
            throws McpException {
        JsonNode value = client.callTool(serverId, toolName, arguments, timeout);
        return result("server_id", serverId, "tool", toolName, "result", value);
    }

    /** Status of one server, or a summary of every known server when {@code serverId} is null. */
    public Map<String, Object> serverStatus(@Nullable String serverId) throws UnknownServerException {
        if (serverId != null) {
            return result("server_id", serverId, "status", client.getStatus(serverId));
        }
        return result("servers", client.listServers());
    }

    private static Map<String, Object> result(Object... keysAndValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
