package ai.aura.mcp;

import ai.aura.mcp.McpException.UnknownServerException;
import ai.aura.mcp.model.ServerInfo;
import ai.aura.mcp.model.ServerStatus;
import ai.aura.mcp.model.Tool;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Thread-safe bookkeeping of known tool servers and their discovered tools.
 *
 * <p>Holds state only: no subprocess or I/O logic lives here. Every accessor returns an immutable {@link ServerInfo}
 * snapshot, so callers can never change registry state except through the setters below. All methods serialize on
 * a single lock.
 */
public final class McpServerRegistry {
    private static final Logger logger = LogManager.getLogger(McpServerRegistry.class);

    private final Object lock = new Object();
    private final Map<String, ServerInfo> servers = new LinkedHashMap<>();

    /** Mint a fresh server id and register it in {@link ServerStatus#STARTING}. */
    public String register(String name) {
        return register(name, null);
    }

    public String register(String name, @Nullable String projectName) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            String id;
            do {
                id = UUID.randomUUID().toString();
            } while (servers.containsKey(id));
            servers.put(id, ServerInfo.starting(id, name, projectName));
            logger.info("MCP server registered: {} ({}, status={})", id, name, ServerStatus.STARTING);
            return id;
        }
    }

    public void setStatus(String serverId, ServerStatus status) throws UnknownServerException {
        setStatus(serverId, status, null);
    }

    public void setStatus(String serverId, ServerStatus status, @Nullable String errorMessage)
            throws UnknownServerException {
        Objects.requireNonNull(status, "status");
        update(serverId, info -> info.withStatus(status, errorMessage));
        if (errorMessage != null) {
            logger.error("MCP server {} status={}: {}", serverId, status, errorMessage);
        } else {
            logger.info("MCP server {} status={}", serverId, status);
        }
    }

    public void setPid(String serverId, long pid) throws UnknownServerException {
        update(serverId, info -> info.withPid(pid));
        logger.debug("MCP server {} assigned pid={}", serverId, pid);
    }

    public void setTools(String serverId, List<Tool> tools) throws UnknownServerException {
        Objects.requireNonNull(tools, "tools");
        update(serverId, info -> info.withTools(tools));
        logger.info("MCP server {} tools discovered: {}", serverId, tools.size());
    }

    public ServerInfo get(String serverId) throws UnknownServerException {
        synchronized (lock) {
            return require(serverId);
        }
    }

    public List<Tool> getTools(String serverId) throws UnknownServerException {
        return get(serverId).tools();
    }

    public boolean contains(String serverId) {
        synchronized (lock) {
            return servers.containsKey(serverId);
        }
    }

    public List<ServerInfo> listAll() {
        synchronized (lock) {
            return List.copyOf(servers.values());
        }
    }

    public List<ServerInfo> listByStatus(ServerStatus status) {
        synchronized (lock) {
            return servers.values().stream().filter(s -> s.status() == status).toList();
        }
    }

    public List<ServerInfo> listByProject(String projectName) {
        synchronized (lock) {
            return servers.values().stream()
                    .filter(s -> projectName.equals(s.projectName()))
                    .toList();
        }
    }

    /** Delete the record. Ids are random UUIDs, so a removed id is not handed out again. */
    public void remove(String serverId) throws UnknownServerException {
        synchronized (lock) {
            if (servers.remove(serverId) == null) {
                throw new UnknownServerException(serverId);
            }
        }
        logger.info("MCP server removed from registry: {}", serverId);
    }

    public int size() {
        synchronized (lock) {
            return servers.size();
        }
    }

    private void update(String serverId, UnaryOperator<ServerInfo> change) throws UnknownServerException {
        synchronized (lock) {
            servers.put(serverId, change.apply(require(serverId)));
        }
    }

    private ServerInfo require(String serverId) throws UnknownServerException {
        var info = servers.get(serverId);
        if (info == null) {
            throw new UnknownServerException(serverId);
        }
        return info;
    }
}
