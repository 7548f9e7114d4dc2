package ai.aura.mcp;

import ai.aura.mcp.McpException.BrokenPipeException;
import ai.aura.mcp.McpException.DiscoveryTimeoutException;
import ai.aura.mcp.McpException.InitializationTimeoutException;
import ai.aura.mcp.McpException.JsonRpcErrorException;
import ai.aura.mcp.McpException.RequestTimeoutException;
import ai.aura.mcp.McpException.ServerNotReadyException;
import ai.aura.mcp.McpException.SpawnException;
import ai.aura.mcp.McpException.ToolCallException;
import ai.aura.mcp.McpException.UnknownServerException;
import ai.aura.mcp.model.ServerInfo;
import ai.aura.mcp.model.ServerStatus;
import ai.aura.mcp.model.Tool;
import ai.aura.mcp.rpc.JsonRpcConnection;
import ai.aura.mcp.transport.McpTransport;
import ai.aura.mcp.transport.TransportFactory;
import ai.aura.mcp.transport.TransportListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for everything that talks to tool servers: start, stop, list tools, call a tool, query status.
 *
 * <p>Startup runs {@code initialize}, the {@code notifications/initialized} notification and {@code tools/list}
 * before a server becomes {@link ServerStatus#READY}; any failure on that path terminates the process and leaves the
 * server in {@link ServerStatus#ERROR} with the reason recorded. Every method may be called concurrently, including
 * against the same server.
 */
public final class McpClientService implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(McpClientService.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String CLIENT_NAME = "aura";
    public static final String CLIENT_VERSION = "1.0.0";

    static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration TERMINATE_TIMEOUT = Duration.ofSeconds(3);
    private static final int MAX_DIAGNOSTIC_LINES = 20;

    private final McpServerRegistry registry;
    private final TransportFactory transportFactory;
    private final Map<String, ServerSession> sessions = new ConcurrentHashMap<>();

    public McpClientService() {
        this(new McpServerRegistry(), TransportFactory.stdio());
    }

    public McpClientService(McpServerRegistry registry, TransportFactory transportFactory) {
        this.registry = Objects.requireNonNull(registry);
        this.transportFactory = Objects.requireNonNull(transportFactory);
    }

    public McpServerRegistry registry() {
        return registry;
    }

    @Blocking
    public String startServer(McpServerConfig config) throws McpException {
        return startServer(config, null);
    }

    /**
     * Spawn the server, run the handshake and discover its tools.
     *
     * @return the id of the now {@link ServerStatus#READY} server
     * @throws SpawnException if the process could not be launched
     * @throws InitializationTimeoutException if {@code initialize} did not answer within the init timeout
     * @throws DiscoveryTimeoutException if {@code tools/list} did not answer within the request timeout
     */
    @Blocking
    public String startServer(McpServerConfig config, @Nullable String projectName) throws McpException {
        var serverId = registry.register(config.name(), projectName);
        var session = new ServerSession(serverId, config);
        // visible to stopServer from here on, so a stop issued mid-startup finds the process to kill
        sessions.put(serverId, session);

        McpTransport transport;
        try {
            transport = transportFactory.open(session.key, config, session);
        } catch (SpawnException e) {
            sessions.remove(serverId, session);
            markError(serverId, e.getMessage());
            throw e;
        }

        try {
            if (!session.bind(transport) || !registry.contains(serverId)) {
                throw new UnknownServerException(serverId);
            }
            session.connection.attach(transport);
            if (transport.pid() >= 0) {
                registry.setPid(serverId, transport.pid());
            }
            initialize(session);
            var tools = discoverTools(session);
            registry.setTools(serverId, tools);
            registry.setStatus(serverId, ServerStatus.READY);
        } catch (McpException | RuntimeException e) {
            var reason = session.describeFailure(e);
            if (session.stopping) {
                logger.info("MCP server {} ({}) was stopped during startup", config.name(), serverId);
            } else {
                logger.error("Failed to start MCP server {} ({}): {}", config.name(), serverId, reason);
            }
            session.teardown(reason);
            markError(serverId, reason);
            sessions.remove(serverId, session);
            throw e;
        }

        logger.info("MCP server {} ready as {} (pid={})", config.name(), serverId, transport.pid());
        return serverId;
    }

    @Blocking
    public void stopServer(String serverId) throws UnknownServerException {
        stopServer(serverId, DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Best-effort {@code shutdown} request, then unconditional termination. The server leaves the registry; every
     * later operation on the id fails with {@link UnknownServerException}. A server still starting is terminated and
     * its {@code startServer} call fails with {@link UnknownServerException}.
     */
    @Blocking
    public void stopServer(String serverId, Duration timeout) throws UnknownServerException {
        var session = sessions.remove(serverId);
        if (session == null) {
            // startup already failed and cleaned up; only the registry record is left
            registry.remove(serverId);
            return;
        }

        session.stopping = true;
        try {
            if (statusOf(serverId) == ServerStatus.READY) {
                session.connection.request("shutdown", objectMapper.createObjectNode(), timeout);
            }
        } catch (McpException e) {
            logger.debug("Shutdown request to {} failed, terminating anyway: {}", serverId, e.getMessage());
        } finally {
            session.teardown("server stopped");
        }

        try {
            if (registry.get(serverId).status() != ServerStatus.ERROR) {
                registry.setStatus(serverId, ServerStatus.STOPPED);
            }
            registry.remove(serverId);
        } catch (UnknownServerException e) {
            logger.debug("MCP server {} was removed by a concurrent stop", serverId);
        }
    }

    public List<Tool> listTools(String serverId) throws UnknownServerException {
        return registry.getTools(serverId);
    }

    @Blocking
    public JsonNode callTool(String serverId, String toolName, Map<String, ?> arguments) throws McpException {
        return callTool(serverId, toolName, arguments, null);
    }

    @Blocking
    public JsonNode callTool(String serverId, String toolName, Map<String, ?> arguments, @Nullable Duration timeout)
            throws McpException {
        JsonNode tree = objectMapper.valueToTree(arguments);
        return callTool(serverId, toolName, tree, timeout);
    }

    /**
     * Invoke a tool and return the {@code result} member of the response.
     *
     * @param timeout bound on the wait; null means the server's configured request timeout
     * @throws ServerNotReadyException if the server is not ready; nothing is written in that case
     * @throws ToolCallException if the server answered with a JSON-RPC error
     * @throws RequestTimeoutException if no answer arrived in time; the server stays usable
     */
    @Blocking
    public JsonNode callTool(
            String serverId, String toolName, @Nullable JsonNode arguments, @Nullable Duration timeout)
            throws McpException {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("Tool name cannot be empty");
        }
        var info = registry.get(serverId);
        if (info.status() != ServerStatus.READY) {
            throw new ServerNotReadyException(serverId, info.status());
        }
        var session = sessions.get(serverId);
        if (session == null) {
            throw new UnknownServerException(serverId);
        }

        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", arguments != null ? arguments : objectMapper.createObjectNode());
        try {
            return session.connection.request("tools/call", params, timeout);
        } catch (JsonRpcErrorException e) {
            throw new ToolCallException(toolName, e.error());
        } catch (BrokenPipeException e) {
            markError(serverId, e.getMessage());
            throw e;
        }
    }

    public ServerStatus getStatus(String serverId) throws UnknownServerException {
        return registry.get(serverId).status();
    }

    public ServerInfo getInfo(String serverId) throws UnknownServerException {
        return registry.get(serverId);
    }

    public List<ServerInfo> listServers() {
        return registry.listAll();
    }

    /**
     * Stop every known server. Individual failures are logged and collected; they never stop the sweep.
     *
     * @return ids of the servers that could not be stopped cleanly
     */
    @Blocking
    public List<String> shutdownAll() {
        var ids = registry.listAll().stream().map(ServerInfo::serverId).toList();
        logger.info("Shutting down all MCP servers (count={})", ids.size());
        var failed = new ArrayList<String>();
        for (var serverId : ids) {
            try {
                stopServer(serverId);
            } catch (UnknownServerException e) {
                logger.debug("MCP server {} was already gone during shutdownAll", serverId);
            } catch (RuntimeException e) {
                logger.error("Failed to stop MCP server {}", serverId, e);
                failed.add(serverId);
            }
        }
        return failed;
    }

    @Override
    public void close() {
        shutdownAll();
    }

    private void initialize(ServerSession session) throws McpException {
        var config = session.config;
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        params.putObject("clientInfo").put("name", CLIENT_NAME).put("version", CLIENT_VERSION);
        try {
            var result = session.connection.request("initialize", params, config.initTimeout());
            logger.debug("MCP initialize result for {}: {}", session.serverId, result);
        } catch (RequestTimeoutException e) {
            throw new InitializationTimeoutException(config.name(), config.initTimeout(), e);
        }
        session.connection.notify("notifications/initialized", null);
    }

    private List<Tool> discoverTools(ServerSession session) throws McpException {
        var config = session.config;
        JsonNode result;
        try {
            result = session.connection.request("tools/list", objectMapper.createObjectNode(), config.requestTimeout());
        } catch (RequestTimeoutException e) {
            throw new DiscoveryTimeoutException(config.name(), config.requestTimeout(), e);
        }
        return parseTools(session.serverId, result);
    }

    static List<Tool> parseTools(String serverId, JsonNode result) {
        var rawTools = result.path("tools");
        if (!rawTools.isArray()) {
            logger.warn("tools/list result from {} has no tools array: {}", serverId, result);
            return List.of();
        }
        var tools = new ArrayList<Tool>();
        for (var node : rawTools) {
            if (!node.isObject() || !node.hasNonNull("name") || node.get("name").asText().isBlank()) {
                logger.warn("Skipping tool descriptor without a name from {}: {}", serverId, node);
                continue;
            }
            try {
                tools.add(objectMapper.treeToValue(node, Tool.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Skipping unreadable tool descriptor from {}: {}", serverId, node, e);
            }
        }
        return List.copyOf(tools);
    }

    private @Nullable ServerStatus statusOf(String serverId) {
        try {
            return registry.get(serverId).status();
        } catch (UnknownServerException e) {
            return null;
        }
    }

    private void markError(String serverId, @Nullable String reason) {
        transitionToError(serverId, reason, false);
    }

    private void transitionToError(String serverId, @Nullable String reason, boolean onlyIfReady) {
        try {
            var status = registry.get(serverId).status();
            if (status == ServerStatus.READY || (!onlyIfReady && status == ServerStatus.STARTING)) {
                registry.setStatus(serverId, ServerStatus.ERROR, reason);
            }
        } catch (UnknownServerException e) {
            logger.debug("MCP server {} left the registry before it could be marked failed", serverId);
        }
    }

    /** Runtime objects of one spawned server. Also the sink for everything its transport reads. */
    private final class ServerSession implements TransportListener {
        final String serverId;
        final String key;
        final McpServerConfig config;
        final JsonRpcConnection connection;
        final Deque<String> diagnostics = new ArrayDeque<>();
        private final Object stateLock = new Object();
        private @Nullable McpTransport transport;
        volatile boolean stopping;

        ServerSession(String serverId, McpServerConfig config) {
            this.serverId = serverId;
            this.config = config;
            this.key = config.name() + "-" + serverId.substring(0, Math.min(8, serverId.length()));
            this.connection = new JsonRpcConnection(key, objectMapper, config.requestTimeout());
        }

        @Override
        public void onLine(String line) {
            connection.onLine(line);
        }

        @Override
        public void onDiagnostic(String line) {
            synchronized (diagnostics) {
                if (diagnostics.size() == MAX_DIAGNOSTIC_LINES) {
                    diagnostics.removeFirst();
                }
                diagnostics.addLast(line);
            }
        }

        @Override
        public void onClosed() {
            connection.close("server process exited");
            if (!stopping) {
                logger.warn("MCP server {} ({}) exited unexpectedly", config.name(), serverId);
                // a failing startup records its own reason
                transitionToError(serverId, "Server process exited unexpectedly", true);
            }
        }

        /** Adopt a freshly opened transport, or terminate it if a stop got here first. */
        boolean bind(McpTransport opened) {
            synchronized (stateLock) {
                if (!stopping) {
                    transport = opened;
                    return true;
                }
            }
            opened.terminate(TERMINATE_TIMEOUT);
            return false;
        }

        /** Terminate the process at most once and fail every waiter. */
        void teardown(String reason) {
            McpTransport t;
            synchronized (stateLock) {
                stopping = true;
                t = transport;
                transport = null;
            }
            if (t != null) {
                t.terminate(TERMINATE_TIMEOUT);
            }
            connection.close(reason);
        }

        String describeFailure(Exception e) {
            var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            synchronized (diagnostics) {
                return diagnostics.isEmpty() ? message : message + " (last stderr: " + diagnostics.peekLast() + ")";
            }
        }
    }
}
