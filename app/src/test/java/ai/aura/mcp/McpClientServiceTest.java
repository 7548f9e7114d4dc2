package ai.aura.mcp;

import static org.junit.jupiter.api.Assertions.*;

import ai.aura.mcp.McpException.BrokenPipeException;
import ai.aura.mcp.McpException.DiscoveryTimeoutException;
import ai.aura.mcp.McpException.InitializationTimeoutException;
import ai.aura.mcp.McpException.RequestTimeoutException;
import ai.aura.mcp.McpException.ServerNotReadyException;
import ai.aura.mcp.McpException.SpawnException;
import ai.aura.mcp.McpException.ToolCallException;
import ai.aura.mcp.McpException.UnknownServerException;
import ai.aura.mcp.model.ServerStatus;
import ai.aura.mcp.model.Tool;
import ai.aura.testutil.ScriptedTransport;
import ai.aura.testutil.ToolServerScripts;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(30)
class McpClientServiceTest {
    private static final McpServerConfig ECHO = McpServerConfig.of("echo", List.of("echo-server"));
    private final ObjectMapper mapper = new ObjectMapper();

    private ScriptedTransport.Factory factory;
    private McpClientService client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private McpClientService clientFor(ScriptedTransport.Responder responder) {
        factory = new ScriptedTransport.Factory(responder);
        client = new McpClientService(new McpServerRegistry(), factory);
        return client;
    }

    @Test
    void startRunsHandshakeAndDiscoversTools() throws Exception {
        clientFor(ToolServerScripts.echoServer());

        var id = client.startServer(ECHO, "demo");

        var info = client.getInfo(id);
        assertEquals(ServerStatus.READY, info.status());
        assertEquals("echo", info.name());
        assertEquals("demo", info.projectName());
        assertEquals(4242L, info.pid());
        assertEquals(List.of("echo"), client.listTools(id).stream().map(Tool::name).toList());
        assertTrue(client.listTools(id).get(0).inputSchema().isRequired("text"));

        var transport = factory.last();
        assertEquals(List.of("initialize", "notifications/initialized", "tools/list"), transport.writtenMethods());
        var initialize = mapper.readTree(transport.written().get(0));
        assertEquals(McpClientService.PROTOCOL_VERSION, initialize.at("/params/protocolVersion").asText());
        assertEquals(McpClientService.CLIENT_NAME, initialize.at("/params/clientInfo/name").asText());
        assertTrue(initialize.at("/params/capabilities").isObject());
        assertFalse(mapper.readTree(transport.written().get(1)).has("id"));
    }

    @Test
    void echoToolReturnsItsArguments() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var id = client.startServer(ECHO);

        JsonNode result = client.callTool(id, "echo", Map.of("text", "hi"));

        assertEquals(mapper.readTree("{\"text\":\"hi\"}"), result);
        var call = mapper.readTree(factory.last().written().get(3));
        assertEquals("tools/call", call.get("method").asText());
        assertEquals("echo", call.at("/params/name").asText());
        assertEquals("hi", call.at("/params/arguments/text").asText());
    }

    @Test
    void callToolWithoutArgumentsSendsEmptyObject() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var id = client.startServer(ECHO);

        client.callTool(id, "echo", (JsonNode) null, null);

        var call = mapper.readTree(factory.last().written().get(3));
        assertTrue(call.at("/params/arguments").isObject());
        assertEquals(0, call.at("/params/arguments").size());
    }

    @Test
    void callOnServerThatIsNotReadyWritesNothing() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var id = client.startServer(ECHO);
        client.registry().setStatus(id, ServerStatus.STARTING);
        int writesBefore = factory.last().writeCount();

        var e = assertThrows(ServerNotReadyException.class, () -> client.callTool(id, "echo", Map.of("text", "x")));

        assertEquals(ServerStatus.STARTING, e.status());
        assertEquals(writesBefore, factory.last().writeCount());
    }

    @Test
    void blankToolNameIsRejectedBeforeAnyLookup() {
        clientFor(ToolServerScripts.echoServer());
        assertThrows(IllegalArgumentException.class, () -> client.callTool("whatever", " ", Map.of()));
    }

    @Test
    void toolErrorIsToolCallExceptionAndServerStaysReady() throws Exception {
        clientFor((message, transport) -> {
            if ("tools/call".equals(message.path("method").asText())) {
                return List.of(ToolServerScripts.error(message.get("id").asLong(), -32602, "text is required"));
            }
            return ToolServerScripts.echoServer().respond(message, transport);
        });
        var id = client.startServer(ECHO);

        var e = assertThrows(ToolCallException.class, () -> client.callTool(id, "echo", Map.of()));

        assertEquals("echo", e.toolName());
        assertEquals(-32602, e.error().code());
        assertEquals("text is required", e.error().message());
        assertEquals(ServerStatus.READY, client.getStatus(id));
    }

    @Test
    void initializationTimeoutLeavesServerInErrorAndTerminated() {
        clientFor(ToolServerScripts.silentOn(
                Set.of("initialize"), List.of(ToolServerScripts.tool("echo", "Echo")), args -> args));
        var config = ECHO.withTimeouts(Duration.ofMillis(100), Duration.ofSeconds(5));

        assertThrows(InitializationTimeoutException.class, () -> client.startServer(config));

        var info = client.listServers().get(0);
        assertEquals(ServerStatus.ERROR, info.status());
        assertTrue(info.errorMessage().contains("timed out"), info.errorMessage());
        assertFalse(factory.last().isAlive());
        assertEquals(1, factory.last().terminateCalls());
        assertEquals(List.of("initialize"), factory.last().writtenMethods());
    }

    @Test
    void discoveryTimeoutLeavesServerInError() {
        clientFor(ToolServerScripts.silentOn(
                Set.of("tools/list"), List.of(ToolServerScripts.tool("echo", "Echo")), args -> args));
        var config = ECHO.withTimeouts(Duration.ofSeconds(5), Duration.ofMillis(100));

        assertThrows(DiscoveryTimeoutException.class, () -> client.startServer(config));

        var info = client.listServers().get(0);
        assertEquals(ServerStatus.ERROR, info.status());
        assertTrue(info.tools().isEmpty());
        assertFalse(factory.last().isAlive());
    }

    @Test
    void startupFailureReasonIncludesLastStderrLine() {
        clientFor((message, transport) -> {
            if ("initialize".equals(message.path("method").asText())) {
                transport.emitStderr("fatal: AIRTABLE_API_KEY is not set");
                return List.of();
            }
            return List.of();
        });
        var config = ECHO.withTimeouts(Duration.ofMillis(200), Duration.ofSeconds(1));

        assertThrows(InitializationTimeoutException.class, () -> client.startServer(config));

        var message = client.listServers().get(0).errorMessage();
        assertTrue(message.contains("AIRTABLE_API_KEY is not set"), message);
    }

    @Test
    void processExitDuringStartupIsBrokenPipe() {
        clientFor((message, transport) -> {
            transport.crash();
            return List.of();
        });

        assertThrows(BrokenPipeException.class, () -> client.startServer(ECHO));

        var info = client.listServers().get(0);
        assertEquals(ServerStatus.ERROR, info.status());
        assertNotNull(info.errorMessage());
    }

    @Test
    void spawnFailureIsRecordedAndCanBeCleanedUp() throws Exception {
        client = new McpClientService(new McpServerRegistry(), (key, config, listener) -> {
            throw new SpawnException("no such file: " + config.command().get(0), null);
        });

        assertThrows(SpawnException.class, () -> client.startServer(ECHO));

        var info = client.listServers().get(0);
        assertEquals(ServerStatus.ERROR, info.status());
        assertTrue(info.errorMessage().contains("echo-server"));
        var e = assertThrows(ServerNotReadyException.class, () -> client.callTool(info.serverId(), "echo", Map.of()));
        assertEquals(ServerStatus.ERROR, e.status());

        client.stopServer(info.serverId());
        assertTrue(client.listServers().isEmpty());
    }

    @Test
    void stoppedServerIsUnknownToEveryOperation() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var id = client.startServer(ECHO);
        var transport = factory.last();

        client.stopServer(id);

        assertTrue(transport.writtenMethods().contains("shutdown"));
        assertFalse(transport.isAlive());
        assertThrows(UnknownServerException.class, () -> client.getStatus(id));
        assertThrows(UnknownServerException.class, () -> client.getInfo(id));
        assertThrows(UnknownServerException.class, () -> client.listTools(id));
        assertThrows(UnknownServerException.class, () -> client.callTool(id, "echo", Map.of("text", "x")));
        assertThrows(UnknownServerException.class, () -> client.stopServer(id));
        assertThrows(UnknownServerException.class, () -> client.stopServer("never-existed"));
    }

    @Test
    void stopDoesNotWaitForAnUnresponsiveShutdown() throws Exception {
        clientFor(ToolServerScripts.silentOn(
                Set.of("shutdown"), List.of(ToolServerScripts.tool("echo", "Echo")), args -> args));
        var id = client.startServer(ECHO);

        long start = System.nanoTime();
        client.stopServer(id, Duration.ofMillis(100));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 3000);
        assertFalse(factory.last().isAlive());
        assertTrue(client.listServers().isEmpty());
    }

    @Test
    void concurrentCallsAnsweredOutOfOrderReachTheirCallers() throws Exception {
        clientFor((message, transport) -> {
            if ("tools/call".equals(message.path("method").asText())) {
                long id = message.get("id").asLong();
                var args = message.at("/params/arguments");
                // later requests are answered first
                transport.deliverLater(ToolServerScripts.result(id, args), Duration.ofMillis(5 + (40 - id % 40) * 3));
                return List.of();
            }
            return ToolServerScripts.echoServer().respond(message, transport);
        });
        var id = client.startServer(ECHO);

        var pool = Executors.newFixedThreadPool(16);
        try {
            var futures = new ArrayList<Future<JsonNode>>();
            for (int i = 0; i < 64; i++) {
                var text = "message-" + i;
                futures.add(pool.submit(() -> client.callTool(id, "echo", Map.of("text", text))));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals("message-" + i, futures.get(i).get(10, TimeUnit.SECONDS).get("text").asText());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(ServerStatus.READY, client.getStatus(id));
    }

    @Test
    void timedOutCallDoesNotPoisonTheServer() throws Exception {
        clientFor((message, transport) -> {
            if ("tools/call".equals(message.path("method").asText())
                    && "slow".equals(message.at("/params/name").asText())) {
                // answer long after the caller gave up
                transport.deliverLater(
                        ToolServerScripts.result(message.get("id").asLong(), mapper.createObjectNode().put("late", true)),
                        Duration.ofMillis(300));
                return List.of();
            }
            return ToolServerScripts.echoServer().respond(message, transport);
        });
        var id = client.startServer(ECHO);

        var e = assertThrows(
                RequestTimeoutException.class,
                () -> client.callTool(id, "slow", Map.of(), Duration.ofMillis(50)));
        assertEquals("tools/call", e.method());

        assertEquals("after", client.callTool(id, "echo", Map.of("text", "after")).get("text").asText());
        Thread.sleep(400);
        assertEquals("again", client.callTool(id, "echo", Map.of("text", "again")).get("text").asText());
        assertEquals(ServerStatus.READY, client.getStatus(id));
    }

    @Test
    void processDeathFailsWaitingCallAndMarksError() throws Exception {
        clientFor((message, transport) -> {
            if ("tools/call".equals(message.path("method").asText())) {
                return List.of();
            }
            return ToolServerScripts.echoServer().respond(message, transport);
        });
        var id = client.startServer(ECHO);
        var transport = factory.last();

        var pool = Executors.newSingleThreadExecutor();
        try {
            var call = pool.submit(() -> client.callTool(id, "echo", Map.of("text", "x")));
            while (transport.writeCount() < 4) {
                Thread.sleep(5);
            }
            transport.crash();

            var e = assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
            assertInstanceOf(BrokenPipeException.class, e.getCause());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(ServerStatus.ERROR, client.getStatus(id));
        assertNotNull(client.getInfo(id).errorMessage());
        assertThrows(ServerNotReadyException.class, () -> client.callTool(id, "echo", Map.of()));

        // error ids stay queryable until they are stopped
        client.stopServer(id);
        assertThrows(UnknownServerException.class, () -> client.getStatus(id));
    }

    @Test
    void unexpectedExitOfIdleServerMarksError() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var id = client.startServer(ECHO);

        factory.last().crash();

        long deadline = System.currentTimeMillis() + 5000;
        while (client.getStatus(id) != ServerStatus.ERROR && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(ServerStatus.ERROR, client.getStatus(id));
    }

    @Test
    void shutdownAllStopsEveryServer() throws Exception {
        clientFor(ToolServerScripts.echoServer());
        var a = client.startServer(ECHO, "p1");
        var b = client.startServer(ECHO, "p1");
        client.startServer(ECHO, "p2");
        assertNotEquals(a, b);
        assertEquals(2, client.registry().listByProject("p1").size());

        var failed = client.shutdownAll();

        assertTrue(failed.isEmpty());
        assertTrue(client.listServers().isEmpty());
        assertTrue(factory.opened().stream().noneMatch(ScriptedTransport::isAlive));
    }

    @Test
    void stopWhileTheProcessIsSpawningTerminatesIt() throws Exception {
        var inner = new ScriptedTransport.Factory(ToolServerScripts.echoServer());
        var spawning = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        client = new McpClientService(new McpServerRegistry(), (key, config, listener) -> {
            spawning.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SpawnException("interrupted while spawning", e);
            }
            return inner.open(key, config, listener);
        });
        var starter = Executors.newSingleThreadExecutor();
        try {
            var start = starter.submit(() -> client.startServer(ECHO));
            assertTrue(spawning.await(5, TimeUnit.SECONDS));
            var id = client.listServers().get(0).serverId();

            client.stopServer(id);
            release.countDown();

            var e = assertThrows(ExecutionException.class, () -> start.get(10, TimeUnit.SECONDS));
            assertInstanceOf(UnknownServerException.class, e.getCause());
            var transport = inner.last();
            assertFalse(transport.isAlive());
            assertEquals(1, transport.terminateCalls());
            assertTrue(transport.written().isEmpty());
            assertTrue(client.listServers().isEmpty());
        } finally {
            starter.shutdownNow();
        }
    }

    @Test
    void twoConcurrentStopsStillTerminateTheProcess() throws Exception {
        clientFor(ToolServerScripts.silentOn(
                Set.of("shutdown"), List.of(ToolServerScripts.tool("echo", "Echo")), args -> args));
        var id = client.startServer(ECHO);
        var transport = factory.last();
        var stoppers = Executors.newSingleThreadExecutor();
        try {
            var first = stoppers.submit(() -> {
                client.stopServer(id, Duration.ofMillis(500));
                return null;
            });
            long deadline = System.currentTimeMillis() + 5000;
            while (!transport.writtenMethods().contains("shutdown")) {
                assertTrue(System.currentTimeMillis() < deadline, "shutdown request never sent");
                Thread.sleep(5);
            }

            // the first stop is waiting on the shutdown answer; the second finds the session already claimed
            client.stopServer(id);
            first.get(10, TimeUnit.SECONDS);

            assertFalse(transport.isAlive());
            assertEquals(1, transport.terminateCalls());
            assertTrue(client.listServers().isEmpty());
            assertThrows(UnknownServerException.class, () -> client.getStatus(id));
        } finally {
            stoppers.shutdownNow();
        }
    }

    @Test
    void parseToolsSkipsBrokenEntries() throws Exception {
        var result = mapper.readTree(
                """
                {"tools":[{"name":"ok"},{"description":"no name"},{"name":""},42,{"name":"also_ok","description":"d"}]}
                """);

        var tools = McpClientService.parseTools("srv", result);

        assertEquals(List.of("ok", "also_ok"), tools.stream().map(Tool::name).toList());
        assertTrue(McpClientService.parseTools("srv", mapper.createObjectNode()).isEmpty());
    }
}
