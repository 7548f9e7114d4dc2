package ai.aura.cli;

import ai.aura.mcp.McpActionHandler;
import ai.aura.mcp.McpClientService;
import ai.aura.mcp.McpException;
import ai.aura.mcp.McpServerConfig;
import ai.aura.mcp.McpServerTemplates;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "aura-mcp",
        mixinStandardHelpOptions = true,
        description = "Start a tool server, list its tools, optionally call one, then stop it.")
public final class McpCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(McpCli.class);
    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Option(names = "--template", description = "Name of a server template, e.g. filesystem.")
    @Nullable
    private String template;

    @CommandLine.Option(names = "--templates-file", description = "JSON file with additional server templates.")
    @Nullable
    private Path templatesFile;

    @CommandLine.Option(names = "--root", description = "Root directory for servers that take one.")
    @Nullable
    private Path root;

    @CommandLine.Option(names = "--name", description = "Server name when launching a raw command.")
    private String name = "custom";

    @CommandLine.Option(names = "--env", description = "Environment override KEY=VALUE. Can be repeated.")
    private Map<String, String> env = new LinkedHashMap<>();

    @CommandLine.Option(names = "--call", description = "Tool to call after discovery.")
    @Nullable
    private String toolName;

    @CommandLine.Option(names = "--args", description = "Tool arguments as a JSON object.", defaultValue = "{}")
    private String argumentsJson = "{}";

    @CommandLine.Option(names = "--timeout", description = "Tool call timeout in seconds.")
    @Nullable
    private Double timeoutSeconds;

    @CommandLine.Option(names = "--project", description = "Project the server is started for.")
    @Nullable
    private String projectName;

    @CommandLine.Parameters(description = "Raw server command, used when no --template is given.")
    private List<String> command = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new McpCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    @Blocking
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if ((template == null) == command.isEmpty()) {
            err.println("Exactly one of --template or a raw server command is required.");
            return 2;
        }

        Map<String, Object> arguments;
        try {
            arguments = objectMapper.readValue(argumentsJson, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            err.println("--args is not a JSON object: " + e.getOriginalMessage());
            return 2;
        }

        var templates = McpServerTemplates.load(templatesFile);
        if (template != null && !templates.contains(template)) {
            err.println("Unknown template '" + template + "'. Known: " + String.join(", ", templates.names()));
            return 2;
        }

        try (var client = new McpClientService()) {
            var handler = new McpActionHandler(client, templates);
            String serverId;
            if (template != null) {
                Map<String, Object> overrides = env.isEmpty() ? null : Map.of("env", env);
                var started = handler.startServer(template, root, overrides, projectName);
                serverId = (String) started.get("server_id");
            } else {
                var config = McpServerConfig.of(name, command).withEnv(env).withCwd(root);
                serverId = client.startServer(config, projectName);
            }

            print(out, handler.listTools(serverId));
            if (toolName != null) {
                var timeout = timeoutSeconds == null ? null : Duration.ofMillis(Math.round(timeoutSeconds * 1000));
                print(out, handler.callTool(serverId, toolName, arguments, timeout));
            }
            handler.stopServer(serverId);
            return 0;
        } catch (McpException e) {
            logger.debug("MCP command failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void print(PrintWriter out, Object value) throws JsonProcessingException {
        out.println(objectMapper.writeValueAsString(value));
        out.flush();
    }
}
