package ai.aura.mcp;

import ai.aura.util.EnvironmentVariables;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * How to launch and talk to one tool server.
 *
 * <p>Environment overrides are kept unexpanded here; {@link #resolvedEnv(Map)} substitutes {@code ${VAR}} references
 * against the host environment when the process is spawned.
 *
 * @param name identity shown to users and used in log and thread names
 * @param command argv-style command vector, executable first
 * @param description optional summary of what the server offers
 * @param env environment variable overrides
 * @param cwd working directory, or null to inherit the client's
 * @param initTimeout bound on the {@code initialize} handshake
 * @param requestTimeout default bound on every other request
 */
public record McpServerConfig(
        String name,
        List<String> command,
        @Nullable String description,
        Map<String, String> env,
        @Nullable Path cwd,
        Duration initTimeout,
        Duration requestTimeout) {

    public static final Duration DEFAULT_INIT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);

    public McpServerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("command must name an executable");
        }
        command = List.copyOf(command);
        env = env == null ? Map.of() : Map.copyOf(env);
        initTimeout = initTimeout == null ? DEFAULT_INIT_TIMEOUT : initTimeout;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        if (initTimeout.isNegative() || initTimeout.isZero()) {
            throw new IllegalArgumentException("initTimeout must be positive, got: " + initTimeout);
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive, got: " + requestTimeout);
        }
    }

    public static McpServerConfig of(String name, List<String> command) {
        return new McpServerConfig(name, command, null, Map.of(), null, null, null);
    }

    public McpServerConfig withEnv(Map<String, String> newEnv) {
        return new McpServerConfig(name, command, description, newEnv, cwd, initTimeout, requestTimeout);
    }

    public McpServerConfig withCwd(@Nullable Path newCwd) {
        return new McpServerConfig(name, command, description, env, newCwd, initTimeout, requestTimeout);
    }

    public McpServerConfig withCommand(List<String> newCommand) {
        return new McpServerConfig(name, newCommand, description, env, cwd, initTimeout, requestTimeout);
    }

    public McpServerConfig withTimeouts(Duration newInitTimeout, Duration newRequestTimeout) {
        return new McpServerConfig(name, command, description, env, cwd, newInitTimeout, newRequestTimeout);
    }

    public Map<String, String> resolvedEnv() {
        return resolvedEnv(System.getenv());
    }

    public Map<String, String> resolvedEnv(Map<String, String> hostEnvironment) {
        return EnvironmentVariables.expandAll(env, hostEnvironment);
    }
}
