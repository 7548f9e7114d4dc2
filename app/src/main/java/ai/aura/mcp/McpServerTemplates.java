package ai.aura.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Named launch templates for commonly used tool servers.
 *
 * <p>The bundled templates live in {@code mcp/server-templates.json} on the classpath. A user file with the same shape
 * may add templates or replace bundled ones. Environment references stay unexpanded until the server is spawned.
 */
public final class McpServerTemplates {
    private static final Logger logger = LogManager.getLogger(McpServerTemplates.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String BUNDLED_RESOURCE = "/mcp/server-templates.json";
    private static final TypeReference<LinkedHashMap<String, Template>> TEMPLATE_MAP = new TypeReference<>() {};

    /**
     * One entry of a templates file.
     *
     * @param rootArgument whether a requested root directory is also passed as the last command argument
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Template(
            List<String> command,
            @Nullable String description,
            @Nullable Map<String, String> env,
            @Nullable String cwd,
            @Nullable Double initTimeoutSeconds,
            @Nullable Double requestTimeoutSeconds,
            boolean rootArgument) {}

    private final Map<String, Template> templates;

    private McpServerTemplates(Map<String, Template> templates) {
        this.templates = Map.copyOf(templates);
    }

    /** Templates shipped with the application. */
    public static McpServerTemplates bundled() {
        try (InputStream in = McpServerTemplates.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + BUNDLED_RESOURCE);
            }
            return new McpServerTemplates(objectMapper.readValue(in, TEMPLATE_MAP));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
        }
    }

    /** Bundled templates overlaid with the entries of {@code userFile}, if it exists. */
    public static McpServerTemplates load(@Nullable Path userFile) throws IOException {
        var bundled = bundled();
        if (userFile == null || !Files.isRegularFile(userFile)) {
            return bundled;
        }
        Map<String, Template> merged = new LinkedHashMap<>(bundled.templates);
        Map<String, Template> user = objectMapper.readValue(userFile.toFile(), TEMPLATE_MAP);
        merged.putAll(user);
        logger.info("Loaded {} MCP server template(s) from {}", user.size(), userFile);
        return new McpServerTemplates(merged);
    }

    public Set<String> names() {
        return templates.keySet();
    }

    public boolean contains(String template) {
        return templates.containsKey(template);
    }

    public McpServerConfig build(String template) {
        return build(template, null, null);
    }

    /**
     * Build a config from a template.
     *
     * @param root filesystem root for servers that take one; becomes the working directory
     * @param overrides replacements for {@code name}, {@code command}, {@code description}, {@code env}, {@code cwd},
     *     {@code initTimeoutSeconds} or {@code requestTimeoutSeconds}; other keys are ignored
     * @throws IllegalArgumentException if the template is unknown or an override has the wrong shape
     */
    public McpServerConfig build(
            String template, @Nullable Path root, @Nullable Map<String, ?> overrides) {
        var base = templates.get(template);
        if (base == null) {
            throw new IllegalArgumentException("Unknown MCP server template: " + template);
        }

        var command = new ArrayList<String>(base.command() != null ? base.command() : List.of());
        Path cwd = base.cwd() != null ? Path.of(base.cwd()) : null;
        if (root != null) {
            cwd = root;
            if (base.rootArgument()) {
                command.add(root.toString());
            }
        }
        var config = new McpServerConfig(
                template,
                command,
                base.description(),
                base.env(),
                cwd,
                seconds(base.initTimeoutSeconds()),
                seconds(base.requestTimeoutSeconds()));
        return overrides == null ? config : applyOverrides(config, overrides);
    }

    private static McpServerConfig applyOverrides(McpServerConfig config, Map<String, ?> overrides) {
        var name = config.name();
        var command = config.command();
        var description = config.description();
        var env = config.env();
        var cwd = config.cwd();
        var initTimeout = config.initTimeout();
        var requestTimeout = config.requestTimeout();

        for (var entry : overrides.entrySet()) {
            var value = entry.getValue();
            switch (entry.getKey()) {
                case "name" -> name = objectMapper.convertValue(value, String.class);
                case "command" -> command = objectMapper.convertValue(value, new TypeReference<List<String>>() {});
                case "description" -> description = objectMapper.convertValue(value, String.class);
                case "env" -> env = objectMapper.convertValue(value, new TypeReference<Map<String, String>>() {});
                case "cwd" -> cwd = value == null ? null : Path.of(value.toString());
                case "initTimeoutSeconds" -> initTimeout = seconds(objectMapper.convertValue(value, Double.class));
                case "requestTimeoutSeconds" ->
                    requestTimeout = seconds(objectMapper.convertValue(value, Double.class));
                default -> logger.debug("Ignoring unknown MCP config override '{}'", entry.getKey());
            }
        }
        return new McpServerConfig(name, command, description, env, cwd, initTimeout, requestTimeout);
    }

    private static @Nullable Duration seconds(@Nullable Double value) {
        return value == null ? null : Duration.ofMillis(Math.round(value * 1000));
    }
}
