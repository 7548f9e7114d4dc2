package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * A named operation exposed by a tool server, as reported by {@code tools/list}.
 *
 * @param name unique within one server
 * @param description human readable summary; servers may omit it
 * @param inputSchema accepted arguments
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tool(
        String name, @Nullable String description, @JsonProperty("inputSchema") InputSchema inputSchema) {

    public Tool {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        if (inputSchema == null) {
            inputSchema = InputSchema.empty();
        }
    }
}
