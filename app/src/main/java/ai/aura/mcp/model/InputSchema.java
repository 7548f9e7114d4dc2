package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * JSON-Schema-like description of the arguments a tool accepts.
 *
 * @param type schema type, {@code "object"} for every tool seen so far
 * @param properties named argument schemas
 * @param required names of the mandatory arguments, possibly empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InputSchema(
        String type, ObjectNode properties, @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> required) {

    public InputSchema(@Nullable String type, @Nullable ObjectNode properties, @Nullable List<String> required) {
        this.type = type == null || type.isBlank() ? "object" : type;
        this.properties = properties == null ? JsonNodeFactory.instance.objectNode() : properties.deepCopy();
        this.required = required == null ? List.of() : List.copyOf(required);
    }

    public static InputSchema empty() {
        return new InputSchema("object", null, null);
    }

    public boolean isRequired(String argument) {
        return required.contains(argument);
    }

    @Override
    public ObjectNode properties() {
        return properties.deepCopy();
    }

    /** Schema of a single named argument, or null when the schema does not describe it. */
    public @Nullable JsonNode property(String argument) {
        var node = properties.get(argument);
        return node == null ? null : node.deepCopy();
    }
}
