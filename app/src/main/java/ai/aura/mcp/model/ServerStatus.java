package ai.aura.mcp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a tool server. {@link #STOPPED} and {@link #ERROR} are terminal. */
public enum ServerStatus {
    /** Registered; process spawn and handshake are in progress. */
    STARTING,
    /** Handshake and tool discovery completed. Tool calls are accepted. */
    READY,
    /** Spawn, handshake or discovery failed, or the process died while ready. */
    ERROR,
    /** Explicitly stopped. */
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == ERROR || this == STOPPED;
    }
}
