package ai.aura.mcp.transport;

/** Receives what a transport reads from its server. Called from the transport's reader threads. */
public interface TransportListener {

    /** A complete, non-blank line from the server's standard output. */
    void onLine(String line);

    /** A line from the server's standard error. Diagnostic only, never protocol traffic. */
    void onDiagnostic(String line);

    /** Standard output reached end of stream; no further {@link #onLine} calls will follow. Called at most once. */
    void onClosed();
}
