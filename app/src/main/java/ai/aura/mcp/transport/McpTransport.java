package ai.aura.mcp.transport;

import ai.aura.mcp.McpException.BrokenPipeException;
import java.time.Duration;

/**
 * Line-oriented, bidirectional channel to one tool server.
 *
 * <p>Incoming lines are pushed to the {@link TransportListener} supplied when the transport was created. Callers of
 * {@link #writeLine(String)} are responsible for serializing their writes.
 */
public interface McpTransport {

    /** Operating system process id, or -1 when the transport is not backed by a process. */
    long pid();

    boolean isAlive();

    /** Write {@code line} followed by a newline and flush. */
    void writeLine(String line) throws BrokenPipeException;

    /**
     * Stop the server: ask politely, wait up to {@code timeout}, force-kill, then release all streams. Always runs to
     * completion and may be called more than once.
     */
    void terminate(Duration timeout);
}
