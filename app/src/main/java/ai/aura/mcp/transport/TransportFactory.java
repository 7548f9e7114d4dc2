package ai.aura.mcp.transport;

import ai.aura.mcp.McpException.SpawnException;
import ai.aura.mcp.McpServerConfig;

/** Creates the transport for a newly registered server. */
@FunctionalInterface
public interface TransportFactory {

    /**
     * @param serverKey short label used in thread and log names
     * @param config launch configuration
     * @param listener sink for everything the server writes
     */
    McpTransport open(String serverKey, McpServerConfig config, TransportListener listener) throws SpawnException;

    static TransportFactory stdio() {
        return StdioProcessTransport::spawn;
    }
}
