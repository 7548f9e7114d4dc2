package ai.aura.mcp.transport;

import ai.aura.mcp.McpException.BrokenPipeException;
import ai.aura.mcp.McpException.SpawnException;
import ai.aura.mcp.McpServerConfig;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a tool server as a child process and exchanges newline-delimited messages over its standard streams.
 *
 * <p>Two daemon threads run for the lifetime of the process: one forwards stdout lines to
 * {@link TransportListener#onLine}, the other forwards stderr lines to {@link TransportListener#onDiagnostic}.
 */
public final class StdioProcessTransport implements McpTransport {
    private static final Logger logger = LogManager.getLogger(StdioProcessTransport.class);
    private static final Duration READER_JOIN_TIMEOUT = Duration.ofSeconds(1);

    private final String serverKey;
    private final Process process;
    private final BufferedWriter stdin;
    private final TransportListener listener;
    private final AtomicBoolean closedNotified = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final Thread stdoutReader;
    private final Thread stderrReader;

    private StdioProcessTransport(String serverKey, Process process, TransportListener listener) {
        this.serverKey = serverKey;
        this.process = process;
        this.listener = listener;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdoutReader = newReader("stdout", this::readStdout);
        this.stderrReader = newReader("stderr", this::readStderr);
    }

    /**
     * Launch the configured command and start both reader threads.
     *
     * @throws SpawnException if the executable cannot be started
     */
    public static StdioProcessTransport spawn(String serverKey, McpServerConfig config, TransportListener listener)
            throws SpawnException {
        var processBuilder = new ProcessBuilder(config.command());
        processBuilder.environment().putAll(config.resolvedEnv());
        if (config.cwd() != null) {
            processBuilder.directory(config.cwd().toFile());
        }

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException | IllegalArgumentException | UnsupportedOperationException | SecurityException e) {
            throw new SpawnException("Failed to spawn MCP server '" + config.name() + "': " + e.getMessage(), e);
        }
        logger.info("Started MCP server process {} (pid={}): {}", serverKey, process.pid(), config.command());

        var transport = new StdioProcessTransport(serverKey, process, listener);
        transport.stdoutReader.start();
        transport.stderrReader.start();
        return transport;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive() && !terminated.get();
    }

    @Override
    public void writeLine(String line) throws BrokenPipeException {
        if (terminated.get() || !process.isAlive()) {
            throw new BrokenPipeException("MCP server " + serverKey + " is no longer accepting input");
        }
        try {
            stdin.write(line);
            stdin.newLine();
            stdin.flush();
        } catch (IOException e) {
            throw new BrokenPipeException("Broken pipe writing to MCP server " + serverKey, e);
        }
        logger.debug("[{}] -> {}", serverKey, line);
    }

    @Override
    public void terminate(Duration timeout) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        boolean interrupted = false;
        try {
            if (process.isAlive()) {
                process.destroy();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("MCP server {} did not terminate gracefully, forcing kill", serverKey);
                    process.destroyForcibly();
                    process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            logger.warn("Interrupted while waiting for MCP server {} to terminate, forcing kill", serverKey);
            process.destroyForcibly();
        } catch (RuntimeException e) {
            logger.warn("Error terminating MCP server {}, forcing kill", serverKey, e);
            process.destroyForcibly();
        } finally {
            closeQuietly("stdin", stdin);
            closeQuietly("stdout", process.getInputStream());
            closeQuietly("stderr", process.getErrorStream());
            interrupted |= join(stdoutReader);
            interrupted |= join(stderrReader);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("MCP server process {} terminated (pid={})", serverKey, process.pid());
    }

    private Thread newReader(String stream, Runnable body) {
        var thread = new Thread(body, "mcp-" + serverKey + "-" + stream);
        thread.setDaemon(true);
        return thread;
    }

    private void readStdout() {
        logger.debug("stdout reader started for {}", serverKey);
        try {
            readLines(process.getInputStream(), line -> {
                logger.debug("[{}] <- {}", serverKey, line);
                listener.onLine(line);
            });
        } finally {
            logger.debug("stdout reader exiting for {}", serverKey);
            if (closedNotified.compareAndSet(false, true)) {
                listener.onClosed();
            }
        }
    }

    private void readStderr() {
        readLines(process.getErrorStream(), line -> {
            logger.debug("[{}|stderr] {}", serverKey, line);
            listener.onDiagnostic(line);
        });
    }

    private void readLines(InputStream stream, Consumer<String> sink) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    sink.accept(line.strip());
                } catch (RuntimeException e) {
                    logger.warn("Listener failed on line from {}", serverKey, e);
                }
            }
        } catch (IOException e) {
            if (!terminated.get()) {
                logger.warn("Reader for {} ended: {}", serverKey, e.getMessage());
            }
        }
    }

    /** @return true if the calling thread was interrupted while waiting */
    private boolean join(Thread reader) {
        if (reader == Thread.currentThread()) {
            return false;
        }
        try {
            reader.join(READER_JOIN_TIMEOUT.toMillis());
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    private void closeQuietly(String stream, Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Failed to close {} of MCP server {}", stream, serverKey, e);
        }
    }
}
