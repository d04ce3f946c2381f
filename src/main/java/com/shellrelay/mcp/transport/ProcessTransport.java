package com.shellrelay.mcp.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one MCP server child process at a time and moves raw bytes over its stdio.
 * <p>
 * Each {@link #start} begins a new generation. Output and exit notifications from
 * an older generation, or from a process being stopped on purpose, never reach the
 * {@link Listener}.
 */
public class ProcessTransport {

    private static final Logger log = LoggerFactory.getLogger(ProcessTransport.class);

    private static final int READ_BUFFER_SIZE = 8192;
    private static final Duration STOP_GRACE = Duration.ofSeconds(2);

    /**
     * Receives output and lifecycle notifications from the reader threads.
     */
    public interface Listener {

        /** A chunk of the server's stdout, in arrival order. */
        void onData(byte[] chunk);

        /** The process ended without {@link #stop()} being called. */
        void onExit(int exitCode);
    }

    private final ProcessLauncher launcher;
    private final Listener listener;
    private final AtomicLong generation = new AtomicLong();

    private Process process;
    private OutputStream stdin;

    public ProcessTransport(ProcessLauncher launcher, Listener listener) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Launches the server and waits out the startup grace period.
     *
     * @throws TransportException with reason {@code SPAWN_FAILED} if the launch fails or
     *                            the process exits before the grace period ends
     */
    public void start(LaunchSpec spec, Duration startupGrace) {
        stop();
        log.info("Starting MCP server: {}", spec.commandLine());

        Process started;
        try {
            started = launcher.launch(spec);
        } catch (IOException e) {
            throw new TransportException(TransportException.Reason.SPAWN_FAILED,
                    "Failed to start MCP server: " + e.getMessage(), e);
        }

        long gen;
        synchronized (this) {
            gen = generation.incrementAndGet();
            process = started;
            stdin = started.getOutputStream();
        }
        startStderrDrain(gen, started);

        if (exitedDuringGrace(started, startupGrace)) {
            int code = started.exitValue();
            stop();
            throw new TransportException(TransportException.Reason.SPAWN_FAILED,
                    "MCP server process exited immediately with code " + code);
        }
        // stdout stays in the pipe until the grace period is over
        startReader(gen, started);
        log.info("MCP server process started (pid {})", pid().map(String::valueOf).orElse("unknown"));
    }

    /**
     * Writes one already-framed message to the server's stdin.
     *
     * @throws TransportException {@code NOT_RUNNING} without a live process,
     *                            {@code WRITE_FAILED} if the pipe rejects the bytes
     */
    public synchronized void write(byte[] frame) {
        if (process == null || !process.isAlive()) {
            throw new TransportException(TransportException.Reason.NOT_RUNNING, "MCP server process not running");
        }
        try {
            stdin.write(frame);
            stdin.flush();
        } catch (IOException e) {
            throw new TransportException(TransportException.Reason.WRITE_FAILED,
                    "Failed to write to MCP server: " + e.getMessage(), e);
        }
    }

    /**
     * Terminates the current process, if any. Safe to call repeatedly.
     */
    public void stop() {
        Process toStop;
        OutputStream toClose;
        synchronized (this) {
            toStop = process;
            toClose = stdin;
            process = null;
            stdin = null;
            // retire the generation so the reader threads stay quiet
            generation.incrementAndGet();
        }
        if (toStop == null) {
            return;
        }
        closeQuietly(toClose);
        toStop.destroy();
        try {
            if (!toStop.waitFor(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("MCP server did not exit within {}ms, killing it", STOP_GRACE.toMillis());
                toStop.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toStop.destroyForcibly();
        }
        log.info("MCP server process stopped");
    }

    public synchronized boolean isAlive() {
        return process != null && process.isAlive();
    }

    public synchronized Optional<Long> pid() {
        if (process == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(process.pid());
        } catch (UnsupportedOperationException e) {
            return Optional.empty();
        }
    }

    private boolean isCurrent(long gen) {
        return generation.get() == gen;
    }

    private boolean exitedDuringGrace(Process started, Duration grace) {
        if (grace.isZero() || grace.isNegative()) {
            return !started.isAlive();
        }
        try {
            return started.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new TransportException(TransportException.Reason.SPAWN_FAILED,
                    "Interrupted while waiting for MCP server startup", e);
        }
    }

    private void startReader(long gen, Process started) {
        Thread reader = new Thread(() -> readLoop(gen, started), "mcp-stdout-" + gen);
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop(long gen, Process started) {
        InputStream out = started.getInputStream();
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try {
            int n;
            while ((n = out.read(buffer)) != -1) {
                if (!isCurrent(gen)) {
                    continue;
                }
                if (n > 0) {
                    listener.onData(Arrays.copyOf(buffer, n));
                }
            }
        } catch (IOException e) {
            if (isCurrent(gen)) {
                log.warn("Error reading MCP server output: {}", e.getMessage());
            } else {
                log.debug("Reader for retired process ended: {}", e.getMessage());
            }
        }

        int exitCode;
        try {
            exitCode = started.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (isCurrent(gen)) {
            log.warn("MCP server process exited with code {}", exitCode);
            synchronized (this) {
                if (isCurrent(gen)) {
                    process = null;
                    stdin = null;
                }
            }
            listener.onExit(exitCode);
        }
    }

    private void startStderrDrain(long gen, Process started) {
        Thread drain = new Thread(() -> {
            try (var reader = new BufferedReader(
                    new InputStreamReader(started.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("[mcp-server] {}", line);
                }
            } catch (IOException e) {
                log.debug("MCP server stderr closed: {}", e.getMessage());
            }
        }, "mcp-stderr-" + gen);
        drain.setDaemon(true);
        drain.start();
    }

    private static void closeQuietly(OutputStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Failed to close MCP server stdin: {}", e.getMessage());
        }
    }
}
