package com.phillippitts.audiofetch.service.process;

import com.phillippitts.audiofetch.exception.FetchExceptionBuilder;
import com.phillippitts.audiofetch.exception.FetchFailedException;
import com.phillippitts.audiofetch.util.LogSanitizer;
import com.phillippitts.audiofetch.util.ProcessTimeouts;
import com.phillippitts.audiofetch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command-line tool with a timeout and captures its output.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently (capped, to avoid pathological memory usage)
 * - Enforce a timeout and terminate runaway processes (graceful, then forcible)
 * - Join the reader threads on every exit path
 *
 * <p>A timeout or nonzero exit is reported through {@link ProcessResult}, not thrown; callers
 * decide what a failure means for them. Only a failure to start or an interrupt is thrown.
 *
 * <p>Instances hold no per-run state and may be shared between threads.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    private final ProcessFactory processFactory;
    private final int maxStdoutBytes;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public ProcessRunner(ProcessFactory processFactory, int maxStdoutBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        if (maxStdoutBytes <= 0) {
            throw new IllegalArgumentException("maxStdoutBytes must be positive");
        }
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Runs {@code command} and waits at most {@code timeout} for it to finish.
     *
     * @param tool short tool name used in thread names and errors (e.g. "yt-dlp")
     * @param command full command line
     * @param workingDir working directory (may be null)
     * @param timeout maximum run time
     * @return captured result; {@link ProcessResult#timedOut()} is set when the process was killed
     * @throws FetchFailedException if the process cannot be started or the wait is interrupted
     */
    public ProcessResult run(String tool, List<String> command, Path workingDir, Duration timeout) {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");

        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(tool, command, workingDir);
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("{} timed out after {} ms; terminating", tool, timeout.toMillis());
                destroyProcess(exec.process());
                joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                return new ProcessResult(-1, exec.stdout().toString(), exec.stderr().toString(), true,
                        TimeUtils.elapsedMillis(startTime));
            }

            // Ensure gobblers have a moment to flush
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("{} exited with {} after {} ms (stdout={} chars)", tool, exitCode, durationMs,
                    exec.stdout().length());
            return new ProcessResult(exitCode, exec.stdout().toString(), exec.stderr().toString(), false,
                    durationMs);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw FetchExceptionBuilder.create("I/O failure: " + e.getMessage())
                    .tool(tool)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("command", command.get(0))
                    .metadata("stderr", exec == null ? null
                            : LogSanitizer.truncate(exec.stderr().toString(), ProcessTimeouts.ERROR_SNIPPET_MAX_CHARS))
                    .cause(e)
                    .build();
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution startProcessWithGobblers(String tool, List<String> command, Path workingDir)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", maxStdoutBytes);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err",
                ProcessTimeouts.STDERR_MAX_BYTES);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached.
     * Once the cap is hit, continues draining the stream without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        Process process = exec.process();
        if (process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
