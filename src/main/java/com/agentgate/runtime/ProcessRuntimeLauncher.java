package com.agentgate.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Launches {@code <command> serve --hostname=<host> --port=<port>} as a child process
 * with the workspace as its working directory. The process counts as ready once it
 * prints a line starting with {@code opencode server listening}; the listen URL is
 * taken from that line when present. Output after readiness is drained to the debug log.
 */
public class ProcessRuntimeLauncher implements RuntimeLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessRuntimeLauncher.class);

    static final String READY_PREFIX = "opencode server listening";
    private static final Pattern LISTEN_URL = Pattern.compile("on\\s+(https?://\\S+)");
    private static final long STOP_GRACE_SECONDS = 5;

    private final RuntimeProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;

    public ProcessRuntimeLauncher(RuntimeProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        this(properties, httpClient, objectMapper, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runtime-io");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * @param ioExecutor runs the process output drains and event stream readers; each
     *                   holds a thread for the lifetime of its stream
     */
    ProcessRuntimeLauncher(RuntimeProperties properties, HttpClient httpClient,
                           ObjectMapper objectMapper, Executor ioExecutor) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
    }

    /** Stops the reader threads. Called after the pool has stopped every runtime. */
    public void shutdown() {
        if (ioExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    @Override
    public RuntimeHandle launch(RuntimeLaunchRequest request) {
        List<String> command = buildCommand(request);
        var builder = new ProcessBuilder(command)
                .directory(request.workspace().toFile())
                .redirectErrorStream(true);
        builder.environment().clear();
        builder.environment().putAll(request.environment());

        log.info("Starting runtime for {} on port {}: {}", request.poolKey(), request.port(), command);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new RuntimeStartupException("Failed to start runtime: " + e.getMessage(), e);
        }

        var ready = new CompletableFuture<String>();
        String fallbackUrl = "http://" + request.hostname() + ":" + request.port();
        ioExecutor.execute(() -> watchOutput(process, request.poolKey(), fallbackUrl, ready));

        Duration timeout = properties.getStartupTimeout();
        String baseUrl;
        try {
            baseUrl = ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            stop(process);
            throw new RuntimeStartupException(
                    "Timeout waiting for server to start after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            stop(process);
            throw new RuntimeStartupException(e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            stop(process);
            Thread.currentThread().interrupt();
            throw new RuntimeStartupException("Interrupted while starting runtime", e);
        }

        log.info("Runtime for {} listening at {} (pid={})", request.poolKey(), baseUrl, process.pid());
        var client = new HttpRuntimeClient(baseUrl, httpClient, objectMapper, ioExecutor,
                properties.getResponseTimeout());
        return new ProcessHandle(process, request.port(), baseUrl, client);
    }

    List<String> buildCommand(RuntimeLaunchRequest request) {
        var command = new ArrayList<>(Arrays.asList(properties.getCommand().trim().split("\\s+")));
        command.add("serve");
        command.add("--hostname=" + request.hostname());
        command.add("--port=" + request.port());
        return command;
    }

    static String parseListenUrl(String line, String fallbackUrl) {
        Matcher matcher = LISTEN_URL.matcher(line);
        return matcher.find() ? matcher.group(1) : fallbackUrl;
    }

    private void watchOutput(Process process, PoolKey key, String fallbackUrl, CompletableFuture<String> ready) {
        var output = new StringBuilder();
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!ready.isDone()) {
                    output.append(line).append('\n');
                    if (line.startsWith(READY_PREFIX)) {
                        ready.complete(parseListenUrl(line, fallbackUrl));
                    }
                }
                log.debug("[{}] {}", key, line);
            }
        } catch (IOException e) {
            log.debug("Runtime output for {} closed: {}", key, e.getMessage());
        }
        if (!ready.isDone()) {
            String exit = "";
            try {
                if (process.waitFor(1, TimeUnit.SECONDS)) {
                    exit = " (exit code " + process.exitValue() + ")";
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ready.completeExceptionally(new RuntimeStartupException(
                    "Server exited before becoming ready" + exit + ": " + output.toString().strip()));
        }
    }

    static void stop(Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private record ProcessHandle(Process process, int port, String baseUrl, RuntimeClient client)
            implements RuntimeHandle {

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void close() {
            stop(process);
        }
    }
}
