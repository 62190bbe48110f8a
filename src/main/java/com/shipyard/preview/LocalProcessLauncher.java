package com.shipyard.preview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs dev servers as child processes of this JVM.
 * <p>
 * stderr is merged into stdout and each line is forwarded to the caller's consumer from a
 * dedicated reader thread, which also keeps the pipe drained so the child never blocks on it.
 */
public class LocalProcessLauncher implements PreviewLauncher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    private final ExecutorService outputReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "preview-output");
        t.setDaemon(true);
        return t;
    });

    @Override
    public PreviewProcess launch(LaunchRequest request, Consumer<String> output) {
        if (!Files.isDirectory(request.workingDirectory())) {
            throw new ProcessSpawnException("Project directory does not exist: " + request.workingDirectory());
        }
        log.debug("Launching {} in {}", request.command(), request.workingDirectory());

        Process process;
        try {
            var builder = new ProcessBuilder(request.command())
                    .directory(request.workingDirectory().toFile())
                    .redirectErrorStream(true);
            builder.environment().putAll(request.environment());
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessSpawnException(
                    "Failed to start dev server for project " + request.projectId() + ": " + e.getMessage(), e);
        }

        outputReaders.execute(() -> pump(process, request.projectId(), output));
        return new LocalPreviewProcess(process);
    }

    private static void pump(Process process, String projectId, Consumer<String> output) {
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                try {
                    output.accept(line);
                } catch (RuntimeException e) {
                    log.warn("Output consumer failed for project {}: {}", projectId, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("Output stream closed for project {}: {}", projectId, e.getMessage());
        }
    }

    @Override
    public void close() {
        outputReaders.shutdownNow();
    }

    static final class LocalPreviewProcess implements PreviewProcess {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        LocalPreviewProcess(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void destroy(Duration grace) {
            if (!process.isAlive()) {
                return;
            }
            // Collect descendants first: they are reparented once the parent dies.
            List<ProcessHandle> descendants = process.descendants().toList();
            descendants.forEach(ProcessHandle::destroy);
            process.destroy();
            try {
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Process {} ignored SIGTERM for {}s, killing", process.pid(), grace.toSeconds());
                    destroyForcibly(descendants);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                destroyForcibly(descendants);
            }
        }

        private void destroyForcibly(List<ProcessHandle> descendants) {
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
