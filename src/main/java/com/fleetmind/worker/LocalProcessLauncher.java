package com.fleetmind.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Launches workers as local OS processes through {@link ProcessBuilder}.
 */
public class LocalProcessLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    @Override
    public WorkerProcess launch(LaunchRequest request) throws IOException {
        var builder = new ProcessBuilder(request.command())
                .directory(request.workingDir().toFile())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
        builder.environment().clear();
        builder.environment().putAll(request.environment());

        Process process = builder.start();
        log.info("Started worker process {} in {}", process.pid(), request.workingDir());
        return new LocalProcess(process);
    }

    private record LocalProcess(Process process) implements WorkerProcess {

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public void destroy(Duration grace) {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker process {} ignored termination, killing it", process.pid());
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
