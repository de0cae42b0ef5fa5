package com.fleetmind.worker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * In-memory worker process: the test writes the process's stdout and stderr and
 * reads back what the supervisor wrote to its stdin.
 */
final class FakeWorkerProcess implements WorkerProcess {

    private final PipedOutputStream stdoutWriter = new PipedOutputStream();
    private final PipedOutputStream stderrWriter = new PipedOutputStream();
    private final PipedInputStream stdout;
    private final PipedInputStream stderr;
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private volatile boolean alive = true;
    private volatile Duration destroyedWith;

    FakeWorkerProcess() {
        try {
            stdout = new PipedInputStream(stdoutWriter, 64 * 1024);
            stderr = new PipedInputStream(stderrWriter, 64 * 1024);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    void emit(String line) throws IOException {
        write(stdoutWriter, line);
    }

    void emitError(String line) throws IOException {
        write(stderrWriter, line);
    }

    /** Simulates the process exiting on its own. */
    void exit() throws IOException {
        alive = false;
        stdoutWriter.close();
        stderrWriter.close();
    }

    String stdinText() {
        return stdin.toString(StandardCharsets.UTF_8);
    }

    Duration destroyedWith() {
        return destroyedWith;
    }

    @Override
    public OutputStream stdin() {
        return stdin;
    }

    @Override
    public InputStream stdout() {
        return stdout;
    }

    @Override
    public InputStream stderr() {
        return stderr;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public long pid() {
        return 4242;
    }

    @Override
    public void destroy(Duration grace) {
        destroyedWith = grace;
        try {
            exit();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void write(PipedOutputStream out, String line) throws IOException {
        synchronized (out) {
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }
}
