package com.fleetmind.worker;

import com.fleetmind.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Reads one half of a worker's output line by line until end of stream.
 * <p>
 * A handler that throws is logged and the loop moves on to the next line.
 */
class StreamConsumer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamConsumer.class);

    private final String workerId;
    private final String pipelineId;
    private final String streamName;
    private final InputStream stream;
    private final Consumer<String> lineHandler;
    private final Runnable onEnd;

    StreamConsumer(WorkerAgent agent, String streamName, InputStream stream,
                   Consumer<String> lineHandler, Runnable onEnd) {
        this.workerId = agent.id();
        this.pipelineId = agent.pipelineId();
        this.streamName = streamName;
        this.stream = stream;
        this.lineHandler = lineHandler;
        this.onEnd = onEnd;
    }

    @Override
    public void run() {
        MdcContext.setWorker(workerId);
        if (pipelineId != null) {
            MdcContext.setPipeline(pipelineId);
        }
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    lineHandler.accept(line);
                } catch (RuntimeException e) {
                    log.error("Failed to handle {} line of worker {}: {}", streamName, workerId, e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            log.debug("{} of worker {} closed: {}", streamName, workerId, e.getMessage());
        } finally {
            try {
                onEnd.run();
            } finally {
                MdcContext.clear();
            }
        }
    }
}
