package com.fleetmind.worker;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputHistoryTest {

    private static OutputEvent event(String workerId, String content) {
        return OutputEvent.of(workerId, OutputType.TEXT, content, null, OutputEvent.MessageHeader.EMPTY, Instant.now());
    }

    @Test
    void keepsOnlyTheMostRecentEvents() {
        var history = new OutputHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.append(event("w1", "line " + i));
        }

        List<OutputEvent> recent = history.recent("w1", 10);
        assertEquals(List.of("line 3", "line 4", "line 5"), recent.stream().map(OutputEvent::content).toList());
    }

    @Test
    void recentReturnsTailOldestFirst() {
        var history = new OutputHistory(10);
        history.append(event("w1", "a"));
        history.append(event("w1", "b"));
        history.append(event("w1", "c"));

        assertEquals(List.of("b", "c"), history.recent("w1", 2).stream().map(OutputEvent::content).toList());
        assertTrue(history.recent("w1", 0).isEmpty());
    }

    @Test
    void workersAreIsolatedAndForgettable() {
        var history = new OutputHistory(10);
        history.append(event("w1", "a"));
        history.append(event("w2", "b"));
        assertEquals(2, history.trackedWorkers());

        history.forget("w1");
        assertTrue(history.recent("w1", 5).isEmpty());
        assertEquals(1, history.recent("w2", 5).size());
        assertEquals(1, history.trackedWorkers());
    }
}
