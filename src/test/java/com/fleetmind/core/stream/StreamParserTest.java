package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StreamParser}.
 */
class StreamParserTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String WORKER = "worker-1";

    private StreamParser parser;

    @BeforeEach
    void setUp() {
        parser = new StreamParser(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private OutputEvent only(ParseResult result) {
        assertEquals(1, result.events().size(), "expected exactly one event");
        return result.events().get(0);
    }

    @Nested
    @DisplayName("Non-protocol lines")
    class PlainTextTests {

        @Test
        @DisplayName("non-JSON line becomes plain text with no signal")
        void nonJsonLineIsPlainText() {
            ParseResult result = parser.parse(WORKER, "Compiling project...");

            OutputEvent event = only(result);
            assertEquals(OutputType.PLAIN_TEXT, event.outputType());
            assertEquals("Compiling project...", event.content());
            assertEquals(LifecycleSignal.NONE, result.signal());
            assertEquals(NOW, event.timestamp());
            assertEquals(WORKER, event.workerId());
        }

        @Test
        @DisplayName("malformed JSON never throws")
        void malformedJsonIsPlainText() {
            ParseResult result = parser.parse(WORKER, "{\"type\": \"assistant\", ");

            assertEquals(OutputType.PLAIN_TEXT, only(result).outputType());
            assertEquals(LifecycleSignal.NONE, result.signal());
        }

        @Test
        @DisplayName("JSON array is not a protocol message")
        void jsonArrayIsPlainText() {
            assertEquals(OutputType.PLAIN_TEXT, only(parser.parse(WORKER, "[1,2,3]")).outputType());
        }

        @Test
        @DisplayName("byte size counts UTF-8 bytes")
        void byteSizeCountsUtf8Bytes() {
            OutputEvent event = only(parser.parse(WORKER, "héllo"));
            assertEquals(6, event.byteSize());
        }

        @Test
        @DisplayName("object with an unrecognized type is UNKNOWN with the raw line as content")
        void unknownTypeKeepsRawLine() {
            String line = "{\"type\":\"telemetry\",\"session_id\":\"s-9\"}";
            ParseResult result = parser.parse(WORKER, line);

            OutputEvent event = only(result);
            assertEquals(OutputType.UNKNOWN, event.outputType());
            assertEquals(line, event.content());
            assertEquals("s-9", result.sessionId());
        }
    }

    @Nested
    @DisplayName("System messages")
    class SystemTests {

        @Test
        @DisplayName("uses the message field when present")
        void usesMessageField() {
            OutputEvent event = only(parser.parse(WORKER,
                    "{\"type\":\"system\",\"message\":\"Warming up\"}"));
            assertEquals(OutputType.SYSTEM, event.outputType());
            assertEquals("Warming up", event.content());
        }

        @Test
        @DisplayName("summarizes init with model and tool count")
        void summarizesInit() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"abc\","
                            + "\"model\":\"sonnet\",\"tools\":[\"Read\",\"Edit\",\"Bash\"]}");

            OutputEvent event = only(result);
            assertEquals("Session initialized with sonnet (3 tools available)", event.content());
            assertEquals("abc", event.sessionId());
            assertEquals("init", event.subtype());
            assertNotNull(event.payload());
            assertEquals("abc", result.session().orElseThrow());
            assertEquals(LifecycleSignal.NONE, result.signal());
        }

        @Test
        @DisplayName("falls back to subtype, then a generic label")
        void fallsBackToSubtype() {
            assertEquals("System: compact", only(parser.parse(WORKER,
                    "{\"type\":\"system\",\"subtype\":\"compact\"}")).content());
            assertEquals("System event", only(parser.parse(WORKER, "{\"type\":\"system\"}")).content());
        }
    }

    @Nested
    @DisplayName("Assistant messages")
    class AssistantTests {

        @Test
        @DisplayName("text with end_turn ends the turn and records last text")
        void textWithEndTurn() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"assistant\",\"session_id\":\"s1\",\"message\":{\"stop_reason\":\"end_turn\","
                            + "\"content\":[{\"type\":\"text\",\"text\":\"First\"},{\"type\":\"text\",\"text\":\"Done\"}]}}");

            assertEquals(2, result.events().size());
            assertEquals(OutputType.TEXT, result.events().get(0).outputType());
            assertEquals("Done", result.lastText());
            assertEquals(LifecycleSignal.TURN_ENDED, result.signal());
            assertTrue(result.signal().endsTurn());
            assertEquals("s1", result.events().get(1).sessionId());
        }

        @Test
        @DisplayName("tool use wins over end_turn and is counted")
        void toolUseIsCounted() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"assistant\",\"message\":{\"stop_reason\":\"end_turn\",\"content\":["
                            + "{\"type\":\"text\",\"text\":\"Let me look\"},"
                            + "{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"Read\",\"input\":{\"path\":\"a.txt\"}}]}}");

            assertEquals(LifecycleSignal.TOOL_INVOKED, result.signal());
            assertEquals(1, result.toolCalls());
            OutputEvent toolUse = result.events().get(1);
            assertEquals(OutputType.TOOL_USE, toolUse.outputType());
            assertTrue(toolUse.content().startsWith("Using tool: Read\nInput:\n"));
            assertTrue(toolUse.content().contains("\"path\" : \"a.txt\""));
            assertEquals("a.txt", toolUse.payload().get("path").asText());
        }

        @Test
        @DisplayName("text blocks without string text are skipped")
        void textBlockWithoutTextSkipped() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"assistant\",\"message\":{\"stop_reason\":\"end_turn\",\"content\":["
                            + "{\"type\":\"text\",\"text\":\"Kept\"},{\"type\":\"text\"},"
                            + "{\"type\":\"text\",\"text\":7}]}}");

            assertEquals(1, result.events().size());
            assertEquals("Kept", result.events().get(0).content());
            assertEquals("Kept", result.lastText());
        }

        @Test
        @DisplayName("text without a stop reason means the turn continues")
        void textWithoutStopReasonContinues() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Thinking\"}]}}");
            assertEquals(LifecycleSignal.CONTINUING, result.signal());
            assertFalse(result.signal().endsTurn());
        }
    }

    @Nested
    @DisplayName("User messages")
    class UserTests {

        @Test
        @DisplayName("tool results become TOOL_RESULT or ERROR events")
        void toolResults() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"user\",\"parent_tool_use_id\":\"p1\",\"message\":{\"content\":["
                            + "{\"type\":\"tool_result\",\"tool_use_id\":\"t1\",\"content\":\"file contents\"},"
                            + "{\"type\":\"tool_result\",\"tool_use_id\":\"t2\",\"content\":\"boom\",\"is_error\":true}]}}");

            assertEquals(2, result.events().size());
            assertEquals(OutputType.TOOL_RESULT, result.events().get(0).outputType());
            assertEquals("file contents", result.events().get(0).content());
            assertEquals(OutputType.ERROR, result.events().get(1).outputType());
            assertEquals("p1", result.events().get(1).parentToolUseId());
            assertEquals(LifecycleSignal.NONE, result.signal());
        }

        @Test
        @DisplayName("structured tool result content is pretty printed")
        void structuredContentIsPretty() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"user\",\"message\":{\"content\":["
                            + "{\"type\":\"tool_result\",\"content\":[{\"type\":\"text\",\"text\":\"x\"}]}]}}");
            assertTrue(only(result).content().contains("\"text\" : \"x\""));
        }
    }

    @Nested
    @DisplayName("Result messages")
    class ResultTests {

        @Test
        @DisplayName("success result carries usage and succeeds the turn")
        void successResult() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"All done\","
                            + "\"total_cost_usd\":0.25,\"duration_ms\":4200,\"duration_api_ms\":3000,\"num_turns\":3,"
                            + "\"usage\":{\"input_tokens\":100,\"output_tokens\":50},"
                            + "\"modelUsage\":{\"sonnet\":{\"inputTokens\":100,\"outputTokens\":50,\"costUSD\":0.25,"
                            + "\"contextWindow\":200000}}}");

            assertEquals("All done", only(result).content());
            assertEquals(LifecycleSignal.TURN_SUCCEEDED, result.signal());
            var usage = result.usageReport().orElseThrow();
            assertEquals(0.25, usage.totalCostUsd());
            assertEquals(4200L, usage.durationMs());
            assertEquals(3000L, usage.durationApiMs());
            assertEquals(3, usage.numTurns());
            assertEquals(150L, usage.tokensUsed());
            assertEquals(100, usage.modelUsage().get("sonnet").inputTokens());
            assertEquals(200000L, usage.modelUsage().get("sonnet").contextWindow());
            assertNull(usage.modelUsage().get("sonnet").maxOutputTokens());
        }

        @Test
        @DisplayName("non-success subtype fails the turn")
        void errorSubtypeFails() {
            ParseResult result = parser.parse(WORKER, "{\"type\":\"result\",\"subtype\":\"error_max_turns\"}");
            assertEquals(LifecycleSignal.TURN_FAILED, result.signal());
            assertFalse(result.signal().endsTurn());
            assertEquals("Result", only(result).content());
        }

        @Test
        @DisplayName("zero token usage is not reported")
        void zeroTokensNotReported() {
            ParseResult result = parser.parse(WORKER,
                    "{\"type\":\"result\",\"subtype\":\"success\",\"usage\":{\"input_tokens\":0,\"output_tokens\":0}}");
            assertNull(result.usageReport().orElseThrow().tokensUsed());
        }

        @Test
        @DisplayName("content prefers summary, then message of a structured result")
        void structuredResultContent() {
            assertEquals("Built it", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"result\":{\"summary\":\"Built it\",\"message\":\"ignored\"}}")).content());
            assertEquals("Note", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"result\":{\"message\":\"Note\"}}")).content());
        }

        @Test
        @DisplayName("structured result without text reports duration and cost")
        void structuredResultWithoutText() {
            assertEquals("Task completed in 1.5s ($0.1230)", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"result\":{},\"duration_ms\":1500,\"total_cost_usd\":0.123}")).content());
            assertEquals("Task completed", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"result\":{}}")).content());
        }

        @Test
        @DisplayName("error field and subtype fallbacks")
        void errorAndSubtypeFallbacks() {
            assertEquals("Error: rate limited", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"error\":\"rate limited\"}")).content());
            assertEquals("Task completed successfully", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"subtype\":\"success\"}")).content());
            assertEquals("Task failed", only(parser.parse(WORKER,
                    "{\"type\":\"result\",\"subtype\":\"error\"}")).content());
        }
    }

    @Nested
    @DisplayName("Stream events")
    class StreamEventTests {

        @Test
        @DisplayName("summarizes data in order of preference")
        void summarizesData() {
            assertEquals("raw data", only(parser.parse(WORKER,
                    "{\"type\":\"stream_event\",\"event\":\"delta\",\"data\":\"raw data\"}")).content());
            assertEquals("hello", only(parser.parse(WORKER,
                    "{\"type\":\"stream_event\",\"event\":\"delta\",\"data\":{\"message\":\"hello\"}}")).content());
            assertEquals("progress: running", only(parser.parse(WORKER,
                    "{\"type\":\"stream_event\",\"event\":\"progress\",\"data\":{\"status\":\"running\"}}")).content());
            assertEquals("Stream: ping", only(parser.parse(WORKER,
                    "{\"type\":\"stream_event\",\"event\":\"ping\",\"data\":{}}")).content());
        }

        @Test
        @DisplayName("falls back to top-level message, then the event name")
        void fallsBackToMessage() {
            assertEquals("top", only(parser.parse(WORKER,
                    "{\"type\":\"stream_event\",\"message\":\"top\"}")).content());
            ParseResult bare = parser.parse(WORKER, "{\"type\":\"stream_event\"}");
            assertEquals("Stream: stream", only(bare).content());
            assertEquals(OutputType.STREAM_EVENT, only(bare).outputType());
        }
    }

    @Test
    @DisplayName("classification is a pure function of the line")
    void classificationIsDeterministic() {
        String line = "{\"type\":\"assistant\",\"uuid\":\"u1\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}}";
        ParseResult first = parser.parse(WORKER, line);
        ParseResult second = parser.parse(WORKER, line);
        assertEquals(first, second);
        assertEquals("u1", first.events().get(0).uuid());
    }
}
