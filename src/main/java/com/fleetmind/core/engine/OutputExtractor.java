package com.fleetmind.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.OutputType;
import com.fleetmind.core.model.StepOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a step worker's output into the step artifact.
 * <p>
 * The final text is the {@code result} string of the last result event, else that
 * event's content, else the last assistant text. JSON wrapped in markdown fences is
 * unwrapped; failing that, an embedded JSON object or array is used when it parses.
 */
@Component
public class OutputExtractor {

    private static final Logger log = LoggerFactory.getLogger(OutputExtractor.class);

    private final ObjectMapper objectMapper;

    public OutputExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StepOutput extract(List<OutputEvent> outputs) {
        String text = unwrapFence(finalText(outputs));
        JsonNode parsed = parse(text);
        if (parsed == null) {
            String span = jsonSpan(text, '{', '}');
            if (span == null) {
                span = jsonSpan(text, '[', ']');
            }
            JsonNode spanParsed = span != null ? parse(span) : null;
            if (spanParsed != null) {
                return new StepOutput(span, spanParsed);
            }
        }
        return new StepOutput(text, parsed);
    }

    static String finalText(List<OutputEvent> outputs) {
        for (int i = outputs.size() - 1; i >= 0; i--) {
            OutputEvent event = outputs.get(i);
            if (event.outputType() == OutputType.RESULT) {
                JsonNode result = event.payload() != null ? event.payload().get("result") : null;
                return result != null && result.isTextual() ? result.asText() : event.content();
            }
        }
        for (int i = outputs.size() - 1; i >= 0; i--) {
            OutputEvent event = outputs.get(i);
            if (event.outputType() == OutputType.TEXT) {
                return event.content();
            }
        }
        return "";
    }

    /**
     * Returns the body of the first ```json fence, else of the first plain fence,
     * else the trimmed text.
     */
    static String unwrapFence(String text) {
        if (text == null) {
            return "";
        }
        String fenced = fenceBody(text, "```json");
        if (fenced == null) {
            fenced = fenceBody(text, "```");
        }
        return fenced != null ? fenced : text.trim();
    }

    private static String fenceBody(String text, String opener) {
        int start = text.indexOf(opener);
        if (start < 0) {
            return null;
        }
        int bodyStart = text.indexOf('\n', start);
        if (bodyStart < 0) {
            return null;
        }
        int end = text.indexOf("```", bodyStart + 1);
        return end < 0 ? null : text.substring(bodyStart + 1, end).trim();
    }

    private static String jsonSpan(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    private JsonNode parse(String text) {
        if (text.isEmpty() || (text.charAt(0) != '{' && text.charAt(0) != '[')) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Step output looks like JSON but does not parse: {}", e.getOriginalMessage());
            return null;
        }
    }
}
