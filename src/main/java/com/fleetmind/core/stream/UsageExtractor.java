package com.fleetmind.core.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetmind.core.model.ModelUsage;
import com.fleetmind.core.model.UsageReport;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Reads the optional usage figures of a {@code result} message.
 */
final class UsageExtractor {

    private UsageExtractor() {}

    static UsageReport extract(JsonNode result) {
        OptionalDouble cost = JsonFields.number(result, "total_cost_usd");
        OptionalLong apiMs = JsonFields.unsignedLong(result, "duration_api_ms");
        OptionalLong ms = JsonFields.unsignedLong(result, "duration_ms");
        OptionalLong turns = JsonFields.unsignedLong(result, "num_turns");

        return new UsageReport(
                cost.isPresent() ? cost.getAsDouble() : null,
                modelUsage(result),
                apiMs.isPresent() ? apiMs.getAsLong() : null,
                ms.isPresent() ? ms.getAsLong() : null,
                turns.isPresent() ? (int) turns.getAsLong() : null,
                tokensUsed(result));
    }

    private static Map<String, ModelUsage> modelUsage(JsonNode result) {
        Map<String, ModelUsage> usage = new LinkedHashMap<>();
        JsonFields.object(result, "modelUsage").ifPresent(models -> {
            Iterator<Map.Entry<String, JsonNode>> it = models.fields();
            while (it.hasNext()) {
                var entry = it.next();
                JsonNode m = entry.getValue();
                OptionalLong contextWindow = JsonFields.unsignedLong(m, "contextWindow");
                OptionalLong maxOutput = JsonFields.unsignedLong(m, "maxOutputTokens");
                usage.put(entry.getKey(), new ModelUsage(
                        JsonFields.unsignedLong(m, "inputTokens").orElse(0),
                        JsonFields.unsignedLong(m, "outputTokens").orElse(0),
                        JsonFields.unsignedLong(m, "cacheCreationInputTokens").orElse(0),
                        JsonFields.unsignedLong(m, "cacheReadInputTokens").orElse(0),
                        JsonFields.number(m, "costUSD").orElse(0.0),
                        contextWindow.isPresent() ? contextWindow.getAsLong() : null,
                        maxOutput.isPresent() ? maxOutput.getAsLong() : null));
            }
        });
        return usage;
    }

    private static Long tokensUsed(JsonNode result) {
        return JsonFields.object(result, "usage")
                .map(u -> JsonFields.unsignedLong(u, "input_tokens").orElse(0)
                        + JsonFields.unsignedLong(u, "output_tokens").orElse(0))
                .filter(total -> total > 0)
                .orElse(null);
    }
}
