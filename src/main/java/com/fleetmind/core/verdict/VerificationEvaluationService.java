package com.fleetmind.core.verdict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetmind.core.model.Decision;
import com.fleetmind.core.model.DecisionType;
import com.fleetmind.core.model.StepOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates a verifier's report.
 * <p>
 * Rules, in order:
 * <ul>
 *   <li>An explicit {@code decision} field ({@code complete}, {@code iterate}, {@code replan},
 *       {@code give_up}) is taken as is, with {@code reasoning}, {@code issues_to_fix} and
 *       {@code suggestions}</li>
 *   <li>Otherwise {@code overall_status} maps {@code success} to COMPLETE, {@code partial} to
 *       ITERATE and {@code failed} to REPLAN, with issues from {@code issues_found} and suggestions
 *       from {@code recommendations}</li>
 *   <li>Any other non-empty report becomes ITERATE with the report itself as the only issue</li>
 *   <li>An empty report gives up</li>
 * </ul>
 */
@Service
public class VerificationEvaluationService implements DecisionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(VerificationEvaluationService.class);

    /** Longest excerpt of an unstructured report carried forward as an issue. */
    static final int MAX_ISSUE_CHARS = 2000;

    @Override
    public Decision evaluate(StepOutput verification) {
        if (verification == null || verification.isBlank()) {
            log.warn("Verification produced no output, giving up");
            return Decision.giveUp("Verification produced no output");
        }

        JsonNode report = verification.structuredData();
        if (report != null && report.isObject()) {
            DecisionType explicit = DecisionType.fromWireName(text(report, "decision"));
            if (explicit != null) {
                return explicitDecision(explicit, report);
            }
            String status = text(report, "overall_status");
            if (status != null) {
                Decision fromStatus = statusDecision(status.trim().toLowerCase(Locale.ROOT), report);
                if (fromStatus != null) {
                    return fromStatus;
                }
                log.warn("Unrecognized overall_status '{}', treating report as unstructured", status);
            }
        }

        log.info("Verification report is unstructured ({} chars), iterating on it", verification.rawText().length());
        return Decision.iterate("Verification report was not structured",
                List.of(truncate(verification.rawText())), List.of());
    }

    private static Decision explicitDecision(DecisionType type, JsonNode report) {
        String reasoning = text(report, "reasoning");
        List<String> issues = strings(report.get("issues_to_fix"));
        List<String> suggestions = strings(report.get("suggestions"));
        return switch (type) {
            case COMPLETE -> Decision.complete(reasoning);
            case ITERATE -> Decision.iterate(reasoning, issues, suggestions);
            case REPLAN -> Decision.replan(reasoning, issues, suggestions);
            case GIVE_UP -> Decision.giveUp(reasoning);
        };
    }

    private static Decision statusDecision(String status, JsonNode report) {
        String summary = text(report, "summary");
        List<String> issues = descriptions(report.get("issues_found"));
        List<String> suggestions = descriptions(report.get("recommendations"));
        return switch (status) {
            case "success" -> Decision.complete(summary);
            case "partial" -> Decision.iterate(summary, issues, suggestions);
            case "failed" -> Decision.replan(summary, issues, suggestions);
            default -> null;
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static List<String> strings(JsonNode array) {
        var values = new ArrayList<String>();
        if (array != null && array.isArray()) {
            array.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }

    /** Reads {@code description} from each element; plain string elements are taken as they are. */
    private static List<String> descriptions(JsonNode array) {
        var values = new ArrayList<String>();
        if (array != null && array.isArray()) {
            array.forEach(item -> {
                String description = item.isTextual() ? item.asText() : item.isObject() ? text(item, "description") : null;
                if (description != null && !description.isBlank()) {
                    values.add(description);
                }
            });
        }
        return values;
    }

    private static String truncate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= MAX_ISSUE_CHARS ? trimmed : trimmed.substring(0, MAX_ISSUE_CHARS) + "...";
    }
}
