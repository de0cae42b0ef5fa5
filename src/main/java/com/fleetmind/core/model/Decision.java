package com.fleetmind.core.model;

import java.util.List;

/**
 * The orchestrator's verdict on a verification result.
 *
 * @param type        which of the four verdicts this is
 * @param reasoning   summary for COMPLETE, reason for REPLAN and GIVE_UP
 * @param issues      problems the next iteration must address
 * @param suggestions hints for the next iteration
 */
public record Decision(
    DecisionType type,
    String reasoning,
    List<String> issues,
    List<String> suggestions
) {

    public Decision {
        reasoning = reasoning != null ? reasoning : "";
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static Decision complete(String summary) {
        return new Decision(DecisionType.COMPLETE, summary, List.of(), List.of());
    }

    public static Decision iterate(List<String> issues, List<String> suggestions) {
        return new Decision(DecisionType.ITERATE, "", issues, suggestions);
    }

    public static Decision iterate(String reasoning, List<String> issues, List<String> suggestions) {
        return new Decision(DecisionType.ITERATE, reasoning, issues, suggestions);
    }

    public static Decision replan(String reason, List<String> issues, List<String> suggestions) {
        return new Decision(DecisionType.REPLAN, reason, issues, suggestions);
    }

    public static Decision giveUp(String reason) {
        return new Decision(DecisionType.GIVE_UP, reason, List.of(), List.of());
    }

    public boolean loopsBack() {
        return type == DecisionType.ITERATE || type == DecisionType.REPLAN;
    }
}
