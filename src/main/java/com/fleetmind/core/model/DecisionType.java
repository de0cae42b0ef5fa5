package com.fleetmind.core.model;

/**
 * The four verdicts the orchestrator can reach after verification.
 */
public enum DecisionType {
    COMPLETE("complete"),
    ITERATE("iterate"),
    REPLAN("replan"),
    GIVE_UP("give_up");

    private final String wireName;

    DecisionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a decision name case-insensitively, accepting {@code give_up},
     * {@code give-up} and {@code giveup}.
     *
     * @return the decision, or {@code null} when the name is not recognized
     */
    public static DecisionType fromWireName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase().replace('-', '_');
        if ("giveup".equals(normalized)) {
            return GIVE_UP;
        }
        for (DecisionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
