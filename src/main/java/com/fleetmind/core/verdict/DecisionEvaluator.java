package com.fleetmind.core.verdict;

import com.fleetmind.core.model.Decision;
import com.fleetmind.core.model.StepOutput;

/**
 * Turns a verification artifact into the orchestrator's next move.
 */
public interface DecisionEvaluator {

    Decision evaluate(StepOutput verification);
}
