package com.fleetmind.core.engine;

import com.fleetmind.core.model.Decision;
import com.fleetmind.core.model.IterationRecord;
import com.fleetmind.core.model.Pipeline;
import com.fleetmind.core.model.StepOutput;
import com.fleetmind.core.model.StepRole;

import java.util.List;

/**
 * Instructions handed to the planning, building and verifying workers.
 */
final class PromptTemplates {

    private PromptTemplates() {}

    private static final String PLANNING = """
            You are the planning stage of an automated plan, build and verify workflow.

            TASK
            %s

            WORKING DIRECTORY
            %s
            Every file you propose to touch must live inside this directory.
            %s
            Study the request and the existing contents of the working directory, then produce
            a concrete plan another agent can carry out without further guidance. Cover the files
            to create or change, required dependencies, the technical approach, error handling,
            and how the result will be tested. List any questions whose answers would change the plan.

            Reply with JSON only:
            {
              "plan": ["Step 1: ...", "Step 2: ..."],
              "questions": ["...?"]
            }
            """;

    private static final String REPLAN = """
            You are the planning stage of an automated plan, build and verify workflow.
            The previous attempt at this task was rejected and needs a different plan.

            TASK
            %s

            WORKING DIRECTORY
            %s

            PREVIOUS PLAN
            %s

            QUESTIONS AND ANSWERS
            %s

            BUILD REPORT
            %s

            VERIFICATION REPORT
            %s

            REASON FOR REPLANNING
            %s

            ISSUES TO RESOLVE
            %s

            SUGGESTIONS
            %s
            %s
            Work out why the previous approach fell short and plan a new one that avoids the same
            problems. Do not repeat steps that already failed.

            Reply with JSON only:
            {
              "plan": ["Step 1: ...", "Step 2: ..."],
              "questions": ["...?"],
              "changes_from_previous": ["..."]
            }
            """;

    private static final String BUILD = """
            You are the build stage of an automated plan, build and verify workflow.
            Carry out the plan below in order and leave the working directory in a finished state.

            TASK
            %s

            WORKING DIRECTORY
            %s
            Do not create or modify anything outside this directory.

            PLAN
            %s

            QUESTIONS AND ANSWERS
            %s
            %s
            Read the existing code before changing it and follow its conventions. Implement only
            what the task asks for, handle errors properly, and check your work as you go.

            When you are done, reply with a short report:
            TASK COMPLETE
            Files changed: one per line
            Summary: two or three sentences
            Notes for verification: anything the verifier should try
            """;

    private static final String VERIFICATION = """
            You are the verification stage of an automated plan, build and verify workflow.
            Decide whether the task below has been carried out correctly and completely, and
            what should happen next.

            TASK
            %s

            PLAN
            %s

            QUESTIONS AND ANSWERS
            %s

            BUILD REPORT
            %s

            ITERATION: %d of %s
            %s
            Inspect every file the build touched, check each plan step against what was actually
            done, compile or run the result where you can, and look for bugs and missing pieces.

            Then choose one decision:
            - complete: every part of the task is done and no critical issue remains.
            - iterate: the approach is sound but fixable issues remain; the plan is kept and the
              build runs again with your issues.
            - replan: the approach itself does not work, or the same issues keep coming back
              from earlier iterations; a new plan is made.
            - give_up: the task cannot be finished without a person, for example because access
              is missing, the requirements conflict, or the iteration budget is spent without progress.

            Reply with JSON only:
            {
              "decision": "complete | iterate | replan | give_up",
              "reasoning": "why this decision",
              "issues_to_fix": ["..."],
              "suggestions": ["..."]
            }
            """;

    static String planning(Pipeline pipeline) {
        return PLANNING.formatted(pipeline.getUserRequest(), pipeline.getWorkingDir(),
                contextSection(pipeline.getCarriedContext()));
    }

    static String replan(Pipeline pipeline, PreviousAttempt previous) {
        Decision decision = previous.decision();
        return REPLAN.formatted(
                pipeline.getUserRequest(),
                pipeline.getWorkingDir(),
                orNone(previous.plan()),
                questionsAndAnswers(previous.questions(), previous.answers()),
                orNone(previous.buildReport()),
                orNone(previous.verificationReport()),
                orNone(decision.reasoning()),
                bullets(decision.issues()),
                bullets(decision.suggestions()),
                contextSection(pipeline.getCarriedContext()));
    }

    static String build(Pipeline pipeline) {
        return BUILD.formatted(
                pipeline.getUserRequest(),
                pipeline.getWorkingDir(),
                orNone(stepText(pipeline, StepRole.PLANNING)),
                questionsAndAnswers(pipeline.getQuestions(), pipeline.getAnswers()),
                contextSection(pipeline.getCarriedContext()));
    }

    static String verification(Pipeline pipeline) {
        return VERIFICATION.formatted(
                pipeline.getUserRequest(),
                orNone(stepText(pipeline, StepRole.PLANNING)),
                questionsAndAnswers(pipeline.getQuestions(), pipeline.getAnswers()),
                orNone(stepText(pipeline, StepRole.BUILDING)),
                pipeline.getCurrentIteration(),
                pipeline.getMaxIterations() > 0 ? String.valueOf(pipeline.getMaxIterations()) : "unlimited",
                previousIssuesSection(pipeline.getIterationHistory()));
    }

    static String stepText(Pipeline pipeline, StepRole role) {
        StepOutput output = pipeline.step(role).getOutput();
        return output != null ? output.rawText() : "";
    }

    static String questionsAndAnswers(List<String> questions, List<String> answers) {
        if (questions.isEmpty()) {
            return "(none)";
        }
        var sb = new StringBuilder();
        for (int i = 0; i < questions.size(); i++) {
            String answer = i < answers.size() && !answers.get(i).isBlank()
                    ? answers.get(i)
                    : "No answer given; use your best judgment.";
            sb.append("Q").append(i + 1).append(": ").append(questions.get(i)).append('\n')
              .append("A").append(i + 1).append(": ").append(answer).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    /** Issues raised by the latest decision, so the verifier can tell repeats from progress. */
    private static String previousIssuesSection(List<IterationRecord> history) {
        if (history.isEmpty() || history.get(history.size() - 1).issues().isEmpty()) {
            return "";
        }
        return "\nPREVIOUS ITERATION ISSUES\n" + bullets(history.get(history.size() - 1).issues()) + "\n";
    }

    private static String contextSection(List<String> context) {
        if (context.isEmpty()) {
            return "";
        }
        return "\nFEEDBACK FROM EARLIER ITERATIONS\n" + bullets(context) + "\n";
    }

    private static String bullets(List<String> items) {
        if (items.isEmpty()) {
            return "(none)";
        }
        var sb = new StringBuilder();
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String orNone(String text) {
        return text == null || text.isBlank() ? "(none)" : text;
    }

    /**
     * What the rejected attempt produced, captured before the pipeline's steps are reset.
     */
    record PreviousAttempt(
        String plan,
        List<String> questions,
        List<String> answers,
        String buildReport,
        String verificationReport,
        Decision decision
    ) {

        static PreviousAttempt of(Pipeline pipeline, Decision decision) {
            return new PreviousAttempt(
                    stepText(pipeline, StepRole.PLANNING),
                    List.copyOf(pipeline.getQuestions()),
                    List.copyOf(pipeline.getAnswers()),
                    stepText(pipeline, StepRole.BUILDING),
                    stepText(pipeline, StepRole.VERIFYING),
                    decision);
        }
    }
}
