package io.ragent.core.model;

import java.util.List;

/**
 * Outcome of one agent run. {@code transcript} is the log as it stood when the run stopped;
 * for failed runs it holds only the turns appended before the failing node.
 */
public record RunResult(
    RunStatus status,
    String answer,
    List<Turn> transcript,
    int iterations,
    String failedNode,
    String error
) {
    public RunResult {
        answer = answer == null ? "" : answer;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }

    public static RunResult completed(String answer, List<Turn> transcript, int iterations) {
        return new RunResult(RunStatus.COMPLETED, answer, transcript, iterations, null, null);
    }

    public static RunResult stopped(
        RunStatus status,
        List<Turn> transcript,
        int iterations,
        String failedNode,
        String error
    ) {
        return new RunResult(status, "", transcript, iterations, failedNode, error);
    }

    public boolean succeeded() {
        return status == RunStatus.COMPLETED;
    }
}
