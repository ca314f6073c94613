package io.ragent.core.agent;

import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Objects;

/**
 * What a node hands back to the driver: turns to append, and for the grader a verdict that is
 * routed on but never stored in the log.
 */
public record NodeResult(List<Turn> turns, GradeVerdict verdict) {

    public NodeResult {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static NodeResult append(List<Turn> turns) {
        return new NodeResult(turns, null);
    }

    public static NodeResult append(Turn turn) {
        return new NodeResult(List.of(turn), null);
    }

    public static NodeResult decide(GradeVerdict verdict) {
        return new NodeResult(List.of(), Objects.requireNonNull(verdict, "verdict must not be null"));
    }
}
