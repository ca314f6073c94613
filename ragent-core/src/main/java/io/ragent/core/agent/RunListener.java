package io.ragent.core.agent;

import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.RunResult;
import io.ragent.core.model.Turn;
import java.util.List;

/**
 * Progress callbacks, invoked on the thread driving the run.
 */
public interface RunListener {
    RunListener NONE = new RunListener() {
    };

    default void onNodeCompleted(NodeName node, List<Turn> appended, GradeVerdict verdict) {
    }

    default void onRunFinished(RunResult result) {
    }
}
