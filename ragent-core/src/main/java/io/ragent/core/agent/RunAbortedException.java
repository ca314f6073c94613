package io.ragent.core.agent;

/**
 * Raised when a run exceeds its configured iteration cap.
 */
public final class RunAbortedException extends RuntimeException {
    public RunAbortedException(int iterations, int maxIterations) {
        super("Run aborted after " + iterations + " query passes (max " + maxIterations + ")");
    }
}
