package io.ragent.core.agent;

public final class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
