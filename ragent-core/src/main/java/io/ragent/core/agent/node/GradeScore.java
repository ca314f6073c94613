package io.ragent.core.agent.node;

/** Structured grader reply: {@code yes} or {@code no}. */
public record GradeScore(String binaryScore) {
}
