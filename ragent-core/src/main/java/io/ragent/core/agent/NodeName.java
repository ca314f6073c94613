package io.ragent.core.agent;

/**
 * States of the agent graph. {@link #TOOL_EXECUTION} runs inline within
 * {@link #QUERY_OR_RESPOND}, so the driver never schedules it on its own.
 */
public enum NodeName {
    QUERY_OR_RESPOND("queryOrRespond"),
    TOOL_EXECUTION("toolExecution"),
    GRADE_DOCUMENTS("gradeDocuments"),
    REWRITE("rewrite"),
    GENERATE("generate"),
    TERMINATED("terminated");

    private final String label;

    NodeName(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
