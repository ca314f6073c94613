package io.ragent.core.agent;

import io.ragent.core.conversation.ConversationView;
import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.Turn;

/**
 * Transition table of the agent graph. Stateless; the next node depends only on the node that
 * just ran, the log and the grader's verdict.
 */
public final class Router {

    private Router() {
    }

    public static NodeName start() {
        return NodeName.QUERY_OR_RESPOND;
    }

    public static NodeName next(NodeName from, ConversationView conversation, GradeVerdict verdict) {
        return switch (from) {
            case QUERY_OR_RESPOND -> requestedTools(conversation) ? NodeName.GRADE_DOCUMENTS : NodeName.TERMINATED;
            case TOOL_EXECUTION -> NodeName.GRADE_DOCUMENTS;
            case GRADE_DOCUMENTS -> {
                if (verdict == null) {
                    throw new IllegalStateException("gradeDocuments finished without a verdict");
                }
                yield verdict == GradeVerdict.RELEVANT ? NodeName.GENERATE : NodeName.REWRITE;
            }
            case REWRITE -> NodeName.QUERY_OR_RESPOND;
            case GENERATE -> NodeName.TERMINATED;
            case TERMINATED -> throw new IllegalStateException("Run already terminated");
        };
    }

    // The pass's decision turn carries the tool calls; its tool output was resolved inline.
    private static boolean requestedTools(ConversationView conversation) {
        Turn decision = conversation.passDecision();
        return decision != null && decision.hasToolCalls();
    }
}
