package io.ragent.core.agent.node;

import io.ragent.core.agent.Node;
import io.ragent.core.agent.NodeContext;
import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.NodeResult;
import io.ragent.core.conversation.ConversationView;
import io.ragent.core.gateway.SchemaViolationException;
import io.ragent.core.gateway.StructuredSchema;
import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grades the retrieved context against the seed question. The verdict drives routing and is
 * not written to the log.
 */
public final class GradeDocumentsNode implements Node {
    private static final Logger LOG = LoggerFactory.getLogger(GradeDocumentsNode.class);

    static final StructuredSchema<GradeScore> SCHEMA = new StructuredSchema<>(
        "grade_documents",
        Map.of(
            "type", "object",
            "properties", Map.of(
                "binaryScore", Map.of(
                    "type", "string",
                    "enum", List.of("yes", "no"),
                    "description", "Relevance score 'yes' or 'no'"
                )
            ),
            "required", List.of("binaryScore"),
            "additionalProperties", false
        ),
        GradeScore.class
    );

    @Override
    public NodeName name() {
        return NodeName.GRADE_DOCUMENTS;
    }

    @Override
    public NodeResult execute(ConversationView conversation, NodeContext context) {
        String prompt = Prompts.render(Prompts.GRADE, Map.of(
            "question", conversation.first().content(),
            "context", conversation.retrievedContext()
        ));

        GradeScore score = context.invokeGateway(gateway -> gateway.generateStructured(List.of(Turn.user(prompt)), SCHEMA));
        GradeVerdict verdict = GradeVerdict.fromLabel(score == null ? null : score.binaryScore())
            .orElseThrow(() -> new SchemaViolationException(
                "Grader returned unsupported label: " + (score == null ? null : score.binaryScore())
            ));
        LOG.debug("Run {}: documents graded {}", context.runId(), verdict);
        return NodeResult.decide(verdict);
    }
}
