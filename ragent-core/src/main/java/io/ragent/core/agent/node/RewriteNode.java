package io.ragent.core.agent.node;

import io.ragent.core.agent.Node;
import io.ragent.core.agent.NodeContext;
import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.NodeResult;
import io.ragent.core.conversation.ConversationView;
import io.ragent.core.gateway.GatewayException;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Map;

/**
 * Reformulates the seed question. Earlier rewrites and tool output are deliberately not shown
 * to the model. The result is appended as a user turn so the next query pass answers it.
 */
public final class RewriteNode implements Node {

    @Override
    public NodeName name() {
        return NodeName.REWRITE;
    }

    @Override
    public NodeResult execute(ConversationView conversation, NodeContext context) {
        String prompt = Prompts.render(Prompts.REWRITE, Map.of("question", conversation.first().content()));
        Turn reply = context.invokeGateway(gateway -> gateway.generate(List.of(Turn.user(prompt))));
        String rewritten = reply.content().strip();
        if (rewritten.isEmpty()) {
            throw new GatewayException("Rewrite produced an empty question");
        }
        return NodeResult.append(Turn.user(rewritten));
    }
}
