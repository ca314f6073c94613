package io.ragent.core.agent.node;

import io.ragent.core.agent.Node;
import io.ragent.core.agent.NodeContext;
import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.NodeResult;
import io.ragent.core.conversation.ConversationView;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Map;

public final class GenerateNode implements Node {

    @Override
    public NodeName name() {
        return NodeName.GENERATE;
    }

    @Override
    public NodeResult execute(ConversationView conversation, NodeContext context) {
        String prompt = Prompts.render(Prompts.GENERATE, Map.of(
            "question", conversation.first().content(),
            "context", conversation.retrievedContext()
        ));
        Turn reply = context.invokeGateway(gateway -> gateway.generate(List.of(Turn.user(prompt))));
        return NodeResult.append(Turn.assistant(reply.content()));
    }
}
