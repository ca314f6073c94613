package io.ragent.core.agent.node;

import io.ragent.core.agent.Node;
import io.ragent.core.agent.NodeContext;
import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.NodeResult;
import io.ragent.core.conversation.ConversationView;
import io.ragent.core.model.ToolResult;
import io.ragent.core.model.Turn;
import java.util.List;

/**
 * Resolves the tool calls of the latest assistant turn. Results are returned in call order.
 */
public final class ToolExecutionNode implements Node {

    @Override
    public NodeName name() {
        return NodeName.TOOL_EXECUTION;
    }

    @Override
    public NodeResult execute(ConversationView conversation, NodeContext context) {
        Turn request = conversation.latest();
        if (!request.hasToolCalls()) {
            return NodeResult.append(List.of());
        }
        List<ToolResult> results = context.executeTools(request.toolCalls());
        return NodeResult.append(results.stream().map(ToolResult::toTurn).toList());
    }
}
