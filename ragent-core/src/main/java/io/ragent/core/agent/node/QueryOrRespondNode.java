package io.ragent.core.agent.node;

import io.ragent.core.agent.Node;
import io.ragent.core.agent.NodeContext;
import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.NodeResult;
import io.ragent.core.conversation.ConversationView;
import io.ragent.core.model.MessageRole;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import io.ragent.core.tool.ToolSpec;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets the model either answer directly or request retrieval. Requested tools are resolved
 * inline, followed by exactly one more model call over the extended conversation; that
 * follow-up reply is never scanned for tool calls here.
 */
public final class QueryOrRespondNode implements Node {
    private static final Logger LOG = LoggerFactory.getLogger(QueryOrRespondNode.class);
    private static final Set<MessageRole> VISIBLE_ROLES = EnumSet.of(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL);

    private final ToolExecutionNode toolExecution;

    public QueryOrRespondNode() {
        this(new ToolExecutionNode());
    }

    public QueryOrRespondNode(ToolExecutionNode toolExecution) {
        this.toolExecution = toolExecution;
    }

    @Override
    public NodeName name() {
        return NodeName.QUERY_OR_RESPOND;
    }

    @Override
    public NodeResult execute(ConversationView conversation, NodeContext context) {
        List<ToolSpec> tools = context.toolSpecs();
        List<Turn> visible = wireSafe(conversation.filter(VISIBLE_ROLES));

        Turn reply = context.invokeGateway(gateway -> gateway.generateWithTools(visible, tools));
        if (!reply.hasToolCalls()) {
            LOG.debug("Run {}: model answered without tools", context.runId());
            return NodeResult.append(reply);
        }

        LOG.debug("Run {}: model requested {} tool call(s)", context.runId(), reply.toolCalls().size());
        List<Turn> pass = new ArrayList<>();
        pass.add(reply);

        List<Turn> withRequest = new ArrayList<>(conversation.turns());
        withRequest.add(reply);
        pass.addAll(toolExecution.execute(ConversationView.of(withRequest), context).turns());

        List<Turn> extended = new ArrayList<>(visible);
        extended.addAll(pass);
        Turn followUp = context.invokeGateway(gateway -> gateway.generateWithTools(extended, tools));
        pass.add(followUp);
        return NodeResult.append(pass);
    }

    // Providers reject assistant tool calls without matching tool replies, e.g. a follow-up reply
    // from an earlier pass that asked for more tools. Those calls are dropped from the request only.
    static List<Turn> wireSafe(List<Turn> turns) {
        Set<String> answered = new HashSet<>();
        for (Turn turn : turns) {
            if (turn.role() == MessageRole.TOOL) {
                answered.add(turn.toolCallId());
            }
        }
        List<Turn> safe = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            if (turn.hasToolCalls() && !allAnswered(turn.toolCalls(), answered)) {
                safe.add(Turn.assistant(turn.content()));
            } else {
                safe.add(turn);
            }
        }
        return safe;
    }

    private static boolean allAnswered(List<ToolCall> calls, Set<String> answered) {
        return calls.stream().allMatch(call -> answered.contains(call.id()));
    }
}
