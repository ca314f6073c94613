package io.ragent.core.agent;

import io.ragent.core.conversation.ConversationView;

public interface Node {
    NodeName name();

    NodeResult execute(ConversationView conversation, NodeContext context);
}
