package io.ragent.core.conversation;

import io.ragent.core.model.MessageRole;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.NoSuchElementException;

record SnapshotView(List<Turn> turns) implements ConversationView {

    @Override
    public Turn first() {
        return turns.stream()
            .filter(turn -> turn.role() == MessageRole.USER)
            .findFirst()
            .orElseThrow(() -> new NoSuchElementException("Conversation has no seed question"));
    }

    @Override
    public Turn latest() {
        if (turns.isEmpty()) {
            throw new NoSuchElementException("Conversation is empty");
        }
        return turns.get(turns.size() - 1);
    }
}
