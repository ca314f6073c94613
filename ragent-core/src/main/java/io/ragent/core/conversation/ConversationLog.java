package io.ragent.core.conversation;

import io.ragent.core.model.MessageRole;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Append-only turn sequence owned by a single run. Not thread-safe: only the orchestrator
 * thread appends.
 */
public final class ConversationLog implements ConversationView {
    private final List<Turn> turns = new ArrayList<>();
    private final Set<String> issuedCallIds = new HashSet<>();
    private final ConversationView readView = new ReadOnlyView();

    public static ConversationLog seeded(String question) {
        ConversationLog log = new ConversationLog();
        log.append(Turn.user(question));
        return log;
    }

    public void append(Turn... newTurns) {
        append(List.of(newTurns));
    }

    /**
     * Appends {@code newTurns} atomically: tool turns may answer calls issued earlier in the
     * same batch, and if any turn is rejected nothing is appended.
     */
    public void append(List<Turn> newTurns) {
        Set<String> staged = new HashSet<>(issuedCallIds);
        for (Turn turn : newTurns) {
            if (turn.role() == MessageRole.ASSISTANT) {
                Set<String> batch = new HashSet<>();
                for (ToolCall call : turn.toolCalls()) {
                    if (!batch.add(call.id())) {
                        throw new IllegalArgumentException("Duplicate tool call id in batch: " + call.id());
                    }
                }
                staged.addAll(batch);
            }
            if (turn.role() == MessageRole.TOOL && !staged.contains(turn.toolCallId())) {
                throw new IllegalArgumentException("Tool turn references unknown call id: " + turn.toolCallId());
            }
        }
        turns.addAll(newTurns);
        issuedCallIds.addAll(staged);
    }

    @Override
    public List<Turn> turns() {
        return Collections.unmodifiableList(turns);
    }

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

    public List<Turn> snapshot() {
        return List.copyOf(turns);
    }

    /** A view that cannot be cast back to the mutable log. */
    public ConversationView view() {
        return readView;
    }

    private final class ReadOnlyView implements ConversationView {
        @Override
        public List<Turn> turns() {
            return ConversationLog.this.turns();
        }

        @Override
        public Turn first() {
            return ConversationLog.this.first();
        }

        @Override
        public Turn latest() {
            return ConversationLog.this.latest();
        }
    }
}
