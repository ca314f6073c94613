package io.ragent.core.conversation;

import io.ragent.core.model.MessageRole;
import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Set;

/**
 * Read-only access to a run's conversation log. Nodes receive a view and return the turns
 * they want appended.
 */
public interface ConversationView {

    /** A view over a fixed turn sequence, used to show a node a log it has not appended yet. */
    static ConversationView of(List<Turn> turns) {
        return new SnapshotView(List.copyOf(turns));
    }

    List<Turn> turns();

    /** The seed question: the first user turn of the run. */
    Turn first();

    Turn latest();

    default int size() {
        return turns().size();
    }

    default boolean isEmpty() {
        return turns().isEmpty();
    }

    default List<Turn> filter(Set<MessageRole> roles) {
        return turns().stream()
            .filter(turn -> roles.contains(turn.role()))
            .toList();
    }

    /**
     * The assistant turn that opened the current pass, i.e. the first assistant turn after the
     * most recent user turn. Returns {@code null} when the pass has no assistant reply yet.
     */
    default Turn passDecision() {
        List<Turn> all = turns();
        int start = 0;
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).role() == MessageRole.USER) {
                start = i + 1;
                break;
            }
        }
        for (int i = start; i < all.size(); i++) {
            if (all.get(i).role() == MessageRole.ASSISTANT) {
                return all.get(i);
            }
        }
        return null;
    }

    /**
     * Tool output answering the most recent answered tool-call batch, joined in call order. Falls back
     * to the latest turn's content when the log holds no tool batch.
     */
    default String retrievedContext() {
        List<Turn> all = turns();
        for (int i = all.size() - 1; i >= 0; i--) {
            Turn turn = all.get(i);
            if (turn.role() != MessageRole.ASSISTANT || !turn.hasToolCalls()) {
                continue;
            }
            // unanswered batch, e.g. a follow-up reply asking for more tools
            if (i + 1 >= all.size() || all.get(i + 1).role() != MessageRole.TOOL) {
                continue;
            }
            StringBuilder context = new StringBuilder();
            for (int j = i + 1; j < all.size() && all.get(j).role() == MessageRole.TOOL; j++) {
                if (context.length() > 0) {
                    context.append("\n\n");
                }
                context.append(all.get(j).content());
            }
            return context.toString();
        }
        return isEmpty() ? "" : latest().content();
    }
}
