package io.ragent.core.model;

import java.util.Locale;
import java.util.Optional;

public enum GradeVerdict {
    RELEVANT,
    IRRELEVANT;

    /**
     * Maps a grader's binary label ({@code yes}/{@code no}, or the verdict names themselves)
     * to a verdict. Unknown labels resolve to empty so callers can reject them.
     */
    public static Optional<GradeVerdict> fromLabel(String label) {
        String normalized = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "yes", "relevant" -> Optional.of(RELEVANT);
            case "no", "irrelevant" -> Optional.of(IRRELEVANT);
            default -> Optional.empty();
        };
    }
}
