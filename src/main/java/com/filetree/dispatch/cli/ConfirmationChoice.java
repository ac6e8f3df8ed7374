package com.filetree.dispatch.cli;

import java.util.Locale;
import java.util.Optional;

/**
 * Answer to "should unselected entries be visible in the tree?" before an export.
 */
public enum ConfirmationChoice {
    YES,
    NO,
    CANCEL;

    public static Optional<ConfirmationChoice> parse(String answer) {
        return switch (answer.strip().toLowerCase(Locale.ROOT)) {
            case "y", "yes" -> Optional.of(YES);
            case "n", "no" -> Optional.of(NO);
            case "c", "cancel" -> Optional.of(CANCEL);
            default -> Optional.empty();
        };
    }
}
