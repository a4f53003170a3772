package com.gridrealm.service;

import com.gridrealm.config.WorldProperties;
import com.gridrealm.model.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Side-effect-free checks applied before the world store commits a mutation.
 */
@Component
@RequiredArgsConstructor
public class ActionValidator {

    /** Anything that is not a word character, whitespace or one of {@code ! ? . ,}. */
    private static final Pattern DISALLOWED_CHAT_CHARS = Pattern.compile("[^\\w\\s!?.,]");

    private final WorldProperties properties;

    public boolean isWithinBounds(Position position) {
        return position != null
                && position.x() >= 0 && position.x() < properties.width()
                && position.y() >= 0 && position.y() < properties.height();
    }

    /**
     * Normalize raw chat input: trim, truncate to {@code chatMaxLength} code points,
     * then strip disallowed characters.
     * <p>
     * Truncation happens before filtering, so the limit counts raw characters and a
     * stripped symbol still consumes one slot of the budget.
     */
    public String sanitizeChat(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        int limit = properties.chatMaxLength();
        if (trimmed.codePointCount(0, trimmed.length()) > limit) {
            trimmed = trimmed.substring(0, trimmed.offsetByCodePoints(0, limit));
        }
        return DISALLOWED_CHAT_CHARS.matcher(trimmed).replaceAll("");
    }
}
