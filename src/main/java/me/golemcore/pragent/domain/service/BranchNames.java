package me.golemcore.pragent.domain.service;

import java.time.Clock;
import java.util.Locale;

/**
 * Derives feature branch names for requests that do not name one.
 */
public final class BranchNames {

    private static final String PREFIX = "feature/";
    private static final int SLUG_SOURCE_CHARS = 20;

    private BranchNames() {
    }

    /**
     * {@code feature/<epochMillis>-<slug>} where the slug is the first 20
     * characters of the description with every non-alphanumeric character
     * replaced by {@code -}, lowercased.
     */
    public static String derive(String description, Clock clock) {
        String source = description != null ? description : "";
        if (source.length() > SLUG_SOURCE_CHARS) {
            source = source.substring(0, SLUG_SOURCE_CHARS);
        }
        String slug = source.replaceAll("[^a-zA-Z0-9]", "-").toLowerCase(Locale.ROOT);
        return PREFIX + clock.millis() + "-" + slug;
    }

    public static String resolve(String requested, String description, Clock clock) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return derive(description, clock);
    }
}
