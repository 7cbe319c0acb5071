package com.buildhook.dispatcher.github;

import java.util.Locale;

/**
 * Keeps GitHub error text short enough for logs and exception messages.
 *
 * GitHub occasionally answers 4xx/5xx with a full HTML error page instead of a
 * JSON body; those are replaced by a one-line marker, everything else is cut
 * at {@link #MAX_DETAIL} characters.
 */
final class ErrorDetails {

    static final int MAX_DETAIL = 500;

    private ErrorDetails() {}

    static String bound(String detail) {
        if (detail == null) {
            return "(no detail)";
        }
        String trimmed = detail.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.contains("<html") && lower.contains("</html>")) {
            return "(HTML error page, " + trimmed.length() + " chars omitted)";
        }
        if (trimmed.length() > MAX_DETAIL) {
            return trimmed.substring(0, MAX_DETAIL) + "...";
        }
        return trimmed;
    }
}
