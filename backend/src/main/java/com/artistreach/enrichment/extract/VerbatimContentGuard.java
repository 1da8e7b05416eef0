package com.artistreach.enrichment.extract;

import java.util.Locale;

public final class VerbatimContentGuard {
    private VerbatimContentGuard() {}

    /**
     * True when {@code email} occurs in {@code content} as a literal substring, ignoring case.
     */
    public static boolean appearsIn(String email, String content) {
        if (email == null || email.isBlank() || content == null || content.isEmpty()) {
            return false;
        }
        return content.toLowerCase(Locale.ROOT).contains(email.trim().toLowerCase(Locale.ROOT));
    }
}
