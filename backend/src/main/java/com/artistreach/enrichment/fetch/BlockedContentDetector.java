package com.artistreach.enrichment.fetch;

import com.artistreach.enrichment.model.PlatformHint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises consent walls, login walls and bot challenges that a platform serves instead of the page
 * that was asked for.
 */
@Component
public class BlockedContentDetector {
    private static final List<String> VIDEO_SIGNATURES = List.of(
        "consent.youtube.com",
        "accounts.google.com/ServiceLogin",
        "before you continue",
        "Sign in to confirm",
        "This page requires JavaScript"
    );

    private static final List<String> PHOTO_SIGNATURES = List.of(
        "Login • Instagram",
        "Create an account",
        "log in to see",
        "Sign up to see photos",
        "Not Found"
    );

    private static final List<String> LOGIN_WALL_SIGNATURES = List.of(
        "You must log in",
        "Log Into Facebook",
        "Facebook - Log In",
        "Sign Up for Facebook",
        "Sign in to Twitter",
        "Log in to Twitter",
        "JavaScript is not available"
    );

    private static final List<String> CHALLENGE_SIGNATURES = List.of(
        "Just a moment...",
        "cf-browser-verification",
        "Attention Required! | Cloudflare",
        "Enable JavaScript and cookies to continue"
    );

    private final Map<PlatformHint, List<String>> signaturesByHint;

    public BlockedContentDetector() {
        this.signaturesByHint = Map.of(
            PlatformHint.VIDEO_PROFILE, combine(VIDEO_SIGNATURES, CHALLENGE_SIGNATURES),
            PlatformHint.PHOTO_PROFILE, combine(PHOTO_SIGNATURES, CHALLENGE_SIGNATURES),
            PlatformHint.LINK_AGGREGATOR, combine(LOGIN_WALL_SIGNATURES, CHALLENGE_SIGNATURES),
            PlatformHint.WEBSITE, combine(LOGIN_WALL_SIGNATURES, CHALLENGE_SIGNATURES)
        );
    }

    /**
     * Returns the first signature found in {@code content}, matched case-insensitively.
     */
    public Optional<String> detect(String content, PlatformHint hint) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        String lower = content.toLowerCase(Locale.ROOT);
        List<String> signatures = signaturesByHint.getOrDefault(
            hint == null ? PlatformHint.WEBSITE : hint,
            CHALLENGE_SIGNATURES
        );
        for (String signature : signatures) {
            if (lower.contains(signature.toLowerCase(Locale.ROOT))) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    private static List<String> combine(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
