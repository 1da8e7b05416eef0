package com.artistreach.enrichment.filter;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.model.FilterResult;
import com.artistreach.enrichment.model.RejectedEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a discovered address is worth contacting. Shared by the extraction module and the
 * controller's final gate, so filtering an already-filtered list yields the same list.
 */
@Component
public class EmailQualityFilter {
    private static final Logger log = LoggerFactory.getLogger(EmailQualityFilter.class);

    public static final String REASON_MALFORMED = "malformed";
    public static final String REASON_PLATFORM_DOMAIN = "platform_domain";
    public static final String REASON_PLACEHOLDER = "placeholder_address";
    public static final String REASON_ROLE_ADDRESS = "role_address";
    public static final String REASON_MERCH = "merch_or_store";
    public static final String REASON_MASKED = "masked_address";
    public static final String REASON_ASSET = "asset_filename";
    public static final String REASON_BLOCKED_DOMAIN = "blocked_domain";

    private static final Pattern VALID_EMAIL =
        Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9-]+(\\.[a-z0-9-]+)*\\.[a-z]{2,}$");
    private static final Pattern MASKED = Pattern.compile("\\*{2,}|^[^@]\\*+@");

    private static final Set<String> ROLE_LOCAL_PARTS = Set.of(
        "support", "help", "noreply", "no-reply", "donotreply", "do-not-reply", "mailer-daemon",
        "postmaster", "webmaster", "hostmaster", "abuse", "dmca", "legal", "compliance", "privacy",
        "privacypolicy", "customerservice", "admin", "root", "test", "example", "user"
    );

    private static final List<String> MERCH_TOKENS = List.of("merch", "store", "shop");
    private static final List<String> MERCH_LOCAL_TOKENS = List.of("privacy", "unsubscribe");

    private static final Set<String> LABEL_AND_MERCH_DOMAINS = Set.of(
        "wmg.com", "umgstores.com", "kontrabandstores.com", "warnerrecords.com", "sonymusic.com",
        "universalmusic.com", "merchbar.com", "shopify.com", "bigcartel.com", "bandmerch.com"
    );

    private static final Set<String> PLATFORM_DOMAINS = Set.of(
        "wixpress.com", "sentry.io", "cloudflare.com", "googleapis.com", "w3.org", "schema.org",
        "spotify.com", "apple.com", "youtube.com", "instagram.com", "facebook.com", "twitter.com",
        "tiktok.com", "x.com"
    );

    private static final Set<String> PLACEHOLDER_DOMAINS = Set.of(
        "example.com", "example.org", "example.net", "test.com", "localhost", "domain.com", "email.com"
    );

    private static final Set<String> PLACEHOLDER_ADDRESSES = Set.of(
        "user@domain.com", "email@email.com", "name@domain.com", "your@email.com", "youremail@email.com"
    );

    private static final List<String> ASSET_TAILS = List.of(
        ".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp", ".css", ".js"
    );

    private final Set<String> configuredBlocklist;

    public EmailQualityFilter(EnrichmentProperties properties) {
        Set<String> blocked = new LinkedHashSet<>();
        for (String domain : properties.getFilter().getBlockedDomains()) {
            if (domain != null && !domain.isBlank()) {
                blocked.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.configuredBlocklist = Set.copyOf(blocked);
    }

    public FilterResult filterEmails(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return new FilterResult(List.of(), List.of());
        }
        Set<String> accepted = new LinkedHashSet<>();
        List<RejectedEmail> rejected = new ArrayList<>();
        Set<String> seenRejected = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String email = normalize(candidate);
            Optional<String> reason = check(email);
            if (reason.isPresent()) {
                if (seenRejected.add(email)) {
                    rejected.add(new RejectedEmail(email, reason.get(), null));
                    log.debug("Rejected {} ({})", email, reason.get());
                }
            } else {
                accepted.add(email);
            }
        }
        return new FilterResult(new ArrayList<>(accepted), rejected);
    }

    public boolean isAcceptable(String email) {
        return email != null && check(normalize(email)).isEmpty();
    }

    /**
     * Returns the rejection reason, or empty when the address passes every rule.
     */
    public Optional<String> check(String rawEmail) {
        if (rawEmail == null) {
            return Optional.of(REASON_MALFORMED);
        }
        String email = normalize(rawEmail);
        for (String tail : ASSET_TAILS) {
            if (email.endsWith(tail)) {
                return Optional.of(REASON_ASSET);
            }
        }
        int at = email.indexOf('@');
        if (at > 0 && MASKED.matcher(email).find()) {
            return Optional.of(REASON_MASKED);
        }
        if (!VALID_EMAIL.matcher(email).matches()) {
            return Optional.of(REASON_MALFORMED);
        }
        String local = email.substring(0, at);
        String domain = email.substring(at + 1);

        if (PLACEHOLDER_ADDRESSES.contains(email) || matchesDomain(domain, PLACEHOLDER_DOMAINS)) {
            return Optional.of(REASON_PLACEHOLDER);
        }
        if (matchesDomain(domain, PLATFORM_DOMAINS)) {
            return Optional.of(REASON_PLATFORM_DOMAIN);
        }
        if (matchesDomain(domain, configuredBlocklist)) {
            return Optional.of(REASON_BLOCKED_DOMAIN);
        }
        if (ROLE_LOCAL_PARTS.contains(local)) {
            return Optional.of(REASON_ROLE_ADDRESS);
        }
        if (matchesDomain(domain, LABEL_AND_MERCH_DOMAINS) || containsAny(domain, MERCH_TOKENS)) {
            return Optional.of(REASON_MERCH);
        }
        if (containsAny(local, MERCH_TOKENS) || containsAny(local, MERCH_LOCAL_TOKENS)) {
            return Optional.of(REASON_MERCH);
        }
        return Optional.empty();
    }

    static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean matchesDomain(String domain, Set<String> domains) {
        if (domains.contains(domain)) {
            return true;
        }
        for (String blocked : domains) {
            if (domain.endsWith("." + blocked)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String value, List<String> tokens) {
        for (String token : tokens) {
            if (value.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
