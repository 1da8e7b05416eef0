package com.artistreach.enrichment.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic email scan over page text or HTML, including {@code mailto:} links. Only addresses
 * that occur literally in the scanned content are returned.
 */
@Component
public class EmailPatternScanner {
    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern MAILTO_PATTERN =
        Pattern.compile("(?i)mailto:([^\"'\\s>]+)");
    private static final Pattern LEADING_JUNK = Pattern.compile("^[\"'<>()\\[\\];:,.]+");
    private static final Pattern TRAILING_JUNK = Pattern.compile("[\\)\\]\\}\\.,;:'\"<>]+$");

    public List<String> scan(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        for (String raw : mailtoTargets(content)) {
            addIfVerbatim(found, raw, content);
        }
        Matcher matcher = EMAIL_PATTERN.matcher(content);
        while (matcher.find()) {
            addIfVerbatim(found, matcher.group(), content);
        }
        return new ArrayList<>(found);
    }

    private List<String> mailtoTargets(String content) {
        List<String> targets = new ArrayList<>();
        if (looksLikeHtml(content)) {
            Document document = Jsoup.parse(content);
            for (Element link : document.select("a[href^=mailto:]")) {
                targets.add(link.attr("href").substring("mailto:".length()));
            }
        }
        Matcher matcher = MAILTO_PATTERN.matcher(content);
        while (matcher.find()) {
            targets.add(matcher.group(1));
        }
        return targets;
    }

    private void addIfVerbatim(Set<String> found, String raw, String content) {
        String email = normalizeCandidate(raw);
        if (email != null && VerbatimContentGuard.appearsIn(email, content)) {
            found.add(email);
        }
    }

    static String normalizeCandidate(String raw) {
        if (raw == null) {
            return null;
        }
        String email = raw;
        int query = email.indexOf('?');
        if (query >= 0) {
            email = email.substring(0, query);
        }
        if (email.contains("%")) {
            try {
                email = URLDecoder.decode(email, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ignored) {
                // keep the undecoded value; the verbatim check decides
            }
        }
        email = LEADING_JUNK.matcher(email.trim()).replaceAll("");
        email = TRAILING_JUNK.matcher(email).replaceAll("").trim();
        if (email.isEmpty() || email.indexOf('@') <= 0 || !Character.isLetterOrDigit(email.charAt(0))) {
            return null;
        }
        return email.toLowerCase(Locale.ROOT);
    }

    private static boolean looksLikeHtml(String content) {
        int tag = content.indexOf('<');
        return tag >= 0 && content.indexOf('>', tag) > tag;
    }
}
