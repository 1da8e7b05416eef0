package com.artistreach.enrichment.step;

import com.artistreach.enrichment.normalize.LinkClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks follow-up links (contact, booking, management pages) out of a fetched page.
 */
final class ContactLinkFinder {
    static final List<String> LINK_IN_BIO_KEYWORDS = List.of("contact", "booking", "management", "email", "business");
    static final List<String> WEBSITE_KEYWORDS = List.of("contact", "booking", "management", "about", "press");

    private ContactLinkFinder() {}

    static List<String> find(String html, String pageUrl, List<String> keywords, boolean sameHostOnly, int limit) {
        if (html == null || html.isBlank() || limit <= 0) {
            return List.of();
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        String pageHost = LinkClassifier.hostOf(pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank() || !href.toLowerCase(Locale.ROOT).startsWith("http")) {
                continue;
            }
            String haystack = (anchor.text() + " " + href).toLowerCase(Locale.ROOT);
            if (!containsAny(haystack, keywords)) {
                continue;
            }
            if (sameHostOnly && pageHost != null && !pageHost.equals(LinkClassifier.hostOf(href))) {
                continue;
            }
            if (href.equals(pageUrl)) {
                continue;
            }
            links.add(stripFragment(href));
            if (links.size() >= limit) {
                break;
            }
        }
        return new ArrayList<>(links);
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
