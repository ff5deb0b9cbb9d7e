package com.example.catalog.discovery;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw href attributes into absolute http(s) URLs.
 */
public final class Hrefs {

    private Hrefs() {}

    /**
     * Resolves each href against the page it came from. Blank, unparseable and
     * non-http entries are dropped; order and duplicates are kept.
     */
    public static List<String> resolveAll(String pageUrl, List<String> hrefs) {
        List<String> resolved = new ArrayList<>();
        for (String href : hrefs) {
            String url = resolve(pageUrl, href);
            if (url != null) {
                resolved.add(url);
            }
        }
        return resolved;
    }

    static String resolve(String pageUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI resolved = URI.create(pageUrl).resolve(href.trim());
            String scheme = resolved.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return resolved.toString();
        } catch (IllegalArgumentException e) {
            // bad hrefs exist in the wild
            return null;
        }
    }
}
