package com.harbour.jobfeed.feed.util;

import java.util.Collection;
import java.util.Locale;

public final class JobUrlUtils {

    private JobUrlUtils() {
    }

    public static boolean matchesAllowedDomain(String url, Collection<String> allowedDomains) {
        if (url == null || url.isBlank() || allowedDomains == null) {
            return false;
        }
        String lowered = url.toLowerCase(Locale.ROOT);
        for (String domain : allowedDomains) {
            if (domain != null && !domain.isBlank() && lowered.contains(domain.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
