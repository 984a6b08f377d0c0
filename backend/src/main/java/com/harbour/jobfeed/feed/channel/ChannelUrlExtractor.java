package com.harbour.jobfeed.feed.channel;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.util.JobUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ChannelUrlExtractor {
    private static final Logger log = LoggerFactory.getLogger(ChannelUrlExtractor.class);
    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");

    private final FeedProperties properties;

    public ChannelUrlExtractor(FeedProperties properties) {
        this.properties = properties;
    }

    /**
     * Pulls allow-listed URLs out of message texts, first-seen order, no repeats.
     */
    public List<String> extract(Collection<String> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        int ignored = 0;
        for (String message : messages) {
            if (message == null || message.isBlank()) {
                continue;
            }
            Matcher matcher = URL_PATTERN.matcher(message);
            while (matcher.find()) {
                String url = matcher.group().trim();
                if (JobUrlUtils.matchesAllowedDomain(url, properties.getAllowedDomains())) {
                    urls.add(url);
                } else {
                    ignored++;
                }
            }
        }
        log.debug("Extracted {} candidate urls ({} outside allowed domains)", urls.size(), ignored);
        return new ArrayList<>(urls);
    }
}
