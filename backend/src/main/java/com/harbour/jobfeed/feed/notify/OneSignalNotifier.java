package com.harbour.jobfeed.feed.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.http.PoliteHttpClient;
import com.harbour.jobfeed.feed.model.HttpFetchResult;
import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.model.ScrapedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Broadcasts newly admitted jobs to every OneSignal subscriber.
 */
@Component
public class OneSignalNotifier implements JobNotifier {
    private static final Logger log = LoggerFactory.getLogger(OneSignalNotifier.class);
    private static final String HEADING = "Job Opening Notification";

    private final PoliteHttpClient httpClient;
    private final FeedProperties properties;
    private final ObjectMapper objectMapper;

    public OneSignalNotifier(PoliteHttpClient httpClient, FeedProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean notifyNewJob(JobRecord job) {
        FeedProperties.Notify notify = properties.getNotify();
        if (!notify.isEnabled()) {
            log.debug("Notifications disabled; skipping job {}", job.id());
            return false;
        }
        if (!notify.isConfigured()) {
            log.warn("Notifications enabled but OneSignal app id, key or url is missing; skipping job {}", job.id());
            return false;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(buildPayload(job, notify.getAppId()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise notification for job {}", job.id(), e);
            return false;
        }

        Map<String, String> headers = Map.of(
            "Content-Type", "application/json; charset=utf-8",
            "Authorization", "Basic " + notify.getRestApiKey()
        );
        HttpFetchResult result = httpClient.postJson(notify.getApiUrl(), payload, headers);
        int status = result == null ? 0 : result.statusCode();
        if (status == 200 || status == 201 || status == 202) {
            log.info("Notification sent for job {} ({})", job.id(), job.title());
            return true;
        }
        log.warn(
            "Notification failed for job {} (status={}, error={}, body={})",
            job.id(),
            status,
            result == null ? null : result.errorCode(),
            result == null ? null : result.body()
        );
        return false;
    }

    Map<String, Object> buildPayload(JobRecord job, String appId) {
        String company = orDefault(job.company(), "Unknown Company");
        String jobTitle = orDefault(job.jobTitle(), "Job Opening");
        String url = firstUsable(job.applyLink(), job.sourceLink());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("app_id", appId);
        payload.put("included_segments", List.of("All"));
        payload.put("headings", Map.of("en", HEADING));
        payload.put("contents", Map.of("en", company + " has openings for " + jobTitle + ". Click now to apply!"));
        payload.put("url", url == null ? "#" : url);
        return payload;
    }

    private String orDefault(String value, String fallback) {
        if (value == null || value.isBlank() || ScrapedJob.NOT_AVAILABLE.equals(value.trim())) {
            return fallback;
        }
        return value.trim();
    }

    private String firstUsable(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank() && !ScrapedJob.NOT_AVAILABLE.equals(value.trim())) {
                return value.trim();
            }
        }
        return null;
    }
}
