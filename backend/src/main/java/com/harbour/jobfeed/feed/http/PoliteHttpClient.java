package com.harbour.jobfeed.feed.http;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    private final FeedProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(FeedProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    /**
     * Fetches a page, rotating through the configured user-agent profiles until one gets a 2xx.
     * Returns the last failed attempt when every profile fails; never throws.
     */
    public HttpFetchResult get(String url, String acceptHeader) {
        List<String> userAgents = properties.getHttp().getUserAgents();
        HttpFetchResult lastResult = null;
        for (String userAgent : userAgents) {
            lastResult = executeOnce(url, "GET", acceptHeader, userAgent, null, Map.of());
            if (lastResult.isSuccessful()) {
                return lastResult;
            }
            if ("invalid_url".equals(lastResult.errorCode()) || "interrupted".equals(lastResult.errorCode())) {
                return lastResult;
            }
            log.info(
                "Fetch {} failed with status={} error={}, trying next user agent",
                url,
                lastResult.statusCode(),
                lastResult.errorCode()
            );
        }
        log.warn("All user agent profiles failed for {}", url);
        return lastResult;
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers) {
        String userAgent = properties.getHttp().getUserAgents().get(0);
        return executeOnce(url, "POST", "application/json", userAgent, jsonBody == null ? "" : jsonBody, headers);
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String acceptHeader,
        String userAgent,
        String body,
        Map<String, String> extraHeaders
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()))
                .header("User-Agent", userAgent)
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.9");
            if (extraHeaders != null) {
                extraHeaders.forEach(builder::header);
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                if (extraHeaders == null || !extraHeaders.containsKey("Content-Type")) {
                    builder.header("Content-Type", "application/json; charset=utf-8");
                }
                request = builder
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getHttp().getPerHostDelayMs()));
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
