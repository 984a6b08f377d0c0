package com.harbour.jobfeed.feed.channel;

import com.harbour.jobfeed.config.FeedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads candidate URLs from a text export of the job channel's recent messages.
 */
@Component
public class ExportedChannelMessageSource implements CandidateUrlSource {
    private static final Logger log = LoggerFactory.getLogger(ExportedChannelMessageSource.class);

    private final FeedProperties properties;
    private final ChannelUrlExtractor extractor;

    public ExportedChannelMessageSource(FeedProperties properties, ChannelUrlExtractor extractor) {
        this.properties = properties;
        this.extractor = extractor;
    }

    @Override
    public List<String> fetchCandidateUrls() {
        String configured = properties.getChannel().getMessagesFile();
        if (configured == null || configured.isBlank()) {
            log.warn("No channel message export configured");
            return List.of();
        }
        Path file = Paths.get(configured.trim());
        if (!Files.isRegularFile(file)) {
            log.warn("Channel message export {} not found", file.toAbsolutePath());
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            List<String> urls = extractor.extract(lines);
            log.info("Channel export {} yielded {} candidate urls", file.toAbsolutePath(), urls.size());
            return urls;
        } catch (IOException e) {
            log.warn("Failed to read channel message export {}", file.toAbsolutePath(), e);
            return List.of();
        }
    }
}
