package com.harbour.jobfeed.feed.seen;

import com.harbour.jobfeed.config.FeedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Seen-set kept as a flat text file, one URL per line. Every add is appended and synced
 * individually so an interrupted run never loses marks written before the interruption.
 */
@Component
public class FileSeenUrlStore implements SeenUrlStore {
    private static final Logger log = LoggerFactory.getLogger(FileSeenUrlStore.class);

    private final Path file;
    private final Set<String> urls = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();
    private volatile boolean loaded;
    // Set when the file ends mid-line, e.g. after a torn append.
    private boolean missingTrailingNewline;

    @Autowired
    public FileSeenUrlStore(FeedProperties properties) {
        this(Paths.get(properties.getSeenUrlsFile()));
    }

    FileSeenUrlStore(Path file) {
        this.file = file;
    }

    @Override
    public boolean contains(String url) {
        String key = normalize(url);
        if (key == null) {
            return false;
        }
        ensureLoaded();
        return urls.contains(key);
    }

    @Override
    public void add(String url) {
        String key = normalize(url);
        if (key == null) {
            return;
        }
        ensureLoaded();
        synchronized (lock) {
            if (urls.contains(key)) {
                return;
            }
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                String line = missingTrailingNewline ? "\n" + key + "\n" : key + "\n";
                Files.writeString(
                    file,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.DSYNC
                );
            } catch (IOException e) {
                throw new SeenUrlStoreException("Failed to append to seen-url file " + file, e);
            }
            missingTrailingNewline = false;
            urls.add(key);
        }
    }

    @Override
    public int size() {
        ensureLoaded();
        return urls.size();
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (lock) {
            if (loaded) {
                return;
            }
            if (Files.exists(file)) {
                try {
                    String content = Files.readString(file, StandardCharsets.UTF_8);
                    missingTrailingNewline = !content.isEmpty() && !content.endsWith("\n");
                    for (String line : content.split("\\R")) {
                        String key = normalize(line);
                        if (key != null) {
                            urls.add(key);
                        }
                    }
                } catch (IOException e) {
                    throw new SeenUrlStoreException("Failed to read seen-url file " + file, e);
                }
            }
            loaded = true;
            log.info("Loaded {} seen urls from {}", urls.size(), file.toAbsolutePath());
        }
    }

    private String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
