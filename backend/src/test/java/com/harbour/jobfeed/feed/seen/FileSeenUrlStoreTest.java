package com.harbour.jobfeed.feed.seen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSeenUrlStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void addedUrlsSurviveARestart() throws Exception {
        Path file = tempDir.resolve("processed_urls.txt");
        FileSeenUrlStore first = new FileSeenUrlStore(file);
        first.add("https://fresheropenings.com/a");
        first.add("https://fresheropenings.com/b");

        FileSeenUrlStore restarted = new FileSeenUrlStore(file);

        assertThat(restarted.contains("https://fresheropenings.com/a")).isTrue();
        assertThat(restarted.contains("https://fresheropenings.com/b")).isTrue();
        assertThat(restarted.contains("https://fresheropenings.com/c")).isFalse();
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .containsExactly("https://fresheropenings.com/a", "https://fresheropenings.com/b");
    }

    @Test
    void eachAddIsWrittenImmediately() throws Exception {
        Path file = tempDir.resolve("nested/dir/processed_urls.txt");
        FileSeenUrlStore store = new FileSeenUrlStore(file);

        store.add("https://fresheropenings.com/a");

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly("https://fresheropenings.com/a");
    }

    @Test
    void readsExistingFileIgnoringBlankLinesAndWhitespace() throws Exception {
        Path file = tempDir.resolve("processed_urls.txt");
        Files.write(file, List.of("  https://fresheropenings.com/x  ", "", "https://freshersrecruitment.co.in/y"));

        FileSeenUrlStore store = new FileSeenUrlStore(file);

        assertThat(store.contains("https://fresheropenings.com/x")).isTrue();
        assertThat(store.contains(" https://freshersrecruitment.co.in/y")).isTrue();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void repeatedAddDoesNotGrowTheFile() throws Exception {
        Path file = tempDir.resolve("processed_urls.txt");
        FileSeenUrlStore store = new FileSeenUrlStore(file);

        store.add("https://fresheropenings.com/a");
        store.add("https://fresheropenings.com/a");

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(1);
    }

    @Test
    void appendAfterTornTailStartsOnItsOwnLine() throws Exception {
        Path file = tempDir.resolve("processed_urls.txt");
        Files.writeString(file, "https://fresheropenings.com/a", StandardCharsets.UTF_8);

        FileSeenUrlStore store = new FileSeenUrlStore(file);
        store.add("https://fresheropenings.com/b");
        store.add("https://fresheropenings.com/c");

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
            "https://fresheropenings.com/a",
            "https://fresheropenings.com/b",
            "https://fresheropenings.com/c"
        );
        FileSeenUrlStore restarted = new FileSeenUrlStore(file);
        assertThat(restarted.contains("https://fresheropenings.com/a")).isTrue();
        assertThat(restarted.contains("https://fresheropenings.com/b")).isTrue();
        assertThat(restarted.size()).isEqualTo(3);
    }

    @Test
    void unreadableMediumIsSurfaced() {
        FileSeenUrlStore store = new FileSeenUrlStore(tempDir);

        assertThatThrownBy(() -> store.contains("https://fresheropenings.com/a"))
            .isInstanceOf(SeenUrlStoreException.class);
    }

    @Test
    void unwritableMediumIsSurfaced() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        FileSeenUrlStore store = new FileSeenUrlStore(blocker.resolve("processed_urls.txt"));

        assertThatThrownBy(() -> store.add("https://fresheropenings.com/a"))
            .isInstanceOf(SeenUrlStoreException.class);
    }
}
