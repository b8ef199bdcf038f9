package com.elssolution.unlockwatch.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionStoreTest {

    @TempDir Path dir;

    Path file;
    SubscriptionStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("data.json");
        store = new SubscriptionStore(file);
    }

    @Test
    void missing_file_loads_empty_defaults() {
        StoreState s = store.load();

        assertThat(s.getSubscribers()).isEmpty();
        assertThat(s.getEndpoint().getUrl()).isEmpty();
        assertThat(s.getEndpoint().getToken()).isEmpty();
        assertThat(s.getAccountState()).isEmpty();
        assertThat(s.isIncludeRaw()).isFalse();
    }

    @Test
    void corrupt_file_loads_empty_defaults() throws Exception {
        Files.writeString(file, "{ this is not json", StandardCharsets.UTF_8);

        assertThat(store.load()).isEqualTo(StoreState.empty());
    }

    @Test
    void empty_file_loads_empty_defaults() throws Exception {
        Files.writeString(file, "", StandardCharsets.UTF_8);

        assertThat(store.load()).isEqualTo(StoreState.empty());
    }

    @Test
    void reads_original_bot_file_layout() throws Exception {
        Files.writeString(file, "{\n"
                + "  \"chats\": { \"1001\": { \"accounts\": [\"gamer123\", \"other\"], \"interval_min\": 7 } },\n"
                + "  \"api\": { \"url\": \"https://status.example/check\", \"token\": \"t0k\" },\n"
                + "  \"last_seen_unlocked\": { \"gamer123\": true },\n"
                + "  \"include_raw\": true,\n"
                + "  \"something_new\": 42\n"
                + "}", StandardCharsets.UTF_8);

        StoreState s = store.load();

        assertThat(s.getSubscribers()).containsOnlyKeys("1001");
        assertThat(s.getSubscribers().get("1001").getAccounts()).containsExactly("gamer123", "other");
        assertThat(s.getSubscribers().get("1001").getIntervalMinutes()).isEqualTo(7);
        assertThat(s.getEndpoint().isConfigured()).isTrue();
        assertThat(s.isUnlocked("gamer123")).isTrue();
        assertThat(s.isUnlocked("other")).isFalse();
        assertThat(s.isIncludeRaw()).isTrue();
    }

    @Test
    void null_sections_are_replaced_with_defaults() throws Exception {
        Files.writeString(file, "{\"chats\": null, \"api\": {\"url\": null}, \"last_seen_unlocked\": null}",
                StandardCharsets.UTF_8);

        StoreState s = store.load();

        assertThat(s.getSubscribers()).isEmpty();
        assertThat(s.getEndpoint().getUrl()).isEmpty();
        assertThat(s.getEndpoint().isConfigured()).isFalse();
        assertThat(s.getAccountState()).isEmpty();
    }

    @Test
    void save_of_load_keeps_state_unchanged() {
        store.addAccount("1001", "gamer123");
        store.setEndpointUrl("https://status.example/check");
        store.setEndpointToken("secret");
        store.markUnlocked("gamer123");
        StoreState before = store.load();

        store.save(store.load());

        assertThat(store.load()).isEqualTo(before);
    }

    @Test
    void add_keeps_insertion_order_and_duplicates() {
        store.addAccount("1001", "b");
        store.addAccount("1001", "a");
        store.addAccount("1001", "b");
        store.addAccount("2002", "c");

        assertThat(store.list("1001").getAccounts()).containsExactly("b", "a", "b");
        assertThat(store.load().getSubscribers().keySet()).containsExactly("1001", "2002");
        assertThat(store.list("1001").getIntervalMinutes()).isEqualTo(StoreState.DEFAULT_INTERVAL_MINUTES);
    }

    @Test
    void remove_drops_every_occurrence() {
        store.addAccount("1001", "a");
        store.addAccount("1001", "b");
        store.addAccount("1001", "a");

        assertThat(store.removeAccount("1001", "a")).isTrue();
        assertThat(store.list("1001").getAccounts()).containsExactly("b");
        assertThat(store.removeAccount("1001", "a")).isFalse();
        assertThat(store.removeAccount("9999", "b")).isFalse();
    }

    @Test
    void list_of_unknown_chat_is_an_empty_default() {
        StoreState.Subscriber sub = store.list("nobody");

        assertThat(sub.getAccounts()).isEmpty();
        assertThat(sub.getIntervalMinutes()).isEqualTo(5);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void interval_must_be_positive() {
        store.setInterval("1001", 15);
        assertThat(store.list("1001").getIntervalMinutes()).isEqualTo(15);

        assertThatThrownBy(() -> store.setInterval("1001", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reset_clears_the_unlocked_mark() {
        store.markUnlocked("gamer123");
        assertThat(store.isUnlocked("gamer123")).isTrue();
        assertThat(store.unlockedAccounts()).containsExactly("gamer123");

        assertThat(store.resetAccount("gamer123")).isTrue();
        assertThat(store.isUnlocked("gamer123")).isFalse();
        assertThat(store.resetAccount("gamer123")).isFalse();
    }

    @Test
    void load_returns_a_private_copy() {
        store.addAccount("1001", "a");

        StoreState copy = store.load();
        copy.getSubscribers().get("1001").getAccounts().add("sneaky");

        assertThat(store.list("1001").getAccounts()).containsExactly("a");
    }

    @Test
    void save_leaves_no_temp_files_behind() throws Exception {
        store.addAccount("1001", "a");
        store.setIncludeRaw(true);

        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("data.json");
        }
    }

    @Test
    void failed_write_keeps_previous_file() throws Exception {
        store.addAccount("1001", "a");
        String before = Files.readString(file);

        // parent "directory" is a regular file, so every write fails
        SubscriptionStore broken = new SubscriptionStore(file.resolve("nested.json"));
        assertThatThrownBy(() -> broken.addAccount("1001", "b"))
                .isInstanceOf(StoreWriteException.class);

        assertThat(Files.readString(file)).isEqualTo(before);
    }

    @Test
    void concurrent_writers_do_not_lose_updates() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        store.addAccount("chat-" + (id % 2), "acc-" + id + "-" + i);
                        if (i % 5 == 0) store.markUnlocked("acc-" + id + "-" + i);
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        StoreState s = store.load();
        int total = s.getSubscribers().values().stream().mapToInt(sub -> sub.getAccounts().size()).sum();
        assertThat(total).isEqualTo(threads * perThread);
        assertThat(s.getAccountState()).hasSize(threads * perThread / 5);
    }
}
