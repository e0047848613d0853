package fr.lapetina.streamflow.infrastructure.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCacheStoreTest {

    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should return stored values until they expire")
    void shouldExpireEntries() throws InterruptedException {
        store.set("short", bytes("a"), Duration.ofMillis(50));
        store.set("long", bytes("b"), Duration.ofHours(1));

        assertThat(store.get("short")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("a")));
        assertThat(store.exists("short")).isTrue();

        Thread.sleep(100);

        assertThat(store.get("short")).isEmpty();
        assertThat(store.exists("short")).isFalse();
        assertThat(store.list()).containsExactly("long");
    }

    @Test
    @DisplayName("sweep should remove only expired entries")
    void shouldSweepExpiredEntries() throws InterruptedException {
        store.set("gone-1", bytes("a"), Duration.ofMillis(10));
        store.set("gone-2", bytes("a"), Duration.ofMillis(10));
        store.set("kept", bytes("b"), Duration.ofHours(1));
        Thread.sleep(50);

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.sweep()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("background sweeper should evict expired entries")
    void shouldSweepInBackground() throws InterruptedException {
        try (InMemoryCacheStore sweeping = new InMemoryCacheStore(Duration.ofMillis(20))) {
            sweeping.set("k", bytes("v"), Duration.ofMillis(10));

            long deadline = System.currentTimeMillis() + 2000;
            while (sweeping.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(sweeping.size()).isZero();
        }
    }

    @Test
    @DisplayName("should isolate stored bytes from caller mutations")
    void shouldCopyValues() {
        byte[] value = bytes("original");
        store.set("k", value, Duration.ofHours(1));
        value[0] = 'X';

        byte[] read = store.get("k").orElseThrow();
        read[1] = 'Y';

        assertThat(store.get("k").orElseThrow()).isEqualTo(bytes("original"));
    }

    @Test
    @DisplayName("should delete and clear entries")
    void shouldDeleteAndClear() {
        store.set("a", bytes("1"), Duration.ofHours(1));
        store.set("b", bytes("2"), Duration.ofHours(1));

        store.delete("a");
        assertThat(store.list()).containsExactly("b");

        store.clear();
        assertThat(store.list()).isEmpty();
        store.delete("missing");
    }
}
