package fr.lapetina.streamflow.infrastructure.cache;

import fr.lapetina.streamflow.flow.Flow;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private ResponseCache cache;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache();
        calls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private Handler counting(String prefix) {
        return (request, response) -> {
            int call = calls.incrementAndGet();
            response.write(prefix + request.readString() + "#" + call);
        };
    }

    private static String run(Handler handler, String input) {
        return new Flow().use(handler).run(FlowContext.background(), input);
    }

    @Nested
    @DisplayName("Content keyed")
    class ContentKeyed {

        @Test
        @DisplayName("should serve a repeated input from the cache")
        void shouldHitOnSameInput() {
            Handler cached = cache.cache(counting("out:"), Duration.ofMinutes(1));

            assertThat(run(cached, "a")).isEqualTo("out:a#1");
            assertThat(run(cached, "a")).isEqualTo("out:a#1");
            assertThat(run(cached, "b")).isEqualTo("out:b#2");
            assertThat(calls.get()).isEqualTo(2);
            assertThat(cache.exists(ResponseCache.key("a"))).isTrue();
            assertThat(cache.listKeys()).containsExactlyInAnyOrder(ResponseCache.key("a"), ResponseCache.key("b"));
        }

        @Test
        @DisplayName("should recompute once the entry expired")
        void shouldRecomputeAfterTtl() throws InterruptedException {
            Handler cached = cache.cache(counting("out:"), Duration.ofMillis(50));

            assertThat(run(cached, "a")).isEqualTo("out:a#1");
            Thread.sleep(100);

            assertThat(run(cached, "a")).isEqualTo("out:a#2");
        }

        @Test
        @DisplayName("should not store the output of a failed call")
        void shouldNotCacheFailures() {
            Handler failing = (request, response) -> {
                calls.incrementAndGet();
                response.write("partial");
                throw new IllegalStateException("boom");
            };
            Handler cached = cache.cache(failing, Duration.ofMinutes(1));

            assertThatThrownBy(() -> run(cached, "a")).hasMessage("boom");
            assertThatThrownBy(() -> run(cached, "a")).hasMessage("boom");
            assertThat(calls.get()).isEqualTo(2);
            assertThat(cache.listKeys()).isEmpty();
        }

        @Test
        @DisplayName("should derive keys from the SHA-256 of the input")
        void shouldUseSha256Keys() {
            assertThat(ResponseCache.key("abc"))
                    .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }

        @Test
        @DisplayName("should forget entries on delete and clear")
        void shouldDeleteEntries() {
            Handler cached = cache.cache(counting("out:"), Duration.ofMinutes(1));
            run(cached, "a");

            cache.delete(ResponseCache.key("a"));
            assertThat(run(cached, "a")).isEqualTo("out:a#2");

            cache.clear();
            assertThat(run(cached, "a")).isEqualTo("out:a#3");
        }

        @Test
        @DisplayName("should serve entries stored directly")
        void shouldServeWarmedEntries() {
            Handler cached = cache.cache(counting("out:"), Duration.ofMinutes(1));
            cache.set(ResponseCache.key("warm"), "preloaded".getBytes(StandardCharsets.UTF_8), Duration.ofMinutes(1));

            assertThat(run(cached, "warm")).isEqualTo("preloaded");
            assertThat(calls.get()).isZero();
            assertThat(cache.get(ResponseCache.key("warm"))).isPresent();
        }
    }

    @Nested
    @DisplayName("Custom keys")
    class CustomKeys {

        @Test
        @DisplayName("should key on request metadata without reading the input on a hit")
        void shouldUseKeyFunction() {
            Handler cached = cache.cacheWithKey(counting("out:"), Duration.ofMinutes(1),
                    request -> request.context().requestId());

            FlowContext tenantA = FlowContext.background().withRequestId("tenant-a");
            Flow flow = new Flow().use(cached);

            assertThat(flow.run(tenantA, "first")).isEqualTo("out:first#1");
            assertThat(flow.run(tenantA, "second")).isEqualTo("out:first#1");
            assertThat(cache.exists("tenant-a")).isTrue();
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("should fall back to the handler when the store fails")
        void shouldDegradeOnStoreFailure() {
            List<RuntimeException> reported = Collections.synchronizedList(new ArrayList<>());
            try (ResponseCache broken = new ResponseCache(new FailingStore()).onError(reported::add)) {
                Handler cached = broken.cache(counting("out:"), Duration.ofMinutes(1));

                assertThat(run(cached, "a")).isEqualTo("out:a#1");
                assertThat(run(cached, "a")).isEqualTo("out:a#2");
            }

            assertThat(reported).hasSize(4).allMatch(e -> e instanceof CacheStoreException);
        }
    }

    private static final class FailingStore implements CacheStore {

        @Override
        public Optional<byte[]> get(String key) {
            throw new CacheStoreException("store unavailable");
        }

        @Override
        public void set(String key, byte[] value, Duration ttl) {
            throw new CacheStoreException("store unavailable");
        }

        @Override
        public void delete(String key) {
            throw new CacheStoreException("store unavailable");
        }

        @Override
        public void clear() {
            throw new CacheStoreException("store unavailable");
        }

        @Override
        public boolean exists(String key) {
            throw new CacheStoreException("store unavailable");
        }

        @Override
        public List<String> list() {
            throw new CacheStoreException("store unavailable");
        }
    }
}
