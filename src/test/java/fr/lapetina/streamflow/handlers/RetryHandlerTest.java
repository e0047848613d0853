package fr.lapetina.streamflow.handlers;

import fr.lapetina.streamflow.domain.model.ErrorType;
import fr.lapetina.streamflow.flow.Flow;
import fr.lapetina.streamflow.flow.FlowContext;
import fr.lapetina.streamflow.flow.Handler;
import fr.lapetina.streamflow.flow.Request;
import fr.lapetina.streamflow.flow.Response;
import fr.lapetina.streamflow.flow.exception.FlowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryHandlerTest {

    private static final Duration FAST = Duration.ofMillis(1);

    /**
     * Fails its first {@code failures} calls, then echoes "ok:" + input.
     */
    private static Handler failingTimes(int failures, AtomicInteger calls, List<String> seenInputs) {
        return (request, response) -> {
            String input = request.readString();
            seenInputs.add(input);
            int call = calls.incrementAndGet();
            response.write("partial-" + call);
            if (call <= failures) {
                throw new IOException("transient failure " + call);
            }
            response.write("|ok:" + input);
        };
    }

    @Nested
    @DisplayName("Attempts")
    class Attempts {

        @Test
        @DisplayName("should succeed on the third attempt and only emit its output")
        void shouldSucceedAfterFailures() {
            AtomicInteger calls = new AtomicInteger();
            List<String> inputs = Collections.synchronizedList(new ArrayList<>());
            Flow flow = new Flow().use(new RetryHandler(failingTimes(2, calls, inputs), 3, FAST, 2.0, FAST));

            String result = flow.run(FlowContext.background(), "payload");

            assertThat(result).isEqualTo("partial-3|ok:payload");
            assertThat(calls.get()).isEqualTo(3);
            assertThat(inputs).containsExactly("payload", "payload", "payload");
        }

        @Test
        @DisplayName("should not retry after a first success")
        void shouldCallOnceOnSuccess() {
            AtomicInteger calls = new AtomicInteger();
            Flow flow = new Flow().use(new RetryHandler(
                    failingTimes(0, calls, new ArrayList<>()), 5, FAST, 2.0, FAST));

            assertThat(flow.run(FlowContext.background(), "x")).isEqualTo("partial-1|ok:x");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail with RETRY_EXHAUSTED after exactly maxAttempts calls")
        void shouldExhaust() {
            AtomicInteger calls = new AtomicInteger();
            RetryHandler retry = new RetryHandler(
                    failingTimes(Integer.MAX_VALUE, calls, new ArrayList<>()), 4, FAST, 2.0, FAST);
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            assertThatThrownBy(() -> retry.serveFlow(Request.of(FlowContext.background(), "x"), new Response(out)))
                    .isInstanceOf(FlowException.class)
                    .hasMessageContaining("transient failure 4")
                    .hasCauseInstanceOf(IOException.class)
                    .extracting(e -> ((FlowException) e).getErrorType())
                    .isEqualTo(ErrorType.RETRY_EXHAUSTED);
            assertThat(calls.get()).isEqualTo(4);
            assertThat(out.size()).isZero();
        }

        @Test
        @DisplayName("should reject a non-positive attempt count on each call")
        void shouldRejectInvalidMaxAttempts() {
            AtomicInteger calls = new AtomicInteger();
            RetryHandler retry = new RetryHandler(failingTimes(0, calls, new ArrayList<>()), 0);

            assertThatThrownBy(() -> retry.serveFlow(
                    Request.of(FlowContext.background(), "x"), new Response(new ByteArrayOutputStream())))
                    .isInstanceOf(FlowException.class)
                    .extracting(e -> ((FlowException) e).getErrorType())
                    .isEqualTo(ErrorType.INVALID_CONFIGURATION);
            assertThat(calls.get()).isZero();
        }
    }

    @Nested
    @DisplayName("Backoff")
    class Backoff {

        @Test
        @DisplayName("should grow exponentially up to the cap")
        void shouldComputeExponentialBackoff() {
            RetryHandler retry = new RetryHandler((request, response) -> { }, 10,
                    Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));

            assertThat(retry.backoff(0)).isEqualTo(Duration.ofMillis(100));
            assertThat(retry.backoff(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(retry.backoff(3)).isEqualTo(Duration.ofMillis(800));
            assertThat(retry.backoff(4)).isEqualTo(Duration.ofSeconds(1));
            assertThat(retry.backoff(2000)).isEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should use the default schedule")
        void shouldUseDefaults() {
            RetryHandler retry = new RetryHandler((request, response) -> { }, 3);

            assertThat(retry.backoff(0)).isEqualTo(RetryHandler.DEFAULT_INITIAL_BACKOFF);
            assertThat(retry.backoff(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(retry.getMaxAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("should stop waiting when the context is cancelled during backoff")
        void shouldAbortBackoffOnCancellation() {
            AtomicInteger calls = new AtomicInteger();
            RetryHandler retry = new RetryHandler(
                    failingTimes(Integer.MAX_VALUE, calls, new ArrayList<>()), 5,
                    Duration.ofSeconds(30), 2.0, Duration.ofSeconds(30));
            FlowContext ctx = FlowContext.background().withTimeout(Duration.ofMillis(100));

            long started = System.nanoTime();
            assertThatThrownBy(() -> retry.serveFlow(
                    Request.of(ctx, "x"), new Response(new ByteArrayOutputStream())))
                    .isInstanceOf(FlowException.class)
                    .extracting(e -> ((FlowException) e).getErrorType())
                    .isEqualTo(ErrorType.DEADLINE_EXCEEDED);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("should carry the payload bytes unchanged into every attempt")
    void shouldReplayBinaryInput() {
        byte[] payload = new byte[64 * 1024];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        AtomicInteger calls = new AtomicInteger();
        Handler echoOnSecond = (request, response) -> {
            byte[] input = request.readAllBytes();
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt");
            }
            response.write(input);
        };

        byte[] result = new Flow()
                .use(new RetryHandler(echoOnSecond, 2, FAST, 2.0, FAST))
                .run(FlowContext.background(), payload, s -> s.readAllBytes());

        assertThat(result).isEqualTo(payload);
        assertThat(calls.get()).isEqualTo(2);
    }
}
