package com.herotasks.realtime.infrastructure;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionInboxTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static byte[] frame(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void drainsFramesInOrder() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        ConnectionInbox inbox = new ConnectionInbox("alice", "ws-1", 8, Duration.ofMillis(100), bytes -> {
            received.add(new String(bytes, StandardCharsets.UTF_8));
            latch.countDown();
        });
        inbox.start(executor);

        inbox.offer(frame("a"));
        inbox.offer(frame("b"));
        inbox.offer(frame("c"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly("a", "b", "c");
        inbox.close();
    }

    @Test
    void dropsFrameWhenFullAfterTimeout() {
        ConnectionInbox inbox = new ConnectionInbox("alice", "ws-1", 1, Duration.ofMillis(20), bytes -> { });

        assertThat(inbox.offer(frame("a"))).isTrue();
        assertThat(inbox.offer(frame("b"))).isFalse();
        assertThat(inbox.pending()).isEqualTo(1);
    }

    @Test
    void consumerFailureDoesNotStopDraining() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        ConnectionInbox inbox = new ConnectionInbox("alice", "ws-1", 8, Duration.ofMillis(100), bytes -> {
            if ("boom".equals(new String(bytes, StandardCharsets.UTF_8))) {
                throw new IllegalStateException("boom");
            }
            latch.countDown();
        });
        inbox.start(executor);

        inbox.offer(frame("boom"));
        inbox.offer(frame("ok"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        inbox.close();
    }

    @Test
    void closeDiscardsQueueAndRejectsNewFrames() {
        ConnectionInbox inbox = new ConnectionInbox("alice", "ws-1", 8, Duration.ofMillis(20), bytes -> { });
        inbox.offer(frame("a"));

        inbox.close();

        assertThat(inbox.isClosed()).isTrue();
        assertThat(inbox.pending()).isZero();
        assertThat(inbox.offer(frame("b"))).isFalse();
    }
}
