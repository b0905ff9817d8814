package com.phillippitts.interviewcopilot.service.events;

import com.phillippitts.interviewcopilot.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class EventChannelTest {

    private sealed interface Event permits Ping, Pong { }

    private record Ping(int n) implements Event { }

    private record Pong(int n) implements Event { }

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void deliversEventsInPublicationOrderFromManyProducers() throws InterruptedException {
        pool = Executors.newFixedThreadPool(4);
        List<Event> received = Collections.synchronizedList(new ArrayList<>());
        EventChannel<Event> channel = new EventChannel<>("test", pool, Map.of(), received::add);

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 100; i++) {
                channel.publish(new Ping(i));
            }
        });
        producer.start();
        producer.join();
        for (int i = 0; i < 100; i++) {
            channel.publish(new Pong(i));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 200);
        List<Integer> pings = received.stream().filter(Ping.class::isInstance).map(e -> ((Ping) e).n()).toList();
        assertThat(pings).isSorted().hasSize(100);
        assertThat(received.subList(100, 200)).allMatch(Pong.class::isInstance);
    }

    @Test
    void publishAfterCloseIsRejected() {
        List<Event> received = new ArrayList<>();
        EventChannel<Event> channel = new EventChannel<>("test", new SyncExecutor(), Map.of(), received::add);

        assertThat(channel.publish(new Ping(1))).isTrue();
        channel.close();

        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.publish(new Ping(2))).isFalse();
        assertThat(received).containsExactly(new Ping(1));
    }

    @Test
    void consumerFailureDoesNotStopDelivery() {
        List<Event> received = new ArrayList<>();
        EventChannel<Event> channel = new EventChannel<>("test", new SyncExecutor(), Map.of(), e -> {
            if (e instanceof Ping) {
                throw new IllegalStateException("boom");
            }
            received.add(e);
        });

        channel.publish(new Ping(1));
        channel.publish(new Pong(2));

        assertThat(received).containsExactly(new Pong(2));
    }
}
