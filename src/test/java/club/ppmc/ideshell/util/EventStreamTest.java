package club.ppmc.ideshell.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventStreamTest {

    @Test
    @DisplayName("collect returns items in offer order once completed")
    void collectPreservesOrder() throws Exception {
        var stream = new EventStream<String>();
        stream.offer("a");
        stream.offer("b");
        stream.offer("c");
        stream.complete();

        assertEquals(List.of("a", "b", "c"), stream.collect(Duration.ofSeconds(1)));
        assertTrue(stream.isFinished());
    }

    @Test
    @DisplayName("offer after complete is rejected")
    void offerAfterCompleteIsDropped() throws Exception {
        var stream = new EventStream<String>();
        stream.offer("a");
        stream.complete();

        assertFalse(stream.offer("late"));
        assertEquals(List.of("a"), stream.collect(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("items equal to each other are all delivered and only complete() ends the stream")
    void equalItemsAreNotMistakenForTheEnd() throws Exception {
        var stream = new EventStream<List<String>>();
        stream.offer(List.of());
        stream.offer(List.of());

        assertEquals(List.of(), stream.poll(Duration.ofMillis(100)).orElseThrow());
        assertEquals(List.of(), stream.poll(Duration.ofMillis(100)).orElseThrow());
        assertFalse(stream.isFinished());

        stream.complete();
        assertEquals(List.of(), stream.collect(Duration.ofSeconds(1)));
    }

    @Test
    void nullItemIsRejected() {
        var stream = new EventStream<String>();

        assertThrows(NullPointerException.class, () -> stream.offer(null));
    }

    @Test
    @DisplayName("collect times out when the producer never completes")
    void collectTimesOut() {
        var stream = new EventStream<String>();
        stream.offer("a");

        assertThrows(TimeoutException.class, () -> stream.collect(Duration.ofMillis(100)));
    }

    @Test
    @DisplayName("poll distinguishes an idle stream from a finished one")
    void pollReportsFinished() throws Exception {
        var stream = new EventStream<String>();

        assertTrue(stream.poll(Duration.ofMillis(20)).isEmpty());
        assertFalse(stream.isFinished());

        stream.complete();
        assertTrue(stream.poll(Duration.ofMillis(20)).isEmpty());
        assertTrue(stream.isFinished());
    }

    @Test
    @DisplayName("iterator blocks until items arrive from another thread")
    void iteratorReceivesItemsFromProducerThread() throws Exception {
        var stream = new EventStream<Integer>();
        CompletableFuture<List<Integer>> consumer = CompletableFuture.supplyAsync(() -> {
            List<Integer> received = new ArrayList<>();
            stream.forEach(received::add);
            return received;
        });

        for (int i = 0; i < 5; i++) {
            stream.offer(i);
        }
        stream.complete();

        assertEquals(List.of(0, 1, 2, 3, 4), consumer.get(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("cancel wakes a blocked consumer, runs the callback once and refuses new items")
    void cancelUnblocksConsumer() throws Exception {
        var callbacks = new AtomicInteger();
        var stream = new EventStream<String>(callbacks::incrementAndGet);
        CompletableFuture<Boolean> consumer = CompletableFuture.supplyAsync(() -> stream.iterator().hasNext());

        Thread.sleep(50);
        stream.cancel();
        stream.cancel();

        assertFalse(consumer.get(2, TimeUnit.SECONDS));
        assertEquals(1, callbacks.get());
        assertTrue(stream.isCancelled());
        assertFalse(stream.offer("ignored"));
    }
}
