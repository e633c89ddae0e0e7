package de.admir.unistore.core.util;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Batches")
class BatchesTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(64);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static List<Integer> items(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    @Test
    @DisplayName("should partition 120 items into 50, 50 and 20")
    void partitionsIntoBatches() {
        List<List<Integer>> batches = Batches.partition(items(120), 50);

        assertThat(batches).extracting(List::size).containsExactly(50, 50, 20);
    }

    @Test
    @DisplayName("should reject a non-positive batch size")
    void rejectsInvalidBatchSize() {
        assertThatThrownBy(() -> Batches.partition(items(3), 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should never run more than one batch at a time")
    void boundsConcurrencyByBatchSize() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Set<Integer> processed = ConcurrentHashMap.newKeySet();

        Xor<StorageError, Void> result = Batches.runInBatches(items(120), 50, executor, item -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            processed.add(item);
            inFlight.decrementAndGet();
            return Xor.right(null);
        }).join();

        assertThat(result.isRight()).isTrue();
        assertThat(processed).hasSize(120);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(50);
    }

    @Test
    @DisplayName("should stop after the batch containing the first failure")
    void stopsAfterFailingBatch() {
        Set<Integer> processed = ConcurrentHashMap.newKeySet();

        Xor<StorageError, Void> result = Batches.runInBatches(items(120), 50, executor, item -> {
            processed.add(item);
            return item == 10 ?
                Xor.left(StorageError.notFound("gone: " + item, null)) :
                Xor.right(null);
        }).join();

        assertThat(result.isLeft()).isTrue();
        assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        assertThat(processed).hasSize(50);
    }

    @Test
    @DisplayName("should turn a thrown exception into a left")
    void mapsThrownException() {
        Xor<StorageError, Void> result = Batches.runInBatches(items(3), 2, executor, item -> {
            throw new IllegalStateException("broken");
        }).join();

        assertThat(result.isLeft()).isTrue();
        assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.BACKEND_UNAVAILABLE);
    }

    @Test
    @DisplayName("should succeed immediately for no items")
    void emptyInput() {
        assertThat(Batches.runInBatches(List.<Integer>of(), 50, executor, item -> Xor.right(null)).join().isRight()).isTrue();
    }
}
