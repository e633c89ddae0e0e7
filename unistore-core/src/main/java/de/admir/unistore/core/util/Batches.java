package de.admir.unistore.core.util;

import de.admir.unistore.core.error.StorageError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded fan-out: items are split into batches of at most {@code batchSize}, each batch runs concurrently on the
 * executor and the next batch starts only once the previous one has fully completed. The first failure of a batch
 * stops further batches but does not cancel its siblings.
 */
public final class Batches {
    private static final Logger logger = LoggerFactory.getLogger(Batches.class);

    private Batches() {
    }

    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        if (SystemUtils.isEmptyCollection(items))
            return Collections.emptyList();
        return Lists.partition(items, batchSize);
    }

    public static <T> CompletableFuture<Xor<StorageError, Void>> runInBatches(List<T> items, int batchSize, Executor executor,
                                                                             Function<T, Xor<StorageError, Void>> action) {
        List<List<T>> batches = partition(items, batchSize);
        CompletableFuture<Xor<StorageError, Void>> chain = CompletableFuture.completedFuture(Xor.right(null));
        for (int i = 0; i < batches.size(); i++) {
            final List<T> batch = batches.get(i);
            final int batchNumber = i + 1;
            chain = chain.thenCompose(previous -> previous.isLeft() ?
                CompletableFuture.completedFuture(previous) :
                runBatch(batch, batchNumber, batches.size(), executor, action));
        }
        return chain;
    }

    private static <T> CompletableFuture<Xor<StorageError, Void>> runBatch(List<T> batch, int batchNumber, int batchCount, Executor executor,
                                                                          Function<T, Xor<StorageError, Void>> action) {
        logger.debug(String.format("Running batch %d/%d with %d items", batchNumber, batchCount, batch.size()));
        List<CompletableFuture<Xor<StorageError, Void>>> tasks = batch.stream()
            .map(item -> CompletableFuture.supplyAsync(() -> action.apply(item), executor))
            .collect(Collectors.toCollection(ArrayList::new));

        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
            .handle((ignored, failure) -> {
                for (CompletableFuture<Xor<StorageError, Void>> task : tasks) {
                    Xor<StorageError, Void> result = task.handle((xor, e) -> e == null ? xor : Xor.<StorageError, Void>left(StorageError.fromThrowable(e, null))).join();
                    if (result.isLeft())
                        return result;
                }
                return Xor.right(null);
            });
    }
}
