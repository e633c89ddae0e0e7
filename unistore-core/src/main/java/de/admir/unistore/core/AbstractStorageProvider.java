package de.admir.unistore.core;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.util.PathUtils;
import de.admir.unistore.core.util.Xor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.slf4j.Logger;

/**
 * Shared plumbing for providers: path validation before any backend call, running blocking backend work on the
 * provider's executor, turning stray exceptions into {@link StorageError}s and logging every failure with its
 * operation and path.
 */
public abstract class AbstractStorageProvider implements StorageProvider {
    protected final Executor executor;

    protected AbstractStorageProvider(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    protected abstract Logger logger();

    /**
     * Maps a vendor or JDK exception thrown while working on {@code path} onto the taxonomy.
     */
    protected StorageError mapFailure(Throwable e, String path) {
        return StorageError.fromThrowable(e, path);
    }

    protected <T> CompletableFuture<Xor<StorageError, T>> async(String operation, String path, Function<List<String>, Xor<StorageError, T>> work) {
        return compose(operation, path, segments -> CompletableFuture.supplyAsync(() -> work.apply(segments), executor));
    }

    protected <T> CompletableFuture<Xor<StorageError, T>> compose(String operation, String path,
                                                                  Function<List<String>, CompletableFuture<Xor<StorageError, T>>> work) {
        Xor<StorageError, List<String>> xorSegments = PathUtils.validate(path);
        if (xorSegments.isLeft()) {
            logFailure(operation, path, xorSegments.getLeft());
            return CompletableFuture.completedFuture(Xor.left(xorSegments.getLeft()));
        }

        CompletableFuture<Xor<StorageError, T>> future;
        try {
            future = work.apply(xorSegments.getRight());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
            .handle((result, e) -> e == null ? result : Xor.<StorageError, T>left(mapFailure(StorageError.unwrap(e), path)))
            .thenApply(result -> result.peekLeft(error -> logFailure(operation, path, error)));
    }

    @Override
    public CompletableFuture<Xor<StorageError, Long>> read(String path, OutputStream destination) {
        Objects.requireNonNull(destination, "destination");
        return read(path).thenApplyAsync(xorContent -> xorContent.flatMapRight(content -> {
            try (InputStream in = content) {
                return Xor.<StorageError, Long>right(in.transferTo(destination));
            } catch (IOException e) {
                StorageError error = mapFailure(e, path);
                logFailure("read", path, error);
                return Xor.<StorageError, Long>left(error);
            }
        }), executor);
    }

    /**
     * Wraps a blocking vendor call, mapping whatever it throws.
     */
    protected <T> Xor<StorageError, T> call(String path, Callable<T> callable) {
        return Xor.catchNonFatal(callable).mapLeft(e -> mapFailure(e, path));
    }

    private void logFailure(String operation, String path, StorageError error) {
        String message = String.format("%s failed for path: %s, type: %s, reason: %s", operation, path, error.getType(), error.getMessage());
        if (error.getType().isExpected()) {
            logger().warn(message);
        } else {
            logger().error(message, error.getCause().orElse(null));
        }
    }
}
