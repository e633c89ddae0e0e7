package de.admir.unistore.core;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.util.Xor;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Operations common to every storage backend. Paths are slash-delimited logical paths interpreted by each backend.
 * <p>
 * Every operation completes with an {@link Xor}: a {@link StorageError} of exactly one
 * {@link de.admir.unistore.core.error.StorageErrorType} on the left, or the documented value on the right. A blank
 * path always yields {@code INVALID_ARGUMENT} without touching the backend.
 */
public interface StorageProvider {

    /**
     * Writes {@code content} to {@code path}, creating missing intermediate containers.
     *
     * @param overwrite replace an existing entry instead of failing with {@code ALREADY_EXISTS}
     * @return a backend-specific locator of the written entry
     */
    CompletableFuture<Xor<StorageError, String>> add(String path, InputStream content, boolean overwrite);

    /**
     * Deletes the entry at {@code path}, recursively for containers. {@code NOT_FOUND} if there is none.
     */
    CompletableFuture<Xor<StorageError, Void>> delete(String path);

    /**
     * Whether an entry is present at {@code path}. A missing entry is never an error.
     */
    CompletableFuture<Xor<StorageError, Boolean>> exists(String path);

    /**
     * The immediate children of the container at {@code path}, in no particular order.
     */
    CompletableFuture<Xor<StorageError, List<StorageItem>>> list(String path);

    /**
     * Opens the content of the entry at {@code path}. The caller owns the returned stream and must close it.
     */
    CompletableFuture<Xor<StorageError, InputStream>> read(String path);

    /**
     * Copies the content of the entry at {@code path} into {@code destination}, which is left open.
     *
     * @return the number of bytes copied
     */
    CompletableFuture<Xor<StorageError, Long>> read(String path, OutputStream destination);
}
