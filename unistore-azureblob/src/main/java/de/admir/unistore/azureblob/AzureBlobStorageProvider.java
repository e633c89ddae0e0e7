package de.admir.unistore.azureblob;

import de.admir.unistore.core.AbstractStorageProvider;
import de.admir.unistore.core.error.IOError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.util.Batches;
import de.admir.unistore.core.util.Xor;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import com.azure.core.exception.HttpResponseException;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobStorageException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object store backend on Azure Blob Storage. The first path segment is the container, the rest the blob name. Folders
 * do not exist as entities, they are synthesized from blob name prefixes when listing.
 */
public class AzureBlobStorageProvider extends AbstractStorageProvider {
    private static final Logger logger = LoggerFactory.getLogger(AzureBlobStorageProvider.class);

    public static final int DEFAULT_DELETE_BATCH_THRESHOLD = 50;

    private final BlobGateway gateway;
    private final int deleteBatchThreshold;

    public AzureBlobStorageProvider(BlobServiceClient endpoint) {
        this(new AzureBlobGateway(endpoint), ForkJoinPool.commonPool(), DEFAULT_DELETE_BATCH_THRESHOLD);
    }

    public AzureBlobStorageProvider(BlobGateway gateway, Executor executor, int deleteBatchThreshold) {
        super(executor);
        if (deleteBatchThreshold < 1)
            throw new IllegalArgumentException("Delete batch threshold must be positive, was " + deleteBatchThreshold);
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.deleteBatchThreshold = deleteBatchThreshold;
    }

    @Override
    protected Logger logger() {
        return logger;
    }

    @Override
    protected StorageError mapFailure(Throwable e, String path) {
        int status = -1;
        if (e instanceof BlobStorageException) {
            status = ((BlobStorageException) e).getStatusCode();
        } else if (e instanceof HttpResponseException && ((HttpResponseException) e).getResponse() != null) {
            status = ((HttpResponseException) e).getResponse().getStatusCode();
        }
        if (status < 0)
            return super.mapFailure(e, path);

        StorageErrorType type = StorageErrorType.fromHttpStatus(status);
        return new StorageError(String.format("Blob service responded with status %d for path: %s", status, path), e, type, path)
            .addNestedError(new IOError(e));
    }

    @Override
    public CompletableFuture<Xor<StorageError, String>> add(String path, InputStream content, boolean overwrite) {
        return async("add", path, segments -> {
            BlobPath blobPath = BlobPath.of(segments);
            if (blobPath.isContainerOnly())
                return Xor.left(StorageError.invalidArgument("Path must name a blob inside a container: " + path, path));

            return call(path, () -> gateway.createContainerIfNotExists(blobPath.getContainerName()))
                .peekRight(created -> {
                    if (created)
                        logger.info(String.format("Created container: %s", blobPath.getContainerName()));
                })
                .flatMapRight(created -> call(path, () -> gateway.blobExists(blobPath.getContainerName(), blobPath.getBlobName())))
                .flatMapRight(blobExists -> {
                    if (blobExists && !overwrite)
                        return Xor.left(StorageError.alreadyExists(String.format("Blob %s already exists", path), path));
                    return call(path, () -> gateway.upload(blobPath.getContainerName(), blobPath.getBlobName(), content, overwrite))
                        .peekRight(url -> logger.info(String.format("Successfully uploaded to Azure Blob: %s", path)));
                });
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, Void>> delete(String path) {
        return compose("delete", path, segments -> {
            BlobPath blobPath = BlobPath.of(segments);
            return CompletableFuture.supplyAsync(() -> findDeletionTargets(path, blobPath), executor)
                .thenCompose(xorTargets -> xorTargets.isLeft() ?
                    CompletableFuture.completedFuture(Xor.<StorageError, Void>left(xorTargets.getLeft())) :
                    deleteTargets(path, blobPath, xorTargets.getRight()));
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, Boolean>> exists(String path) {
        return async("exists", path, segments -> {
            BlobPath blobPath = BlobPath.of(segments);
            return call(path, () -> gateway.containerExists(blobPath.getContainerName()))
                .flatMapRight(containerExists -> !containerExists || blobPath.isContainerOnly() ?
                    Xor.right(containerExists) :
                    call(path, () -> gateway.blobExists(blobPath.getContainerName(), blobPath.getBlobName())));
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, List<StorageItem>>> list(String path) {
        return async("list", path, segments -> {
            BlobPath blobPath = BlobPath.of(segments);
            return requireContainer(path, blobPath)
                .flatMapRight(ignored -> call(path, () -> gateway.listByHierarchy(blobPath.getContainerName(), blobPath.childPrefix())))
                .mapRight(blobItems -> blobItems.stream()
                    .map(blobItem -> toStorageItem(blobItem, blobPath.childPrefix()))
                    .collect(Collectors.toList()));
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, InputStream>> read(String path) {
        return async("read", path, segments -> {
            BlobPath blobPath = BlobPath.of(segments);
            if (blobPath.isContainerOnly())
                return Xor.left(StorageError.invalidArgument("Path must name a blob inside a container: " + path, path));

            return requireContainer(path, blobPath)
                .flatMapRight(ignored -> call(path, () -> gateway.blobExists(blobPath.getContainerName(), blobPath.getBlobName())))
                .flatMapRight(blobExists -> blobExists ?
                    call(path, () -> gateway.openBlob(blobPath.getContainerName(), blobPath.getBlobName())) :
                    Xor.left(StorageError.notFound("Blob not found: " + path, path)));
        });
    }

    /**
     * An empty target list means the whole container goes, otherwise the listed blob names are deleted.
     */
    private Xor<StorageError, List<String>> findDeletionTargets(String path, BlobPath blobPath) {
        return requireContainer(path, blobPath).flatMapRight(ignored -> {
            if (blobPath.isContainerOnly())
                return Xor.right(List.<String>of());

            return call(path, () -> gateway.blobExists(blobPath.getContainerName(), blobPath.getBlobName()))
                .flatMapRight(blobExists -> {
                    if (blobExists)
                        return Xor.right(List.of(blobPath.getBlobName()));
                    return call(path, () -> gateway.listFlat(blobPath.getContainerName(), blobPath.childPrefix()))
                        .flatMapRight(blobItems -> blobItems.isEmpty() ?
                            Xor.left(StorageError.notFound("Blob not found: " + path, path)) :
                            Xor.right(blobItems.stream().map(BlobItem::getName).collect(Collectors.toList())));
                });
        });
    }

    private CompletableFuture<Xor<StorageError, Void>> deleteTargets(String path, BlobPath blobPath, List<String> blobNames) {
        if (blobNames.isEmpty()) {
            return CompletableFuture.supplyAsync(() -> call(path, () -> {
                gateway.deleteContainer(blobPath.getContainerName());
                logger.info(String.format("Successfully deleted container: %s", blobPath.getContainerName()));
                return null;
            }), executor);
        }

        logger.debug(String.format("Deleting %d blobs for path: %s", blobNames.size(), path));
        return Batches.runInBatches(blobNames, deleteBatchThreshold, executor, blobName -> call(path, () -> {
            gateway.deleteBlob(blobPath.getContainerName(), blobName);
            return null;
        })).thenApply(result -> result.peekRight(ignored -> logger.info(String.format("Successfully deleted: %s", path))));
    }

    private Xor<StorageError, Boolean> requireContainer(String path, BlobPath blobPath) {
        return call(path, () -> gateway.containerExists(blobPath.getContainerName()))
            .flatMapRight(containerExists -> containerExists ?
                Xor.right(true) :
                Xor.left(StorageError.notFound("Container not found: " + blobPath.getContainerName(), path)));
    }

    private static StorageItem toStorageItem(BlobItem blobItem, String prefix) {
        String name = prefix == null ? blobItem.getName() : StringUtils.removeStart(blobItem.getName(), prefix);
        if (Boolean.TRUE.equals(blobItem.isPrefix()))
            return StorageItem.folder(StringUtils.removeEnd(name, "/"));
        return StorageItem.file(name);
    }
}
