package de.admir.unistore.gdrive;

import de.admir.unistore.core.AbstractStorageProvider;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.model.StorageItemType;
import de.admir.unistore.core.util.Batches;
import de.admir.unistore.core.util.PathUtils;
import de.admir.unistore.core.util.Xor;
import de.admir.unistore.gdrive.constants.MimeTypes;
import de.admir.unistore.gdrive.constants.Role;
import de.admir.unistore.gdrive.model.GoogleStorageItem;

import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;

import org.apache.commons.collections.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ID-addressed backend on Google Drive. Every path segment is resolved to a Drive ID through
 * {@link DrivePathResolver}; uploads are shared with anyone holding the link and {@link #add} returns that link.
 */
public class GoogleDriveStorageProvider extends AbstractStorageProvider {
    private static final Logger logger = LoggerFactory.getLogger(GoogleDriveStorageProvider.class);

    public static final int DEFAULT_DELETE_BATCH_THRESHOLD = 50;

    private static final String SHAREABLE_LINK_FORMAT = "https://drive.google.com/file/d/%s/view";
    private static final Pattern SHAREABLE_LINK_PATTERN = Pattern.compile("/file/d/(.*?)/view");

    private final DriveGateway gateway;
    private final DrivePathResolver resolver;
    private final int deleteBatchThreshold;
    private final Role shareRole;

    public GoogleDriveStorageProvider(Drive driveService) {
        this(new GoogleDriveGateway(driveService), ForkJoinPool.commonPool(), DEFAULT_DELETE_BATCH_THRESHOLD, Role.READER);
    }

    public GoogleDriveStorageProvider(DriveGateway gateway, Executor executor, int deleteBatchThreshold, Role shareRole) {
        super(executor);
        if (deleteBatchThreshold < 1)
            throw new IllegalArgumentException("Delete batch threshold must be positive, was " + deleteBatchThreshold);
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.resolver = new DrivePathResolver(gateway);
        this.deleteBatchThreshold = deleteBatchThreshold;
        this.shareRole = Objects.requireNonNull(shareRole, "shareRole");
    }

    public int getDeleteBatchThreshold() {
        return deleteBatchThreshold;
    }

    @Override
    protected Logger logger() {
        return logger;
    }

    @Override
    protected StorageError mapFailure(Throwable e, String path) {
        return DriveErrors.map(e, path);
    }

    /**
     * Drive has no overwrite in place: with {@code overwrite} set, files of the same name in the target folder are
     * deleted before the new one is uploaded. Folders sharing the name are left alone.
     */
    @Override
    public CompletableFuture<Xor<StorageError, String>> add(String path, InputStream content, boolean overwrite) {
        return compose("add", path, segments -> {
            String fileName = PathUtils.lastSegment(segments);
            return CompletableFuture.supplyAsync(() -> resolver.ensureFolder(PathUtils.parentSegments(segments), path)
                    .flatMapRight(parentId -> call(path, () -> gateway.findChildren(parentId, fileName, DriveQuery.Kind.FILES))
                        .mapRight(existing -> new UploadTarget(parentId, existing))), executor)
                .thenCompose(xorTarget -> {
                    if (xorTarget.isLeft())
                        return CompletableFuture.completedFuture(Xor.<StorageError, UploadTarget>left(xorTarget.getLeft()));

                    UploadTarget target = xorTarget.getRight();
                    if (CollectionUtils.isEmpty(target.existing))
                        return CompletableFuture.completedFuture(Xor.<StorageError, UploadTarget>right(target));
                    if (!overwrite)
                        return CompletableFuture.completedFuture(Xor.<StorageError, UploadTarget>left(
                            StorageError.alreadyExists(String.format("File %s already exists", path), path)));

                    logger.info(String.format("Overwriting existing file in Google Drive: %s", path));
                    return deleteByIds(ids(target.existing), path).thenApply(deleted -> deleted.mapRight(ignored -> target));
                })
                .thenApplyAsync(xorTarget -> xorTarget.flatMapRight(target -> upload(target.parentId, fileName, content, path)), executor);
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, Void>> delete(String path) {
        return compose("delete", path, segments -> CompletableFuture
            .supplyAsync(() -> resolver.resolveAll(segments, DriveQuery.Kind.ANY, path), executor)
            .thenCompose(xorFiles -> xorFiles.isLeft() ?
                CompletableFuture.completedFuture(Xor.<StorageError, Void>left(xorFiles.getLeft())) :
                deleteByIds(ids(xorFiles.getRight()), path)));
    }

    @Override
    public CompletableFuture<Xor<StorageError, Boolean>> exists(String path) {
        return async("exists", path, segments -> resolver.resolveAll(segments, DriveQuery.Kind.ANY, path)
            .fold(error -> error.is(StorageErrorType.NOT_FOUND) ? Xor.right(false) : Xor.left(error),
                files -> Xor.right(true)));
    }

    /**
     * Lists the folder at {@code path}; the literal path {@value DrivePathResolver#ROOT_ID} lists the drive root.
     */
    @Override
    public CompletableFuture<Xor<StorageError, List<StorageItem>>> list(String path) {
        return async("list", path, segments -> {
            Xor<StorageError, String> xorFolderId = isRoot(segments) ?
                Xor.right(DrivePathResolver.ROOT_ID) :
                resolver.resolveFolder(segments, path);
            return xorFolderId.flatMapRight(folderId -> call(path, () -> gateway.listChildren(folderId))
                .mapRight(files -> files.stream()
                    .map(file -> toStorageItem(file, folderId))
                    .collect(Collectors.toList())));
        });
    }

    @Override
    public CompletableFuture<Xor<StorageError, InputStream>> read(String path) {
        return async("read", path, segments -> resolver.resolveAll(segments, DriveQuery.Kind.FILES, path)
            .flatMapRight(files -> call(path, () -> gateway.download(files.get(0).getId()))));
    }

    public static String toShareableLink(String fileId) {
        return String.format(SHAREABLE_LINK_FORMAT, fileId);
    }

    public static Optional<String> extractFileIdFromLink(String link) {
        if (link == null)
            return Optional.empty();
        Matcher matcher = SHAREABLE_LINK_PATTERN.matcher(link);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Xor<StorageError, String> upload(String parentId, String fileName, InputStream content, String path) {
        return call(path, () -> gateway.upload(parentId, fileName, content))
            .flatMapRight(uploadedFile -> call(path, () -> {
                gateway.shareWithAnyone(uploadedFile.getId(), shareRole);
                return toShareableLink(uploadedFile.getId());
            }))
            .peekRight(shareableLink -> logger.info(String.format("Successfully uploaded to Google Drive with shareable link: %s", shareableLink)));
    }

    private CompletableFuture<Xor<StorageError, Void>> deleteByIds(List<String> fileIds, String path) {
        if (fileIds.size() > deleteBatchThreshold)
            logger.debug(String.format("Deleting %d entries in batches of %d for path: %s", fileIds.size(), deleteBatchThreshold, path));
        return Batches.runInBatches(fileIds, deleteBatchThreshold, executor, fileId -> call(path, () -> {
            gateway.delete(fileId);
            return null;
        }));
    }

    private static boolean isRoot(List<String> segments) {
        return segments.size() == 1 && DrivePathResolver.ROOT_ID.equals(segments.get(0));
    }

    private static List<String> ids(List<File> files) {
        return files.stream().map(File::getId).collect(Collectors.toList());
    }

    private static StorageItem toStorageItem(File file, String parentId) {
        StorageItemType type = MimeTypes.FOLDER.equals(file.getMimeType()) ? StorageItemType.FOLDER : StorageItemType.FILE;
        return new GoogleStorageItem(file.getName(), type, file.getId(), parentId);
    }

    private static final class UploadTarget {
        private final String parentId;
        private final List<File> existing;

        private UploadTarget(String parentId, List<File> existing) {
            this.parentId = parentId;
            this.existing = existing == null ? Collections.emptyList() : existing;
        }
    }
}
