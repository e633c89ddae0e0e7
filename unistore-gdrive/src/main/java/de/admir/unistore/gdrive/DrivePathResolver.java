package de.admir.unistore.gdrive;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.util.PathUtils;
import de.admir.unistore.core.util.Xor;

import java.util.List;
import java.util.Objects;

import com.google.api.services.drive.model.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves logical paths to Drive IDs by walking from the root one segment at a time, querying the children of the
 * current folder by name.
 * <p>
 * Drive allows several entries with the same name under one parent. Folder walks adopt the first match, terminal
 * lookups return every match so that all of them can be deleted.
 */
public class DrivePathResolver {
    private static final Logger logger = LoggerFactory.getLogger(DrivePathResolver.class);

    public static final String ROOT_ID = "root";

    private final DriveGateway gateway;

    public DrivePathResolver(DriveGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    /**
     * Walks existing folders only. The first missing segment yields {@code NOT_FOUND} naming that segment.
     */
    public Xor<StorageError, String> resolveFolder(List<String> folderSegments, String path) {
        String currentId = ROOT_ID;
        for (String segment : folderSegments) {
            Xor<StorageError, List<File>> xorFolders = findChildren(currentId, segment, DriveQuery.Kind.FOLDERS, path);
            if (xorFolders.isLeft())
                return Xor.left(xorFolders.getLeft());
            if (xorFolders.getRight().isEmpty())
                return Xor.left(segmentNotFound(segment, path));
            currentId = xorFolders.getRight().get(0).getId();
        }
        return Xor.right(currentId);
    }

    /**
     * Walks the folders, creating every missing one under the current folder.
     */
    public Xor<StorageError, String> ensureFolder(List<String> folderSegments, String path) {
        String currentId = ROOT_ID;
        for (String segment : folderSegments) {
            Xor<StorageError, List<File>> xorFolders = findChildren(currentId, segment, DriveQuery.Kind.FOLDERS, path);
            if (xorFolders.isLeft())
                return Xor.left(xorFolders.getLeft());

            if (xorFolders.getRight().isEmpty()) {
                final String parentId = currentId;
                Xor<StorageError, File> xorCreatedFolder = Xor.catchNonFatal(() -> gateway.createFolder(parentId, segment))
                    .mapLeft(e -> DriveErrors.map(e, path));
                if (xorCreatedFolder.isLeft())
                    return Xor.left(xorCreatedFolder.getLeft());
                logger.info(String.format("Created folder '%s' under %s", segment, parentId));
                currentId = xorCreatedFolder.getRight().getId();
            } else {
                currentId = xorFolders.getRight().get(0).getId();
            }
        }
        return Xor.right(currentId);
    }

    /**
     * Resolves the parent folders, then returns every entry of {@code terminalKind} named like the last segment.
     * Never returns an empty list, an absent entry is {@code NOT_FOUND}.
     */
    public Xor<StorageError, List<File>> resolveAll(List<String> segments, DriveQuery.Kind terminalKind, String path) {
        String name = PathUtils.lastSegment(segments);
        return resolveFolder(PathUtils.parentSegments(segments), path)
            .flatMapRight(parentId -> findChildren(parentId, name, terminalKind, path))
            .flatMapRight(files -> files.isEmpty() ? Xor.left(segmentNotFound(name, path)) : Xor.right(files));
    }

    private Xor<StorageError, List<File>> findChildren(String parentId, String name, DriveQuery.Kind kind, String path) {
        return Xor.catchNonFatal(() -> gateway.findChildren(parentId, name, kind)).mapLeft(e -> DriveErrors.map(e, path));
    }

    private static StorageError segmentNotFound(String segment, String path) {
        return StorageError.notFound(String.format("Path segment '%s' not found in Google Drive", segment), path);
    }
}
