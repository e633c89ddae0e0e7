package de.admir.unistore.localdisk;

import de.admir.unistore.core.AbstractStorageProvider;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.util.Xor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Path-addressed backend on the local filesystem. Logical paths are native paths, optionally confined to a root
 * directory.
 */
public class LocalDiskStorageProvider extends AbstractStorageProvider {
    private static final Logger logger = LoggerFactory.getLogger(LocalDiskStorageProvider.class);

    private final Path root;

    /**
     * Paths are used as given, relative ones resolving against the working directory.
     */
    public LocalDiskStorageProvider() {
        this(null, ForkJoinPool.commonPool());
    }

    public LocalDiskStorageProvider(Path root) {
        this(root, ForkJoinPool.commonPool());
    }

    public LocalDiskStorageProvider(Path root, Executor executor) {
        super(executor);
        this.root = root == null ? null : root.toAbsolutePath().normalize();
    }

    public Optional<Path> getRoot() {
        return Optional.ofNullable(root);
    }

    @Override
    protected Logger logger() {
        return logger;
    }

    @Override
    public CompletableFuture<Xor<StorageError, String>> add(String path, InputStream content, boolean overwrite) {
        return async("add", path, segments -> resolve(path).flatMapRight(target -> {
            if (Files.isDirectory(target))
                return Xor.left(StorageError.alreadyExists("A directory already exists at path: " + path, path));
            if (!overwrite && Files.exists(target))
                return Xor.left(StorageError.alreadyExists(String.format("File %s already exists", path), path));

            return call(path, () -> {
                Path directory = target.getParent();
                if (directory != null && !Files.isDirectory(directory)) {
                    Files.createDirectories(directory);
                    logger.info(String.format("Created directory: %s", directory));
                }
                if (overwrite) {
                    Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.copy(content, target);
                }
                logger.info(String.format("Successfully wrote to: %s", path));
                return path;
            });
        }));
    }

    @Override
    public CompletableFuture<Xor<StorageError, Void>> delete(String path) {
        return async("delete", path, segments -> resolve(path).flatMapRight(target -> {
            if (Files.isRegularFile(target)) {
                return call(path, () -> {
                    Files.delete(target);
                    return null;
                });
            } else if (Files.isDirectory(target)) {
                return call(path, () -> {
                    deleteRecursively(target);
                    return null;
                });
            }
            return Xor.left(StorageError.notFound("No file or directory found with the specified path: " + path, path));
        }));
    }

    @Override
    public CompletableFuture<Xor<StorageError, Boolean>> exists(String path) {
        return async("exists", path, segments -> resolve(path).mapRight(Files::isRegularFile));
    }

    @Override
    public CompletableFuture<Xor<StorageError, List<StorageItem>>> list(String path) {
        return async("list", path, segments -> resolve(path).flatMapRight(directory -> {
            if (!Files.isDirectory(directory))
                return Xor.left(StorageError.notFound("Directory not found: " + path, path));

            return call(path, () -> {
                List<StorageItem> directories = new ArrayList<>();
                List<StorageItem> files = new ArrayList<>();
                try (Stream<Path> children = Files.list(directory)) {
                    children.sorted(Comparator.comparing(Path::getFileName)).forEach(child -> {
                        String name = child.getFileName().toString();
                        if (Files.isDirectory(child)) {
                            directories.add(StorageItem.folder(name));
                        } else {
                            files.add(StorageItem.file(name));
                        }
                    });
                }
                List<StorageItem> items = new ArrayList<>(directories);
                items.addAll(files);
                return items;
            });
        }));
    }

    @Override
    public CompletableFuture<Xor<StorageError, InputStream>> read(String path) {
        return async("read", path, segments -> resolve(path).flatMapRight(file -> {
            if (!Files.isRegularFile(file))
                return Xor.left(StorageError.notFound("File not found: " + path, path));
            return call(path, () -> Files.newInputStream(file));
        }));
    }

    private Xor<StorageError, Path> resolve(String path) {
        Path resolved;
        try {
            resolved = root == null ? Paths.get(path) : root.resolve(stripLeadingSeparators(path)).normalize();
        } catch (InvalidPathException e) {
            return Xor.left(StorageError.invalidArgument("Invalid path: " + e.getMessage(), path));
        }
        if (root != null && !resolved.startsWith(root))
            return Xor.left(StorageError.invalidArgument("Path escapes the storage root: " + path, path));
        if (root != null ? resolved.equals(root) : resolved.normalize().toString().isEmpty())
            return Xor.left(StorageError.invalidArgument("Path must name an entry below the storage root: " + path, path));
        return Xor.right(resolved);
    }

    private static String stripLeadingSeparators(String path) {
        String stripped = path;
        while (stripped.startsWith("/") || stripped.startsWith("\\"))
            stripped = stripped.substring(1);
        return stripped;
    }

    private static void deleteRecursively(Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null)
                    throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
