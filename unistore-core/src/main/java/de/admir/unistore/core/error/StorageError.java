package de.admir.unistore.core.error;

import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import lombok.ToString;


/**
 * The single failure type surfaced by storage providers. Exactly one {@link StorageErrorType} per error, the originating
 * logical path, and optionally the nested vendor errors that led to it.
 */
@ToString(callSuper = true)
public class StorageError extends BaseError<StorageError> {
    private final StorageErrorType type;
    private final String path;

    public StorageError(String message, StorageErrorType type, String path) {
        super(message);
        this.type = type;
        this.path = path;
    }

    public StorageError(String message, Throwable cause, StorageErrorType type, String path) {
        super(message, cause);
        this.type = type;
        this.path = path;
    }

    public StorageErrorType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    public boolean is(StorageErrorType expected) {
        return type == expected;
    }

    public static StorageError invalidArgument(String message, String path) {
        return new StorageError(message, StorageErrorType.INVALID_ARGUMENT, path);
    }

    public static StorageError notFound(String message, String path) {
        return new StorageError(message, StorageErrorType.NOT_FOUND, path);
    }

    public static StorageError alreadyExists(String message, String path) {
        return new StorageError(message, StorageErrorType.ALREADY_EXISTS, path);
    }

    /**
     * Maps JDK failures onto the taxonomy. Anything without a more specific meaning is treated as the backend being
     * unavailable.
     */
    public static StorageError fromThrowable(Throwable e, String path) {
        Throwable unwrapped = unwrap(e);
        StorageErrorType type;
        if (unwrapped instanceof NoSuchFileException || unwrapped instanceof NotDirectoryException) {
            type = StorageErrorType.NOT_FOUND;
        } else if (unwrapped instanceof FileAlreadyExistsException || unwrapped instanceof DirectoryNotEmptyException) {
            type = StorageErrorType.ALREADY_EXISTS;
        } else if (unwrapped instanceof AccessDeniedException || unwrapped instanceof SecurityException) {
            type = StorageErrorType.PERMISSION_DENIED;
        } else if (unwrapped instanceof IllegalArgumentException) {
            type = StorageErrorType.INVALID_ARGUMENT;
        } else {
            type = StorageErrorType.BACKEND_UNAVAILABLE;
        }
        return new StorageError(String.format("%s failed for path: %s", unwrapped.getClass().getSimpleName(), path), unwrapped, type, path)
            .addNestedError(new IOError(unwrapped));
    }

    public static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null)
            current = current.getCause();
        return current;
    }
}
