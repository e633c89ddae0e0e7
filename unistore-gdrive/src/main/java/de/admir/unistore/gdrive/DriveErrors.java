package de.admir.unistore.gdrive;

import de.admir.unistore.core.error.AuthorizationError;
import de.admir.unistore.core.error.IOError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;

import java.util.Set;

import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;

/**
 * Maps Drive client failures onto the storage error taxonomy.
 */
public final class DriveErrors {
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded", "dailyLimitExceeded", "quotaExceeded");

    private DriveErrors() {
    }

    public static StorageError map(Throwable e, String path) {
        Throwable unwrapped = StorageError.unwrap(e);

        if (unwrapped instanceof TokenResponseException) {
            return new StorageError("Error while authorizing against Google Drive", unwrapped, StorageErrorType.PERMISSION_DENIED, path)
                .addNestedError(new AuthorizationError(unwrapped));
        }

        if (unwrapped instanceof HttpResponseException) {
            int status = ((HttpResponseException) unwrapped).getStatusCode();
            StorageErrorType type = status == 403 && isRateLimited(unwrapped) ?
                StorageErrorType.BACKEND_UNAVAILABLE :
                StorageErrorType.fromHttpStatus(status);
            return new StorageError(String.format("Google Drive responded with status %d for path: %s", status, path), unwrapped, type, path)
                .addNestedError(new IOError(unwrapped));
        }

        return StorageError.fromThrowable(unwrapped, path);
    }

    private static boolean isRateLimited(Throwable e) {
        if (!(e instanceof GoogleJsonResponseException))
            return false;
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null)
            return false;
        return details.getErrors().stream().anyMatch(errorInfo -> RATE_LIMIT_REASONS.contains(errorInfo.getReason()));
    }
}
