package de.admir.unistore.gdrive;

import de.admir.unistore.core.error.IOError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DriveErrors")
class DriveErrorsTest {

    private static HttpResponseException.Builder response(int status, String message) {
        return new HttpResponseException.Builder(status, message, new HttpHeaders());
    }

    @Test
    @DisplayName("should map HTTP statuses of the Drive API")
    void mapsStatuses() {
        assertThat(DriveErrors.map(response(404, "Not Found").build(), "a").getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        assertThat(DriveErrors.map(response(409, "Conflict").build(), "a").getType()).isEqualTo(StorageErrorType.ALREADY_EXISTS);
        assertThat(DriveErrors.map(response(401, "Unauthorized").build(), "a").getType()).isEqualTo(StorageErrorType.PERMISSION_DENIED);
        assertThat(DriveErrors.map(response(403, "Forbidden").build(), "a").getType()).isEqualTo(StorageErrorType.PERMISSION_DENIED);
        assertThat(DriveErrors.map(response(503, "Unavailable").build(), "a").getType()).isEqualTo(StorageErrorType.BACKEND_UNAVAILABLE);
    }

    @Test
    @DisplayName("should treat rate limiting as the backend being unavailable")
    void mapsRateLimit() {
        GoogleJsonError.ErrorInfo errorInfo = new GoogleJsonError.ErrorInfo();
        errorInfo.setReason("userRateLimitExceeded");
        GoogleJsonError details = new GoogleJsonError();
        details.setCode(403);
        details.setErrors(Collections.singletonList(errorInfo));

        StorageError error = DriveErrors.map(new GoogleJsonResponseException(response(403, "Forbidden"), details), "a/b");

        assertThat(error.getType()).isEqualTo(StorageErrorType.BACKEND_UNAVAILABLE);
        assertThat(error.getPath()).isEqualTo("a/b");
    }

    @Test
    @DisplayName("should unwrap async failures and nest the vendor error")
    void unwrapsAndNests() {
        StorageError error = DriveErrors.map(new CompletionException(response(404, "Not Found").build()), "a");

        assertThat(error.getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        assertThat(error.getNestedErrors()).hasSize(1).first().isInstanceOf(IOError.class);
    }

    @Test
    @DisplayName("should treat plain IO failures as the backend being unavailable")
    void mapsIoFailure() {
        assertThat(DriveErrors.map(new IOException("connection reset"), "a").getType()).isEqualTo(StorageErrorType.BACKEND_UNAVAILABLE);
    }
}
