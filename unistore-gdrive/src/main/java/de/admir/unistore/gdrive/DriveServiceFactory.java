package de.admir.unistore.gdrive;

import de.admir.unistore.core.StorageEndpointFactory;
import de.admir.unistore.core.error.AuthorizationError;
import de.admir.unistore.core.error.IOError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.util.Xor;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a Drive client from a service account key (the JSON document downloaded from the cloud console), limited to
 * files the application created.
 */
public class DriveServiceFactory implements StorageEndpointFactory<Drive> {
    private static final Logger logger = LoggerFactory.getLogger(DriveServiceFactory.class);

    static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

    private static final List<String> SCOPES = Collections.singletonList(DriveScopes.DRIVE_FILE);

    private final String applicationName;

    public DriveServiceFactory(String applicationName) {
        this.applicationName = applicationName;
    }

    @Override
    public Xor<StorageError, Drive> createEndpoint(String serviceAccountJson) {
        if (StringUtils.isBlank(serviceAccountJson))
            return Xor.left(StorageError.invalidArgument("Service account credentials cannot be null or empty", null));

        Xor<StorageError, GoogleCredentials> xorCredentials = Xor.catchNonFatal(() -> {
            try (InputStream stream = new ByteArrayInputStream(serviceAccountJson.getBytes(StandardCharsets.UTF_8))) {
                return GoogleCredentials.fromStream(stream).createScoped(SCOPES);
            }
        }).mapLeft(e -> new StorageError("Error while reading service account credentials", e, StorageErrorType.PERMISSION_DENIED, null)
            .addNestedError(new AuthorizationError(e)));

        return xorCredentials.flatMapRight(credentials -> createTransport().mapRight(transport -> {
            logger.debug(String.format("Creating Google Drive service for application: %s", applicationName));
            return new Drive.Builder(transport, JSON_FACTORY, new HttpCredentialsAdapter(credentials))
                .setApplicationName(applicationName)
                .build();
        }));
    }

    static Xor<StorageError, HttpTransport> createTransport() {
        return Xor.<HttpTransport>catchNonFatal(GoogleNetHttpTransport::newTrustedTransport)
            .mapLeft(e -> new StorageError("Could not instantiate HTTP transport", e, StorageErrorType.BACKEND_UNAVAILABLE, null)
                .addNestedError(new IOError(e)));
    }
}
