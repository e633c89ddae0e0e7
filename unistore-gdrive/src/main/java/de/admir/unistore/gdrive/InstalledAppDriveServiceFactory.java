package de.admir.unistore.gdrive;

import de.admir.unistore.core.StorageEndpointFactory;
import de.admir.unistore.core.error.AuthorizationError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.util.Xor;

import java.io.File;
import java.io.StringReader;
import java.util.Collections;
import java.util.List;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a Drive client acting on behalf of a user. The configuration is an OAuth client secrets JSON; the first run
 * opens the consent page and stores the refresh token in the data store directory, later runs reuse it.
 */
public class InstalledAppDriveServiceFactory implements StorageEndpointFactory<Drive> {
    private static final Logger logger = LoggerFactory.getLogger(InstalledAppDriveServiceFactory.class);

    private static final List<String> SCOPES = Collections.singletonList(DriveScopes.DRIVE);
    private static final String USER_ID = "user";

    private final String applicationName;
    private final File dataStoreDir;

    public InstalledAppDriveServiceFactory(String applicationName, File dataStoreDir) {
        this.applicationName = applicationName;
        this.dataStoreDir = dataStoreDir;
    }

    @Override
    public Xor<StorageError, Drive> createEndpoint(String clientSecretsJson) {
        if (StringUtils.isBlank(clientSecretsJson))
            return Xor.left(StorageError.invalidArgument("Client secrets cannot be null or empty", null));

        return DriveServiceFactory.createTransport().flatMapRight(transport -> authorize(transport, clientSecretsJson)
            .mapLeft(authError -> new StorageError("Error while creating authorized drive service", StorageErrorType.PERMISSION_DENIED, null)
                .addNestedError(authError))
            .mapRight(credential -> new Drive.Builder(transport, DriveServiceFactory.JSON_FACTORY, credential)
                .setApplicationName(applicationName)
                .build()));
    }

    private Xor<AuthorizationError, GoogleAuthorizationCodeFlow> createAuthorizationFlow(HttpTransport transport, String clientSecretsJson) {
        return Xor.catchNonFatal(() -> {
            GoogleClientSecrets clientSecrets = GoogleClientSecrets.load(DriveServiceFactory.JSON_FACTORY, new StringReader(clientSecretsJson));
            return new GoogleAuthorizationCodeFlow.Builder(transport, DriveServiceFactory.JSON_FACTORY, clientSecrets, SCOPES)
                .setDataStoreFactory(new FileDataStoreFactory(dataStoreDir))
                .setAccessType("offline")
                .build();
        }).mapLeft(AuthorizationError::new);
    }

    private Xor<AuthorizationError, Credential> authorize(HttpTransport transport, String clientSecretsJson) {
        logger.debug("Attempting to authorize");
        return createAuthorizationFlow(transport, clientSecretsJson)
            .flatMapRight(flow -> Xor.catchNonFatal(() -> new AuthorizationCodeInstalledApp(flow, new LocalServerReceiver()).authorize(USER_ID))
                .mapLeft(AuthorizationError::new))
            .peekRight(credential -> logger.debug("Credentials saved to " + dataStoreDir.getAbsolutePath()));
    }
}
