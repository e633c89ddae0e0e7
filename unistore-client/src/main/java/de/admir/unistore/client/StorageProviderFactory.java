package de.admir.unistore.client;

import de.admir.unistore.azureblob.AzureBlobGateway;
import de.admir.unistore.azureblob.AzureBlobStorageProvider;
import de.admir.unistore.azureblob.BlobServiceClientFactory;
import de.admir.unistore.core.StorageEndpointFactory;
import de.admir.unistore.core.StorageProvider;
import de.admir.unistore.core.config.CoreConfig;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.secret.SecretProvider;
import de.admir.unistore.core.util.Xor;
import de.admir.unistore.gdrive.DriveServiceFactory;
import de.admir.unistore.gdrive.GoogleDriveGateway;
import de.admir.unistore.gdrive.GoogleDriveStorageProvider;
import de.admir.unistore.gdrive.InstalledAppDriveServiceFactory;
import de.admir.unistore.gdrive.constants.Role;
import de.admir.unistore.localdisk.LocalDiskStorageProvider;

import java.io.File;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import com.google.api.services.drive.Drive;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the provider selected by {@code unistore.backend}. The backend's secret is fetched and its endpoint created
 * exactly once per call to {@link #create()}.
 */
public class StorageProviderFactory {
    private static final Logger logger = LoggerFactory.getLogger(StorageProviderFactory.class);

    public static final String LOCAL_DISK = "localdisk";
    public static final String AZURE_BLOB = "azureblob";
    public static final String GOOGLE_DRIVE = "gdrive";

    private static final String SERVICE_ACCOUNT_AUTH = "service-account";
    private static final String INSTALLED_APP_AUTH = "installed-app";

    private final Config config;
    private final SecretProvider secretProvider;
    private final Executor executor;

    public StorageProviderFactory(Config config, SecretProvider secretProvider) {
        this(config, secretProvider, ForkJoinPool.commonPool());
    }

    public StorageProviderFactory(Config config, SecretProvider secretProvider, Executor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.secretProvider = Objects.requireNonNull(secretProvider, "secretProvider");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Xor<StorageError, StorageProvider> create() {
        try {
            String backend = CoreConfig.getBackend(config).trim().toLowerCase(Locale.ROOT);
            logger.info(String.format("Creating storage provider for backend: %s", backend));
            switch (backend) {
                case LOCAL_DISK:
                    return Xor.right(createLocalDisk());
                case AZURE_BLOB:
                    return createAzureBlob();
                case GOOGLE_DRIVE:
                    return createGoogleDrive();
                default:
                    return Xor.left(StorageError.invalidArgument("Unknown storage backend: " + backend, null));
            }
        } catch (ConfigException | IllegalArgumentException e) {
            logger.error("Invalid storage configuration", e);
            return Xor.left(StorageError.invalidArgument("Invalid storage configuration: " + e.getMessage(), null));
        }
    }

    private StorageProvider createLocalDisk() {
        String root = config.getString("unistore.localdisk.root");
        return new LocalDiskStorageProvider(StringUtils.isBlank(root) ? null : Paths.get(root), executor);
    }

    private Xor<StorageError, StorageProvider> createAzureBlob() {
        int deleteBatchThreshold = CoreConfig.getDeleteBatchThreshold(config);
        return secretProvider.getSecret(config.getString("unistore.azureblob.connection-string-secret"))
            .flatMapRight(new BlobServiceClientFactory()::createEndpoint)
            .mapRight(endpoint -> new AzureBlobStorageProvider(new AzureBlobGateway(endpoint), executor, deleteBatchThreshold));
    }

    private Xor<StorageError, StorageProvider> createGoogleDrive() {
        Config driveConfig = config.getConfig("unistore.gdrive");
        String applicationName = driveConfig.getString("application-name");
        int deleteBatchThreshold = driveConfig.getInt("delete-batch-threshold");
        Role shareRole = Role.fromApiValue(driveConfig.getString("share-role"));

        StorageEndpointFactory<Drive> endpointFactory;
        String auth = driveConfig.getString("auth");
        if (SERVICE_ACCOUNT_AUTH.equals(auth)) {
            endpointFactory = new DriveServiceFactory(applicationName);
        } else if (INSTALLED_APP_AUTH.equals(auth)) {
            endpointFactory = new InstalledAppDriveServiceFactory(applicationName, new File(driveConfig.getString("data-store-dir")));
        } else {
            return Xor.left(StorageError.invalidArgument("Unknown Google Drive auth mode: " + auth, null));
        }

        return secretProvider.getSecret(driveConfig.getString("credentials-secret"))
            .flatMapRight(endpointFactory::createEndpoint)
            .mapRight(drive -> new GoogleDriveStorageProvider(new GoogleDriveGateway(drive), executor, deleteBatchThreshold, shareRole));
    }
}
