package de.admir.unistore.azureblob;

import de.admir.unistore.core.StorageEndpointFactory;
import de.admir.unistore.core.error.IOError;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.util.Xor;

import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;

import org.apache.commons.lang3.StringUtils;

public class BlobServiceClientFactory implements StorageEndpointFactory<BlobServiceClient> {

    @Override
    public Xor<StorageError, BlobServiceClient> createEndpoint(String connectionString) {
        if (StringUtils.isBlank(connectionString))
            return Xor.left(StorageError.invalidArgument("Connection string cannot be null or empty", null));

        return Xor.catchNonFatal(() -> new BlobServiceClientBuilder().connectionString(connectionString).buildClient())
            .mapLeft(e -> new StorageError("Unable to initialize blob service client", e,
                e instanceof IllegalArgumentException ? StorageErrorType.INVALID_ARGUMENT : StorageErrorType.BACKEND_UNAVAILABLE, null)
                .addNestedError(new IOError(e)));
    }
}
