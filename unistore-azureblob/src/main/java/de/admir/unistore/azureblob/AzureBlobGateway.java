package de.admir.unistore.azureblob;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.ListBlobsOptions;

public class AzureBlobGateway implements BlobGateway {
    private static final String DELIMITER = "/";

    private final BlobServiceClient endpoint;

    public AzureBlobGateway(BlobServiceClient endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    @Override
    public boolean containerExists(String containerName) {
        return container(containerName).exists();
    }

    @Override
    public boolean createContainerIfNotExists(String containerName) {
        return container(containerName).createIfNotExists();
    }

    @Override
    public void deleteContainer(String containerName) {
        container(containerName).delete();
    }

    @Override
    public boolean blobExists(String containerName, String blobName) {
        return blob(containerName, blobName).exists();
    }

    @Override
    public String upload(String containerName, String blobName, InputStream content, boolean overwrite) {
        BlobClient blobClient = blob(containerName, blobName);
        blobClient.upload(content, overwrite);
        return blobClient.getBlobUrl();
    }

    @Override
    public void deleteBlob(String containerName, String blobName) {
        blob(containerName, blobName).delete();
    }

    @Override
    public InputStream openBlob(String containerName, String blobName) {
        return blob(containerName, blobName).openInputStream();
    }

    @Override
    public List<BlobItem> listByHierarchy(String containerName, String prefix) {
        List<BlobItem> items = new ArrayList<>();
        container(containerName)
            .listBlobsByHierarchy(DELIMITER, new ListBlobsOptions().setPrefix(prefix), null)
            .forEach(items::add);
        return items;
    }

    @Override
    public List<BlobItem> listFlat(String containerName, String prefix) {
        List<BlobItem> items = new ArrayList<>();
        container(containerName)
            .listBlobs(new ListBlobsOptions().setPrefix(prefix), null)
            .forEach(items::add);
        return items;
    }

    private BlobContainerClient container(String containerName) {
        return endpoint.getBlobContainerClient(containerName);
    }

    private BlobClient blob(String containerName, String blobName) {
        return container(containerName).getBlobClient(blobName);
    }
}
