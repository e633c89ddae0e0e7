package de.admir.unistore.azureblob;

import java.io.InputStream;
import java.util.List;

import com.azure.storage.blob.models.BlobItem;

/**
 * The blob service calls the provider needs. Implementations may throw the vendor's unchecked exceptions, the provider
 * maps them.
 */
public interface BlobGateway {

    boolean containerExists(String containerName);

    /**
     * @return true if the container was created by this call
     */
    boolean createContainerIfNotExists(String containerName);

    void deleteContainer(String containerName);

    boolean blobExists(String containerName, String blobName);

    /**
     * @return the URL of the written blob
     */
    String upload(String containerName, String blobName, InputStream content, boolean overwrite);

    void deleteBlob(String containerName, String blobName);

    InputStream openBlob(String containerName, String blobName);

    /**
     * Lists one level below {@code prefix} using {@code /} as delimiter. Virtual directories come back as prefix items.
     */
    List<BlobItem> listByHierarchy(String containerName, String prefix);

    /**
     * Lists every blob below {@code prefix}, at any depth.
     */
    List<BlobItem> listFlat(String containerName, String prefix);
}
