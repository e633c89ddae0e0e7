package de.admir.unistore.azureblob;

import de.admir.unistore.core.util.PathUtils;

import java.util.List;
import java.util.Locale;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A logical path split the object store way: the first segment names the container, the remaining segments joined
 * with {@code /} form the blob name. Container names are lower-cased since the service only accepts lower case.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BlobPath {
    private final String containerName;
    private final String blobName;

    private BlobPath(String containerName, String blobName) {
        this.containerName = containerName;
        this.blobName = blobName;
    }

    /**
     * @param segments the already validated, non-empty segments of a logical path
     */
    public static BlobPath of(List<String> segments) {
        String containerName = segments.get(0).toLowerCase(Locale.ROOT);
        String blobName = PathUtils.join(segments.subList(1, segments.size()));
        return new BlobPath(containerName, blobName);
    }

    public boolean isContainerOnly() {
        return blobName.isEmpty();
    }

    /**
     * The prefix selecting everything below this path inside its container, {@code null} for the container itself.
     */
    public String childPrefix() {
        return isContainerOnly() ? null : blobName + PathUtils.SEPARATOR;
    }
}
