package de.admir.unistore.azureblob;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BlobPath")
class BlobPathTest {

    @Test
    @DisplayName("should lower-case the container and join the rest into the blob name")
    void splitsContainerAndBlob() {
        BlobPath blobPath = BlobPath.of(List.of("Photos", "2023", "Beach.PNG"));

        assertThat(blobPath.getContainerName()).isEqualTo("photos");
        assertThat(blobPath.getBlobName()).isEqualTo("2023/Beach.PNG");
        assertThat(blobPath.isContainerOnly()).isFalse();
        assertThat(blobPath.childPrefix()).isEqualTo("2023/Beach.PNG/");
    }

    @Test
    @DisplayName("should treat a single segment as the container")
    void containerOnly() {
        BlobPath blobPath = BlobPath.of(List.of("photos"));

        assertThat(blobPath.isContainerOnly()).isTrue();
        assertThat(blobPath.getBlobName()).isEmpty();
        assertThat(blobPath.childPrefix()).isNull();
    }
}
