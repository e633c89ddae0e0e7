package de.admir.unistore.azureblob;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.util.Xor;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.HttpResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AzureBlobStorageProvider")
class AzureBlobStorageProviderTest {

    private ExecutorService executor;
    private InMemoryBlobGateway gateway;
    private AzureBlobStorageProvider provider;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(64);
        gateway = new InMemoryBlobGateway();
        provider = new AzureBlobStorageProvider(gateway, executor, 50);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static InputStream content(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private String readAll(String path) throws IOException {
        try (InputStream stream = provider.read(path).join().getRight()) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        @DisplayName("should create the container and return the blob URL")
        void createsContainer() {
            Xor<StorageError, String> result = provider.add("Photos/2023/beach.png", content("png"), false).join();

            assertThat(result.getRight()).isEqualTo(InMemoryBlobGateway.ACCOUNT_URL + "/photos/2023/beach.png");
            assertThat(gateway.hasBlob("photos", "2023/beach.png")).isTrue();
        }

        @Test
        @DisplayName("should refuse an existing blob without overwrite")
        void refusesWithoutOverwrite() throws IOException {
            gateway.put("docs", "a.txt", "first");

            Xor<StorageError, String> result = provider.add("docs/a.txt", content("second"), false).join();

            assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.ALREADY_EXISTS);
            assertThat(readAll("docs/a.txt")).isEqualTo("first");
        }

        @Test
        @DisplayName("should replace content with overwrite")
        void overwritesContent() throws IOException {
            gateway.put("docs", "a.txt", "first version");

            assertThat(provider.add("docs/a.txt", content("v2"), true).join().isRight()).isTrue();
            assertThat(readAll("docs/a.txt")).isEqualTo("v2");
        }

        @Test
        @DisplayName("should reject a path naming only a container")
        void rejectsContainerOnly() {
            assertThat(provider.add("docs", content("x"), false).join().getLeft().getType()).isEqualTo(StorageErrorType.INVALID_ARGUMENT);
        }
    }

    @Nested
    @DisplayName("exists")
    class Exists {

        @Test
        @DisplayName("should be false when the container is missing")
        void missingContainer() {
            Xor<StorageError, Boolean> result = provider.exists("nowhere/a.txt").join();

            assertThat(result.isRight()).isTrue();
            assertThat(result.getRight()).isFalse();
        }

        @Test
        @DisplayName("should check the blob inside an existing container")
        void checksBlob() {
            gateway.put("docs", "a.txt", "x");

            assertThat(provider.exists("docs/a.txt").join().getRight()).isTrue();
            assertThat(provider.exists("docs/b.txt").join().getRight()).isFalse();
            assertThat(provider.exists("docs").join().getRight()).isTrue();
        }
    }

    @Nested
    @DisplayName("list")
    class ListChildren {

        @Test
        @DisplayName("should synthesize folders from prefixes")
        void listsContainer() {
            gateway.put("docs", "a.txt", "x");
            gateway.put("docs", "reports/q1.pdf", "x");
            gateway.put("docs", "reports/2023/q2.pdf", "x");

            assertThat(provider.list("docs").join().getRight())
                .containsExactlyInAnyOrder(StorageItem.folder("reports"), StorageItem.file("a.txt"));
        }

        @Test
        @DisplayName("should name items relative to the listed folder")
        void listsVirtualFolder() {
            gateway.put("docs", "reports/q1.pdf", "x");
            gateway.put("docs", "reports/2023/q2.pdf", "x");

            List<StorageItem> items = provider.list("docs/reports").join().getRight();

            assertThat(items).containsExactlyInAnyOrder(StorageItem.folder("2023"), StorageItem.file("q1.pdf"));
        }

        @Test
        @DisplayName("should report a missing container as not found")
        void missingContainer() {
            assertThat(provider.list("nowhere").join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("should report a missing blob as not found")
        void missingBlob() {
            gateway.put("docs", "a.txt", "x");

            assertThat(provider.read("docs/b.txt").join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
            assertThat(provider.read("nowhere/b.txt").join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        }

        @Test
        @DisplayName("should copy blob content into a destination stream")
        void copiesIntoStream() {
            gateway.put("docs", "a.txt", "blob content");
            ByteArrayOutputStream destination = new ByteArrayOutputStream();

            Xor<StorageError, Long> result = provider.read("docs/a.txt", destination).join();

            assertThat(result.getRight()).isEqualTo(12L);
            assertThat(destination.toString(StandardCharsets.UTF_8)).isEqualTo("blob content");
        }

        @Test
        @DisplayName("should leave the destination untouched for a missing blob")
        void missingBlobIntoStream() {
            ByteArrayOutputStream destination = new ByteArrayOutputStream();

            assertThat(provider.read("docs/b.txt", destination).join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
            assertThat(destination.size()).isZero();
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("should delete a single blob")
        void deletesBlob() {
            gateway.put("docs", "a.txt", "x");
            gateway.put("docs", "b.txt", "x");

            assertThat(provider.delete("docs/a.txt").join().isRight()).isTrue();
            assertThat(gateway.hasBlob("docs", "a.txt")).isFalse();
            assertThat(gateway.hasBlob("docs", "b.txt")).isTrue();
        }

        @Test
        @DisplayName("should delete a virtual folder in batches")
        void deletesVirtualFolderInBatches() {
            for (int i = 0; i < 120; i++)
                gateway.put("docs", "bulk/file-" + i + ".txt", "x");
            gateway.put("docs", "keep.txt", "x");

            Xor<StorageError, Void> result = provider.delete("docs/bulk").join();

            assertThat(result.isRight()).isTrue();
            assertThat(gateway.getDeleteCount()).isEqualTo(120);
            assertThat(gateway.getMaxDeletesInFlight()).isLessThanOrEqualTo(50);
            assertThat(gateway.blobCount("docs")).isEqualTo(1);
        }

        @Test
        @DisplayName("should delete the container for a container-only path")
        void deletesContainer() {
            gateway.put("docs", "a.txt", "x");

            assertThat(provider.delete("docs").join().isRight()).isTrue();
            assertThat(gateway.containerExists("docs")).isFalse();
        }

        @Test
        @DisplayName("should report nothing to delete as not found")
        void missingEntry() {
            gateway.put("docs", "a.txt", "x");

            assertThat(provider.delete("docs/missing").join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
            assertThat(provider.delete("nowhere").join().getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        }

        @Test
        @DisplayName("should propagate a failing deletion and skip later batches")
        void propagatesFailure() {
            for (int i = 0; i < 120; i++)
                gateway.put("docs", String.format("bulk/file-%03d.txt", i), "x");
            gateway.failDeletionOf("bulk/file-010.txt");

            Xor<StorageError, Void> result = provider.delete("docs/bulk").join();

            assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.BACKEND_UNAVAILABLE);
            assertThat(gateway.getDeleteCount()).isEqualTo(49);
        }
    }

    @Test
    @DisplayName("should map HTTP failures of the blob service")
    void mapsHttpFailures() {
        HttpResponse response = mock(HttpResponse.class);
        when(response.getStatusCode()).thenReturn(403);
        BlobGateway failingGateway = mock(BlobGateway.class);
        when(failingGateway.containerExists("docs")).thenThrow(new HttpResponseException("Forbidden", response));

        AzureBlobStorageProvider failingProvider = new AzureBlobStorageProvider(failingGateway, executor, 50);

        assertThat(failingProvider.list("docs/a").join().getLeft().getType()).isEqualTo(StorageErrorType.PERMISSION_DENIED);
    }

    @Test
    @DisplayName("should reject empty paths before calling the service")
    void rejectsEmptyPaths() {
        assertThat(provider.exists("/").join().getLeft().getType()).isEqualTo(StorageErrorType.INVALID_ARGUMENT);
        assertThat(provider.delete(null).join().getLeft().getType()).isEqualTo(StorageErrorType.INVALID_ARGUMENT);
    }
}
