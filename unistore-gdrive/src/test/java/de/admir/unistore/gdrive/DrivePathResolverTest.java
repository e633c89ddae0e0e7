package de.admir.unistore.gdrive;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.util.Xor;

import com.google.api.services.drive.model.File;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DrivePathResolver")
class DrivePathResolverTest {

    private InMemoryDriveGateway gateway;
    private DrivePathResolver resolver;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryDriveGateway();
        resolver = new DrivePathResolver(gateway);
    }

    @Test
    @DisplayName("should create missing folders once and reuse them afterwards")
    void createsAndReusesFolders() {
        String first = resolver.ensureFolder(List.of("a", "b"), "a/b/c.txt").getRight();
        String second = resolver.ensureFolder(List.of("a", "b"), "a/b/d.txt").getRight();

        assertThat(second).isEqualTo(first);
        assertThat(gateway.getCreatedFolders()).isEqualTo(2);
        assertThat(gateway.childrenNamed(DrivePathResolver.ROOT_ID, "a")).hasSize(1);
    }

    @Test
    @DisplayName("should resolve the empty folder list to the root")
    void resolvesRoot() {
        assertThat(resolver.resolveFolder(List.of(), "c.txt").getRight()).isEqualTo(DrivePathResolver.ROOT_ID);
    }

    @Test
    @DisplayName("should name the missing segment")
    void namesMissingSegment() {
        gateway.putFolder(DrivePathResolver.ROOT_ID, "a");

        Xor<StorageError, String> result = resolver.resolveFolder(List.of("a", "b", "c"), "a/b/c");

        assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        assertThat(result.getLeft().getMessage()).contains("'b'");
        assertThat(result.getLeft().getPath()).isEqualTo("a/b/c");
    }

    @Test
    @DisplayName("should not walk through files")
    void skipsFilesWhenWalking() {
        gateway.putFile(DrivePathResolver.ROOT_ID, "a", "not a folder");

        assertThat(resolver.resolveFolder(List.of("a"), "a").getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
    }

    @Test
    @DisplayName("should adopt the first of several folders with the same name")
    void adoptsFirstDuplicateFolder() {
        String firstId = gateway.putFolder(DrivePathResolver.ROOT_ID, "a");
        gateway.putFolder(DrivePathResolver.ROOT_ID, "a");

        assertThat(resolver.ensureFolder(List.of("a"), "a/x.txt").getRight()).isEqualTo(firstId);
        assertThat(gateway.getCreatedFolders()).isZero();
    }

    @Test
    @DisplayName("should return every terminal match")
    void returnsAllTerminalMatches() {
        String folderId = gateway.putFolder(DrivePathResolver.ROOT_ID, "a");
        gateway.putFile(folderId, "c.txt", "1");
        gateway.putFile(folderId, "c.txt", "2");
        gateway.putFolder(folderId, "c.txt");

        Xor<StorageError, List<File>> any = resolver.resolveAll(List.of("a", "c.txt"), DriveQuery.Kind.ANY, "a/c.txt");
        Xor<StorageError, List<File>> filesOnly = resolver.resolveAll(List.of("a", "c.txt"), DriveQuery.Kind.FILES, "a/c.txt");

        assertThat(any.getRight()).hasSize(3);
        assertThat(filesOnly.getRight()).hasSize(2);
    }

    @Test
    @DisplayName("should report a missing terminal entry as not found")
    void missingTerminal() {
        gateway.putFolder(DrivePathResolver.ROOT_ID, "a");

        Xor<StorageError, List<File>> result = resolver.resolveAll(List.of("a", "c.txt"), DriveQuery.Kind.ANY, "a/c.txt");

        assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.NOT_FOUND);
        assertThat(result.getLeft().getMessage()).contains("'c.txt'");
    }
}
