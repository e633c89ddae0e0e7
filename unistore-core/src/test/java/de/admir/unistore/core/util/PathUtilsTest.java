package de.admir.unistore.core.util;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PathUtils")
class PathUtilsTest {

    @Test
    @DisplayName("should ignore empty segments")
    void ignoresEmptySegments() {
        assertThat(PathUtils.pathToList("//a///b/c.txt/")).containsExactly("a", "b", "c.txt");
    }

    @Test
    @DisplayName("should keep whitespace inside non-blank segments")
    void keepsWhitespace() {
        assertThat(PathUtils.pathToList("docs/ a.txt/ /b.txt ")).containsExactly("docs", " a.txt", "b.txt ");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "/", "///", " / / "})
    @DisplayName("should reject paths without segments")
    void rejectsPathsWithoutSegments(String path) {
        Xor<StorageError, List<String>> result = PathUtils.validate(path);

        assertThat(result.isLeft()).isTrue();
        assertThat(result.getLeft().getType()).isEqualTo(StorageErrorType.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("should accept a single segment")
    void acceptsSingleSegment() {
        assertThat(PathUtils.validate("root").getRight()).containsExactly("root");
    }

    @Test
    @DisplayName("should split last and parent segments")
    void splitsLastAndParent() {
        List<String> segments = Arrays.asList("a", "b", "c.txt");

        assertThat(PathUtils.lastSegment(segments)).isEqualTo("c.txt");
        assertThat(PathUtils.parentSegments(segments)).containsExactly("a", "b");
        assertThat(PathUtils.join(PathUtils.parentSegments(segments))).isEqualTo("a/b");
    }
}
