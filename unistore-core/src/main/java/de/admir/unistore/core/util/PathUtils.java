package de.admir.unistore.core.util;

import de.admir.unistore.core.error.StorageError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Logical path grammar shared by every backend: segments separated by {@code /}, blank segments ignored. Other
 * segments are kept verbatim, surrounding whitespace included.
 */
public final class PathUtils {
    public static final char SEPARATOR = '/';

    private PathUtils() {
    }

    public static List<String> pathToList(String path) {
        if (path == null)
            return Collections.emptyList();
        List<String> segments = new ArrayList<>();
        for (String segment : StringUtils.split(path, SEPARATOR)) {
            if (StringUtils.isNotBlank(segment))
                segments.add(segment);
        }
        return segments;
    }

    /**
     * Splits the path, rejecting blank input and input without a single usable segment.
     */
    public static Xor<StorageError, List<String>> validate(String path) {
        if (StringUtils.isBlank(path))
            return Xor.left(StorageError.invalidArgument("Path cannot be null or empty", path));
        List<String> segments = pathToList(path);
        if (segments.isEmpty())
            return Xor.left(StorageError.invalidArgument("Path does not contain any segment: " + path, path));
        return Xor.right(segments);
    }

    public static String lastSegment(List<String> segments) {
        return segments.get(segments.size() - 1);
    }

    public static List<String> parentSegments(List<String> segments) {
        return segments.subList(0, segments.size() - 1);
    }

    public static String join(List<String> segments) {
        return SystemUtils.joinStrings(segments, String.valueOf(SEPARATOR));
    }
}
