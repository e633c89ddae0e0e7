package de.admir.unistore.core.util;

import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;

public class SystemUtils {
    public static final String EMPTY_STRING = "";

    private SystemUtils() {
    }

    public static String joinStrings(List<String> strings, String delimiter, String prefix, String suffix) {
        StringJoiner joiner = new StringJoiner(delimiter, prefix, suffix);
        for (String str : strings)
            joiner.add(str);
        return joiner.toString();
    }

    public static String joinStrings(List<String> strings, String delimiter) {
        return joinStrings(strings, delimiter, EMPTY_STRING, EMPTY_STRING);
    }

    public static boolean isEmptyCollection(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }
}
