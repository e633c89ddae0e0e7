package de.admir.unistore.gdrive;

import de.admir.unistore.gdrive.constants.MimeTypes;

/**
 * Builds the {@code q} expressions of Drive file searches. Trashed entries never match.
 */
public final class DriveQuery {

    public enum Kind {
        FOLDERS, FILES, ANY
    }

    private DriveQuery() {
    }

    public static String childrenOf(String parentId) {
        return String.format("'%s' in parents and trashed = false", escape(parentId));
    }

    public static String childrenOf(String parentId, String name, Kind kind) {
        StringBuilder query = new StringBuilder(childrenOf(parentId))
            .append(String.format(" and name = '%s'", escape(name)));
        if (kind == Kind.FOLDERS) {
            query.append(String.format(" and mimeType = '%s'", MimeTypes.FOLDER));
        } else if (kind == Kind.FILES) {
            query.append(String.format(" and mimeType != '%s'", MimeTypes.FOLDER));
        }
        return query.toString();
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
