package de.admir.unistore.gdrive.constants;

public final class MimeTypes {
    public static final String FOLDER = "application/vnd.google-apps.folder";
    public static final String OCTET_STREAM = "application/octet-stream";

    private MimeTypes() {
    }
}
