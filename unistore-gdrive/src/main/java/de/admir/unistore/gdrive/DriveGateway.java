package de.admir.unistore.gdrive;

import de.admir.unistore.gdrive.constants.Role;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.google.api.services.drive.model.File;

/**
 * The Drive v3 calls the storage provider is built on. Returned files carry at least id, name, mimeType and parents.
 */
public interface DriveGateway {

    /**
     * Children of {@code parentId} named exactly {@code name}, all pages.
     */
    List<File> findChildren(String parentId, String name, DriveQuery.Kind kind) throws IOException;

    List<File> listChildren(String parentId) throws IOException;

    File createFolder(String parentId, String name) throws IOException;

    File upload(String parentId, String name, InputStream content) throws IOException;

    /**
     * Grants {@code role} to anyone holding the link.
     */
    void shareWithAnyone(String fileId, Role role) throws IOException;

    void delete(String fileId) throws IOException;

    InputStream download(String fileId) throws IOException;
}
