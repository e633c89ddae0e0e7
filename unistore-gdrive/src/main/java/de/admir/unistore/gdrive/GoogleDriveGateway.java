package de.admir.unistore.gdrive;

import de.admir.unistore.gdrive.constants.MimeTypes;
import de.admir.unistore.gdrive.constants.Role;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.api.client.http.InputStreamContent;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import com.google.api.services.drive.model.Permission;

public class GoogleDriveGateway implements DriveGateway {
    private static final String FILE_FIELDS = "id, kind, mimeType, name, parents, modifiedTime";
    private static final String LIST_FIELDS = String.format("nextPageToken, files (%s)", FILE_FIELDS);
    private static final int PAGE_SIZE = 100;
    private static final String ANYONE = "anyone";

    private final Drive driveService;

    public GoogleDriveGateway(Drive driveService) {
        this.driveService = Objects.requireNonNull(driveService, "driveService");
    }

    @Override
    public List<File> findChildren(String parentId, String name, DriveQuery.Kind kind) throws IOException {
        return search(DriveQuery.childrenOf(parentId, name, kind));
    }

    @Override
    public List<File> listChildren(String parentId) throws IOException {
        return search(DriveQuery.childrenOf(parentId));
    }

    @Override
    public File createFolder(String parentId, String name) throws IOException {
        File folder = new File()
            .setName(name)
            .setMimeType(MimeTypes.FOLDER)
            .setParents(Collections.singletonList(parentId));
        return driveService.files().create(folder).setFields(FILE_FIELDS).execute();
    }

    @Override
    public File upload(String parentId, String name, InputStream content) throws IOException {
        File fileMetadata = new File()
            .setName(name)
            .setParents(Collections.singletonList(parentId));
        return driveService.files()
            .create(fileMetadata, new InputStreamContent(MimeTypes.OCTET_STREAM, content))
            .setFields(FILE_FIELDS)
            .execute();
    }

    @Override
    public void shareWithAnyone(String fileId, Role role) throws IOException {
        Permission permission = new Permission()
            .setType(ANYONE)
            .setRole(role.getApiValue());
        driveService.permissions().create(fileId, permission).execute();
    }

    @Override
    public void delete(String fileId) throws IOException {
        driveService.files().delete(fileId).execute();
    }

    @Override
    public InputStream download(String fileId) throws IOException {
        return driveService.files().get(fileId).executeMediaAsInputStream();
    }

    private List<File> search(String query) throws IOException {
        List<File> files = new ArrayList<>();
        String pageToken = null;
        do {
            FileList page = driveService.files().list()
                .setQ(query)
                .setSpaces("drive")
                .setFields(LIST_FIELDS)
                .setPageSize(PAGE_SIZE)
                .setPageToken(pageToken)
                .execute();
            if (page.getFiles() != null)
                files.addAll(page.getFiles());
            pageToken = page.getNextPageToken();
        } while (pageToken != null);
        return files;
    }
}
