package de.admir.unistore.gdrive.model;

import de.admir.unistore.core.model.StorageItem;
import de.admir.unistore.core.model.StorageItemType;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A listing entry of an ID-addressed hierarchy, carrying the Drive ID of the entry and of the folder containing it.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class GoogleStorageItem extends StorageItem {
    private final String id;
    private final String parentId;

    public GoogleStorageItem(String name, StorageItemType type, String id, String parentId) {
        super(name, type);
        this.id = id;
        this.parentId = parentId;
    }
}
