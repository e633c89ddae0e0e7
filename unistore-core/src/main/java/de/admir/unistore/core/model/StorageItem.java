package de.admir.unistore.core.model;

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One entry of a listing. Created fresh on every list call, never persisted.
 */
@Getter
@EqualsAndHashCode
public class StorageItem {
    private final String name;
    private final StorageItemType type;

    public StorageItem(String name, StorageItemType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static StorageItem file(String name) {
        return new StorageItem(name, StorageItemType.FILE);
    }

    public static StorageItem folder(String name) {
        return new StorageItem(name, StorageItemType.FOLDER);
    }

    @Override
    public String toString() {
        return type + ": " + name;
    }
}
