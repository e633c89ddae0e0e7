package de.admir.unistore.core.model;

public enum StorageItemType {
    FILE, FOLDER
}
