package de.admir.unistore.core.error;

public enum StorageErrorType {
    INVALID_ARGUMENT,
    ALREADY_EXISTS,
    NOT_FOUND,
    BACKEND_UNAVAILABLE,
    PERMISSION_DENIED;

    public static StorageErrorType fromHttpStatus(int status) {
        switch (status) {
            case 400:
                return INVALID_ARGUMENT;
            case 401:
            case 403:
                return PERMISSION_DENIED;
            case 404:
                return NOT_FOUND;
            case 409:
            case 412:
                return ALREADY_EXISTS;
            default:
                return BACKEND_UNAVAILABLE;
        }
    }

    /**
     * Caller mistakes and absent entries are expected outcomes; everything else points at the backend.
     */
    public boolean isExpected() {
        return this == INVALID_ARGUMENT || this == ALREADY_EXISTS || this == NOT_FOUND;
    }
}
