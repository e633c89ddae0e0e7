package de.admir.unistore.gdrive.constants;

/**
 * Permission roles understood by the Drive permissions API.
 */
public enum Role {
    COMMENTER("commenter"),
    FILE_ORGANIZER("fileOrganizer"),
    ORGANIZER("organizer"),
    OWNER("owner"),
    READER("reader"),
    WRITER("writer");

    private final String apiValue;

    Role(String apiValue) {
        this.apiValue = apiValue;
    }

    public String getApiValue() {
        return apiValue;
    }

    public static Role fromApiValue(String value) {
        for (Role role : values()) {
            if (role.apiValue.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value))
                return role;
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
