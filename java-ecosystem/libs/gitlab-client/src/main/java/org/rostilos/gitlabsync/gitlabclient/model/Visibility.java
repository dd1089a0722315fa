package org.rostilos.gitlabsync.gitlabclient.model;

import java.util.Locale;

/**
 * Visibility level of a GitLab group or project.
 */
public enum Visibility {
    PUBLIC,
    INTERNAL,
    PRIVATE;

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the value GitLab uses on the wire.
     *
     * @return the matching visibility, or null when the value is null or unknown
     */
    public static Visibility fromApiValue(String value) {
        if (value == null) {
            return null;
        }
        for (Visibility visibility : values()) {
            if (visibility.apiValue().equalsIgnoreCase(value.trim())) {
                return visibility;
            }
        }
        return null;
    }
}
