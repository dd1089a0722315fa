package org.rostilos.gitlabsync.gitlabclient.dto.request;

import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial body of {@code PUT /groups/:id}. Null fields are left untouched.
 */
public record GroupUpdateRequest(
        String name,
        String description,
        Visibility visibility
) {

    public boolean isEmpty() {
        return changedFieldCount() == 0;
    }

    public int changedFieldCount() {
        return toPayload().size();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (name != null) {
            payload.put("name", name);
        }
        if (description != null) {
            payload.put("description", description);
        }
        if (visibility != null) {
            payload.put("visibility", visibility.apiValue());
        }
        return payload;
    }
}
