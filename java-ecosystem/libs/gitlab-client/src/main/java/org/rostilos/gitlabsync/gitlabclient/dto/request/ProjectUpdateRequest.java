package org.rostilos.gitlabsync.gitlabclient.dto.request;

import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial body of {@code PUT /projects/:id}. Null fields are left untouched.
 */
public record ProjectUpdateRequest(
        String name,
        String description,
        String defaultBranch,
        List<String> topics,
        Visibility visibility,
        Boolean mirror,
        Boolean mirrorTriggerBuilds,
        Boolean mirrorOverwritesDivergedBranches
) {

    public static Builder builder() {
        return new Builder();
    }

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
        if (defaultBranch != null) {
            payload.put("default_branch", defaultBranch);
        }
        if (topics != null) {
            payload.put("topics", topics);
        }
        if (visibility != null) {
            payload.put("visibility", visibility.apiValue());
        }
        if (mirror != null) {
            payload.put("mirror", mirror);
        }
        if (mirrorTriggerBuilds != null) {
            payload.put("mirror_trigger_builds", mirrorTriggerBuilds);
        }
        if (mirrorOverwritesDivergedBranches != null) {
            payload.put("mirror_overwrites_diverged_branches", mirrorOverwritesDivergedBranches);
        }
        return payload;
    }

    public static final class Builder {
        private String name;
        private String description;
        private String defaultBranch;
        private List<String> topics;
        private Visibility visibility;
        private Boolean mirror;
        private Boolean mirrorTriggerBuilds;
        private Boolean mirrorOverwritesDivergedBranches;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder defaultBranch(String defaultBranch) {
            this.defaultBranch = defaultBranch;
            return this;
        }

        public Builder topics(List<String> topics) {
            this.topics = topics == null ? null : List.copyOf(topics);
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder mirror(Boolean mirror) {
            this.mirror = mirror;
            return this;
        }

        public Builder mirrorTriggerBuilds(Boolean mirrorTriggerBuilds) {
            this.mirrorTriggerBuilds = mirrorTriggerBuilds;
            return this;
        }

        public Builder mirrorOverwritesDivergedBranches(Boolean mirrorOverwritesDivergedBranches) {
            this.mirrorOverwritesDivergedBranches = mirrorOverwritesDivergedBranches;
            return this;
        }

        public ProjectUpdateRequest build() {
            return new ProjectUpdateRequest(name, description, defaultBranch, topics, visibility,
                    mirror, mirrorTriggerBuilds, mirrorOverwritesDivergedBranches);
        }
    }
}
