package org.rostilos.gitlabsync.engine.instance;

import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;

/**
 * How a group is designated when it still has to be visited: by numeric id, by full path,
 * or by a record that is already known and need not be fetched again.
 */
public sealed interface GroupRef permits GroupRef.ById, GroupRef.ByPath, GroupRef.Resolved {

    /**
     * Human readable designation used in logs and error messages.
     */
    String describe();

    record ById(long id) implements GroupRef {
        @Override
        public String describe() {
            return "#" + id;
        }
    }

    record ByPath(String path) implements GroupRef {
        @Override
        public String describe() {
            return path;
        }
    }

    record Resolved(GitLabGroup group) implements GroupRef {
        @Override
        public String describe() {
            return group.fullPath();
        }
    }
}
