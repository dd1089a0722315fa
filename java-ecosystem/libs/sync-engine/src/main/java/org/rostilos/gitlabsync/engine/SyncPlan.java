package org.rostilos.gitlabsync.engine;

import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult.ResourceKind;

import java.util.ArrayList;
import java.util.List;

/**
 * What a run would do, computed without any write call.
 */
public record SyncPlan(List<Entry> entries) {

    public SyncPlan {
        entries = List.copyOf(entries);
    }

    public enum Action {
        CREATE,
        UPDATE
    }

    /**
     * @param releaseTags tags of the releases that would be created, empty unless releases are mirrored
     */
    public record Entry(ResourceKind kind, String sourcePath, String destinationPath, Action action,
                        List<String> releaseTags) {

        public Entry {
            releaseTags = releaseTags == null ? List.of() : List.copyOf(releaseTags);
        }

        @Override
        public String toString() {
            String line = kind.name().toLowerCase() + " " + sourcePath + " -> " + destinationPath
                    + " (" + action.name().toLowerCase() + ")";
            return releaseTags.isEmpty() ? line : line + ", releases " + String.join(", ", releaseTags);
        }
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        entries.forEach(entry -> lines.add(entry.toString()));
        return lines;
    }
}
