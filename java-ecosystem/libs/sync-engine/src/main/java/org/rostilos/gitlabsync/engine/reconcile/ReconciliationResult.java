package org.rostilos.gitlabsync.engine.reconcile;

/**
 * What a reconciler did with one group or project.
 *
 * @param patchedFields number of attributes sent in the update call, 0 unless {@link Outcome#UPDATED}
 * @param reason        failure reason, only set for {@link Outcome#FAILED}
 */
public record ReconciliationResult(
        ResourceKind kind,
        String sourcePath,
        String destinationPath,
        Outcome outcome,
        int patchedFields,
        String reason
) {

    public enum ResourceKind {
        GROUP,
        PROJECT
    }

    public enum Outcome {
        CREATED,
        UPDATED,
        UNCHANGED,
        FAILED
    }

    public static ReconciliationResult created(ResourceKind kind, String sourcePath, String destinationPath) {
        return new ReconciliationResult(kind, sourcePath, destinationPath, Outcome.CREATED, 0, null);
    }

    /**
     * UPDATED when at least one field was patched, UNCHANGED otherwise.
     */
    public static ReconciliationResult existing(ResourceKind kind, String sourcePath, String destinationPath,
                                                int patchedFields) {
        return new ReconciliationResult(kind, sourcePath, destinationPath,
                patchedFields > 0 ? Outcome.UPDATED : Outcome.UNCHANGED, patchedFields, null);
    }

    public static ReconciliationResult failed(ResourceKind kind, String sourcePath, String destinationPath,
                                              String reason) {
        return new ReconciliationResult(kind, sourcePath, destinationPath, Outcome.FAILED, 0, reason);
    }

    @Override
    public String toString() {
        String line = kind.name().toLowerCase() + " " + sourcePath + " -> " + destinationPath + ": " + outcome;
        if (outcome == Outcome.UPDATED) {
            return line + " (" + patchedFields + " field(s))";
        }
        if (outcome == Outcome.FAILED) {
            return line + " (" + reason + ")";
        }
        return line;
    }
}
