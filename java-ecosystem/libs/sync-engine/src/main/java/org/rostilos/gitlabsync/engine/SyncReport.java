package org.rostilos.gitlabsync.engine;

import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult.Outcome;

import java.util.List;

/**
 * Outcome of a run.
 *
 * @param results             one entry per reconciled group and project, groups first
 * @param errors              every error of the run
 * @param pullMirrorAvailable mirror strategy used, false when the run stopped before the probe
 * @param plan                planned changes of a dry run, null otherwise
 */
public record SyncReport(
        List<ReconciliationResult> results,
        SyncErrors errors,
        boolean pullMirrorAvailable,
        SyncPlan plan
) {

    public SyncReport {
        results = List.copyOf(results);
        errors = errors == null ? SyncErrors.NONE : errors;
    }

    public static SyncReport aborted(SyncErrors errors) {
        return new SyncReport(List.of(), errors, false, null);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isDryRun() {
        return plan != null;
    }

    public long count(Outcome outcome) {
        return results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public String summary() {
        if (isDryRun()) {
            return "dry run: " + plan.entries().size() + " planned change(s), " + errors.size() + " error(s)";
        }
        return count(Outcome.CREATED) + " created, " + count(Outcome.UPDATED) + " updated, "
                + count(Outcome.UNCHANGED) + " unchanged, " + count(Outcome.FAILED) + " failed, "
                + errors.size() + " error(s)";
    }
}
