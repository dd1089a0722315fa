package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.SyncErrors;

import java.util.List;

/**
 * Results and errors of reconciling one kind of resource.
 */
public record ReconciliationPass(List<ReconciliationResult> results, SyncErrors errors) {

    public ReconciliationPass {
        results = List.copyOf(results);
    }
}
