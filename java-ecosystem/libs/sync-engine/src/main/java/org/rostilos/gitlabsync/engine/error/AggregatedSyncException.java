package org.rostilos.gitlabsync.engine.error;

import java.util.List;

/**
 * Carries every error of a run; each one is attached as a suppressed exception.
 */
public class AggregatedSyncException extends RuntimeException {

    private final List<Throwable> errors;

    AggregatedSyncException(String message, List<Throwable> errors) {
        super(message);
        this.errors = List.copyOf(errors);
        errors.forEach(this::addSuppressed);
    }

    public List<Throwable> getErrors() {
        return errors;
    }
}
