package org.rostilos.gitlabsync.engine.error;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Immutable, ordered collection of the errors produced by one or more stages of a run.
 * Every factory returns {@link #NONE} when it ends up with no error, so "did anything fail"
 * is always {@code errors.isEmpty()} or {@code errors == SyncErrors.NONE}.
 */
public final class SyncErrors {

    public static final SyncErrors NONE = new SyncErrors(List.of());

    private static final int DEFAULT_INDENT = 2;

    private final List<Throwable> errors;

    private SyncErrors(List<Throwable> errors) {
        this.errors = errors;
    }

    public static SyncErrors of(Throwable error) {
        if (error == null) {
            return NONE;
        }
        List<Throwable> flattened = new ArrayList<>();
        flatten(error, flattened);
        return new SyncErrors(Collections.unmodifiableList(flattened));
    }

    public static SyncErrors of(Collection<? extends Throwable> errors) {
        if (errors == null || errors.isEmpty()) {
            return NONE;
        }
        List<Throwable> flattened = new ArrayList<>();
        for (Throwable error : errors) {
            if (error != null) {
                flatten(error, flattened);
            }
        }
        return flattened.isEmpty() ? NONE : new SyncErrors(Collections.unmodifiableList(flattened));
    }

    /**
     * Take every error currently queued. The queue is empty afterwards.
     */
    public static SyncErrors drain(BlockingQueue<? extends Throwable> queue) {
        List<Throwable> drained = new ArrayList<>();
        queue.drainTo(drained);
        return of(drained);
    }

    public static SyncErrors merge(SyncErrors... parts) {
        List<Throwable> all = new ArrayList<>();
        for (SyncErrors part : parts) {
            if (part != null) {
                all.addAll(part.errors);
            }
        }
        return of(all);
    }

    public SyncErrors and(SyncErrors other) {
        return merge(this, other);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public List<Throwable> errors() {
        return errors;
    }

    public boolean hasBlocking() {
        return errors.stream().anyMatch(e -> e instanceof MirrorException m && m.isBlocking());
    }

    public String render() {
        return render(DEFAULT_INDENT);
    }

    /**
     * One line per error: {@code <indent>- message}.
     */
    public String render(int indent) {
        String prefix = " ".repeat(Math.max(indent, 0)) + "- ";
        StringBuilder report = new StringBuilder();
        for (Throwable error : errors) {
            if (report.length() > 0) {
                report.append(System.lineSeparator());
            }
            report.append(prefix).append(describe(error));
        }
        return report.toString();
    }

    /**
     * @return null when there is no error, otherwise an exception carrying all of them
     */
    public AggregatedSyncException toException() {
        if (isEmpty()) {
            return null;
        }
        String message = errors.size() + " error(s) occurred:" + System.lineSeparator() + render();
        return new AggregatedSyncException(message, errors);
    }

    private static void flatten(Throwable error, List<Throwable> target) {
        if (error instanceof AggregatedSyncException aggregated) {
            target.addAll(aggregated.getErrors());
        } else {
            target.add(error);
        }
    }

    private static String describe(Throwable error) {
        if (error instanceof MirrorException mirror) {
            return mirror.describe();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return isEmpty() ? "SyncErrors[NONE]" : "SyncErrors" + Arrays.toString(errors.toArray());
    }
}
