package org.rostilos.gitlabsync.engine.error;

/**
 * Failure raised by the synchronization engine.
 * A blocking failure makes every further step of the run meaningless; a non-blocking one is scoped
 * to a single group, project or fetch unit.
 */
public class MirrorException extends RuntimeException {

    public enum Severity {
        BLOCKING,
        NON_BLOCKING
    }

    private final Severity severity;

    public MirrorException(Severity severity, String message) {
        super(message);
        this.severity = severity;
    }

    public MirrorException(Severity severity, String message, Throwable cause) {
        super(message, cause);
        this.severity = severity;
    }

    public static MirrorException blocking(String message, Throwable cause) {
        return new MirrorException(Severity.BLOCKING, message, cause);
    }

    public static MirrorException nonBlocking(String message) {
        return new MirrorException(Severity.NON_BLOCKING, message);
    }

    public static MirrorException nonBlocking(String message, Throwable cause) {
        return new MirrorException(Severity.NON_BLOCKING, message, cause);
    }

    /**
     * A failure scoped to one unit of work: the exception itself when it already is a MirrorException,
     * otherwise a non-blocking failure wrapping it.
     * @param unit what was being processed, e.g. "project g/p"
     */
    public static MirrorException scopedTo(String unit, RuntimeException e) {
        if (e instanceof MirrorException mirror) {
            return mirror;
        }
        return nonBlocking("Unexpected failure on " + unit + ": " + e, e);
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    /**
     * Message of this exception followed by the message of its root cause, when there is one.
     */
    public String describe() {
        Throwable root = getCause();
        while (root != null && root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root == null || root.getMessage() == null || getMessage().contains(root.getMessage())) {
            return getMessage();
        }
        return getMessage() + ": " + root.getMessage();
    }
}
