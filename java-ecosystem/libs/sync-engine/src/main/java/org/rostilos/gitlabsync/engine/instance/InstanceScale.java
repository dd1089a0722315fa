package org.rostilos.gitlabsync.engine.instance;

/**
 * Operator hint selecting the fetch strategy. Never detected automatically.
 */
public enum InstanceScale {
    /** Bulk-list every group and project, then filter locally. */
    SMALL,
    /** Fetch declared entries one by one and walk declared groups recursively. */
    BIG;

    public static InstanceScale of(boolean big) {
        return big ? BIG : SMALL;
    }
}
