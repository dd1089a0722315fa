package org.rostilos.gitlabsync.engine;

import org.rostilos.gitlabsync.engine.instance.InstanceSettings;

/**
 * Settings of one synchronization run.
 *
 * @param source          instance copied from
 * @param destination     instance copied to
 * @param concurrency     size of the worker pool
 * @param dryRun          fetch and plan only, no write call
 * @param forcePremium    assume the destination license allows pull mirroring
 * @param forceNonPremium never pull-mirror, always copy repositories with git
 */
public record SyncSettings(
        InstanceSettings source,
        InstanceSettings destination,
        int concurrency,
        boolean dryRun,
        boolean forcePremium,
        boolean forceNonPremium
) {

    public static final int DEFAULT_CONCURRENCY = 10;

    public SyncSettings {
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Source and destination instances are required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
    }
}
