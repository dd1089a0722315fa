package org.rostilos.gitlabsync.runner.config;

import org.rostilos.gitlabsync.engine.SyncSettings;
import org.rostilos.gitlabsync.engine.instance.InstanceScale;
import org.rostilos.gitlabsync.engine.instance.InstanceSettings;
import org.rostilos.gitlabsync.gitlabclient.GitLabConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run configuration, bound from {@code gitlab-sync.*}. Concurrency, retry and timeout accept -1 for
 * "no limit", which is turned into a very large value; 0 is rejected.
 */
@ConfigurationProperties(prefix = "gitlab-sync")
public class GitLabSyncProperties {

    static final int UNLIMITED = -1;
    static final int NO_LIMIT_VALUE = 10_000;

    private Instance source = new Instance();
    private Instance destination = new Instance();
    private String mirrorMapping;
    private boolean dryRun;
    private boolean verbose;
    private int concurrency = SyncSettings.DEFAULT_CONCURRENCY;
    private int retry = GitLabConfig.DEFAULT_MAX_RETRIES;
    private int timeoutSeconds = GitLabConfig.DEFAULT_TIMEOUT_SECONDS;
    private boolean forcePremium;
    private boolean forceNonPremium;
    private String scratchDirectory;

    public Instance getSource() {
        return source;
    }

    public void setSource(Instance source) {
        this.source = source;
    }

    public Instance getDestination() {
        return destination;
    }

    public void setDestination(Instance destination) {
        this.destination = destination;
    }

    public String getMirrorMapping() {
        return mirrorMapping;
    }

    public void setMirrorMapping(String mirrorMapping) {
        this.mirrorMapping = mirrorMapping;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getRetry() {
        return retry;
    }

    public void setRetry(int retry) {
        this.retry = retry;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean isForcePremium() {
        return forcePremium;
    }

    public void setForcePremium(boolean forcePremium) {
        this.forcePremium = forcePremium;
    }

    public boolean isForceNonPremium() {
        return forceNonPremium;
    }

    public void setForceNonPremium(boolean forceNonPremium) {
        this.forceNonPremium = forceNonPremium;
    }

    public String getScratchDirectory() {
        return scratchDirectory;
    }

    public void setScratchDirectory(String scratchDirectory) {
        this.scratchDirectory = scratchDirectory;
    }

    public int resolvedConcurrency() {
        return resolveLimit("concurrency", concurrency);
    }

    public int resolvedRetry() {
        return resolveLimit("retry", retry);
    }

    public Duration resolvedTimeout() {
        return Duration.ofSeconds(resolveLimit("timeout-seconds", timeoutSeconds));
    }

    /**
     * @return the mapping file, never null
     * @throws IllegalStateException when no mapping file is configured
     */
    public Path mirrorMappingPath() {
        if (mirrorMapping == null || mirrorMapping.isBlank()) {
            throw new IllegalStateException("gitlab-sync.mirror-mapping (MIRROR_MAPPING) is mandatory");
        }
        return Path.of(mirrorMapping);
    }

    public Path scratchDirectoryPath() {
        return scratchDirectory == null || scratchDirectory.isBlank() ? null : Path.of(scratchDirectory);
    }

    public SyncSettings toSyncSettings() {
        if (destination.getToken() == null || destination.getToken().isBlank()) {
            throw new IllegalStateException("gitlab-sync.destination.token (DESTINATION_GITLAB_TOKEN) is mandatory");
        }
        return new SyncSettings(
                source.toInstanceSettings("source"),
                destination.toInstanceSettings("destination"),
                resolvedConcurrency(),
                dryRun,
                forcePremium,
                forceNonPremium
        );
    }

    private static int resolveLimit(String name, int value) {
        if (value == UNLIMITED) {
            return NO_LIMIT_VALUE;
        }
        if (value <= 0) {
            throw new IllegalStateException("gitlab-sync." + name + " must be -1 (no limit) or strictly greater "
                    + "than 0, got " + value);
        }
        return value;
    }

    /**
     * Connection settings of one GitLab instance.
     */
    public static class Instance {

        private String url;
        private String token;
        private boolean big;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isBig() {
            return big;
        }

        public void setBig(boolean big) {
            this.big = big;
        }

        InstanceSettings toInstanceSettings(String role) {
            if (url == null || url.isBlank()) {
                throw new IllegalStateException("gitlab-sync." + role + ".url is mandatory");
            }
            return new InstanceSettings(url, token, InstanceScale.of(big));
        }
    }
}
