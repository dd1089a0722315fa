package org.rostilos.gitlabsync.engine.capability;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.gitlabclient.GitLabApi;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabLicense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Decides once per run whether the destination can pull-mirror projects natively.
 * That needs GitLab {@value #MINIMUM_VERSION} or later and a non-expired Premium or Ultimate license.
 * The version is always checked. Either override flag replaces the license check.
 */
public class MirrorCapabilityProber {

    private static final Logger log = LoggerFactory.getLogger(MirrorCapabilityProber.class);

    public static final String MINIMUM_VERSION = "17.6";
    private static final Set<String> PREMIUM_PLANS = Set.of("premium", "ultimate");

    private final GitLabApi destinationApi;

    public MirrorCapabilityProber(GitLabApi destinationApi) {
        this.destinationApi = destinationApi;
    }

    /**
     * @param forcePremium    assume a premium license whatever the API reports
     * @param forceNonPremium never use the pull mirror; takes precedence over {@code forcePremium}
     * @throws MirrorException (blocking) when a check that matters cannot be completed
     */
    public boolean isPullMirrorAvailable(boolean forcePremium, boolean forceNonPremium) {
        String version;
        try {
            version = destinationApi.getPlatformVersion();
        } catch (IOException e) {
            throw MirrorException.blocking("Failed to read destination GitLab version", e);
        }
        boolean versionOk = isAtLeast(version, MINIMUM_VERSION);
        log.info("Destination GitLab version {} (pull mirror requires {}+)", version, MINIMUM_VERSION);

        if (forceNonPremium) {
            log.info("Pull mirror disabled by configuration");
            return false;
        }
        if (!versionOk) {
            return false;
        }
        if (forcePremium) {
            log.info("Premium license assumed by configuration, pull mirror enabled");
            return true;
        }

        GitLabLicense license;
        try {
            license = destinationApi.getLicense();
        } catch (IOException e) {
            throw MirrorException.blocking("Failed to read destination GitLab license", e);
        }
        boolean premium = license.plan() != null
                && PREMIUM_PLANS.contains(license.plan().toLowerCase(Locale.ROOT))
                && !license.expired();
        log.info("Destination license plan {}{}, pull mirror {}", license.plan(),
                license.expired() ? " (expired)" : "", premium ? "enabled" : "disabled");
        return premium;
    }

    /**
     * Compare dotted numeric versions. Suffixes such as {@code -ee} or {@code -pre} are ignored and
     * missing components count as zero.
     *
     * @throws MirrorException (blocking) when {@code version} has no numeric component
     */
    static boolean isAtLeast(String version, String minimum) {
        int[] actual = parse(version);
        int[] required = parse(minimum);
        for (int i = 0; i < Math.max(actual.length, required.length); i++) {
            int a = i < actual.length ? actual[i] : 0;
            int r = i < required.length ? required[i] : 0;
            if (a != r) {
                return a > r;
            }
        }
        return true;
    }

    private static int[] parse(String version) {
        if (version == null) {
            throw MirrorException.blocking("Unparseable GitLab version: null", null);
        }
        String core = version.trim();
        int suffix = 0;
        while (suffix < core.length() && (Character.isDigit(core.charAt(suffix)) || core.charAt(suffix) == '.')) {
            suffix++;
        }
        core = core.substring(0, suffix);
        if (core.isEmpty() || core.startsWith(".")) {
            throw MirrorException.blocking("Unparseable GitLab version: " + version, null);
        }
        String[] parts = core.split("\\.");
        int[] numbers = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                numbers[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw MirrorException.blocking("Unparseable GitLab version: " + version, e);
            }
        }
        return numbers;
    }
}
