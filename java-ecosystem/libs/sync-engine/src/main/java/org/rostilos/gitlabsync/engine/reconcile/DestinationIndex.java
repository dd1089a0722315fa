package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Destination path to source path index of mapping entries, sorted by destination path so that a parent
 * always comes before its descendants.
 */
final class DestinationIndex {

    private static final Logger log = LoggerFactory.getLogger(DestinationIndex.class);

    private DestinationIndex() {
        // Utility class
    }

    /**
     * A destination claimed by two sources keeps the declared one over a derived one, and otherwise the
     * first source in path order; the other one is reported as an error and skipped.
     *
     * @param declared tells declared source paths from the ones derived below a declared group
     */
    static SortedMap<String, String> of(Map<String, MirrorOptions> entries, Predicate<String> declared,
                                        String kind, Collection<Throwable> errors) {
        SortedMap<String, String> index = new TreeMap<>();
        Map<String, MirrorOptions> sorted = new TreeMap<>(entries);
        sorted.forEach((sourcePath, options) -> {
            if (declared.test(sourcePath)) {
                claim(index, sourcePath, options, kind, errors);
            }
        });
        sorted.forEach((sourcePath, options) -> {
            if (!declared.test(sourcePath)) {
                claim(index, sourcePath, options, kind, errors);
            }
        });
        return index;
    }

    private static void claim(SortedMap<String, String> index, String sourcePath, MirrorOptions options,
                              String kind, Collection<Throwable> errors) {
        String previous = index.putIfAbsent(options.destinationPath(), sourcePath);
        if (previous != null) {
            log.error("Duplicate destination path {} for {}s {} and {}", options.destinationPath(), kind,
                    previous, sourcePath);
            errors.add(MirrorException.nonBlocking("duplicate destination path " + options.destinationPath()
                    + " for " + kind + "s " + previous + " and " + sourcePath + ", " + sourcePath + " skipped"));
        }
    }
}
