package org.rostilos.gitlabsync.gittransport;

import org.eclipse.jgit.api.Git;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Local bare mirror of a source repository living in its own scratch directory.
 */
public final class MirrorRepository implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MirrorRepository.class);

    private final Git git;
    private final Path directory;
    private final String sourceUrl;

    MirrorRepository(Git git, Path directory, String sourceUrl) {
        this.git = git;
        this.directory = directory;
        this.sourceUrl = sourceUrl;
    }

    Git git() {
        return git;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    @Override
    public void close() {
        git.close();
        deleteRecursively(directory);
    }

    static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up scratch directory {}: {}", root, e.getMessage());
        }
    }
}
