package org.rostilos.gitlabsync.gittransport;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * GitTransport backed by JGit.
 */
public class JGitTransport implements GitTransport {

    private static final Logger log = LoggerFactory.getLogger(JGitTransport.class);

    private static final String SCRATCH_PREFIX = "bare-mirror-";
    private static final RefSpec ALL_REFS = new RefSpec("+refs/*:refs/*");

    private final Path scratchDirectory;

    /**
     * @param scratchDirectory parent directory for mirror clones, null for the system temp directory
     */
    public JGitTransport(Path scratchDirectory) {
        this.scratchDirectory = scratchDirectory;
    }

    @Override
    public MirrorRepository mirrorClone(String url, GitCredentials credentials) throws IOException {
        Path directory = createScratchDirectory();
        log.debug("Cloning {} as mirror into {}", url, directory);
        try {
            Git git = Git.cloneRepository()
                    .setURI(url)
                    .setDirectory(directory.toFile())
                    .setMirror(true)
                    .setCredentialsProvider(credentials.toCredentialsProvider())
                    .call();
            return new MirrorRepository(git, directory, url);
        } catch (GitAPIException | RuntimeException e) {
            MirrorRepository.deleteRecursively(directory);
            throw new IOException("Failed to clone source repository " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void addRemote(MirrorRepository repository, String remoteName, String url) throws IOException {
        try {
            repository.git().remoteAdd()
                    .setName(remoteName)
                    .setUri(new URIish(url))
                    .call();
        } catch (URISyntaxException | GitAPIException e) {
            throw new IOException("Failed to add remote " + remoteName + " (" + url + "): " + e.getMessage(), e);
        }
    }

    @Override
    public void forcePushAllRefs(MirrorRepository repository, String remoteName, GitCredentials credentials)
            throws IOException {
        Iterable<PushResult> results;
        try {
            results = repository.git().push()
                    .setRemote(remoteName)
                    .setRefSpecs(ALL_REFS)
                    .setForce(true)
                    .setCredentialsProvider(credentials.toCredentialsProvider())
                    .call();
        } catch (GitAPIException e) {
            throw new IOException("Failed to push to remote " + remoteName + ": " + e.getMessage(), e);
        }

        List<String> failures = new ArrayList<>();
        for (PushResult result : results) {
            for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                switch (update.getStatus()) {
                    case OK, UP_TO_DATE, NON_EXISTING -> {
                    }
                    default -> {
                        String ref = update.getRemoteName();
                        String reason = update.getMessage() != null
                                ? update.getStatus() + " (" + update.getMessage() + ")"
                                : update.getStatus().toString();
                        if (ref.startsWith(Constants.R_HEADS) || ref.startsWith(Constants.R_TAGS)) {
                            failures.add(ref + ": " + reason);
                        } else {
                            // GitLab keeps refs such as refs/merge-requests/* read-only
                            log.debug("Skipped ref {} on {}: {}", ref, remoteName, reason);
                        }
                    }
                }
            }
        }
        if (!failures.isEmpty()) {
            throw new IOException("Push to " + remoteName + " rejected " + failures.size() + " ref(s): "
                    + String.join(", ", failures));
        }
    }

    @Override
    public String readSymbolicHead(MirrorRepository repository) throws IOException {
        Ref head = repository.git().getRepository().exactRef(Constants.HEAD);
        if (head == null || !head.isSymbolic()) {
            return null;
        }
        return head.getTarget().getName();
    }

    @Override
    public boolean writeSymbolicHead(String destination, String ref) throws IOException {
        Path localPath = toLocalPath(destination);
        if (localPath == null) {
            log.debug("Destination {} is remote, HEAD is left to the hosting platform", destination);
            return false;
        }

        try (Git git = Git.open(localPath.toFile())) {
            Repository repository = git.getRepository();
            RefUpdate update = repository.updateRef(Constants.HEAD);
            RefUpdate.Result result = update.link(ref);
            if (result != RefUpdate.Result.NEW && result != RefUpdate.Result.FORCED
                    && result != RefUpdate.Result.NO_CHANGE) {
                throw new IOException("Failed to set HEAD of " + destination + " to " + ref + ": " + result);
            }
            log.debug("Destination {} HEAD now points to {}", destination, ref);
            return true;
        }
    }

    private Path toLocalPath(String destination) {
        if (destination.startsWith("file:")) {
            return Path.of(URI.create(destination));
        }
        if (destination.contains("://") || destination.contains("@")) {
            return null;
        }
        Path path = Path.of(destination);
        return Files.isDirectory(path) ? path : null;
    }

    private Path createScratchDirectory() throws IOException {
        if (scratchDirectory == null) {
            return Files.createTempDirectory(SCRATCH_PREFIX);
        }
        Files.createDirectories(scratchDirectory);
        return Files.createTempDirectory(scratchDirectory, SCRATCH_PREFIX);
    }
}
