package org.rostilos.gitlabsync.engine.mirror;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.gittransport.GitCredentials;
import org.rostilos.gitlabsync.gittransport.GitTransport;
import org.rostilos.gitlabsync.gittransport.MirrorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Copies a repository with plain git when the destination cannot pull-mirror: mirror clone of the
 * source, force push of every ref to the destination, then the source HEAD is replayed on the destination.
 */
public class GitMirrorEngine {

    private static final Logger log = LoggerFactory.getLogger(GitMirrorEngine.class);

    static final String DESTINATION_REMOTE = "destination";

    private final GitTransport transport;

    public GitMirrorEngine(GitTransport transport) {
        this.transport = transport;
    }

    /**
     * @throws MirrorException (non-blocking) when any step fails; the scratch clone is removed either way
     */
    public GitMirrorResult mirror(String sourceUrl, GitCredentials sourceCredentials,
                                  String destinationUrl, GitCredentials destinationCredentials) {
        String step = "clone";
        try (MirrorRepository repository = transport.mirrorClone(sourceUrl, sourceCredentials)) {
            step = "add remote";
            transport.addRemote(repository, DESTINATION_REMOTE, destinationUrl);
            step = "push";
            transport.forcePushAllRefs(repository, DESTINATION_REMOTE, destinationCredentials);

            step = "set HEAD";
            String head = transport.readSymbolicHead(repository);
            boolean headWritten = head != null && transport.writeSymbolicHead(destinationUrl, head);
            log.info("Mirrored {} to {} (HEAD {}{})", sourceUrl, destinationUrl, head,
                    headWritten ? "" : ", left to the destination");
            return new GitMirrorResult(head, headWritten);
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Git mirror of " + sourceUrl + " failed at " + step, e);
        }
    }

    /**
     * @param head        ref the source HEAD points to, null when it is detached or missing
     * @param headWritten whether the destination HEAD could be set directly
     */
    public record GitMirrorResult(String head, boolean headWritten) {
    }
}
