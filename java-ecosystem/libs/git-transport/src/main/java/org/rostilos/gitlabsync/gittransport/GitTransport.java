package org.rostilos.gitlabsync.gittransport;

import java.io.IOException;

/**
 * Git-level primitives used to copy a repository when the destination cannot pull it by itself.
 */
public interface GitTransport {

    /**
     * Clone a repository with mirror semantics (bare, every ref fetched) into a scratch directory.
     * The returned handle owns the directory and deletes it on close.
     *
     * @param url clone URL of the source repository
     * @param credentials credentials for the source
     * @return handle on the local bare mirror
     */
    MirrorRepository mirrorClone(String url, GitCredentials credentials) throws IOException;

    /**
     * Register an additional remote on the local mirror.
     */
    void addRemote(MirrorRepository repository, String remoteName, String url) throws IOException;

    /**
     * Force-push every ref ({@code +refs/*:refs/*}) to the given remote.
     * Rejected branches or tags fail the push; rejected refs outside those namespaces are reported in the log only.
     */
    void forcePushAllRefs(MirrorRepository repository, String remoteName, GitCredentials credentials)
            throws IOException;

    /**
     * Read the ref HEAD points to in the local mirror.
     *
     * @return full ref name, e.g. "refs/heads/main", or null when HEAD is detached or missing
     */
    String readSymbolicHead(MirrorRepository repository) throws IOException;

    /**
     * Point the HEAD of a destination repository at the given ref.
     * Only repositories reachable on the local file system can be rewritten directly.
     *
     * @param destination file URL or local path of a bare repository, or a remote URL
     * @param ref full ref name
     * @return true when HEAD was written, false when the destination is remote and must be updated through its API
     */
    boolean writeSymbolicHead(String destination, String ref) throws IOException;
}
