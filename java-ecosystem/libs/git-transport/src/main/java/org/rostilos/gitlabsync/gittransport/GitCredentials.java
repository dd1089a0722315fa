package org.rostilos.gitlabsync.gittransport;

import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;

/**
 * HTTP basic credentials for git over HTTPS. GitLab accepts any username together with an access token
 * as the password.
 */
public record GitCredentials(String username, String token) {

    public static final String DEFAULT_GIT_USER = "git";

    public GitCredentials {
        if (username == null || username.isBlank()) {
            username = DEFAULT_GIT_USER;
        }
    }

    public static GitCredentials ofToken(String token) {
        return new GitCredentials(DEFAULT_GIT_USER, token);
    }

    public static GitCredentials anonymous() {
        return new GitCredentials(DEFAULT_GIT_USER, null);
    }

    public boolean isAnonymous() {
        return token == null || token.isBlank();
    }

    /**
     * @return a JGit credentials provider, or null for anonymous access
     */
    public CredentialsProvider toCredentialsProvider() {
        if (isAnonymous()) {
            return null;
        }
        return new UsernamePasswordCredentialsProvider(username, token);
    }

    @Override
    public String toString() {
        return "GitCredentials[username=" + username + ", token=" + (isAnonymous() ? "<none>" : "****") + "]";
    }
}
