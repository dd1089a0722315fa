package org.rostilos.gitlabsync.engine.instance;

/**
 * Connection settings of one GitLab instance.
 *
 * @param url   base URL, e.g. https://gitlab.example.com
 * @param token personal or group access token, also used as the git password
 * @param scale fetch strategy hint
 */
public record InstanceSettings(
        String url,
        String token,
        InstanceScale scale
) {

    public InstanceSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("GitLab instance URL must not be blank");
        }
        if (scale == null) {
            scale = InstanceScale.SMALL;
        }
    }

    public boolean isAnonymous() {
        return token == null || token.isBlank();
    }

    @Override
    public String toString() {
        return "InstanceSettings[url=" + url + ", token=" + (token == null || token.isBlank() ? "<none>" : "****")
                + ", scale=" + scale + "]";
    }
}
