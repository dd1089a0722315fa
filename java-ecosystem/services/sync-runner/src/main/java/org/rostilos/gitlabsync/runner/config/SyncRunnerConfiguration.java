package org.rostilos.gitlabsync.runner.config;

import org.rostilos.gitlabsync.engine.GitLabSyncService;
import org.rostilos.gitlabsync.engine.SyncSettings;
import org.rostilos.gitlabsync.engine.mapping.MirrorMappingLoader;
import org.rostilos.gitlabsync.gitlabclient.GitLabApi;
import org.rostilos.gitlabsync.gitlabclient.GitLabHttpClientFactory;
import org.rostilos.gitlabsync.gittransport.GitTransport;
import org.rostilos.gitlabsync.gittransport.JGitTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine from {@link GitLabSyncProperties}: one API client per instance, the JGit transport
 * and the sync service.
 */
@Configuration
@EnableConfigurationProperties(GitLabSyncProperties.class)
public class SyncRunnerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SyncRunnerConfiguration.class);

    @Bean
    public SyncSettings syncSettings(GitLabSyncProperties properties) {
        SyncSettings settings = properties.toSyncSettings();
        log.debug("Sync settings: source {}, destination {}, concurrency {}, dry run {}",
                settings.source(), settings.destination(), settings.concurrency(), settings.dryRun());
        return settings;
    }

    @Bean
    public GitLabHttpClientFactory gitLabHttpClientFactory() {
        return new GitLabHttpClientFactory();
    }

    @Bean
    public GitLabApi sourceGitLabApi(GitLabHttpClientFactory factory, GitLabSyncProperties properties,
                                     SyncSettings settings) {
        return factory.createGitLabClient(settings.source().url(), settings.source().token(),
                properties.resolvedTimeout(), properties.resolvedRetry());
    }

    @Bean
    public GitLabApi destinationGitLabApi(GitLabHttpClientFactory factory, GitLabSyncProperties properties,
                                          SyncSettings settings) {
        return factory.createGitLabClient(settings.destination().url(), settings.destination().token(),
                properties.resolvedTimeout(), properties.resolvedRetry());
    }

    @Bean
    public GitTransport gitTransport(GitLabSyncProperties properties) {
        return new JGitTransport(properties.scratchDirectoryPath());
    }

    @Bean
    public MirrorMappingLoader mirrorMappingLoader() {
        return new MirrorMappingLoader();
    }

    @Bean
    public GitLabSyncService gitLabSyncService(SyncSettings settings,
                                               @Qualifier("sourceGitLabApi") GitLabApi sourceApi,
                                               @Qualifier("destinationGitLabApi") GitLabApi destinationApi,
                                               GitTransport gitTransport) {
        return new GitLabSyncService(settings, sourceApi, destinationApi, gitTransport);
    }
}
