package org.rostilos.gitlabsync.runner;

import org.rostilos.gitlabsync.engine.GitLabSyncService;
import org.rostilos.gitlabsync.engine.SyncReport;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.MirrorMappingException;
import org.rostilos.gitlabsync.engine.mapping.MirrorMappingLoader;
import org.rostilos.gitlabsync.runner.config.GitLabSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one synchronization at startup. The exit code is 1 when the mapping is invalid or the run
 * reported any error.
 */
@Component
public class SyncRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    static final String ENGINE_LOGGER = "org.rostilos.gitlabsync";

    private final GitLabSyncProperties properties;
    private final MirrorMappingLoader mappingLoader;
    private final GitLabSyncService syncService;
    private final LoggingSystem loggingSystem;

    private volatile int exitCode;

    public SyncRunner(GitLabSyncProperties properties, MirrorMappingLoader mappingLoader,
                      GitLabSyncService syncService, LoggingSystem loggingSystem) {
        this.properties = properties;
        this.mappingLoader = mappingLoader;
        this.syncService = syncService;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.isVerbose()) {
            loggingSystem.setLogLevel(ENGINE_LOGGER, LogLevel.DEBUG);
            log.debug("Verbose mode enabled");
        }

        Path mappingFile = properties.mirrorMappingPath();
        MirrorMapping mapping;
        try {
            mapping = mappingLoader.load(mappingFile);
        } catch (MirrorMappingException e) {
            log.error("Invalid mirror mapping {}:{}  - {}", mappingFile, System.lineSeparator(),
                    String.join(System.lineSeparator() + "  - ", e.getProblems()));
            exitCode = 1;
            return;
        }

        SyncReport report = syncService.run(mapping);
        if (report.hasErrors()) {
            log.error("Synchronization finished with {} error(s):{}{}", report.errors().size(),
                    System.lineSeparator(), report.errors().render());
            exitCode = 1;
        } else {
            log.info("Synchronization completed: {}", report.summary());
            exitCode = 0;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
