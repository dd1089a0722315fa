package org.rostilos.gitlabsync.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GitLabSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GitLabSyncApplication.class, args)));
    }
}
