package org.rostilos.gitlabsync.engine.instance;

public enum InstanceRole {
    SOURCE,
    DESTINATION
}
