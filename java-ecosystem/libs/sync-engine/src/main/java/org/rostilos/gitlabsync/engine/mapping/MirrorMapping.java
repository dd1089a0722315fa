package org.rostilos.gitlabsync.engine.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Source path to {@link MirrorOptions} correspondence for projects and groups.
 * Starts with the declared entries and is extended while the source instance is fetched, possibly
 * from many threads at once; every access goes through the table's read/write lock.
 * Entries given to the constructor or to {@code addProject}/{@code addGroup} are declared; entries added
 * with the {@code IfAbsent} variants are derived.
 */
public class MirrorMapping {

    private final Table projects = new Table();
    private final Table groups = new Table();

    public MirrorMapping() {
    }

    public MirrorMapping(Map<String, MirrorOptions> projects, Map<String, MirrorOptions> groups) {
        projects.forEach(this.projects::put);
        groups.forEach(this.groups::put);
    }

    public void addProject(String sourcePath, MirrorOptions options) {
        projects.put(sourcePath, options);
    }

    public void addGroup(String sourcePath, MirrorOptions options) {
        groups.put(sourcePath, options);
    }

    /**
     * @return true when the entry was added, false when one already existed for the path
     */
    public boolean addProjectIfAbsent(String sourcePath, MirrorOptions options) {
        return projects.putIfAbsent(sourcePath, options);
    }

    public boolean addGroupIfAbsent(String sourcePath, MirrorOptions options) {
        return groups.putIfAbsent(sourcePath, options);
    }

    public MirrorOptions getProject(String sourcePath) {
        return projects.get(sourcePath);
    }

    public MirrorOptions getGroup(String sourcePath) {
        return groups.get(sourcePath);
    }

    public boolean isDeclaredProject(String sourcePath) {
        return projects.isDeclared(sourcePath);
    }

    public boolean isDeclaredGroup(String sourcePath) {
        return groups.isDeclared(sourcePath);
    }

    /**
     * @return a sorted copy of the project entries
     */
    public Map<String, MirrorOptions> projectsSnapshot() {
        return projects.snapshot();
    }

    public Map<String, MirrorOptions> groupsSnapshot() {
        return groups.snapshot();
    }

    public int projectCount() {
        return projects.size();
    }

    public int groupCount() {
        return groups.size();
    }

    private static final class Table {
        private final Map<String, MirrorOptions> entries = new HashMap<>();
        private final Set<String> declared = new HashSet<>();
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        void put(String path, MirrorOptions options) {
            lock.writeLock().lock();
            try {
                entries.put(path, options);
                declared.add(path);
            } finally {
                lock.writeLock().unlock();
            }
        }

        boolean putIfAbsent(String path, MirrorOptions options) {
            lock.writeLock().lock();
            try {
                return entries.putIfAbsent(path, options) == null;
            } finally {
                lock.writeLock().unlock();
            }
        }

        MirrorOptions get(String path) {
            lock.readLock().lock();
            try {
                return entries.get(path);
            } finally {
                lock.readLock().unlock();
            }
        }

        boolean isDeclared(String path) {
            lock.readLock().lock();
            try {
                return declared.contains(path);
            } finally {
                lock.readLock().unlock();
            }
        }

        int size() {
            lock.readLock().lock();
            try {
                return entries.size();
            } finally {
                lock.readLock().unlock();
            }
        }

        Map<String, MirrorOptions> snapshot() {
            lock.readLock().lock();
            try {
                return Collections.unmodifiableMap(new TreeMap<>(entries));
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
