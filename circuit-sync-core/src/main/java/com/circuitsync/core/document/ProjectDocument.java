package com.circuitsync.core.document;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A project directory: the root fragment plus one fragment per sub-circuit instance,
 * keyed by file name relative to the directory.
 */
public final class ProjectDocument {

    /** File extension of schematic fragments. */
    public static final String EXTENSION = ".kicad_sch";

    private final Path directory;
    private final String projectName;
    private final Map<String, SchematicDocument> fragments = new LinkedHashMap<>();
    private final Set<String> removed = new LinkedHashSet<>();

    public ProjectDocument(Path directory, String projectName, SchematicDocument root) {
        this.directory = directory;
        this.projectName = projectName;
        fragments.put(root.fileName(), root);
    }

    public Path directory() {
        return directory;
    }

    public String projectName() {
        return projectName;
    }

    public String rootFileName() {
        return projectName + EXTENSION;
    }

    public SchematicDocument root() {
        return fragments.get(rootFileName());
    }

    public Optional<SchematicDocument> fragment(String fileName) {
        return Optional.ofNullable(fragments.get(fileName));
    }

    public Collection<SchematicDocument> fragments() {
        return Collections.unmodifiableCollection(fragments.values());
    }

    public void addFragment(SchematicDocument fragment) {
        fragments.put(fragment.fileName(), fragment);
        removed.remove(fragment.fileName());
    }

    /**
     * Drops a fragment; the file is deleted on the next write.
     */
    public void removeFragment(String fileName) {
        if (fileName.equals(rootFileName())) {
            throw new IllegalArgumentException("The root fragment cannot be removed");
        }
        if (fragments.remove(fileName) != null) {
            removed.add(fileName);
        }
    }

    public Set<String> removedFragments() {
        return Collections.unmodifiableSet(removed);
    }

    void clearRemoved() {
        removed.clear();
    }
}
