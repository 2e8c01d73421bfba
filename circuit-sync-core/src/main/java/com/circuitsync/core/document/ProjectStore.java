package com.circuitsync.core.document;

import com.circuitsync.core.config.SyncConfig.DocumentSettings;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.sexpr.DocumentFormatException;
import com.circuitsync.core.sexpr.SExpressionParser;
import com.circuitsync.core.sexpr.SNode.SList;
import com.circuitsync.core.util.FileUtils;
import com.circuitsync.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes a project directory.
 *
 * <p>Loading starts at {@code <project>.kicad_sch} and follows {@code Sheetfile}
 * references, loading each file once. Every fragment is parsed even after a failure
 * so that all format errors are reported together.
 *
 * <p>Writing is all or nothing: every fragment that needs writing goes to a temp file
 * in the target directory first; only when all temps exist are they moved over their
 * targets. Removed fragments are deleted last.
 */
public class ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

    private final DocumentSettings settings;

    public ProjectStore(DocumentSettings settings) {
        this.settings = settings;
    }

    /**
     * Result of loading a project.
     *
     * @param project the project, null when the root fragment itself is unreadable
     * @param issues format errors of every fragment that failed to parse
     */
    public record LoadResult(ProjectDocument project, List<SyncIssue> issues) {
        public LoadResult {
            issues = List.copyOf(issues);
        }

        public boolean hasErrors() {
            return issues.stream().anyMatch(SyncIssue::isFatal);
        }
    }

    /**
     * Files touched by a write.
     *
     * @param written fragments written
     * @param deleted fragments deleted
     */
    public record WriteResult(List<String> written, List<String> deleted) {
        public WriteResult {
            written = List.copyOf(written);
            deleted = List.copyOf(deleted);
        }
    }

    /**
     * Loads a project, creating an empty in-memory root when none exists yet.
     *
     * @param directory project directory
     * @param projectName base name of the root fragment
     * @return the project and any format errors
     * @throws UncheckedIOException when an existing file cannot be read
     */
    public LoadResult load(Path directory, String projectName) {
        String rootName = projectName + ProjectDocument.EXTENSION;
        Path rootPath = directory.resolve(rootName);
        List<SyncIssue> issues = new ArrayList<>();

        SchematicDocument root;
        if (Files.exists(rootPath)) {
            try {
                root = SchematicDocument.parse(rootName, read(rootPath, rootName));
            } catch (DocumentFormatException e) {
                log.error("Cannot parse {}: {}", rootName, e.getMessage());
                issues.add(SyncIssue.of(IssueKind.FORMAT_ERROR, rootName, e.getMessage()));
                return new LoadResult(null, issues);
            }
        } else {
            log.info("No schematic at {}, starting a new project", rootPath);
            root = SchematicDocument.create(rootName, settings.version(), settings.generator(),
                IdGenerator.uuid(projectName, "root"), settings.paper(), true);
        }

        ProjectDocument project = new ProjectDocument(directory, projectName, root);
        Set<String> visited = new HashSet<>();
        visited.add(rootName);
        Deque<SchematicDocument> pending = new ArrayDeque<>();
        pending.add(root);

        while (!pending.isEmpty()) {
            SchematicDocument parent = pending.poll();
            for (SList sheet : parent.elements(SchematicElements.SHEET)) {
                String file = SchematicElements.property(sheet, SchematicElements.SHEET_FILE).orElse("");
                if (file.isEmpty() || !visited.add(file)) {
                    continue;
                }
                Path childPath = directory.resolve(file);
                if (!Files.exists(childPath)) {
                    log.warn("Sheet file {} referenced by {} does not exist, creating it", file, parent.fileName());
                    SchematicDocument child = SchematicDocument.create(file, parent.version(), settings.generator(),
                        SchematicElements.uuid(sheet), settings.paper(), false);
                    project.addFragment(child);
                    continue;
                }
                try {
                    SchematicDocument child = SchematicDocument.parse(file, read(childPath, file));
                    project.addFragment(child);
                    pending.add(child);
                } catch (DocumentFormatException e) {
                    log.error("Cannot parse {}: {}", file, e.getMessage());
                    issues.add(SyncIssue.of(IssueKind.FORMAT_ERROR, file, e.getMessage()));
                }
            }
        }

        log.info("Loaded {} fragment(s) from {}", project.fragments().size(), directory);
        return new LoadResult(project, issues);
    }

    /**
     * @throws DocumentFormatException when the file is not valid UTF-8
     */
    private static String read(Path path, String fileName) {
        try {
            return SExpressionParser.decode(Files.readAllBytes(path), fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * Writes every fragment that needs writing and deletes removed fragments.
     *
     * <p>If staging fails no target is touched. The previous content of a target stays
     * in place until its temp file is moved over it.
     *
     * @throws UncheckedIOException when a temp file cannot be written or moved
     */
    public WriteResult write(ProjectDocument project) {
        Path directory = project.directory();
        Map<SchematicDocument, String> texts = new LinkedHashMap<>();
        for (SchematicDocument fragment : project.fragments()) {
            if (fragment.needsWrite()) {
                texts.put(fragment, fragment.serialize());
            }
        }

        Map<SchematicDocument, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<SchematicDocument, String> entry : texts.entrySet()) {
                Path target = directory.resolve(entry.getKey().fileName());
                staged.put(entry.getKey(), FileUtils.stage(target, entry.getValue()));
            }
        } catch (IOException e) {
            staged.values().forEach(FileUtils::deleteQuietly);
            throw new UncheckedIOException("Failed to stage fragments in " + directory, e);
        }

        List<String> written = new ArrayList<>();
        Map<SchematicDocument, Path> unmoved = new LinkedHashMap<>(staged);
        try {
            for (Map.Entry<SchematicDocument, Path> entry : staged.entrySet()) {
                SchematicDocument fragment = entry.getKey();
                Path target = directory.resolve(fragment.fileName());
                move(entry.getValue(), target);
                unmoved.remove(fragment);
                fragment.markSaved(texts.get(fragment));
                written.add(fragment.fileName());
                log.debug("Wrote {}", target);
            }
        } catch (UncheckedIOException e) {
            log.error("Write of {} stopped after {} fragment(s), removing {} temp file(s)",
                directory, written.size(), unmoved.size());
            unmoved.values().forEach(FileUtils::deleteQuietly);
            throw e;
        }

        List<String> deleted = new ArrayList<>();
        for (String fileName : project.removedFragments()) {
            Path target = directory.resolve(fileName);
            try {
                if (Files.deleteIfExists(target)) {
                    deleted.add(fileName);
                    log.debug("Deleted {}", target);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete " + target, e);
            }
        }
        project.clearRemoved();

        log.info("Wrote {} fragment(s), deleted {}", written.size(), deleted.size());
        return new WriteResult(written, deleted);
    }

    private static void move(Path source, Path target) {
        try {
            FileUtils.replace(source, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move " + source + " to " + target, e);
        }
    }
}
