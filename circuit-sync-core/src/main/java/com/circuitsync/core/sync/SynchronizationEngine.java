package com.circuitsync.core.sync;

import com.circuitsync.core.annotation.AnchorResolver;
import com.circuitsync.core.annotation.AnnotationSynchronizer;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.description.BuildResult;
import com.circuitsync.core.description.CircuitDescription;
import com.circuitsync.core.description.DescriptionModels;
import com.circuitsync.core.description.DocumentModels;
import com.circuitsync.core.diff.ChangeKind;
import com.circuitsync.core.diff.ComponentChange;
import com.circuitsync.core.diff.DiffEngine;
import com.circuitsync.core.diff.EditPlan;
import com.circuitsync.core.diff.InstanceChange;
import com.circuitsync.core.diff.NetChange;
import com.circuitsync.core.document.ProjectDocument;
import com.circuitsync.core.document.ProjectStore;
import com.circuitsync.core.document.ProjectStore.LoadResult;
import com.circuitsync.core.document.ProjectStore.WriteResult;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.hierarchy.HierarchyManager;
import com.circuitsync.core.library.CachingSymbolLibrary;
import com.circuitsync.core.library.KicadSymbolLibrary;
import com.circuitsync.core.library.SymbolLibrary;
import com.circuitsync.core.model.BoundaryPort;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.EndpointKind;
import com.circuitsync.core.model.IdentityConflictException;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.placement.Extent;
import com.circuitsync.core.placement.PlacedEntity;
import com.circuitsync.core.placement.PlacementEngine;
import com.circuitsync.core.placement.PlacementRequest;
import com.circuitsync.core.placement.PlacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one synchronization of a circuit description into a project directory.
 *
 * <p>A run loads and parses every fragment, interprets the current model, builds the
 * desired model, diffs the two and applies the plan fragment by fragment: component
 * edits, placement of new entities, hierarchy edits and finally labels. Any fatal issue
 * ends the run before anything is written, so the files on disk stay byte-identical.
 * Runs are single-threaded; callers serialize concurrent runs on one project.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SynchronizationEngine engine = new SynchronizationEngine(ConfigLoader.load(configPath));
 * SyncReport report = engine.synchronize(description, Path.of("hardware/board"));
 * }</pre>
 */
public class SynchronizationEngine {

    private static final Logger log = LoggerFactory.getLogger(SynchronizationEngine.class);

    private final SyncConfig config;
    private final SymbolLibrary library;
    private final ProjectStore store;
    private final DiffEngine diffEngine;
    private final PlacementEngine placementEngine;
    private final HierarchyManager hierarchy;
    private final AnnotationSynchronizer annotations;

    public SynchronizationEngine(SyncConfig config) {
        this(config, new CachingSymbolLibrary(new KicadSymbolLibrary(
            config.library().paths().stream().map(Path::of).toList())));
    }

    /**
     * @param config run configuration
     * @param library symbol lookup consulted before the symbols embedded in the project
     */
    public SynchronizationEngine(SyncConfig config, SymbolLibrary library) {
        this.config = config;
        this.library = library;
        this.store = new ProjectStore(config.document());
        this.diffEngine = new DiffEngine(config.sync().preserveUserComponents());
        this.placementEngine = new PlacementEngine(config.placement());
        this.hierarchy = new HierarchyManager(config.document());
        this.annotations = new AnnotationSynchronizer();
    }

    /**
     * Brings the project in line with the description and writes the changed fragments.
     *
     * @param description desired circuit
     * @param projectDirectory directory holding the root fragment
     * @return report of the run; {@code success} is false when a fatal issue aborted it
     * @throws java.io.UncheckedIOException when writing a fragment fails
     */
    public SyncReport synchronize(CircuitDescription description, Path projectDirectory) {
        return run(description, projectDirectory, false);
    }

    /**
     * Computes the report of a run without writing anything.
     */
    public SyncReport plan(CircuitDescription description, Path projectDirectory) {
        return run(description, projectDirectory, true);
    }

    private SyncReport run(CircuitDescription description, Path projectDirectory, boolean dryRun) {
        String projectName = projectName(projectDirectory);
        log.info("Synchronizing {} into {}{}", projectName, projectDirectory, dryRun ? " (dry run)" : "");
        List<SyncIssue> issues = new ArrayList<>();

        LoadResult loaded = store.load(projectDirectory, projectName);
        issues.addAll(loaded.issues());
        if (loaded.hasErrors()) {
            log.error("Aborting: {} fragment(s) could not be parsed", loaded.issues().size());
            return SyncReport.failed(dryRun, issues);
        }
        ProjectDocument project = loaded.project();

        BuildResult current = DocumentModels.fromDocument(project);
        issues.addAll(current.issues());
        SymbolLibrary symbols = SymbolLibrary.chain(library, DocumentModels.embeddedLibrary(project));

        BuildResult desired;
        try {
            desired = DescriptionModels.fromDescription(description, symbols);
        } catch (IdentityConflictException e) {
            issues.add(SyncIssue.of(IssueKind.IDENTITY_CONFLICT, e.getIdentity(), e.getMessage()));
            log.error("Aborting: {}", e.getMessage());
            return SyncReport.failed(dryRun, issues);
        } catch (IllegalArgumentException e) {
            issues.add(SyncIssue.of(IssueKind.INVALID_DESCRIPTION, "description", e.getMessage()));
            log.error("Aborting: {}", e.getMessage());
            return SyncReport.failed(dryRun, issues);
        }
        issues.addAll(desired.issues());

        EditPlan first = diffEngine.diff(current.circuit(), desired.circuit());
        Circuit target = ReferenceAllocator.allocate(current.circuit(), desired.circuit(), first);
        EditPlan plan = diffEngine.diff(current.circuit(), target);
        reportPreserved(plan, issues);
        log.info("Plan: components {}, nets {}, instances {}",
            plan.componentCounts(), plan.netCounts(), plan.instanceCounts());

        String rootPath = "/" + project.root().uuid();
        apply(project, project.root(), plan, target, rootPath, new ComponentSynchronizer(symbols), issues);

        List<String> written;
        List<String> deleted;
        if (dryRun) {
            written = project.fragments().stream()
                .filter(SchematicDocument::needsWrite)
                .map(SchematicDocument::fileName)
                .sorted()
                .toList();
            deleted = project.removedFragments().stream().sorted().toList();
        } else {
            WriteResult result = store.write(project);
            written = result.written();
            deleted = result.deleted();
        }
        log.info("{} fragment(s) {}, {} deleted", written.size(), dryRun ? "would be written" : "written",
            deleted.size());
        return new SyncReport(true, dryRun,
            SyncReport.ChangeCounts.of(plan.componentCounts()),
            SyncReport.ChangeCounts.of(plan.netCounts()),
            SyncReport.ChangeCounts.of(plan.instanceCounts()),
            written, deleted, issues);
    }

    private String projectName(Path projectDirectory) {
        String configured = config.sync().projectName();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        Path name = projectDirectory.toAbsolutePath().normalize().getFileName();
        return name == null ? "project" : name.toString();
    }

    private static void reportPreserved(EditPlan plan, List<SyncIssue> issues) {
        for (ComponentChange change : plan.components()) {
            if (change.preserved()) {
                issues.add(SyncIssue.of(IssueKind.PRESERVED_COMPONENT, change.current().reference(),
                    "Not in the description, kept because user components are preserved"));
            }
        }
        for (InstanceChange instance : plan.instances()) {
            if (instance.kind() != ChangeKind.REMOVE) {
                reportPreserved(instance.body(), issues);
            }
        }
    }

    /**
     * Applies the plan of one namespace to its fragment, then recurses into the instances.
     */
    private void apply(ProjectDocument project, SchematicDocument fragment, EditPlan plan, Circuit desired,
                       String sheetPath, ComponentSynchronizer components, List<SyncIssue> issues) {
        for (InstanceChange change : plan.instances()) {
            if (change.kind() == ChangeKind.REMOVE) {
                hierarchy.remove(project, fragment, change.current());
            }
        }
        for (ComponentChange change : plan.components()) {
            if (change.kind() == ChangeKind.REMOVE) {
                components.remove(fragment, change.current());
            }
        }

        Map<String, Position> placed = place(fragment, plan, issues);

        Map<String, Component> targetComponents = new HashMap<>();
        Set<String> moved = new HashSet<>();
        for (ComponentChange change : plan.components()) {
            switch (change.kind()) {
                case ADD -> {
                    Component added = change.desired().withPosition(placed.get(change.desired().key()));
                    components.add(fragment, added, project.projectName(), sheetPath);
                    targetComponents.put(added.key(), added);
                }
                case UPDATE -> {
                    components.update(fragment, change);
                    targetComponents.put(change.current().key(), retained(change));
                    if (pinsMoved(change.current(), retained(change))) {
                        moved.add(change.current().key());
                    }
                }
                case KEEP -> {
                    targetComponents.put(change.current().key(), retained(change));
                    if (pinsMoved(change.current(), retained(change))) {
                        moved.add(change.current().key());
                    }
                }
                case REMOVE -> {
                    // removed above
                }
            }
        }

        Map<String, SchematicDocument> children = new HashMap<>();
        for (InstanceChange change : plan.instances()) {
            switch (change.kind()) {
                case ADD -> children.put(change.desired().key(), hierarchy.add(project, fragment, change.desired(),
                    placed.get(change.desired().key()), sheetPath));
                case UPDATE -> hierarchy.update(fragment, change.current(), change.desired());
                case KEEP, REMOVE -> {
                    // nothing on the sheet itself
                }
            }
        }

        Map<Endpoint, Position> ports = HierarchyManager.portAnchors(fragment);
        AnchorResolver anchors = endpoint -> endpoint.kind() == EndpointKind.PORT
            ? Optional.ofNullable(ports.get(endpoint))
            : Optional.ofNullable(targetComponents.get(endpoint.ownerKey()))
                .flatMap(component -> AnchorResolver.pinAnchor(component, endpoint.terminal()));
        Set<String> boundaryNets = desired.ports().stream()
            .map(BoundaryPort::internalNet)
            .collect(Collectors.toSet());
        annotations.apply(fragment, plan.nets(), boundaryNets, anchors, moved);

        for (InstanceChange change : plan.instances()) {
            if (change.kind() == ChangeKind.REMOVE) {
                continue;
            }
            SubcircuitInstance instance = change.current() != null ? change.current() : change.desired();
            SchematicDocument child = change.current() != null
                ? project.fragment(change.current().fileName()).orElse(null)
                : children.get(change.desired().key());
            if (child == null) {
                log.warn("Fragment {} of sub-circuit {} is missing, skipping its body",
                    instance.fileName(), instance.name());
                continue;
            }
            apply(project, child, change.body(), change.desired().body(), sheetPath + "/" + instance.key(),
                components, issues);
        }
    }

    /**
     * Component as it stands after the run: its document placement with the pins of the
     * described type.
     */
    private static Component retained(ComponentChange change) {
        Component current = change.current();
        if (change.desired() == null) {
            return current;
        }
        return new Component(current.key(), current.identity(), change.desired().reference(),
            change.desired().typeId(), current.properties(), current.position(), change.desired().pins());
    }

    /**
     * True when any pin of {@code after} sits elsewhere than in {@code before}, or a pin
     * appeared or disappeared.
     */
    static boolean pinsMoved(Component before, Component after) {
        Set<String> numbers = new HashSet<>();
        before.pins().forEach(pin -> numbers.add(pin.number()));
        after.pins().forEach(pin -> numbers.add(pin.number()));
        for (String number : numbers) {
            Optional<Position> was = before.pinPosition(number);
            Optional<Position> is = after.pinPosition(number);
            if (was.isPresent() != is.isPresent()) {
                return true;
            }
            if (was.isPresent() && was.get().distanceTo(is.get()) >= DocumentModels.ANCHOR_TOLERANCE_MM) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Position> place(SchematicDocument fragment, EditPlan plan, List<SyncIssue> issues) {
        List<PlacedEntity> existing = new ArrayList<>();
        List<PlacementRequest> requests = new ArrayList<>();
        for (ComponentChange change : plan.components()) {
            if (change.kind() == ChangeKind.ADD) {
                Component added = change.desired();
                requests.add(new PlacementRequest(added.key(), added.reference(),
                    Extent.ofPins(added.pins(), Position.at(BigDecimal.ZERO, BigDecimal.ZERO)),
                    neighbours(added.key(), plan.nets())));
            } else if (change.kind() != ChangeKind.REMOVE) {
                Component kept = retained(change);
                existing.add(new PlacedEntity(kept.key(), kept.position(), Extent.ofPins(kept.pins(), kept.position())));
            }
        }
        for (InstanceChange change : plan.instances()) {
            if (change.kind() == ChangeKind.ADD) {
                SubcircuitInstance added = change.desired();
                requests.add(new PlacementRequest(added.key(), added.name(),
                    HierarchyManager.sheetExtent(added.ports().size()), neighbours(added.key(), plan.nets())));
            } else if (change.kind() != ChangeKind.REMOVE) {
                SubcircuitInstance kept = change.current();
                HierarchyManager.findSheet(fragment, kept.key()).ifPresent(sheet -> {
                    BigDecimal[] size = SchematicElements.sheetSize(sheet);
                    SchematicElements.position(sheet).ifPresent(position ->
                        existing.add(new PlacedEntity(kept.key(), position, Extent.ofSheet(size[0], size[1]))));
                });
            }
        }
        if (requests.isEmpty()) {
            return Map.of();
        }
        PlacementResult result = placementEngine.place(existing, requests);
        issues.addAll(result.issues());
        return result.positions();
    }

    /**
     * Keys of the entities sharing a net with {@code key}, in net then endpoint order.
     */
    private static List<String> neighbours(String key, List<NetChange> nets) {
        Set<String> result = new LinkedHashSet<>();
        for (NetChange change : nets) {
            if (change.desired() == null) {
                continue;
            }
            List<Endpoint> endpoints = change.desired().endpoints();
            if (endpoints.stream().noneMatch(e -> e.ownerKey().equals(key))) {
                continue;
            }
            endpoints.stream()
                .map(Endpoint::ownerKey)
                .filter(owner -> !owner.equals(key))
                .forEach(result::add);
        }
        return List.copyOf(result);
    }
}
