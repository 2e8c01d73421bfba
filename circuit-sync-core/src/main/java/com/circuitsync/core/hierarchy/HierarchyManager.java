package com.circuitsync.core.hierarchy;

import com.circuitsync.core.config.SyncConfig.DocumentSettings;
import com.circuitsync.core.document.ProjectDocument;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.placement.Extent;
import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;
import com.circuitsync.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps one fragment per sub-circuit instance and the {@code sheet} elements that
 * reference them.
 *
 * <p>A fragment is named after the instance's stable identity, so renaming an instance
 * only changes the sheet's {@code Sheetname}. The sheet also records the instance's
 * definition in a hidden {@code Definition} field. Removing an instance deletes its fragment
 * and every fragment below it. An instance without components is still an instance and
 * keeps its fragment.
 */
public class HierarchyManager {

    private static final Logger log = LoggerFactory.getLogger(HierarchyManager.class);

    private static final String FRAGMENT_PREFIX = "sheet_";
    private static final BigDecimal SHEET_WIDTH = new BigDecimal("25.4");
    private static final BigDecimal MIN_SHEET_HEIGHT = new BigDecimal("12.7");
    private static final BigDecimal PIN_PITCH = new BigDecimal("2.54");
    private static final int PIN_ANGLE = 180;

    private final DocumentSettings settings;

    public HierarchyManager(DocumentSettings settings) {
        this.settings = settings;
    }

    /**
     * Deterministic fragment file name for an instance identity.
     */
    public static String fragmentFileName(String identity) {
        return FRAGMENT_PREFIX + IdGenerator.generate(identity) + ProjectDocument.EXTENSION;
    }

    /**
     * Box of a new sheet with the given ports, one pin slot per port on its left edge.
     */
    public static Extent sheetExtent(int portCount) {
        BigDecimal height = PIN_PITCH.multiply(BigDecimal.valueOf(portCount + 1L)).max(MIN_SHEET_HEIGHT);
        return Extent.ofSheet(SHEET_WIDTH, height);
    }

    /**
     * Sheet pin anchors of every sheet in {@code fragment}, keyed by port endpoint.
     * Each position carries the pin's angle as rotation.
     */
    public static Map<Endpoint, Position> portAnchors(SchematicDocument fragment) {
        Map<Endpoint, Position> anchors = new LinkedHashMap<>();
        for (SList sheet : fragment.elements(SchematicElements.SHEET)) {
            String key = sheetKey(sheet);
            for (SList pin : sheet.all("pin")) {
                SchematicElements.position(pin).ifPresent(p -> anchors.put(Endpoint.port(key, pin.atomValue(1)), p));
            }
        }
        return anchors;
    }

    /**
     * Key under which a sheet's instance is known to the model.
     */
    public static String sheetKey(SList sheet) {
        String uuid = SchematicElements.uuid(sheet);
        return uuid.isEmpty()
            ? "sheet-" + SchematicElements.property(sheet, SchematicElements.SHEET_NAME).orElse("")
            : uuid;
    }

    public static Optional<SList> findSheet(SchematicDocument fragment, String key) {
        return fragment.elements(SchematicElements.SHEET).stream()
            .filter(sheet -> sheetKey(sheet).equals(key))
            .findFirst();
    }

    /**
     * Creates the fragment of an added instance and the sheet that references it.
     *
     * @param project project receiving the fragment
     * @param parent fragment receiving the sheet
     * @param instance the added instance; its identity becomes the sheet uuid
     * @param position top-left corner of the sheet
     * @param parentPath sheet path of {@code parent}, e.g. {@code /<root uuid>}
     * @return the new, empty fragment
     */
    public SchematicDocument add(ProjectDocument project, SchematicDocument parent, SubcircuitInstance instance,
                                 Position position, String parentPath) {
        String fileName = fragmentFileName(instance.identity());
        Extent extent = sheetExtent(instance.ports().size());
        List<SList> pins = new ArrayList<>();
        for (int i = 0; i < instance.ports().size(); i++) {
            String port = instance.ports().get(i);
            pins.add(SchematicElements.sheetPin(port, pinSlot(position, i), IdGenerator.uuid(instance.identity(), "port", port)));
        }
        int page = project.fragments().size() + 1;
        SList sheet = SchematicElements.sheet(position, extent.maxX(), extent.maxY(), instance.identity(),
            instance.name(), fileName, pins, project.projectName(), parentPath, page);
        parent.add(SchematicElements.withProperty(sheet, SchematicElements.SHEET_DEFINITION, instance.definition()));

        SchematicDocument fragment = project.fragment(fileName).orElseGet(() -> {
            SchematicDocument created = SchematicDocument.create(fileName, parent.version(), settings.generator(),
                instance.identity(), settings.paper(), false);
            project.addFragment(created);
            return created;
        });
        log.info("Added sub-circuit {} as {}", instance.name(), fileName);
        return fragment;
    }

    /**
     * Applies a rename, a definition change and port changes to an existing sheet.
     * Retained pins keep their position; new pins take the first free slot on the left
     * edge, growing the sheet when it is full.
     */
    public void update(SchematicDocument parent, SubcircuitInstance current, SubcircuitInstance desired) {
        SList sheet = findSheet(parent, current.key())
            .orElseThrow(() -> new IllegalStateException("Sheet " + current.key() + " not found in " + parent.fileName()));
        SList updated = SchematicElements.withProperty(sheet, SchematicElements.SHEET_NAME, desired.name());
        updated = SchematicElements.withProperty(updated, SchematicElements.SHEET_DEFINITION, desired.definition());

        Position origin = SchematicElements.position(sheet).orElse(Position.at(BigDecimal.ZERO, BigDecimal.ZERO));
        BigDecimal[] size = SchematicElements.sheetSize(sheet);
        Map<String, SList> existing = new LinkedHashMap<>();
        for (SList pin : sheet.all("pin")) {
            existing.put(pin.atomValue(1), pin);
        }
        Set<BigDecimal> usedY = new HashSet<>();
        for (SList pin : existing.values()) {
            if (desired.ports().contains(pin.atomValue(1))) {
                SchematicElements.position(pin).ifPresent(p -> usedY.add(p.y().stripTrailingZeros()));
            }
        }

        List<SList> pins = new ArrayList<>();
        for (String port : desired.ports()) {
            SList pin = existing.get(port);
            if (pin == null) {
                int slot = 0;
                while (usedY.contains(pinSlot(origin, slot).y().stripTrailingZeros())) {
                    slot++;
                }
                Position anchor = pinSlot(origin, slot);
                usedY.add(anchor.y().stripTrailingZeros());
                pin = SchematicElements.sheetPin(port, anchor, IdGenerator.uuid(current.key(), "port", port));
                BigDecimal needed = anchor.y().subtract(origin.y()).add(PIN_PITCH);
                if (needed.compareTo(size[1]) > 0) {
                    size[1] = needed;
                }
            }
            pins.add(pin);
        }
        updated = SchematicElements.withSheetPins(updated, pins);
        updated = updated.withFirst("size", SList.of("size",
            SAtom.number(size[0]), SAtom.number(size[1])));
        if (!updated.equals(sheet)) {
            parent.replace(sheet, updated);
            log.info("Updated sub-circuit {} ({})", desired.name(), current.fileName());
        }
    }

    /**
     * Removes an instance's sheet, its fragment and every fragment below it.
     */
    public void remove(ProjectDocument project, SchematicDocument parent, SubcircuitInstance instance) {
        findSheet(parent, instance.key()).ifPresent(parent::remove);
        removeFragments(project, instance);
        log.info("Removed sub-circuit {} ({})", instance.name(), instance.fileName());
    }

    private static void removeFragments(ProjectDocument project, SubcircuitInstance instance) {
        for (SubcircuitInstance child : instance.body().instances()) {
            removeFragments(project, child);
        }
        if (instance.fileName() != null && !instance.fileName().isEmpty()) {
            project.removeFragment(instance.fileName());
        }
    }

    private static Position pinSlot(Position sheetOrigin, int index) {
        BigDecimal y = sheetOrigin.y().add(PIN_PITCH.multiply(BigDecimal.valueOf(index + 1L)));
        return new Position(sheetOrigin.x(), y, PIN_ANGLE, null);
    }
}
