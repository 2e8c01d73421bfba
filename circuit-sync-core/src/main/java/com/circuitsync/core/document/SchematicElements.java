package com.circuitsync.core.document;

import com.circuitsync.core.model.AnnotationKind;
import com.circuitsync.core.model.Mirror;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.sexpr.SNode;
import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;
import com.circuitsync.core.util.IdGenerator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Readers and builders for schematic elements: symbols, labels, sheets and their parts.
 */
public final class SchematicElements {

    public static final String SYMBOL = "symbol";
    public static final String SHEET = "sheet";
    public static final String LIB_SYMBOLS = "lib_symbols";
    public static final String PROPERTY = "property";
    public static final String REFERENCE = "Reference";
    public static final String SHEET_NAME = "Sheetname";
    public static final String SHEET_FILE = "Sheetfile";
    /** Hidden sheet field naming the sub-circuit definition an instance was built from. */
    public static final String SHEET_DEFINITION = "Definition";

    private static final BigDecimal FONT_SIZE = new BigDecimal("1.27");

    private SchematicElements() {
        // Utility class
    }

    // ---- shared parts ----

    public static SList at(BigDecimal x, BigDecimal y, int angle) {
        return SList.of("at", SAtom.number(x), SAtom.number(y), SAtom.number(angle));
    }

    public static SList effects(boolean hidden) {
        SList font = SList.of("font", SList.of("size", SAtom.number(FONT_SIZE), SAtom.number(FONT_SIZE)));
        if (hidden) {
            return SList.of("effects", font, SList.of("hide", SAtom.symbol("yes")));
        }
        return SList.of("effects", font);
    }

    private static SList effects(String... justify) {
        SList font = SList.of("font", SList.of("size", SAtom.number(FONT_SIZE), SAtom.number(FONT_SIZE)));
        List<SNode> just = new ArrayList<>();
        for (String j : justify) {
            just.add(SAtom.symbol(j));
        }
        return SList.of("effects", font, SList.of("justify", just));
    }

    public static SList uuidNode(String uuid) {
        return SList.of("uuid", SAtom.string(uuid));
    }

    // ---- readers ----

    public static String uuid(SList element) {
        return element.first("uuid").map(u -> u.atomValue(1)).orElse("");
    }

    /**
     * Position from {@code (at x y [angle])} and {@code (mirror x|y)}.
     */
    public static Optional<Position> position(SList element) {
        Optional<SList> at = element.first("at");
        if (at.isEmpty() || at.get().size() < 3) {
            return Optional.empty();
        }
        SList a = at.get();
        int angle = a.size() > 3 ? a.decimal(3).intValue() : 0;
        Mirror mirror = element.first("mirror")
            .map(m -> switch (m.atomValue(1)) {
                case "x" -> Mirror.X;
                case "y" -> Mirror.Y;
                default -> Mirror.NONE;
            })
            .orElse(Mirror.NONE);
        return Optional.of(new Position(a.decimal(1), a.decimal(2), angle, mirror));
    }

    public static Optional<String> property(SList element, String name) {
        for (SList property : element.all(PROPERTY)) {
            if (property.atomValue(1).equals(name)) {
                return Optional.of(property.atomValue(2));
            }
        }
        return Optional.empty();
    }

    /**
     * All properties of an element in document order.
     */
    public static Map<String, String> properties(SList element) {
        Map<String, String> result = new LinkedHashMap<>();
        for (SList property : element.all(PROPERTY)) {
            result.put(property.atomValue(1), property.atomValue(2));
        }
        return result;
    }

    public static String libId(SList symbol) {
        return symbol.first("lib_id").map(l -> l.atomValue(1)).orElse("");
    }

    public static int unit(SList symbol) {
        return symbol.first("unit").map(u -> u.decimal(1).intValue()).orElse(1);
    }

    /**
     * @return true for power symbols ({@code #PWR} references), which are not circuit components
     */
    public static boolean isPowerSymbol(SList symbol) {
        return property(symbol, REFERENCE).map(r -> r.startsWith("#")).orElse(false);
    }

    // ---- edits ----

    /**
     * Sets a property value in place, or adds a hidden property at the element's anchor.
     */
    public static SList withProperty(SList element, String name, String value) {
        List<SNode> children = new ArrayList<>(element.children());
        int lastProperty = -1;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof SList list && list.isHead(PROPERTY)) {
                lastProperty = i;
                if (list.atomValue(1).equals(name)) {
                    if (list.atomValue(2).equals(value)) {
                        return element;
                    }
                    children.set(i, list.withChild(2, SAtom.string(value)));
                    return new SList(children);
                }
            }
        }
        Position anchor = position(element).orElse(Position.at(BigDecimal.ZERO, BigDecimal.ZERO));
        SList property = SList.of(PROPERTY, SAtom.string(name), SAtom.string(value),
            at(anchor.x(), anchor.y(), 0), effects(true));
        children.add(lastProperty >= 0 ? lastProperty + 1 : children.size(), property);
        return new SList(children);
    }

    public static SList withoutProperty(SList element, String name) {
        return element.filter(child -> !(child instanceof SList list
            && list.isHead(PROPERTY) && list.atomValue(1).equals(name)));
    }

    /**
     * Sets the Reference property and every {@code (reference ...)} inside the
     * symbol's instance paths.
     */
    public static SList withReference(SList symbol, String reference) {
        SList updated = withProperty(symbol, REFERENCE, reference);
        Optional<SList> instances = updated.first("instances");
        if (instances.isEmpty()) {
            return updated;
        }
        return updated.withFirst("instances", (SList) replaceReferences(instances.get(), reference));
    }

    private static SNode replaceReferences(SNode node, String reference) {
        if (!(node instanceof SList list)) {
            return node;
        }
        if (list.isHead("reference")) {
            return SList.of("reference", SAtom.string(reference));
        }
        List<SNode> children = new ArrayList<>(list.size());
        for (SNode child : list.children()) {
            children.add(replaceReferences(child, reference));
        }
        return new SList(children);
    }

    public static SList withLibId(SList symbol, String libId) {
        return symbol.withFirst("lib_id", SList.of("lib_id", SAtom.string(libId)));
    }

    // ---- builders ----

    /**
     * Builds a placed symbol with its properties, pin uuids and instance path.
     *
     * @param libId library id
     * @param position placement
     * @param uuid stable identity
     * @param reference reference label
     * @param properties remaining properties; Value first when present
     * @param pinNumbers pin numbers, each receiving a derived uuid
     * @param projectName project name of the instance path
     * @param instancePath sheet path such as {@code /<root uuid>}
     */
    public static SList symbol(
        String libId,
        Position position,
        String uuid,
        String reference,
        Map<String, String> properties,
        List<String> pinNumbers,
        String projectName,
        String instancePath
    ) {
        List<SNode> children = new ArrayList<>();
        children.add(SList.of("lib_id", SAtom.string(libId)));
        children.add(at(position.x(), position.y(), position.rotation()));
        if (position.mirror() != Mirror.NONE) {
            children.add(SList.of("mirror", SAtom.symbol(position.mirror() == Mirror.X ? "x" : "y")));
        }
        children.add(SList.of("unit", SAtom.number(1)));
        children.add(SList.of("exclude_from_sim", SAtom.symbol("no")));
        children.add(SList.of("in_bom", SAtom.symbol("yes")));
        children.add(SList.of("on_board", SAtom.symbol("yes")));
        children.add(SList.of("dnp", SAtom.symbol("no")));
        children.add(uuidNode(uuid));

        BigDecimal labelOffset = new BigDecimal("2.54");
        children.add(SList.of(PROPERTY, SAtom.string(REFERENCE), SAtom.string(reference),
            at(position.x(), position.y().subtract(labelOffset), 0), effects(false)));
        for (Map.Entry<String, String> property : orderedProperties(properties).entrySet()) {
            boolean visible = property.getKey().equals("Value");
            BigDecimal y = visible ? position.y().add(labelOffset) : position.y();
            children.add(SList.of(PROPERTY, SAtom.string(property.getKey()), SAtom.string(property.getValue()),
                at(position.x(), y, 0), effects(!visible)));
        }
        for (String number : pinNumbers) {
            children.add(SList.of("pin", SAtom.string(number),
                uuidNode(IdGenerator.uuid(uuid, "pin", number))));
        }
        children.add(SList.of("instances",
            SList.of("project", SAtom.string(projectName),
                SList.of("path", SAtom.string(instancePath),
                    SList.of("reference", SAtom.string(reference)),
                    SList.of("unit", SAtom.number(1))))));
        return SList.of(SYMBOL, children);
    }

    private static Map<String, String> orderedProperties(Map<String, String> properties) {
        Map<String, String> ordered = new LinkedHashMap<>();
        if (properties.containsKey("Value")) {
            ordered.put("Value", properties.get("Value"));
        }
        properties.keySet().stream().sorted()
            .filter(k -> !k.equals("Value") && !k.equals(REFERENCE))
            .forEach(k -> ordered.put(k, properties.get(k)));
        return ordered;
    }

    /**
     * Builds a label element of the given kind anchored at {@code anchor}.
     */
    public static SList label(AnnotationKind kind, String text, Position anchor, String uuid) {
        SList at = at(anchor.x(), anchor.y(), anchor.rotation());
        boolean flipped = anchor.rotation() == 180 || anchor.rotation() == 270;
        return switch (kind) {
            case LOCAL_LABEL -> SList.of(kind.element(), SAtom.string(text), at,
                SList.of("fields_autoplaced", SAtom.symbol("yes")),
                effects(flipped ? "right" : "left", "bottom"), uuidNode(uuid));
            case GLOBAL_LABEL -> SList.of(kind.element(), SAtom.string(text),
                SList.of("shape", SAtom.symbol("passive")), at,
                SList.of("fields_autoplaced", SAtom.symbol("yes")),
                effects(flipped ? "right" : "left"), uuidNode(uuid));
            case HIERARCHICAL_LABEL -> SList.of(kind.element(), SAtom.string(text),
                SList.of("shape", SAtom.symbol("bidirectional")), at,
                effects(flipped ? "right" : "left"), uuidNode(uuid));
            case SHEET_PIN -> sheetPin(text, anchor, uuid);
        };
    }

    public static SList sheetPin(String name, Position anchor, String uuid) {
        return SList.of("pin", SAtom.string(name), SAtom.symbol("bidirectional"),
            at(anchor.x(), anchor.y(), anchor.rotation()),
            effects(anchor.rotation() == 180 ? "left" : "right"), uuidNode(uuid));
    }

    /**
     * Builds a sheet element referencing a child fragment.
     */
    public static SList sheet(
        Position position,
        BigDecimal width,
        BigDecimal height,
        String uuid,
        String sheetName,
        String sheetFile,
        List<SList> pins,
        String projectName,
        String parentPath,
        int page
    ) {
        List<SNode> children = new ArrayList<>();
        children.add(SList.of("at", SAtom.number(position.x()), SAtom.number(position.y())));
        children.add(SList.of("size", SAtom.number(width), SAtom.number(height)));
        children.add(SList.of("fields_autoplaced", SAtom.symbol("yes")));
        children.add(SList.of("stroke", SList.of("width", SAtom.number(new BigDecimal("0.1524"))),
            SList.of("type", SAtom.symbol("solid"))));
        children.add(SList.of("fill", SList.of("color", SAtom.number(0), SAtom.number(0), SAtom.number(0),
            SAtom.number(0))));
        children.add(uuidNode(uuid));
        children.add(SList.of(PROPERTY, SAtom.string(SHEET_NAME), SAtom.string(sheetName),
            at(position.x(), position.y().subtract(new BigDecimal("0.7116")), 0),
            effects("left", "bottom")));
        children.add(SList.of(PROPERTY, SAtom.string(SHEET_FILE), SAtom.string(sheetFile),
            at(position.x(), position.y().add(height).add(new BigDecimal("0.5846")), 0),
            effects("left", "top")));
        children.addAll(pins);
        children.add(SList.of("instances",
            SList.of("project", SAtom.string(projectName),
                SList.of("path", SAtom.string(parentPath), SList.of("page", SAtom.string(Integer.toString(page)))))));
        return SList.of(SHEET, children);
    }

    /**
     * Sheet size from {@code (size w h)}.
     */
    public static BigDecimal[] sheetSize(SList sheet) {
        return sheet.first("size")
            .map(s -> new BigDecimal[] {s.decimal(1), s.decimal(2)})
            .orElse(new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
    }

    public static SList withSheetPins(SList sheet, List<SList> pins) {
        List<SNode> children = new ArrayList<>();
        int insertAt = -1;
        for (SNode child : sheet.children()) {
            if (child instanceof SList list && list.isHead("pin")) {
                if (insertAt < 0) {
                    insertAt = children.size();
                }
                continue;
            }
            children.add(child);
        }
        if (insertAt < 0) {
            insertAt = children.size();
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) instanceof SList list && list.isHead("instances")) {
                    insertAt = i;
                    break;
                }
            }
        }
        children.addAll(insertAt, pins);
        return new SList(children);
    }
}
