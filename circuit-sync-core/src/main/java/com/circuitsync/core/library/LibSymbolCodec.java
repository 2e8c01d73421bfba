package com.circuitsync.core.library;

import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.model.Pin;
import com.circuitsync.core.model.PinType;
import com.circuitsync.core.sexpr.AtomKind;
import com.circuitsync.core.sexpr.SNode;
import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between {@code (symbol ...)} trees and {@link SymbolDefinition}s.
 *
 * <p>Pins are collected from unit sub-symbols named {@code <name>_<unit>_<style>};
 * unit 0 holds pins shared by every unit.
 */
public final class LibSymbolCodec {

    private static final Pattern UNIT_NAME = Pattern.compile(".*_(\\d+)_(\\d+)$");

    private LibSymbolCodec() {
        // Utility class
    }

    /**
     * Reads the pins and properties of unit 1 of {@code symbol}.
     *
     * @param symbol a {@code (symbol "name" ...)} tree
     * @param typeId id the definition is registered under
     * @return definition whose embedded tree is {@code symbol} renamed to {@code typeId}
     */
    public static SymbolDefinition read(SList symbol, String typeId) {
        return new SymbolDefinition(typeId, readPins(symbol, 1), readProperties(symbol), rename(symbol, typeId));
    }

    /**
     * Pins of {@code unit}, plus common pins, first occurrence of a number wins.
     */
    public static List<Pin> readPins(SList symbol, int unit) {
        Map<String, Pin> pins = new LinkedHashMap<>();
        collectPins(symbol, unit, pins);
        return List.copyOf(pins.values());
    }

    private static void collectPins(SList symbol, int unit, Map<String, Pin> into) {
        for (SList pin : symbol.all("pin")) {
            Pin parsed = readPin(pin);
            into.putIfAbsent(parsed.number(), parsed);
        }
        for (SList sub : symbol.all("symbol")) {
            Matcher m = UNIT_NAME.matcher(sub.atomValue(1));
            int subUnit = m.matches() ? Integer.parseInt(m.group(1)) : 0;
            if (subUnit == 0 || subUnit == unit) {
                collectPins(sub, unit, into);
            }
        }
    }

    private static Pin readPin(SList pin) {
        PinType type = PinType.fromToken(pin.atomValue(1));
        BigDecimal x = BigDecimal.ZERO;
        BigDecimal y = BigDecimal.ZERO;
        int angle = 0;
        SList at = pin.first("at").orElse(null);
        if (at != null) {
            x = at.decimal(1);
            y = at.decimal(2);
            angle = at.size() > 3 ? at.decimal(3).intValue() : 0;
        }
        String name = pin.first("name").map(n -> n.atomValue(1)).filter(n -> !n.equals("~")).orElse("");
        String number = pin.first("number").map(n -> n.atomValue(1)).orElse("");
        return new Pin(number, name, type, x, y, angle);
    }

    /**
     * Property name to value map of a symbol, in document order.
     */
    public static Map<String, String> readProperties(SList symbol) {
        Map<String, String> properties = new LinkedHashMap<>();
        for (SList property : symbol.all("property")) {
            properties.put(property.atomValue(1), property.atomValue(2));
        }
        return properties;
    }

    /**
     * Copy of {@code symbol} whose name atom is {@code name}.
     */
    public static SList rename(SList symbol, String name) {
        return symbol.withChild(1, SAtom.string(name));
    }

    /**
     * Builds a minimal embeddable symbol for a definition that has no source tree.
     */
    public static SList synthesize(String typeId, List<Pin> pins, Map<String, String> properties) {
        String shortName = typeId.contains(":") ? typeId.substring(typeId.indexOf(':') + 1) : typeId;
        List<SNode> children = new ArrayList<>();
        children.add(SAtom.string(typeId));
        children.add(SList.of("exclude_from_sim", SAtom.symbol("no")));
        children.add(SList.of("in_bom", SAtom.symbol("yes")));
        children.add(SList.of("on_board", SAtom.symbol("yes")));
        Map<String, String> props = new LinkedHashMap<>();
        props.put("Reference", properties.getOrDefault("Reference", "U"));
        props.put("Value", properties.getOrDefault("Value", shortName));
        properties.forEach(props::putIfAbsent);
        props.forEach((name, value) -> children.add(SList.of("property",
            SAtom.string(name), SAtom.string(value),
            SchematicElements.at(BigDecimal.ZERO, BigDecimal.ZERO, 0),
            SchematicElements.effects(!name.equals("Reference") && !name.equals("Value")))));

        List<SNode> unit = new ArrayList<>();
        unit.add(SAtom.string(shortName + "_1_1"));
        for (Pin pin : pins) {
            unit.add(SList.of("pin",
                SAtom.symbol(pin.type().token()),
                SAtom.symbol("line"),
                SchematicElements.at(pin.offsetX(), pin.offsetY(), pin.angle()),
                SList.of("length", SAtom.number(new BigDecimal("1.27"))),
                SList.of("name", SAtom.string(pin.name().isEmpty() ? "~" : pin.name()), SchematicElements.effects(false)),
                SList.of("number", SAtom.string(pin.number()), SchematicElements.effects(false))));
        }
        children.add(SList.of("symbol", unit));
        return SList.of("symbol", children);
    }

    /**
     * @return true when the list is a symbol declaration (its name is a string)
     */
    static boolean isSymbol(SNode node) {
        return node instanceof SList list && list.isHead("symbol") && list.size() > 1
            && list.get(1) instanceof SAtom atom && atom.kind() == AtomKind.STRING;
    }
}
