package com.circuitsync.core.sync;

import com.circuitsync.core.diff.ComponentChange;
import com.circuitsync.core.diff.PropertyPatch;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.library.SymbolDefinition;
import com.circuitsync.core.library.SymbolLibrary;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Pin;
import com.circuitsync.core.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies component changes to the {@code symbol} elements of one fragment.
 *
 * <p>Updates rewrite only what the patch names, so properties the description does not
 * mention, the placement and any unknown fields of the element are left alone.
 */
public class ComponentSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ComponentSynchronizer.class);

    private static final String VALUE = "Value";
    private static final String LIBRARY_ONLY_PREFIX = "ki_";

    private final SymbolLibrary library;

    public ComponentSynchronizer(SymbolLibrary library) {
        this.library = library;
    }

    /**
     * Adds a placed component and embeds its library symbol.
     *
     * @param fragment target fragment
     * @param component desired component with its assigned position
     * @param projectName project name of the instance path
     * @param sheetPath sheet path of {@code fragment}
     */
    public void add(SchematicDocument fragment, Component component, String projectName, String sheetPath) {
        SymbolDefinition definition = library.resolve(component.typeId())
            .orElseGet(() -> SymbolDefinition.of(component.typeId(), component.pins()));
        fragment.embedLibSymbol(definition.librarySymbol());

        Map<String, String> properties = new LinkedHashMap<>();
        definition.properties().forEach((name, value) -> {
            if (!name.equals(SchematicElements.REFERENCE) && !name.startsWith(LIBRARY_ONLY_PREFIX)) {
                properties.put(name, value);
            }
        });
        properties.putIfAbsent(VALUE, shortName(component.typeId()));
        component.properties().forEach((name, value) -> {
            if (value.isEmpty()) {
                properties.remove(name);
            } else {
                properties.put(name, value);
            }
        });
        List<String> pinNumbers = component.pins().stream().map(Pin::number).toList();
        fragment.add(SchematicElements.symbol(component.typeId(), component.position(), component.identity(),
            component.reference(), properties, pinNumbers, projectName, sheetPath));
        log.debug("Added {} ({}) at {},{}", component.reference(), component.typeId(),
            component.position().x(), component.position().y());
    }

    /**
     * Applies the attribute patch of an UPDATE in place.
     */
    public void update(SchematicDocument fragment, ComponentChange change) {
        Component current = change.current();
        SList symbol = find(fragment, current)
            .orElseThrow(() -> new IllegalStateException(
                "Symbol " + current.reference() + " not found in " + fragment.fileName()));
        PropertyPatch patch = change.patch();
        SList updated = symbol;
        if (patch.reference() != null) {
            updated = SchematicElements.withReference(updated, patch.reference());
        }
        if (patch.typeId() != null) {
            SymbolDefinition definition = library.resolve(patch.typeId())
                .orElseGet(() -> SymbolDefinition.of(patch.typeId(), change.desired().pins()));
            fragment.embedLibSymbol(definition.librarySymbol());
            updated = SchematicElements.withLibId(updated, patch.typeId());
        }
        for (Map.Entry<String, String> property : patch.set().entrySet()) {
            updated = SchematicElements.withProperty(updated, property.getKey(), property.getValue());
        }
        for (String property : patch.removed()) {
            updated = SchematicElements.withoutProperty(updated, property);
        }
        fragment.replace(symbol, updated);
        log.debug("Updated {}: {}", current.reference(), patch);
    }

    public void remove(SchematicDocument fragment, Component component) {
        Optional<SList> symbol = find(fragment, component);
        if (symbol.isPresent()) {
            fragment.remove(symbol.get());
            log.debug("Removed {}", component.reference());
        } else {
            log.warn("Symbol {} already absent from {}", component.reference(), fragment.fileName());
        }
    }

    private static String shortName(String typeId) {
        int colon = typeId.indexOf(':');
        return colon >= 0 ? typeId.substring(colon + 1) : typeId;
    }

    /**
     * Finds a component's symbol element by uuid, or by reference and type for symbols
     * without one.
     */
    static Optional<SList> find(SchematicDocument fragment, Component component) {
        for (SList symbol : fragment.elements(SchematicElements.SYMBOL)) {
            if (component.identity() != null) {
                if (component.identity().equals(SchematicElements.uuid(symbol))) {
                    return Optional.of(symbol);
                }
            } else if (SchematicElements.uuid(symbol).isEmpty()
                && component.reference().equals(SchematicElements.property(symbol, SchematicElements.REFERENCE).orElse(""))
                && component.typeId().equals(SchematicElements.libId(symbol))) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }
}
