package com.circuitsync.core.document;

import com.circuitsync.core.sexpr.DocumentFormatException;
import com.circuitsync.core.sexpr.SExpressionParser;
import com.circuitsync.core.sexpr.SExpressionWriter;
import com.circuitsync.core.sexpr.SNode;
import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One schematic fragment (one sheet) held as its top-level element list.
 *
 * <p>Symbols, labels, sheets and the embedded symbol library have typed accessors.
 * Every other element (wires, junctions, text, graphics, unknown future kinds) is
 * carried along untouched and keeps its position in the element order.
 *
 * <p>Edits mark the document dirty. A document that was never edited serializes
 * nowhere; a dirty one is written in canonical layout.
 */
public final class SchematicDocument {

    private static final String ROOT_HEAD = "kicad_sch";
    private static final Set<String> TRAILING_SECTIONS = Set.of("sheet_instances", "symbol_instances", "embedded_fonts");

    private final String fileName;
    private final List<SNode> elements;
    private String originalText;
    private boolean dirty;

    private SchematicDocument(String fileName, List<SNode> elements, String originalText) {
        this.fileName = fileName;
        this.elements = elements;
        this.originalText = originalText;
        this.dirty = originalText == null;
    }

    /**
     * Parses a fragment.
     *
     * @param fileName fragment file name, used in error messages
     * @param text file content
     * @return the parsed fragment
     * @throws DocumentFormatException when the text is malformed, is not a schematic or
     *     carries an unsupported version
     */
    public static SchematicDocument parse(String fileName, String text) {
        SList root = SExpressionParser.parseSingle(text, fileName);
        if (!root.isHead(ROOT_HEAD)) {
            throw new DocumentFormatException(fileName, "Not a schematic: top-level element is '" + root.head() + "'");
        }
        SList version = root.first("version")
            .orElseThrow(() -> new DocumentFormatException(fileName, "Missing (version N) header"));
        int number;
        try {
            number = version.decimal(1).intValueExact();
        } catch (IllegalStateException | ArithmeticException e) {
            throw new DocumentFormatException(fileName, "Invalid version header: " + SExpressionWriter.writeInline(version));
        }
        FormatVersion.requireSupported(number, fileName);
        return new SchematicDocument(fileName, new ArrayList<>(root.children().subList(1, root.size())), text);
    }

    /**
     * Creates an empty fragment. Root fragments also carry the sheet instance table.
     */
    public static SchematicDocument create(String fileName, int version, String generator, String uuid,
                                           String paper, boolean root) {
        List<SNode> elements = new ArrayList<>();
        elements.add(SList.of("version", SAtom.number(version)));
        elements.add(SList.of("generator", SAtom.string(generator)));
        elements.add(SList.of("uuid", SAtom.string(uuid)));
        elements.add(SList.of("paper", SAtom.string(paper)));
        elements.add(SList.of("lib_symbols"));
        if (root) {
            elements.add(SList.of("sheet_instances",
                SList.of("path", SAtom.string("/"), SList.of("page", SAtom.string("1")))));
        }
        return new SchematicDocument(fileName, elements, null);
    }

    public String fileName() {
        return fileName;
    }

    public int version() {
        return first("version").map(v -> v.decimal(1).intValue()).orElse(FormatVersion.MINIMUM);
    }

    public String uuid() {
        return first("uuid").map(u -> u.atomValue(1)).orElse("");
    }

    public List<SNode> elements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Top-level elements with the given head, in document order.
     */
    public List<SList> elements(String head) {
        List<SList> result = new ArrayList<>();
        for (SNode node : elements) {
            if (node instanceof SList list && list.isHead(head)) {
                result.add(list);
            }
        }
        return result;
    }

    public Optional<SList> first(String head) {
        for (SNode node : elements) {
            if (node instanceof SList list && list.isHead(head)) {
                return Optional.of(list);
            }
        }
        return Optional.empty();
    }

    /**
     * Adds a top-level element after the last element with the same head, or before the
     * trailing instance tables when there is none.
     */
    public void add(SList element) {
        int lastSame = -1;
        int trailing = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof SList list) {
                if (list.isHead(element.head())) {
                    lastSame = i;
                } else if (trailing < 0 && TRAILING_SECTIONS.contains(list.head())) {
                    trailing = i;
                }
            }
        }
        int index = lastSame >= 0 ? lastSame + 1 : (trailing >= 0 ? trailing : elements.size());
        elements.add(index, element);
        dirty = true;
    }

    /**
     * Removes the given element instance.
     *
     * @return true when it was present
     */
    public boolean remove(SList element) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == element) {
                elements.remove(i);
                dirty = true;
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the given element instance in place.
     *
     * @throws IllegalArgumentException when {@code existing} is not part of this document
     */
    public void replace(SList existing, SList replacement) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == existing) {
                if (!existing.equals(replacement)) {
                    elements.set(i, replacement);
                    dirty = true;
                }
                return;
            }
        }
        throw new IllegalArgumentException("Element not found in " + fileName + ": " + existing.head());
    }

    /**
     * Embedded library symbol with the given id, if any.
     */
    public Optional<SList> libSymbol(String libId) {
        return first(SchematicElements.LIB_SYMBOLS)
            .flatMap(libs -> libs.all("symbol").stream().filter(s -> s.atomValue(1).equals(libId)).findFirst());
    }

    public List<SList> libSymbols() {
        return first(SchematicElements.LIB_SYMBOLS).map(libs -> libs.all("symbol")).orElse(List.of());
    }

    /**
     * Adds {@code symbol} to {@code lib_symbols} unless a symbol with its name is present.
     *
     * @return true when the symbol was added
     */
    public boolean embedLibSymbol(SList symbol) {
        String name = symbol.atomValue(1);
        if (libSymbol(name).isPresent()) {
            return false;
        }
        Optional<SList> libs = first(SchematicElements.LIB_SYMBOLS);
        if (libs.isPresent()) {
            replace(libs.get(), libs.get().append(symbol));
        } else {
            int paper = -1;
            for (int i = 0; i < elements.size(); i++) {
                if (elements.get(i) instanceof SList list && (list.isHead("paper") || list.isHead("title_block"))) {
                    paper = i;
                }
            }
            elements.add(paper + 1, SList.of(SchematicElements.LIB_SYMBOLS, symbol));
            dirty = true;
        }
        return true;
    }

    public SList toTree() {
        List<SNode> children = new ArrayList<>(elements.size() + 1);
        children.add(SAtom.symbol(ROOT_HEAD));
        children.addAll(elements);
        return new SList(children);
    }

    public String serialize() {
        return SExpressionWriter.write(toTree());
    }

    /**
     * @return true when this fragment has not been saved yet
     */
    public boolean isNew() {
        return originalText == null;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * @return true when the fragment must be written: new, or edited to different text
     */
    public boolean needsWrite() {
        return dirty && (originalText == null || !serialize().equals(originalText));
    }

    /**
     * Records {@code text} as the saved state after a successful write.
     */
    void markSaved(String text) {
        this.originalText = text;
        this.dirty = false;
    }
}
