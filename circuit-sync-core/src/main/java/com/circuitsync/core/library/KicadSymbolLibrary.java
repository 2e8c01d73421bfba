package com.circuitsync.core.library;

import com.circuitsync.core.sexpr.DocumentFormatException;
import com.circuitsync.core.sexpr.SExpressionParser;
import com.circuitsync.core.sexpr.SNode;
import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;
import com.circuitsync.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol library reading {@code .kicad_sym} files.
 *
 * <p>A type id {@code Lib:Name} is looked up in {@code Lib.kicad_sym} inside any of
 * the configured directories (or matching one of the configured files). Files are
 * parsed on first use. Derived symbols ({@code extends}) are flattened so the
 * embedded copy is self-contained. Unreadable or malformed files count as misses.
 */
public class KicadSymbolLibrary implements SymbolLibrary {

    private static final Logger log = LoggerFactory.getLogger(KicadSymbolLibrary.class);
    private static final String EXTENSION = ".kicad_sym";

    private final List<Path> searchPaths;
    private final Map<String, Map<String, SList>> loadedFiles = new HashMap<>();

    public KicadSymbolLibrary(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    @Override
    public Optional<SymbolDefinition> resolve(String typeId) {
        int colon = typeId.indexOf(':');
        if (colon <= 0) {
            log.debug("Type id without library nickname: {}", typeId);
            return Optional.empty();
        }
        String nickname = typeId.substring(0, colon);
        String symbolName = typeId.substring(colon + 1);

        Map<String, SList> symbols = loadedFiles.computeIfAbsent(nickname, this::loadLibrary);
        SList symbol = symbols.get(symbolName);
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.of(LibSymbolCodec.read(flatten(symbol, symbols), typeId));
    }

    private Map<String, SList> loadLibrary(String nickname) {
        for (Path candidate : candidates(nickname)) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try {
                SList root = SExpressionParser.parseSingle(Files.readString(candidate), candidate.toString());
                Map<String, SList> symbols = new LinkedHashMap<>();
                for (SNode child : root.children()) {
                    if (LibSymbolCodec.isSymbol(child)) {
                        SList symbol = (SList) child;
                        symbols.put(symbol.atomValue(1), symbol);
                    }
                }
                log.debug("Loaded {} symbols from {}", symbols.size(), candidate);
                return symbols;
            } catch (IOException e) {
                log.warn("Failed to read symbol library {}: {}", candidate, e.getMessage());
            } catch (DocumentFormatException e) {
                log.warn("Malformed symbol library {}: {}", candidate, e.getMessage());
            }
        }
        log.debug("No symbol library found for nickname: {}", nickname);
        return Map.of();
    }

    /**
     * Library files named after {@code nickname}: directly inside a configured directory
     * first, then in its subdirectories, then configured files.
     */
    private List<Path> candidates(String nickname) {
        String fileName = nickname + EXTENSION;
        List<Path> result = new ArrayList<>();
        for (Path path : searchPaths) {
            if (Files.isDirectory(path)) {
                result.add(path.resolve(fileName));
                try {
                    result.addAll(FileUtils.findFiles(path, "**/" + fileName));
                } catch (IOException e) {
                    log.warn("Failed to search symbol directory {}: {}", path, e.getMessage());
                }
            } else if (path.getFileName() != null
                && FileUtils.extension(path).equals(EXTENSION.substring(1))
                && FileUtils.baseName(path).equals(nickname)) {
                result.add(path);
            }
        }
        return result;
    }

    /**
     * Replaces an {@code (extends "Parent")} marker by the parent's unit sub-symbols,
     * renamed to the derived symbol's name.
     */
    private SList flatten(SList symbol, Map<String, SList> symbols) {
        Optional<SList> extendsMarker = symbol.first("extends");
        if (extendsMarker.isEmpty()) {
            return symbol;
        }
        String parentName = extendsMarker.get().atomValue(1);
        SList parent = symbols.get(parentName);
        if (parent == null || parent == symbol) {
            log.warn("Symbol {} extends unknown symbol {}", symbol.atomValue(1), parentName);
            return symbol.filter(child -> !(child instanceof SList list && list.isHead("extends")));
        }
        parent = flatten(parent, symbols);

        String name = symbol.atomValue(1);
        List<SNode> children = new ArrayList<>();
        for (SNode child : symbol.children()) {
            if (!(child instanceof SList list && list.isHead("extends"))) {
                children.add(child);
            }
        }
        for (SList unit : parent.all("symbol")) {
            String unitName = unit.atomValue(1);
            String renamed = unitName.startsWith(parentName)
                ? name + unitName.substring(parentName.length())
                : unitName;
            children.add(unit.withChild(1, SAtom.string(renamed)));
        }
        return new SList(children);
    }
}
