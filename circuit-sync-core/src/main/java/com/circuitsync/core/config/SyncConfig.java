package com.circuitsync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Root configuration of a synchronization run.
 *
 * <p>Loaded from {@code circuitsync.yaml}. Every section and every field is optional;
 * missing values fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * placement:
 *   grid: 1.27
 *   clearance: 2.54
 *   originX: 25.4
 *   originY: 25.4
 *   sweepWidth: 254
 *   searchLimit: 400
 *
 * document:
 *   version: 20231120
 *   paper: "A4"
 *   generator: "circuit-sync"
 *
 * library:
 *   paths:
 *     - "/usr/share/kicad/symbols"
 *
 * sync:
 *   projectName: "amplifier"
 *   preserveUserComponents: false
 * }</pre>
 *
 * @param placement placement engine settings
 * @param document settings for newly created fragments
 * @param library symbol library settings
 * @param sync run behaviour
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncConfig(
    @JsonProperty("placement") PlacementSettings placement,
    @JsonProperty("document") DocumentSettings document,
    @JsonProperty("library") LibrarySettings library,
    @JsonProperty("sync") SyncSettings sync
) {
    public SyncConfig {
        if (placement == null) {
            placement = PlacementSettings.defaults();
        }
        if (document == null) {
            document = DocumentSettings.defaults();
        }
        if (library == null) {
            library = new LibrarySettings(List.of());
        }
        if (sync == null) {
            sync = SyncSettings.defaults();
        }
    }

    /**
     * @return configuration with every default applied
     */
    public static SyncConfig defaults() {
        return new SyncConfig(null, null, null, null);
    }

    /**
     * Placement engine settings. Lengths are millimetres.
     *
     * @param grid grid pitch every placed position snaps to
     * @param clearance minimum gap kept around every bounding box
     * @param originX x of the first sweep slot
     * @param originY y of the first sweep slot
     * @param sweepWidth width of a sweep row before wrapping
     * @param searchLimit maximum rings of the locality spiral and rows of the sweep
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlacementSettings(
        @JsonProperty("grid") BigDecimal grid,
        @JsonProperty("clearance") BigDecimal clearance,
        @JsonProperty("originX") BigDecimal originX,
        @JsonProperty("originY") BigDecimal originY,
        @JsonProperty("sweepWidth") BigDecimal sweepWidth,
        @JsonProperty("searchLimit") Integer searchLimit
    ) {
        public PlacementSettings {
            if (grid == null || grid.signum() <= 0) {
                grid = new BigDecimal("1.27");
            }
            if (clearance == null || clearance.signum() < 0) {
                clearance = new BigDecimal("2.54");
            }
            if (originX == null) {
                originX = new BigDecimal("25.4");
            }
            if (originY == null) {
                originY = new BigDecimal("25.4");
            }
            if (sweepWidth == null || sweepWidth.signum() <= 0) {
                sweepWidth = new BigDecimal("254");
            }
            if (searchLimit == null || searchLimit <= 0) {
                searchLimit = 400;
            }
        }

        public static PlacementSettings defaults() {
            return new PlacementSettings(null, null, null, null, null, null);
        }
    }

    /**
     * Header values of fragments this tool creates.
     *
     * @param version format version written into new fragments
     * @param paper paper size
     * @param generator generator name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentSettings(
        @JsonProperty("version") Integer version,
        @JsonProperty("paper") String paper,
        @JsonProperty("generator") String generator
    ) {
        public DocumentSettings {
            if (version == null) {
                version = 20231120;
            }
            if (paper == null || paper.isBlank()) {
                paper = "A4";
            }
            if (generator == null || generator.isBlank()) {
                generator = "circuit-sync";
            }
        }

        public static DocumentSettings defaults() {
            return new DocumentSettings(null, null, null);
        }
    }

    /**
     * @param paths directories or {@code .kicad_sym} files searched for symbol definitions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LibrarySettings(
        @JsonProperty("paths") List<String> paths
    ) {
        public LibrarySettings {
            paths = paths == null ? List.of() : List.copyOf(paths);
        }
    }

    /**
     * @param projectName base name of the root fragment; the project directory name when absent
     * @param preserveUserComponents keep components that exist only in the document
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SyncSettings(
        @JsonProperty("projectName") String projectName,
        @JsonProperty("preserveUserComponents") Boolean preserveUserComponents
    ) {
        public SyncSettings {
            if (preserveUserComponents == null) {
                preserveUserComponents = Boolean.FALSE;
            }
        }

        public static SyncSettings defaults() {
            return new SyncSettings(null, false);
        }
    }
}
