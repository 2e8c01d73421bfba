package com.circuitsync.core.document;

import com.circuitsync.core.sexpr.DocumentFormatException;

/**
 * Schematic format versions, as written in the {@code (version N)} header.
 */
public final class FormatVersion {

    /** KiCad 7. */
    public static final int KICAD_7 = 20230121;

    /** KiCad 8. */
    public static final int KICAD_8 = 20231120;

    /** KiCad 9. */
    public static final int KICAD_9 = 20250114;

    /** Oldest version this tool reads and writes. */
    public static final int MINIMUM = KICAD_7;

    private FormatVersion() {
        // Constants
    }

    /**
     * @throws DocumentFormatException when {@code version} predates {@link #MINIMUM}
     */
    public static void requireSupported(int version, String source) {
        if (version < MINIMUM) {
            throw new DocumentFormatException(source,
                "Unsupported format version " + version + " (minimum " + MINIMUM + ")");
        }
    }

    /**
     * @return a short name such as {@code KiCad 8} for logging
     */
    public static String describe(int version) {
        if (version >= KICAD_9) {
            return "KiCad 9";
        }
        if (version >= KICAD_8) {
            return "KiCad 8";
        }
        return "KiCad 7";
    }
}
