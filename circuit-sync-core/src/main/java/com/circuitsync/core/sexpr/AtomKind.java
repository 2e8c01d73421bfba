package com.circuitsync.core.sexpr;

/**
 * Lexical kind of an {@link SNode.SAtom}.
 */
public enum AtomKind {
    /** Bare word such as {@code kicad_sch}, {@code yes} or {@code passive}. */
    SYMBOL,

    /** Double-quoted string. */
    STRING,

    /** Decimal number, kept as written. */
    NUMBER
}
