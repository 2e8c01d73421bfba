package com.circuitsync.core.sexpr;

import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;

/**
 * Serializes {@link SNode} trees in one fixed layout.
 *
 * <p>A list made only of atoms is written on a single line. Any other list keeps its
 * leading atoms on the opening line and puts every following child on its own line,
 * one tab deeper, with the closing parenthesis on a line of its own. The same rule
 * applies everywhere, so writing a parsed canonical document reproduces it exactly.
 */
public final class SExpressionWriter {

    private SExpressionWriter() {
        // Utility class
    }

    /**
     * Writes a complete document: the node followed by a single newline.
     */
    public static String write(SNode node) {
        StringBuilder sb = new StringBuilder(4096);
        append(sb, node, 0);
        sb.append('\n');
        return sb.toString();
    }

    /**
     * Writes a node without the trailing newline.
     */
    public static String writeInline(SNode node) {
        StringBuilder sb = new StringBuilder(256);
        append(sb, node, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, SNode node, int depth) {
        if (node instanceof SAtom atom) {
            appendAtom(sb, atom);
            return;
        }
        SList list = (SList) node;
        sb.append('(');
        if (list.allAtoms()) {
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                appendAtom(sb, (SAtom) list.get(i));
            }
            sb.append(')');
            return;
        }

        int i = 0;
        while (i < list.size() && list.get(i) instanceof SAtom atom) {
            if (i > 0) {
                sb.append(' ');
            }
            appendAtom(sb, atom);
            i++;
        }
        for (; i < list.size(); i++) {
            sb.append('\n');
            indent(sb, depth + 1);
            append(sb, list.get(i), depth + 1);
        }
        sb.append('\n');
        indent(sb, depth);
        sb.append(')');
    }

    private static void appendAtom(StringBuilder sb, SAtom atom) {
        if (atom.kind() == AtomKind.STRING) {
            sb.append('"').append(atom.text()).append('"');
        } else {
            sb.append(atom.text());
        }
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append('\t');
        }
    }
}
