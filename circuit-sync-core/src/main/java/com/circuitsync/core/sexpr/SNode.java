package com.circuitsync.core.sexpr;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A node of a parsed S-expression document.
 *
 * <p>The tree is immutable. Edits produce new lists through the {@code with*}
 * helpers on {@link SList}, so an untouched subtree keeps its exact lexemes and
 * serializes back to the same text.
 */
public sealed interface SNode permits SNode.SList, SNode.SAtom {

    /**
     * Parenthesized list. By convention the first child is a symbol naming the
     * element ({@code symbol}, {@code label}, {@code at}, ...).
     *
     * @param children child nodes in document order
     */
    record SList(List<SNode> children) implements SNode {

        public SList {
            Objects.requireNonNull(children, "children must not be null");
            children = List.copyOf(children);
        }

        /**
         * Builds a list headed by a symbol.
         *
         * @param head element name
         * @param rest remaining children
         * @return new list
         */
        public static SList of(String head, SNode... rest) {
            List<SNode> children = new ArrayList<>(rest.length + 1);
            children.add(SAtom.symbol(head));
            children.addAll(Arrays.asList(rest));
            return new SList(children);
        }

        /**
         * Builds a list headed by a symbol from an existing child list.
         *
         * @param head element name
         * @param rest remaining children
         * @return new list
         */
        public static SList of(String head, List<? extends SNode> rest) {
            List<SNode> children = new ArrayList<>(rest.size() + 1);
            children.add(SAtom.symbol(head));
            children.addAll(rest);
            return new SList(children);
        }

        /**
         * @return the head symbol, or an empty string when the list does not start with a symbol
         */
        public String head() {
            if (!children.isEmpty() && children.get(0) instanceof SAtom atom && atom.kind() == AtomKind.SYMBOL) {
                return atom.text();
            }
            return "";
        }

        public boolean isHead(String name) {
            return head().equals(name);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        /**
         * Returns the decoded value of the atom at {@code index}, or an empty string when
         * the index is out of range or the child is a list.
         */
        public String atomValue(int index) {
            if (index < children.size() && children.get(index) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        /**
         * Returns the numeric value of the atom at {@code index}.
         *
         * @throws IllegalStateException when the child is missing or not a number
         */
        public BigDecimal decimal(int index) {
            if (index < children.size() && children.get(index) instanceof SAtom atom && atom.kind() == AtomKind.NUMBER) {
                return atom.decimal();
            }
            throw new IllegalStateException("Expected number at index " + index + " of (" + head() + ")");
        }

        /**
         * First direct child list with the given head.
         */
        public Optional<SList> first(String name) {
            for (SNode child : children) {
                if (child instanceof SList list && list.isHead(name)) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        /**
         * All direct child lists with the given head, in document order.
         */
        public List<SList> all(String name) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.isHead(name)) {
                    result.add(list);
                }
            }
            return result;
        }

        public SList withChild(int index, SNode replacement) {
            List<SNode> copy = new ArrayList<>(children);
            copy.set(index, replacement);
            return new SList(copy);
        }

        public SList append(SNode child) {
            List<SNode> copy = new ArrayList<>(children);
            copy.add(child);
            return new SList(copy);
        }

        /**
         * Replaces the first child list headed {@code name} or appends {@code replacement}
         * when there is none.
         */
        public SList withFirst(String name, SList replacement) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) instanceof SList list && list.isHead(name)) {
                    return withChild(i, replacement);
                }
            }
            return append(replacement);
        }

        /**
         * Removes every direct child for which {@code keep} answers false.
         */
        public SList filter(Predicate<SNode> keep) {
            List<SNode> copy = new ArrayList<>(children.size());
            for (SNode child : children) {
                if (keep.test(child)) {
                    copy.add(child);
                }
            }
            return copy.size() == children.size() ? this : new SList(copy);
        }

        boolean allAtoms() {
            for (SNode child : children) {
                if (child instanceof SList) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Leaf token. {@code text} is the lexeme exactly as written between the delimiters;
     * for strings that is the escaped form without the surrounding quotes.
     *
     * @param text source lexeme
     * @param kind lexical kind
     */
    record SAtom(String text, AtomKind kind) implements SNode {

        public SAtom {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }

        public static SAtom symbol(String name) {
            return new SAtom(name, AtomKind.SYMBOL);
        }

        /**
         * Creates a string atom from its decoded value.
         */
        public static SAtom string(String value) {
            return new SAtom(escape(value), AtomKind.STRING);
        }

        /**
         * Creates a number atom in plain notation without trailing zeros.
         */
        public static SAtom number(BigDecimal value) {
            BigDecimal stripped = value.stripTrailingZeros();
            if (stripped.signum() == 0) {
                return new SAtom("0", AtomKind.NUMBER);
            }
            return new SAtom(stripped.toPlainString(), AtomKind.NUMBER);
        }

        public static SAtom number(long value) {
            return new SAtom(Long.toString(value), AtomKind.NUMBER);
        }

        /**
         * @return the decoded value: unescaped for strings, the lexeme otherwise
         */
        public String value() {
            return kind == AtomKind.STRING ? unescape(text) : text;
        }

        public BigDecimal decimal() {
            return new BigDecimal(text);
        }

        static String escape(String value) {
            StringBuilder sb = new StringBuilder(value.length() + 8);
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            return sb.toString();
        }

        static String unescape(String raw) {
            if (raw.indexOf('\\') < 0) {
                return raw;
            }
            StringBuilder sb = new StringBuilder(raw.length());
            for (int i = 0; i < raw.length(); i++) {
                char c = raw.charAt(i);
                if (c == '\\' && i + 1 < raw.length()) {
                    char next = raw.charAt(++i);
                    switch (next) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        default -> sb.append(next);
                    }
                } else {
                    sb.append(c);
                }
            }
            return sb.toString();
        }
    }
}
