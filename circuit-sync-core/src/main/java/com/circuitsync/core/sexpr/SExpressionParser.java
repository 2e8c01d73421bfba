package com.circuitsync.core.sexpr;

import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for the parenthesized text format used by schematic and symbol library files.
 *
 * <p>Unknown element heads are not interpreted; they become ordinary {@link SList}
 * nodes and survive a parse/write cycle. Numbers keep their lexeme so no precision
 * is lost. Any syntax error raises {@link DocumentFormatException} with the position
 * of the offending character; offsets count UTF-8 bytes of the original input.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SList root = SExpressionParser.parseSingle(text, "amp.kicad_sch");
 * String version = root.first("version").map(v -> v.atomValue(1)).orElse("");
 * }</pre>
 */
public final class SExpressionParser {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final String text;
    private final String source;
    private final int leadingBytes;
    private int pos;
    private int line = 1;
    private int column = 1;

    private SExpressionParser(String text, String source) {
        boolean bom = !text.isEmpty() && text.charAt(0) == '\uFEFF';
        this.text = bom ? text.substring(1) : text;
        this.source = source;
        this.leadingBytes = bom ? 3 : 0;
    }

    /**
     * Parses every top-level form of {@code text}.
     *
     * @param text document text
     * @param source name used in error messages
     * @return top-level nodes in order
     * @throws DocumentFormatException when the text is malformed
     */
    public static List<SNode> parse(String text, String source) {
        return new SExpressionParser(text, source).parseAll();
    }

    /**
     * Decodes {@code bytes} as UTF-8 and parses them.
     *
     * @throws DocumentFormatException when the bytes are not valid UTF-8 or the text is malformed
     */
    public static List<SNode> parse(byte[] bytes, String source) {
        return parse(decode(bytes, source), source);
    }

    /**
     * Decodes {@code bytes} as strict UTF-8.
     *
     * @param bytes file content
     * @param source name used in error messages
     * @return the decoded text
     * @throws DocumentFormatException at the first byte that is not valid UTF-8
     */
    public static String decode(byte[] bytes, String source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(bytes.length * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        out.flip();
        if (result.isError()) {
            String decoded = out.toString();
            int line = 1;
            int column = 1;
            for (int i = 0; i < decoded.length(); i++) {
                if (decoded.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            throw new DocumentFormatException(source, in.position(), line, column,
                "Invalid UTF-8 byte sequence");
        }
        return out.toString();
    }

    /**
     * Parses a document that must consist of exactly one top-level list.
     *
     * @throws DocumentFormatException when there is not exactly one list
     */
    public static SList parseSingle(String text, String source) {
        List<SNode> forms = parse(text, source);
        if (forms.size() != 1 || !(forms.get(0) instanceof SList list)) {
            throw new DocumentFormatException(source,
                "Expected exactly one top-level list but found " + forms.size() + " form(s)");
        }
        return list;
    }

    private List<SNode> parseAll() {
        List<SNode> top = new ArrayList<>();
        Deque<List<SNode>> stack = new ArrayDeque<>();
        Deque<int[]> openings = new ArrayDeque<>();

        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                break;
            }
            char c = text.charAt(pos);
            if (c == '(') {
                openings.push(new int[] {pos, line, column});
                stack.push(new ArrayList<>());
                advance();
            } else if (c == ')') {
                if (stack.isEmpty()) {
                    throw error("Unexpected ')'");
                }
                advance();
                openings.pop();
                SList list = new SList(stack.pop());
                emit(list, stack, top);
            } else if (c == '"') {
                emit(readString(), stack, top);
            } else {
                emit(readBare(), stack, top);
            }
        }

        if (!stack.isEmpty()) {
            int[] open = openings.peek();
            throw errorAt(open[0], open[1], open[2], "Unterminated list");
        }
        return top;
    }

    private static void emit(SNode node, Deque<List<SNode>> stack, List<SNode> top) {
        if (stack.isEmpty()) {
            top.add(node);
        } else {
            stack.peek().add(node);
        }
    }

    private SAtom readString() {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        advance();
        int contentStart = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos >= text.length()) {
                    break;
                }
                advance();
            } else if (c == '"') {
                String raw = text.substring(contentStart, pos);
                advance();
                return new SAtom(raw, AtomKind.STRING);
            } else {
                advance();
            }
        }
        throw errorAt(startPos, startLine, startColumn, "Unterminated string");
    }

    private SAtom readBare() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')') {
                break;
            }
            if (c == '"') {
                throw error("Unexpected '\"' inside bare token");
            }
            advance();
        }
        String lexeme = text.substring(start, pos);
        AtomKind kind = NUMBER.matcher(lexeme).matches() ? AtomKind.NUMBER : AtomKind.SYMBOL;
        return new SAtom(lexeme, kind);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            advance();
        }
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private DocumentFormatException error(String message) {
        return errorAt(pos, line, column, message);
    }

    private DocumentFormatException errorAt(int charPos, int atLine, int atColumn, String message) {
        int offset = leadingBytes + text.substring(0, charPos).getBytes(StandardCharsets.UTF_8).length;
        return new DocumentFormatException(source, offset, atLine, atColumn, message);
    }
}
