package com.circuitsync.core.sexpr;

import com.circuitsync.core.sexpr.SNode.SAtom;
import com.circuitsync.core.sexpr.SNode.SList;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SExpressionWriter}.
 */
class SExpressionWriterTest {

    private static final String CANONICAL = """
        (kicad_sch
        \t(version 20231120)
        \t(generator "eeschema")
        \t(symbol
        \t\t(lib_id "Device:R")
        \t\t(at 50.8 63.5 0)
        \t\t(property "Reference" "R1"
        \t\t\t(at 52.07 62.23 0)
        \t\t)
        \t)
        )
        """;

    @Test
    void write_canonicalText_reproducesInput() {
        SList tree = SExpressionParser.parseSingle(CANONICAL, "test");

        assertThat(SExpressionWriter.write(tree)).isEqualTo(CANONICAL);
    }

    @Test
    void write_foreignLayout_isCanonicalizedOnce() {
        String foreign = "(kicad_sch (version 20231120)   (generator \"eeschema\")\n(symbol (lib_id \"Device:R\") "
            + "(at 50.8 63.5 0) (property \"Reference\" \"R1\" (at 52.07 62.23 0))))";

        String first = SExpressionWriter.write(SExpressionParser.parseSingle(foreign, "test"));
        String second = SExpressionWriter.write(SExpressionParser.parseSingle(first, "test"));

        assertThat(first).isEqualTo(CANONICAL);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void write_allAtomList_staysOnOneLine() {
        SList list = SList.of("at", SAtom.number(new BigDecimal("1.50")), SAtom.number(2), SAtom.number(0));

        assertThat(SExpressionWriter.writeInline(list)).isEqualTo("(at 1.5 2 0)");
    }

    @Test
    void write_newStrings_areEscaped() {
        SList list = SList.of("property", SAtom.string("Note"), SAtom.string("a \"b\"\nc"));

        String text = SExpressionWriter.writeInline(list);

        assertThat(text).isEqualTo("(property \"Note\" \"a \\\"b\\\"\\nc\")");
        SList reparsed = SExpressionParser.parseSingle(text, "test");
        assertThat(reparsed.atomValue(2)).isEqualTo("a \"b\"\nc");
    }

    @Test
    void write_endsWithSingleNewline() {
        String text = SExpressionWriter.write(SList.of("kicad_sch"));

        assertThat(text).isEqualTo("(kicad_sch)\n");
    }

    @Test
    void number_zeroAndTrailingZeros_areNormalized() {
        assertThat(SAtom.number(new BigDecimal("0.000")).text()).isEqualTo("0");
        assertThat(SAtom.number(new BigDecimal("25.400")).text()).isEqualTo("25.4");
        assertThat(SAtom.number(new BigDecimal("1E+2")).text()).isEqualTo("100");
    }
}
