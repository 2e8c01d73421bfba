package com.circuitsync.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link References}.
 */
class ReferencesTest {

    @ParameterizedTest
    @CsvSource({"R,true", "R?,true", "#PWR,true", "R1,false", "U12,false", "R1?,false"})
    void isPrefixOnly_classifiesReferences(String reference, boolean expected) {
        assertThat(References.isPrefixOnly(reference)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"R12,R,12", "R?,R,-1", "C,C,-1", "#PWR03,#PWR,3"})
    void prefixAndNumber_splitReference(String reference, String prefix, int number) {
        assertThat(References.prefix(reference)).isEqualTo(prefix);
        assertThat(References.number(reference)).isEqualTo(number);
    }

    @Test
    void naturalOrder_sortsNumbersByValue() {
        List<String> pins = new ArrayList<>(List.of("10", "2", "1", "A", "B1"));

        pins.sort(References.NATURAL_ORDER);

        assertThat(pins).containsExactly("1", "2", "10", "A", "B1");
    }
}
