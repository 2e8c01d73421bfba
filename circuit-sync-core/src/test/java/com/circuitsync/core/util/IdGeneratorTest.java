package com.circuitsync.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_sameIdentity_returnsSameShortHexId() {
        String first = IdGenerator.generate("/", "sheet", "filter-1");

        assertThat(first).isEqualTo(IdGenerator.generate("/", "sheet", "filter-1"));
        assertThat(first).matches("[0-9a-f]{16}");
    }

    @Test
    void generate_componentsAreJoined_notConcatenated() {
        assertThat(IdGenerator.generate("ab", "c")).isNotEqualTo(IdGenerator.generate("a", "bc"));
        assertThat(IdGenerator.generate("ab", "c")).isEqualTo(IdGenerator.generate("ab:c"));
    }

    @Test
    void generate_noComponents_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void uuid_sameComponents_returnsSameVersion3Uuid() {
        String uuid = IdGenerator.uuid("/", "component", "r1");

        assertThat(uuid).isEqualTo(IdGenerator.uuid("/", "component", "r1"));
        assertThat(UUID.fromString(uuid).version()).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/", "/a1b2/", "/a1b2/c3d4/"})
    void uuid_namespaceIsPartOfIdentity(String namespace) {
        assertThat(IdGenerator.uuid(namespace, "component", "r1"))
            .isNotEqualTo(IdGenerator.uuid(namespace + "x/", "component", "r1"));
    }

    @Test
    void uuid_noComponents_throwsException() {
        assertThatThrownBy(() -> IdGenerator.uuid()).isInstanceOf(IllegalArgumentException.class);
    }
}
