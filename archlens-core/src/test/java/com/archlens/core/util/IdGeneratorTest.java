package com.archlens.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withSameInput_isDeterministic() {
        String first = IdGenerator.generate("src/core/engine.ts");
        String second = IdGenerator.generate("src/core/engine.ts");

        assertThat(first).isEqualTo(second).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void generate_withDifferentSplits_producesDifferentIds() {
        // The separator keeps ("ab", "c") and ("a", "bc") apart
        assertThat(IdGenerator.generate("ab", "c")).isNotEqualTo(IdGenerator.generate("a", "bc"));
    }

    @Test
    void generate_withoutComponents_throws() {
        assertThatThrownBy(IdGenerator::generate).isInstanceOf(IllegalArgumentException.class);
    }
}
