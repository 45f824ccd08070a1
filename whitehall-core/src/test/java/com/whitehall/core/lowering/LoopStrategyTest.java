package com.whitehall.core.lowering;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LoopStrategy}.
 */
class LoopStrategyTest {

    @Test
    void forContainer_lazy_usesItemsBuilder() {
        assertThat(LoopStrategy.forContainer(ContainerKind.LAZY)).isEqualTo(LoopStrategy.LAZY_ITEMS);
    }

    @Test
    void forContainer_layout_repeatsInline() {
        assertThat(LoopStrategy.forContainer(ContainerKind.LAYOUT)).isEqualTo(LoopStrategy.INLINE_REPETITION);
    }

    @ParameterizedTest
    @EnumSource(ContainerKind.class)
    void forContainer_everyKind_hasStrategy(ContainerKind kind) {
        assertThat(LoopStrategy.forContainer(kind)).isNotNull();
    }
}
