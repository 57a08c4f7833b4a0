package com.jay.carbonscore.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundingTest {

    @Test
    void halfUpToTwoAndOneDecimals() {
        assertThat(Rounding.mass(1.005)).isEqualTo(1.01);
        assertThat(Rounding.score(49.95)).isEqualTo(50.0);
    }

    @Test
    void nonFiniteValuesAreRejected() {
        assertThatThrownBy(() -> Rounding.mass(Double.NaN)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void sumIsDecimalExact() {
        assertThat(Rounding.sum(0.1, 0.2)).isEqualTo(0.3);
        assertThat(Rounding.sum(0.0, 571.0, 134.0)).isEqualTo(705.0);
    }

    @Test
    void partsCarryTheRemainingCents() {
        double third = 1.0 / 3;

        assertThat(Rounding.massParts(List.of(third, third, third), 1.0)).containsExactly(0.33, 0.34, 0.33);
    }

    @Test
    void tinyPartsNeverGoNegative() {
        List<Double> parts = Rounding.massParts(Collections.nCopies(12, 0.004), 0.04);

        assertThat(parts).hasSize(12).allSatisfy(p -> assertThat(p).isNotNegative());
        assertThat(parts.stream().map(BigDecimal::valueOf).reduce(BigDecimal.ZERO, BigDecimal::add))
            .isEqualByComparingTo("0.04");
    }
}
