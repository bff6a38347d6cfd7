package com.sprig.grammar.runtime.model;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectorNodeTest {

    private final SelectorNode<String> selector =
            new SelectorNode<>(IntArrayList.of(10, 11, 12), DoubleArrayList.of(1.0, 2.0, 1.0));

    @ParameterizedTest(name = "sample {0} picks option {1}")
    @CsvSource({
            "0.0, 0",
            "0.999, 0",
            "1.0, 1",
            "2.5, 1",
            "3.0, 2",
            "3.999, 2",
            "4.0, 2",
            "17.0, 2"
    })
    @DisplayName("Should pick the first option whose running weight exceeds the sample")
    void shouldPickByCumulativeWeight(double sample, int expected) {
        assertThat(selector.pick(sample)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should sum the weights")
    void shouldSumWeights() {
        assertThat(selector.totalWeight()).isEqualTo(4.0);
        assertThat(selector.children().toIntArray()).containsExactly(10, 11, 12);
    }

    @Test
    @DisplayName("Should reject non-positive weights and mismatched sizes")
    void shouldValidate() {
        assertThatThrownBy(() -> new SelectorNode<String>(IntArrayList.of(1), DoubleArrayList.of(0.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SelectorNode<String>(IntArrayList.of(1, 2), DoubleArrayList.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SelectorNode<String>(IntArrayList.of(), DoubleArrayList.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SelectorNode<String>(IntArrayList.of(1, 2),
                DoubleArrayList.of(Double.MAX_VALUE, Double.MAX_VALUE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflow");
    }

    @Test
    @DisplayName("Should copy its inputs")
    void shouldCopyInputs() {
        IntArrayList options = IntArrayList.of(1);
        SelectorNode<String> node = new SelectorNode<>(options, DoubleArrayList.of(1.0));

        options.set(0, 99);

        assertThat(node.options().getInt(0)).isEqualTo(1);
    }
}
