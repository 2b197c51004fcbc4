package io.framekit.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntSelectionTest {

    @Test
    void shouldGrowPastInitialCapacity() {
        var selection = new IntSelection(2);
        for (var i = 0; i < 100; i++) {
            selection.add(i * 2);
        }
        assertThat(selection.size()).isEqualTo(100);
        assertThat(selection.first()).isZero();
        assertThat(selection.get(99)).isEqualTo(198);
        assertThat(selection.toIntArray()).hasSize(100);
    }

    @Test
    void shouldRejectNegativeRows() {
        var selection = new IntSelection();
        assertThatThrownBy(() -> selection.add(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(selection.isEmpty()).isTrue();
    }
}
