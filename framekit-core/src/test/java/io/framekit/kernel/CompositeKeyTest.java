package io.framekit.kernel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeKeyTest {

    @Test
    @DisplayName("Keys built from a separator-bearing string and its split parts must differ")
    void separatorContent_shouldNotCollide() {
        var joined = CompositeKey.of("a|b");
        var split = CompositeKey.of("a", "|b");
        var splitOther = CompositeKey.of("a|", "b");

        assertThat(joined).isNotEqualTo(split);
        assertThat(split).isNotEqualTo(splitOther);
    }

    @Test
    @DisplayName("Keys with equal hash codes but different values must not be equal")
    void hashCollision_shouldNotBeEqual() {
        assertThat("Aa".hashCode()).isEqualTo("BB".hashCode());
        assertThat(CompositeKey.of("Aa")).isNotEqualTo(CompositeKey.of("BB"));
    }

    @Test
    void numericComponents_shouldCompareByValue() {
        assertThat(CompositeKey.of(1L)).isEqualTo(CompositeKey.of(1.0));
        assertThat(CompositeKey.of(1)).isEqualTo(CompositeKey.of(1L));
        assertThat(CompositeKey.of(-0.0)).isEqualTo(CompositeKey.of(0.0));
        assertThat(CompositeKey.of(1.5)).isNotEqualTo(CompositeKey.of(1L));
        assertThat(CompositeKey.of(1L).hashCode()).isEqualTo(CompositeKey.of(1.0).hashCode());
    }

    @Test
    void typesShouldNotMix() {
        assertThat(CompositeKey.of("1")).isNotEqualTo(CompositeKey.of(1L));
        assertThat(CompositeKey.of(true)).isNotEqualTo(CompositeKey.of("true"));
    }

    @Test
    void nullComponents_shouldBeEqualToEachOther() {
        var key = CompositeKey.of(1L, null);
        assertThat(key.hasNull()).isTrue();
        assertThat(key).isEqualTo(CompositeKey.of(1L, null));
        assertThat(CompositeKey.of(1L, 2L).hasNull()).isFalse();
    }

    @Test
    void shouldExposeComponents() {
        var key = CompositeKey.of("x", 3);
        assertThat(key.size()).isEqualTo(2);
        assertThat(key.get(0)).isEqualTo("x");
        assertThat(key.get(1)).isEqualTo(3L);
    }
}
