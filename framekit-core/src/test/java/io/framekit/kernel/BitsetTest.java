package io.framekit.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitsetTest {

    @Test
    void shouldStartCleared() {
        var bits = new Bitset(130);
        assertThat(bits.length()).isEqualTo(130);
        assertThat(bits.count()).isZero();
        assertThat(bits.none()).isTrue();
        assertThat(bits.any()).isFalse();
    }

    @Test
    void shouldSetClearAndTestAcrossWordBoundaries() {
        var bits = new Bitset(130);
        bits.set(0);
        bits.set(63);
        bits.set(64);
        bits.set(129);
        assertThat(bits.test(63)).isTrue();
        assertThat(bits.test(64)).isTrue();
        assertThat(bits.test(65)).isFalse();
        assertThat(bits.count()).isEqualTo(4);

        bits.clear(63);
        assertThat(bits.test(63)).isFalse();
        assertThat(bits.count()).isEqualTo(3);
    }

    @Test
    void shouldRejectOutOfRangePositions() {
        var bits = new Bitset(8);
        assertThatThrownBy(() -> bits.set(8)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> bits.test(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> bits.clear(100)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void setAll_shouldNotSpillPastLength() {
        var bits = new Bitset(70);
        bits.setAll();
        assertThat(bits.count()).isEqualTo(70);
        assertThat(bits.all()).isTrue();

        bits.clearAll();
        assertThat(bits.none()).isTrue();
    }

    @Test
    void copy_shouldBeIndependent() {
        var bits = new Bitset(10);
        bits.set(3);
        var copy = bits.copy();
        copy.set(4);

        assertThat(bits.test(4)).isFalse();
        assertThat(copy.test(3)).isTrue();
        assertThat(copy).isNotEqualTo(bits);
    }

    @Test
    void slice_shouldReindexFromZeroAndClampBounds() {
        var bits = new Bitset(10);
        bits.set(2);
        bits.set(5);
        bits.set(9);

        var slice = bits.slice(2, 6);
        assertThat(slice.length()).isEqualTo(4);
        assertThat(slice.test(0)).isTrue();
        assertThat(slice.test(3)).isTrue();
        assertThat(slice.count()).isEqualTo(2);

        assertThat(bits.slice(8, 50).length()).isEqualTo(2);
        assertThat(bits.slice(7, 3).length()).isZero();
    }

    @Test
    void nextSetBit_shouldWalkSetPositions() {
        var bits = new Bitset(200);
        bits.set(5);
        bits.set(70);
        bits.set(199);

        assertThat(bits.nextSetBit(0)).isEqualTo(5);
        assertThat(bits.nextSetBit(6)).isEqualTo(70);
        assertThat(bits.nextSetBit(71)).isEqualTo(199);
        assertThat(bits.nextSetBit(200)).isEqualTo(-1);
    }

    @Test
    void toString_shouldRenderBits() {
        var bits = new Bitset(4);
        bits.set(1);
        bits.set(3);
        assertThat(bits).hasToString("Bitset[0101]");
    }

    @Test
    void negativeLength_shouldBeEmpty() {
        assertThat(new Bitset(-3).length()).isZero();
    }
}
