package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnStorageTest {

    @Test
    void newColumn_shouldHaveNoMaskUntilFirstNull() {
        var column = new LongColumn(new long[]{1, 2, 3}, null);
        assertThat(column.dtype()).isEqualTo(DType.INT64);
        assertThat(column.hasNulls()).isFalse();
        assertThat(column.nullMask()).isNull();

        column.setNull(1);
        assertThat(column.isNull(1)).isTrue();
        assertThat(column.nullCount()).isEqualTo(1);
        assertThat(column.nullMask().test(1)).isTrue();
    }

    @Test
    void set_shouldClearNullBit() {
        var column = new DoubleColumn(3);
        column.setNull(0);
        column.set(0, 2.5);
        assertThat(column.isNull(0)).isFalse();
        assertThat(column.get(0)).isEqualTo(2.5);
    }

    @Test
    void gather_shouldFollowPositionsAndMarkMissingAsNull() {
        var column = new StringColumn(new String[]{"a", "b", "c"}, null);
        column.setNull(2);

        var gathered = column.gather(new int[]{2, 0, ColumnStorage.MISSING, 1, 0});
        assertThat(gathered.length()).isEqualTo(5);
        assertThat(gathered.isNull(0)).isTrue();
        assertThat(gathered.get(1)).isEqualTo("a");
        assertThat(gathered.isNull(2)).isTrue();
        assertThat(gathered.get(3)).isEqualTo("b");
        assertThat(gathered.nullCount()).isEqualTo(2);
    }

    @Test
    void slice_shouldClampBoundsAndCarryMask() {
        var column = new LongColumn(new long[]{10, 20, 30, 40}, null);
        column.setNull(2);

        var slice = column.slice(1, 10);
        assertThat(slice.length()).isEqualTo(3);
        assertThat(slice.get(0)).isEqualTo(20L);
        assertThat(slice.isNull(1)).isTrue();

        assertThat(column.slice(3, 1).length()).isZero();
    }

    @Test
    void copy_shouldBeIndependentWithFreshReferenceCount() {
        var column = new BooleanColumn(new boolean[]{true, false});
        column.retain();
        var copy = column.copy();

        copy.set(0, false);
        copy.setNull(1);

        assertThat(column.get(0)).isTrue();
        assertThat(column.hasNulls()).isFalse();
        assertThat(copy.references()).isEqualTo(1);
        assertThat(column.references()).isEqualTo(2);
    }

    @Test
    void retainAndRelease_shouldTrackSharing() {
        var column = new DoubleColumn(new double[]{1.0}, null);
        assertThat(column.isShared()).isFalse();

        column.retain();
        assertThat(column.isShared()).isTrue();

        column.release();
        assertThat(column.isShared()).isFalse();
    }

    @Test
    void maskLengthMismatch_shouldBeRejected() {
        assertThatThrownBy(() -> new LongColumn(new long[3], new Bitset(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mask length");
    }

    @Test
    void offsetsOutsideColumn_shouldBeRejected() {
        var column = new LongColumn(2);
        assertThatThrownBy(() -> column.get(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> column.isNull(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void setBoxed_shouldConvertNumbers() {
        var longs = new LongColumn(1);
        longs.setBoxed(0, 7);
        assertThat(longs.boxed(0)).isEqualTo(7L);

        var doubles = new DoubleColumn(1);
        doubles.setBoxed(0, 3L);
        assertThat(doubles.boxed(0)).isEqualTo(3.0);
    }
}
