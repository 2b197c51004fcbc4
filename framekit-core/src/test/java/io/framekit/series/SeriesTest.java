package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.core.FrameConfiguration;
import io.framekit.core.InvalidArgumentException;
import io.framekit.core.PositionOutOfBoundsException;
import io.framekit.storage.ColumnStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeriesTest {

    private static Series withNull() {
        return Series.of("x", Arrays.asList(1.0, null, 3.0));
    }

    @Test
    void of_shouldInferDtypeFromNonNullValues() {
        assertThat(Series.of("a", Arrays.asList(null, 1L)).dtype()).isEqualTo(DType.INT64);
        assertThat(Series.of("b", List.of(1.5)).dtype()).isEqualTo(DType.FLOAT64);
        assertThat(Series.of("c", List.of(true)).dtype()).isEqualTo(DType.BOOL);
        assertThat(Series.of("d", List.of("s")).dtype()).isEqualTo(DType.STRING);
        assertThat(Series.of("e", Arrays.asList(null, null)).dtype()).isEqualTo(DType.STRING);
    }

    @Test
    void of_shouldWidenMixedValues() {
        var numbers = Series.of("n", Arrays.asList(1L, null, 2.5, 3));
        assertThat(numbers.dtype()).isEqualTo(DType.FLOAT64);
        assertThat(numbers.values()).containsExactly(1.0, null, 2.5, 3.0);

        var mixed = Series.of("m", List.of(1L, true, "x"));
        assertThat(mixed.dtype()).isEqualTo(DType.STRING);
        assertThat(mixed.values()).containsExactly("1", "true", "x");
    }

    @Test
    void of_shouldRejectValuesOfTheWrongType() {
        assertThatThrownBy(() -> Series.of("a", DType.INT64, List.of(1.5)))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("not compatible");
        assertThatThrownBy(() -> Series.of("a", DType.BOOL, List.of("yes")))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void get_shouldReturnNullForNullCellsAndOutOfRange() {
        var series = withNull();
        assertThat(series.length()).isEqualTo(3);
        assertThat(series.get(0)).isEqualTo(1.0);
        assertThat(series.get(1)).isNull();
        assertThat(series.get(3)).isNull();
        assertThat(series.get(-1)).isNull();
        assertThat(series.isValid(1)).isFalse();
        assertThat(series.isNull(1)).isTrue();
        assertThat(series.isNull(7)).isFalse();
    }

    @Test
    @DisplayName("fillNA replaces nulls and leaves no mask; dropNA removes them")
    void fillNaAndDropNa_shouldHandleNullCells() {
        var series = withNull();

        var filled = series.fillNA(0.0);
        assertThat(filled.values()).containsExactly(1.0, 0.0, 3.0);
        assertThat(filled.nullCount()).isZero();
        assertThat(filled.hasNulls()).isFalse();

        var dropped = series.dropNA();
        assertThat(dropped.length()).isEqualTo(2);
        assertThat(dropped.values()).containsExactly(1.0, 3.0);

        assertThat(series.nullCount()).isEqualTo(1);
    }

    @Test
    void fillNA_withIncompatibleValue_shouldThrow() {
        assertThatThrownBy(() -> withNull().fillNA("zero"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void set_shouldWriteAndNullValuesShouldMarkCellNull() {
        var series = Series.ofLongs("n", 1, 2, 3);
        series.set(0, 10);
        series.set(2, null);

        assertThat(series.get(0)).isEqualTo(10L);
        assertThat(series.isNull(2)).isTrue();
        assertThat(series.count()).isEqualTo(2);
    }

    @Test
    void set_outOfRange_shouldThrowButSetNullShouldBeIgnored() {
        var series = Series.ofLongs("n", 1, 2);
        assertThatThrownBy(() -> series.set(2, 5L))
                .isInstanceOf(PositionOutOfBoundsException.class)
                .hasMessageContaining("position 2");

        series.setNull(5);
        series.setNull(-1);
        assertThat(series.nullCount()).isZero();
    }

    @Test
    void view_shouldShareStorageUntilFirstWrite() {
        var original = Series.ofLongs("n", 1, 2, 3);
        var view = original.view();

        assertThat(view.sharesStorageWith(original)).isTrue();
        assertThat(original.sharesStorage()).isTrue();

        view.set(0, 99L);

        assertThat(original.get(0)).isEqualTo(1L);
        assertThat(view.get(0)).isEqualTo(99L);
        assertThat(view.sharesStorageWith(original)).isFalse();
        assertThat(original.sharesStorage()).isFalse();
    }

    @Test
    void writeToOriginal_shouldNotLeakIntoRenamedView() {
        var original = Series.ofStrings("s", "a", "b");
        var renamed = original.rename("t");

        original.setNull(1);

        assertThat(renamed.name()).isEqualTo("t");
        assertThat(renamed.get(1)).isEqualTo("b");
        assertThat(original.isNull(1)).isTrue();
    }

    @Test
    void copy_shouldNeverShareStorage() {
        var original = Series.ofDoubles("d", 1.0, 2.0);
        var copy = original.copy();
        assertThat(copy.sharesStorageWith(original)).isFalse();
        assertThat(original.sharesStorage()).isFalse();
    }

    @Test
    void take_shouldGatherAndTreatMissingAsNull() {
        var series = Series.ofStrings("s", "a", "b", "c");
        var taken = series.take(new int[]{2, ColumnStorage.MISSING, 0});

        assertThat(taken.values()).containsExactly("c", null, "a");
        assertThatThrownBy(() -> series.take(new int[]{3}))
                .isInstanceOf(PositionOutOfBoundsException.class);
    }

    @Test
    void slice_shouldClampBounds() {
        var series = Series.ofLongs("n", 1, 2, 3, 4);
        assertThat(series.slice(1, 3).values()).containsExactly(2L, 3L);
        assertThat(series.slice(-5, 2).values()).containsExactly(1L, 2L);
        assertThat(series.slice(3, 1).length()).isZero();
    }

    @Test
    void filterAndMap_shouldSkipNullCells() {
        var series = Series.of("n", Arrays.asList(1L, null, 3L, 4L));

        assertThat(series.filter(v -> (Long) v > 1).values()).containsExactly(3L, 4L);

        var mapped = series.map(v -> (Long) v == 3L ? null : (Long) v * 10);
        assertThat(mapped.dtype()).isEqualTo(DType.INT64);
        assertThat(mapped.values()).containsExactly(10L, null, null, 40L);
    }

    @Test
    void reducers_shouldSkipNulls() {
        var series = Series.of("n", Arrays.asList(2.0, null, 4.0, 6.0));

        assertThat(series.sum()).isEqualTo(12.0);
        assertThat(series.mean()).isEqualTo(4.0);
        assertThat(series.var()).isEqualTo(4.0);
        assertThat(series.std()).isEqualTo(2.0);
        assertThat(series.median()).isEqualTo(4.0);
        assertThat(series.min()).isEqualTo(2.0);
        assertThat(series.max()).isEqualTo(6.0);
    }

    @Test
    void reducersOnEmptyInput_shouldFollowNanRules() {
        var allNull = Series.nulls("n", DType.FLOAT64, 3);
        assertThat(allNull.sum()).isZero();
        assertThat(allNull.mean()).isNaN();
        assertThat(allNull.median()).isNaN();
        assertThat(allNull.min()).isNull();

        var single = Series.ofDoubles("one", 5.0);
        assertThat(single.var()).isNaN();
        assertThat(single.std()).isNaN();
    }

    @Test
    void quantile_shouldInterpolateLinearly() {
        var series = Series.ofLongs("n", 4, 1, 3, 2);
        assertThat(series.quantile(0.0)).isEqualTo(1.0);
        assertThat(series.quantile(1.0)).isEqualTo(4.0);
        assertThat(series.quantile(0.25)).isCloseTo(1.75, within(1e-12));
        assertThat(series.quantile(0.5)).isEqualTo(2.5);
        assertThat(series.quantile(1.5)).isNaN();
    }

    @Test
    void numericReducers_onStringSeries_shouldThrow() {
        var series = Series.ofStrings("s", "b", "a");
        assertThatThrownBy(series::sum)
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("not numeric");
        assertThat(series.min()).isEqualTo("a");
        assertThat(series.max()).isEqualTo("b");
    }

    @Test
    void toDoubleArray_shouldRenderNullsAsNaN() {
        var values = Series.of("n", Arrays.asList(1L, null)).toDoubleArray();
        assertThat(values[0]).isEqualTo(1.0);
        assertThat(values[1]).isNaN();
    }

    @Test
    void parse_shouldPickNarrowestTypeAndMarkNaTokens() {
        var config = FrameConfiguration.defaults();

        var ints = Series.parse("i", new String[]{"1", " 2 ", "NA"}, config);
        assertThat(ints.dtype()).isEqualTo(DType.INT64);
        assertThat(ints.values()).containsExactly(1L, 2L, null);

        var doubles = Series.parse("d", new String[]{"1", "2.5"}, config);
        assertThat(doubles.dtype()).isEqualTo(DType.FLOAT64);

        var bools = Series.parse("b", new String[]{"true", "FALSE"}, config);
        assertThat(bools.dtype()).isEqualTo(DType.BOOL);
        assertThat(bools.values()).containsExactly(true, false);

        var strings = Series.parse("s", new String[]{"x", "1"}, config);
        assertThat(strings.dtype()).isEqualTo(DType.STRING);

        var scientific = Series.parse("e", new String[]{"1e3", "-.5", "+2.", "3.5E-2"}, config);
        assertThat(scientific.dtype()).isEqualTo(DType.FLOAT64);
        assertThat(scientific.values()).containsExactly(1000.0, -0.5, 2.0, 0.035);

        var literals = Series.parse("l", new String[]{"1d", "2f", "0x1p3"}, config);
        assertThat(literals.dtype()).isEqualTo(DType.STRING);
        assertThat(literals.values()).containsExactly("1d", "2f", "0x1p3");

        var empty = Series.parse("e", new String[]{"", "null"}, config);
        assertThat(empty.dtype()).isEqualTo(DType.STRING);
        assertThat(empty.nullCount()).isEqualTo(2);
    }

    @Test
    void typedAccessors_shouldReturnZeroValuesForNulls() {
        var longs = (Int64Series) Series.of("n", Arrays.asList(7L, null));
        assertThat(longs.getLong(0)).isEqualTo(7L);
        assertThat(longs.getLong(1)).isZero();
        assertThat(longs.toLongArray()).containsExactly(7L, 0L);

        var doubles = Series.ofDoubles("d", 1.5);
        assertThat(doubles.getDouble(3)).isZero();
    }

    @Test
    void toString_shouldElideMiddleOfLongSeries() {
        var series = Series.ofLongs("n", 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
        series.setNull(0);

        var text = series.toString();
        assertThat(text).startsWith("Series(n, dtype=int64, len=12)");
        assertThat(text).contains("0: <null>").contains("...").contains("11: 11");
        assertThat(text).doesNotContain("6: 6");
    }

    @Test
    void stats_shouldHandleEmptyArrays() {
        assertThat(Stats.mean(new double[0])).isNaN();
        assertThat(Stats.variance(new double[]{1.0})).isNaN();
        assertThat(Stats.median(new double[]{3.0, 1.0, 2.0})).isEqualTo(2.0);
        assertThat(Stats.quantileOfSorted(new double[]{1.0, 2.0}, -0.1)).isNaN();
    }
}
