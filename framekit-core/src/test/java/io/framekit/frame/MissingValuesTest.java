package io.framekit.frame;

import io.framekit.core.ColumnNotFoundException;
import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.index.RangeIndex;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MissingValuesTest {

    private static DataFrame sparse() {
        return DataFrame.builder()
                .values("a", 1L, null, 3L, null)
                .values("b", 1.0, null, null, 4.0)
                .strings("c", "x", null, "z", null)
                .build();
    }

    @Test
    void isNaAndNotNa_shouldFlagCells() {
        var flags = sparse().isNa();
        assertThat(flags.column("a").dtype()).isEqualTo(DType.BOOL);
        assertThat(flags.column("a").values()).containsExactly(false, true, false, true);
        assertThat(sparse().notNa().column("b").values()).containsExactly(true, false, false, true);
    }

    @Test
    void dropNa_any_shouldKeepOnlyCompleteRows() {
        var result = sparse().dropNa();
        assertThat(result.rowCount()).isEqualTo(1);
        assertThat(result.column("c").values()).containsExactly("x");
    }

    @Test
    void dropNa_all_shouldDropOnlyEntirelyNullRows() {
        var result = sparse().dropNa(DropNaOptions.all());
        assertThat(result.rowCount()).isEqualTo(3);
        assertThat(result.column("a").values()).containsExactly(1L, 3L, null);
        assertThat(result.index()).isEqualTo(new RangeIndex(0, 3, 1));
    }

    @Test
    void dropNa_thresh_shouldCountNonNullCells() {
        var result = sparse().dropNa(DropNaOptions.thresh(2));
        assertThat(result.column("a").values()).containsExactly(1L, 3L);
    }

    @Test
    void dropNa_subset_shouldInspectOnlyNamedColumns() {
        var result = sparse().dropNa(DropNaOptions.any().withSubset("a"));
        assertThat(result.column("c").values()).containsExactly("x", "z");

        assertThatThrownBy(() -> sparse().dropNa(DropNaOptions.any().withSubset("nope")))
                .isInstanceOf(ColumnNotFoundException.class);
    }

    @Test
    void fillNa_scalar_shouldSkipColumnsOfOtherTypes() {
        var result = sparse().fillNa(0L);
        assertThat(result.column("a").values()).containsExactly(1L, 0L, 3L, 0L);
        assertThat(result.column("b").values()).containsExactly(1.0, 0.0, 0.0, 4.0);
        assertThat(result.column("c").nullCount()).isEqualTo(2);
    }

    @Test
    void fillNa_perColumn_shouldValidateColumnsAndTypes() {
        var result = sparse().fillNa(Map.of("c", "?", "a", -1L));
        assertThat(result.column("c").values()).containsExactly("x", "?", "z", "?");
        assertThat(result.column("a").values()).containsExactly(1L, -1L, 3L, -1L);
        assertThat(result.column("b").nullCount()).isEqualTo(2);

        assertThat(sparse().fillNa("b", 9.5).column("b").values()).containsExactly(1.0, 9.5, 9.5, 4.0);

        assertThatThrownBy(() -> sparse().fillNa("nope", 1L))
                .isInstanceOf(ColumnNotFoundException.class);
        assertThatThrownBy(() -> sparse().fillNa("a", "text"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void interpolateLinear_shouldFillInteriorGapsOnly() {
        var frame = DataFrame.builder()
                .values("v", null, 0L, null, null, null, 4L, null)
                .build();

        var result = frame.interpolate(FillMethod.LINEAR);
        assertThat(result.column("v").dtype()).isEqualTo(DType.FLOAT64);
        assertThat(result.column("v").values()).containsExactly(null, 0.0, 1.0, 2.0, 3.0, 4.0, null);
    }

    @Test
    void interpolateLinear_shouldSkipGapsLongerThanLimit() {
        var frame = DataFrame.builder()
                .values("v", 0.0, null, 2.0, null, null, 5.0)
                .build();

        var result = frame.interpolate(FillMethod.LINEAR, 1);
        assertThat(result.column("v").values()).containsExactly(0.0, 1.0, 2.0, null, null, 5.0);
    }

    @Test
    void interpolateForwardAndBackward_shouldRespectLimit() {
        var frame = DataFrame.builder()
                .values("v", 1L, null, null, 4L)
                .build();

        assertThat(frame.interpolate(FillMethod.FORWARD).column("v").values())
                .containsExactly(1L, 1L, 1L, 4L);
        assertThat(frame.interpolate(FillMethod.FORWARD, 1).column("v").values())
                .containsExactly(1L, 1L, null, 4L);
        assertThat(frame.interpolate(FillMethod.BACKWARD, 1).column("v").values())
                .containsExactly(1L, null, 4L, 4L);
        assertThat(frame.interpolate(FillMethod.FORWARD).column("v").dtype()).isEqualTo(DType.INT64);
    }

    @Test
    void interpolate_shouldLeaveNonNumericColumnsShared() {
        var frame = sparse();
        var result = frame.interpolate(FillMethod.FORWARD);

        assertThat(result.column("c").sharesStorageWith(frame.column("c"))).isTrue();
        assertThat(result.column("c").nullCount()).isEqualTo(2);
    }
}
