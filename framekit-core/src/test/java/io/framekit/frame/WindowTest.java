package io.framekit.frame;

import io.framekit.core.ColumnNotFoundException;
import io.framekit.core.DType;
import io.framekit.core.FrameConfiguration;
import io.framekit.core.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowTest {

    private static DataFrame prices() {
        return DataFrame.builder()
                .doubles("price", 1.0, 2.0, 3.0, 4.0, 5.0)
                .strings("ticker", "a", "a", "a", "a", "a")
                .build();
    }

    @Test
    void rollingSizeOne_shouldReproduceValues() {
        var mean = prices().rolling(1).mean("price");
        assertThat(mean.values()).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
        assertThat(mean.name()).isEqualTo("price_mean");
        assertThat(mean.dtype()).isEqualTo(DType.FLOAT64);
    }

    @Test
    void rolling_shouldNullRowsBelowMinPeriods() {
        var sum = prices().rolling(3).sum("price");
        assertThat(sum.values()).containsExactly(null, null, 6.0, 9.0, 12.0);

        var partial = prices().rolling(3, WindowOptions.defaults().withMinPeriods(1)).sum("price");
        assertThat(partial.values()).containsExactly(1.0, 3.0, 6.0, 9.0, 12.0);
    }

    @Test
    void centeredWindow_shouldLookBothWays() {
        var mean = prices().rolling(3, WindowOptions.defaults().withMinPeriods(1).centered()).mean("price");
        assertThat(mean.values()).containsExactly(1.5, 2.0, 3.0, 4.0, 4.5);
    }

    @Test
    void rolling_shouldSkipNullCells() {
        var frame = DataFrame.builder().values("v", 1.0, null, 3.0, 5.0).build();

        var max = frame.rolling(2, WindowOptions.defaults().withMinPeriods(1)).max("v");
        assertThat(max.values()).containsExactly(1.0, 1.0, 3.0, 5.0);

        var strict = frame.rolling(2).min("v");
        assertThat(strict.values()).containsExactly(null, null, null, 3.0);
    }

    @Test
    void rollingStd_shouldUseSampleDeviation() {
        var std = prices().rolling(2).std("price");
        assertThat(std.get(0)).isNull();
        assertThat(std.getDouble(1)).isCloseTo(Math.sqrt(0.5), within(1e-12));
    }

    @Test
    void expanding_shouldCoverEveryRowSoFar() {
        var sum = prices().expanding(1).sum("price");
        assertThat(sum.values()).containsExactly(1.0, 3.0, 6.0, 10.0, 15.0);

        var mean = prices().expanding(3).mean("price");
        assertThat(mean.values()).containsExactly(null, null, 2.0, 2.5, 3.0);
        assertThat(prices().expanding(0).minPeriods()).isEqualTo(1);
    }

    @Test
    void ewmMean_shouldFollowRecurrence() {
        var frame = DataFrame.builder().values("v", 2.0, null, 4.0, 8.0).build();

        var ewm = frame.ewm(0.5).mean("v");
        assertThat(ewm.values()).containsExactly(2.0, 2.0, 3.0, 5.5);
    }

    @Test
    void ewm_shouldFallBackToConfiguredAlpha() {
        assertThat(prices().ewm(0.0).alpha()).isEqualTo(0.5);
        assertThat(prices().ewm(1.5).alpha()).isEqualTo(0.5);
        assertThat(prices().ewm(0.2).alpha()).isEqualTo(0.2);

        var config = FrameConfiguration.builder().ewmDefaultAlpha(0.25).build();
        assertThat(prices().withConfiguration(config).ewm(-1).alpha()).isEqualTo(0.25);
    }

    @Test
    void ewmOtherReducers_shouldUseExpandingWindow() {
        var max = prices().ewm(0.5).max("price");
        assertThat(max.values()).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
    }

    @Test
    void invalidArguments_shouldThrow() {
        assertThatThrownBy(() -> prices().rolling(0))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("at least 1");
        assertThatThrownBy(() -> prices().rolling(2).mean("ticker"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("numeric");
        assertThatThrownBy(() -> prices().rolling(2).mean("nope"))
                .isInstanceOf(ColumnNotFoundException.class);
    }

    @Test
    void aggregate_shouldAcceptIntegerColumns() {
        var frame = DataFrame.builder().longs("n", 4, 2, 6).build();
        var result = frame.rolling(2).aggregate("n", WindowReducer.MAX);
        assertThat(result.values()).containsExactly(null, 4.0, 6.0);
        assertThat(result.name()).isEqualTo("n_max");
    }
}
