package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.core.FrameConfiguration;
import io.framekit.index.Index;
import io.framekit.series.Series;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Column-by-column construction of a {@link DataFrame}; columns keep insertion order.
 * <pre>{@code
 * var df = DataFrame.builder()
 *         .longs("id", 1, 2, 3)
 *         .strings("name", "a", null, "c")
 *         .build();
 * }</pre>
 */
public final class DataFrameBuilder {

    private final List<Series> columns = new ArrayList<>();
    private FrameConfiguration configuration = FrameConfiguration.defaults();
    private Index index;

    DataFrameBuilder() {
    }

    public DataFrameBuilder longs(String name, long... values) {
        return column(Series.ofLongs(name, values));
    }

    public DataFrameBuilder doubles(String name, double... values) {
        return column(Series.ofDoubles(name, values));
    }

    public DataFrameBuilder booleans(String name, boolean... values) {
        return column(Series.ofBooleans(name, values));
    }

    /**
     * String column; {@code null} elements become null cells.
     */
    public DataFrameBuilder strings(String name, String... values) {
        return column(Series.ofStrings(name, values));
    }

    /**
     * Column with the dtype inferred from its non-null elements (see {@link Series#of(String, List)}); {@code null} elements become null cells.
     */
    public DataFrameBuilder values(String name, Object... values) {
        return column(Series.of(name, Arrays.asList(values)));
    }

    public DataFrameBuilder values(String name, DType dtype, List<?> values) {
        return column(Series.of(name, dtype, values));
    }

    /**
     * Column parsed from text, with the configured NA tokens as nulls.
     */
    public DataFrameBuilder parse(String name, String... raw) {
        return column(Series.parse(name, raw, configuration));
    }

    public DataFrameBuilder column(Series column) {
        columns.add(column);
        return this;
    }

    public DataFrameBuilder index(Index index) {
        this.index = index;
        return this;
    }

    public DataFrameBuilder configuration(FrameConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }

    /**
     * @throws io.framekit.core.InvalidArgumentException if two columns share a name
     * @throws io.framekit.core.InvalidShapeException    if lengths differ from each other or from the index
     */
    public DataFrame build() {
        var views = new ArrayList<Series>(columns.size());
        for (var column : columns) {
            views.add(column.view());
        }
        return new DataFrame(views, index, configuration);
    }
}
