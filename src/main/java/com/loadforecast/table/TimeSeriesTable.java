package com.loadforecast.table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

/**
 * Immutable, time-indexed table of named numeric columns.
 * <p>
 * Missing values are {@link Double#NaN}. Column order is insertion order and is
 * significant: datasets used for training keep the target in the first column and
 * the horizon in the last one.
 */
public final class TimeSeriesTable {

    private final List<Instant> index;
    private final LinkedHashMap<String, double[]> columns;

    private TimeSeriesTable(List<Instant> index, LinkedHashMap<String, double[]> columns) {
        this.index = index;
        this.columns = columns;
    }

    public static Builder builder(List<Instant> index) {
        return new Builder(index);
    }

    public static TimeSeriesTable empty(List<Instant> index) {
        return new Builder(index).build();
    }

    public List<Instant> getIndex() {
        return index;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public int rowCount() {
        return index.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public String columnName(int position) {
        List<String> names = columnNames();
        int resolved = position < 0 ? names.size() + position : position;
        if (resolved < 0 || resolved >= names.size()) {
            throw new IndexOutOfBoundsException("Column position " + position + " outside table of " + names.size());
        }
        return names.get(resolved);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "', available: " + columns.keySet());
        }
        return values.clone();
    }

    public double value(int row, String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        return values[row];
    }

    public TimeSeriesTable selectRows(int[] rows) {
        List<Instant> newIndex = new ArrayList<>(rows.length);
        for (int r : rows) {
            newIndex.add(index.get(r));
        }
        LinkedHashMap<String, double[]> selected = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            double[] out = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                out[i] = values[rows[i]];
            }
            selected.put(name, out);
        });
        return new TimeSeriesTable(Collections.unmodifiableList(newIndex), selected);
    }

    public TimeSeriesTable filterRows(IntPredicate keep) {
        return selectRows(IntStream.range(0, rowCount()).filter(keep).toArray());
    }

    public TimeSeriesTable between(Instant fromInclusive, Instant toInclusive) {
        return filterRows(r -> !index.get(r).isBefore(fromInclusive) && !index.get(r).isAfter(toInclusive));
    }

    public TimeSeriesTable selectColumns(List<String> names) {
        LinkedHashMap<String, double[]> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, column(name));
        }
        return new TimeSeriesTable(index, selected);
    }

    /** Columns in positions {@code [fromInclusive, toExclusive)}; negative bounds count from the end. */
    public TimeSeriesTable sliceColumns(int fromInclusive, int toExclusive) {
        List<String> names = columnNames();
        int from = Math.max(0, fromInclusive < 0 ? names.size() + fromInclusive : fromInclusive);
        int to = Math.min(names.size(), toExclusive < 0 ? names.size() + toExclusive : toExclusive);
        return selectColumns(names.subList(Math.min(from, to), to < from ? from : to));
    }

    /** Returns a copy with the column replaced in place, or appended when it does not exist yet. */
    public TimeSeriesTable withColumn(String name, double[] values) {
        if (values.length != rowCount()) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                + " values, table has " + rowCount() + " rows");
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(name, values.clone());
        return new TimeSeriesTable(index, copy);
    }

    public TimeSeriesTable withoutColumn(String name) {
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return new TimeSeriesTable(index, copy);
    }

    public TimeSeriesTable sortByIndex() {
        int[] order = IntStream.range(0, rowCount()).boxed()
            .sorted(Comparator.comparing(index::get))
            .mapToInt(Integer::intValue)
            .toArray();
        return selectRows(order);
    }

    /** Row-major copy of the given columns, for model fitting. */
    public double[][] toMatrix() {
        double[][] matrix = new double[rowCount()][columnCount()];
        int c = 0;
        for (double[] values : columns.values()) {
            for (int r = 0; r < values.length; r++) {
                matrix[r][c] = values[r];
            }
            c++;
        }
        return matrix;
    }

    public Map<String, Double> row(int r) {
        Map<String, Double> out = new LinkedHashMap<>();
        columns.forEach((name, values) -> out.put(name, values[r]));
        return out;
    }

    @Override
    public String toString() {
        return "TimeSeriesTable{rows=" + rowCount() + ", columns=" + columns.keySet() + "}";
    }

    public static final class Builder {
        private final List<Instant> index;
        private final LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();

        private Builder(List<Instant> index) {
            this.index = List.copyOf(index);
        }

        public Builder column(String name, double[] values) {
            if (values.length != index.size()) {
                throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " values, index has " + index.size());
            }
            columns.put(name, values.clone());
            return this;
        }

        public Builder constantColumn(String name, double value) {
            double[] values = new double[index.size()];
            Arrays.fill(values, value);
            columns.put(name, values);
            return this;
        }

        public TimeSeriesTable build() {
            return new TimeSeriesTable(index, new LinkedHashMap<>(columns));
        }
    }
}
