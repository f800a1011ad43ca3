package com.trading.sdg.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.IntPredicate;
import java.util.function.LongPredicate;

/**
 * Immutable time-indexed column table.
 * <p>
 * Rows are keyed by an ascending epoch-millis (UTC) index. Column values are
 * boxed ({@link Double}, {@link Long}, {@link Boolean}, {@link String}) and may
 * be {@code null}. Scalar values live beside the columns and are not broadcast:
 * consumers that combine a scalar with a series read it through
 * {@link #valueOrScalar(String, int)}.
 */
public final class Table {

    private static final Table EMPTY = new Table(new long[0], new LinkedHashMap<>(), Map.of());

    private final long[] index;
    private final LinkedHashMap<String, Object[]> columns;
    private final Map<String, Object> scalars;

    private Table(long[] index, LinkedHashMap<String, Object[]> columns, Map<String, Object> scalars) {
        this.index = index;
        this.columns = columns;
        this.scalars = scalars;
    }

    public static Table empty() {
        return EMPTY;
    }

    /** A zero-row table that still carries the expected column names. */
    public static Table emptyWithColumns(Collection<String> names) {
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (String n : names)
            cols.put(n, new Object[0]);
        return new Table(new long[0], cols, Map.of());
    }

    /**
     * @throws IllegalArgumentException if a column length differs from the
     *                                  index length or the index is not sorted.
     */
    public static Table of(long[] index, Map<String, ? extends List<?>> columns) {
        for (int i = 1; i < index.length; i++) {
            if (index[i] < index[i - 1])
                throw new IllegalArgumentException("Index must be ascending at row " + i);
        }
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (var e : columns.entrySet()) {
            if (e.getValue().size() != index.length)
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + e.getValue().size()
                        + " rows, index has " + index.length);
            cols.put(e.getKey(), e.getValue().toArray());
        }
        return new Table(index.clone(), cols, Map.of());
    }

    /** A one-row table at timestamp 0, used for scalar results. */
    public static Table singleRow(Map<String, ?> values) {
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (var e : values.entrySet())
            cols.put(e.getKey(), new Object[] { e.getValue() });
        return new Table(new long[] { 0L }, cols, Map.of());
    }

    public int rowCount() {
        return index.length;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return index.length == 0;
    }

    public long timestamp(int row) {
        return index[row];
    }

    public long[] timestamps() {
        return index.clone();
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /** Column or scalar with this name. */
    public boolean has(String name) {
        return columns.containsKey(name) || scalars.containsKey(name);
    }

    public List<Object> column(String name) {
        Object[] values = columns.get(name);
        if (values == null)
            throw new IllegalArgumentException("Unknown column: " + name);
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    public Object value(String name, int row) {
        Object[] values = columns.get(name);
        if (values == null)
            throw new IllegalArgumentException("Unknown column: " + name);
        return values[row];
    }

    public boolean hasScalar(String name) {
        return scalars.containsKey(name);
    }

    public Object scalar(String name) {
        if (!scalars.containsKey(name))
            throw new IllegalArgumentException("Unknown scalar: " + name);
        return scalars.get(name);
    }

    public Map<String, Object> scalars() {
        return Collections.unmodifiableMap(scalars);
    }

    /** Reads a column cell, falling back to a scalar of the same name. */
    public Object valueOrScalar(String name, int row) {
        Object[] values = columns.get(name);
        if (values != null)
            return values[row];
        if (scalars.containsKey(name))
            return scalars.get(name);
        throw new IllegalArgumentException("Unknown column or scalar: " + name);
    }

    public Table withScalar(String name, Object value) {
        Map<String, Object> s = new LinkedHashMap<>(scalars);
        s.put(name, value);
        return new Table(index, columns, s);
    }

    public Table withColumn(String name, List<?> values) {
        if (values.size() != index.length)
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
                    + " rows, index has " + index.length);
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>(columns);
        cols.put(name, values.toArray());
        return new Table(index, cols, scalars);
    }

    /** Keeps only the listed columns that exist, in the listed order. */
    public Table select(Collection<String> names) {
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (String n : names) {
            Object[] values = columns.get(n);
            if (values != null)
                cols.put(n, values);
        }
        return new Table(index, cols, scalars);
    }

    public Table rename(String from, String to) {
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (var e : columns.entrySet())
            cols.put(e.getKey().equals(from) ? to : e.getKey(), e.getValue());
        return new Table(index, cols, scalars);
    }

    /** Drops rows where any column is null. */
    public Table dropNulls() {
        return filter(row -> {
            for (Object[] values : columns.values()) {
                if (values[row] == null)
                    return false;
            }
            return true;
        });
    }

    /** Keeps rows whose timestamp matches. */
    public Table filterTimestamps(LongPredicate keep) {
        return filter(row -> keep.test(index[row]));
    }

    private Table filter(IntPredicate keep) {
        int[] rows = new int[index.length];
        int n = 0;
        for (int r = 0; r < index.length; r++) {
            if (keep.test(r))
                rows[n++] = r;
        }
        if (n == index.length)
            return this;
        long[] idx = new long[n];
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (String name : columns.keySet())
            cols.put(name, new Object[n]);
        for (int i = 0; i < n; i++) {
            idx[i] = index[rows[i]];
            for (var e : columns.entrySet())
                cols.get(e.getKey())[i] = e.getValue()[rows[i]];
        }
        return new Table(idx, cols, scalars);
    }

    /**
     * Outer join on the index. Cells missing on one side are null; columns of
     * {@code other} win on name clashes.
     */
    public Table join(Table other) {
        if (other.columns.isEmpty() && other.index.length == 0) {
            return other.scalars.isEmpty() ? this : mergeScalars(other);
        }
        if (columns.isEmpty() && index.length == 0) {
            return other.mergeScalars(this);
        }
        TreeSet<Long> union = new TreeSet<>();
        for (long t : index)
            union.add(t);
        for (long t : other.index)
            union.add(t);
        long[] idx = new long[union.size()];
        int i = 0;
        for (long t : union)
            idx[i++] = t;

        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (var e : columns.entrySet())
            cols.put(e.getKey(), spread(index, e.getValue(), idx));
        for (var e : other.columns.entrySet())
            cols.put(e.getKey(), spread(other.index, e.getValue(), idx));
        Map<String, Object> s = new LinkedHashMap<>(scalars);
        s.putAll(other.scalars);
        return new Table(idx, cols, s);
    }

    private Table mergeScalars(Table other) {
        Map<String, Object> s = new LinkedHashMap<>(other.scalars);
        s.putAll(scalars);
        return new Table(index, columns, s);
    }

    private static Object[] spread(long[] from, Object[] values, long[] to) {
        Object[] out = new Object[to.length];
        int j = 0;
        for (int i = 0; i < to.length && j < from.length; i++) {
            while (j < from.length && from[j] < to[i])
                j++;
            if (j < from.length && from[j] == to[i])
                out[i] = values[j];
        }
        return out;
    }

    /**
     * As-of alignment onto another index: each target row takes the latest row
     * whose timestamp is not after it, or null if there is none.
     */
    public Table alignTo(long[] target) {
        if (Arrays.equals(index, target))
            return this;
        LinkedHashMap<String, Object[]> cols = new LinkedHashMap<>();
        for (String name : columns.keySet())
            cols.put(name, new Object[target.length]);
        int j = -1;
        for (int i = 0; i < target.length; i++) {
            while (j + 1 < index.length && index[j + 1] <= target[i])
                j++;
            if (j < 0)
                continue;
            for (var e : columns.entrySet())
                cols.get(e.getKey())[i] = e.getValue()[j];
        }
        return new Table(target.clone(), cols, scalars);
    }

    /** Row values of a column as doubles; nulls become NaN. */
    public double[] doubles(String name) {
        Object[] values = columns.get(name);
        if (values == null)
            throw new IllegalArgumentException("Unknown column: " + name);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++)
            out[i] = toDouble(values[i]);
        return out;
    }

    public static double toDouble(Object v) {
        if (v == null)
            return Double.NaN;
        if (v instanceof Number n)
            return n.doubleValue();
        if (v instanceof Boolean b)
            return b ? 1.0 : 0.0;
        throw new IllegalArgumentException("Value is not numeric: " + v);
    }

    /** Builds a list-backed column for {@link #withColumn}. */
    public static List<Object> columnOf(int rows) {
        return new ArrayList<>(Collections.nCopies(rows, null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Table t))
            return false;
        if (!Arrays.equals(index, t.index) || !columns.keySet().equals(t.columns.keySet())
                || !scalars.equals(t.scalars))
            return false;
        for (var e : columns.entrySet()) {
            if (!Arrays.equals(e.getValue(), t.columns.get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(columns.keySet(), scalars);
        return 31 * h + Arrays.hashCode(index);
    }

    @Override
    public String toString() {
        return "Table[rows=" + index.length + ", columns=" + columns.keySet() + ", scalars=" + scalars.keySet() + "]";
    }
}
