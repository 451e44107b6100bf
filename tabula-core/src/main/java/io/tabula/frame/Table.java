package io.tabula.frame;

import io.tabula.core.ColumnNotFoundException;
import io.tabula.core.TableConstructionException;
import io.tabula.core.TabulaConfiguration;
import io.tabula.kernel.MemoryEstimator;
import io.tabula.kernel.MemoryUsage;
import io.tabula.kernel.ReadOnlyViews;
import io.tabula.kernel.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Ordered mapping of column name to {@link Series}, every column holding the same number of rows.
 * <p>
 * Built from row records with {@link #fromRows(List)} or from column lists with
 * {@link #fromColumns(Map)}. Input is validated eagerly and copied; the table owns its series
 * and can never be changed afterwards. Any attempt to replace a column or a cell through the
 * returned views fails with {@link io.tabula.core.MutationNotAllowedException}.
 * <p>
 * All statistics are delegated to the column series. The no-argument forms return an ordered,
 * read-only mapping from column name to result.
 */
public final class Table {

    private static final Logger log = LoggerFactory.getLogger(Table.class);

    private final Map<String, Series> columns;
    private final List<String> columnNames;
    private final int rowCount;

    private Table(LinkedHashMap<String, Series> owned) {
        this.columns = ReadOnlyViews.map(owned, "Table column");
        this.columnNames = ReadOnlyViews.list(new ArrayList<>(owned.keySet()), "Table column name");
        this.rowCount = owned.isEmpty() ? 0 : owned.values().iterator().next().length();
        if (log.isDebugEnabled()) {
            log.debug("Built table with {} rows and {} columns {}", rowCount, columnNames.size(), columnNames);
        }
    }

    /**
     * Build a table from row records. Every record must have exactly the keys of the first one,
     * in any order; columns follow the key order of the first record.
     *
     * @throws TableConstructionException if the list is empty, a record is null or the key sets differ
     */
    public static Table fromRows(List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new TableConstructionException("Table: expected a non-empty list of row records");
        }
        Map<String, ?> first = rows.get(0);
        if (first == null) {
            throw new TableConstructionException("Table: row records must not be null (row 0)");
        }
        Set<String> keys = new LinkedHashSet<>(first.keySet());
        requireColumnNames(keys);
        for (int i = 1; i < rows.size(); i++) {
            Map<String, ?> row = rows.get(i);
            if (row == null) {
                throw new TableConstructionException("Table: row records must not be null (row " + i + ")");
            }
            if (row.size() != keys.size() || !keys.containsAll(row.keySet())) {
                throw new TableConstructionException(
                        "Table: all row records must have the same keys (row " + i + " has " + row.keySet()
                                + ", expected " + keys + ")");
            }
        }

        LinkedHashMap<String, Series> built = new LinkedHashMap<>();
        for (String key : keys) {
            List<Value> values = new ArrayList<>(rows.size());
            for (Map<String, ?> row : rows) {
                values.add(Value.of(row.get(key)));
            }
            built.put(key, Series.wrap(key, values));
        }
        return new Table(built);
    }

    /**
     * Build a table from column lists. Columns follow the iteration order of the map, so pass a
     * {@link LinkedHashMap} to control it.
     *
     * @throws TableConstructionException if the map is empty, a column is null or the lengths differ
     */
    public static Table fromColumns(Map<String, ? extends List<?>> data) {
        if (data == null || data.isEmpty()) {
            throw new TableConstructionException("Table: expected at least one column");
        }
        requireColumnNames(data.keySet());
        int expectedLength = -1;
        for (Map.Entry<String, ? extends List<?>> entry : data.entrySet()) {
            if (entry.getValue() == null) {
                throw new TableConstructionException("Table: column \"" + entry.getKey() + "\" must be a list");
            }
            int length = entry.getValue().size();
            if (expectedLength < 0) {
                expectedLength = length;
            } else if (length != expectedLength) {
                throw new TableConstructionException(
                        "Table: all columns must have the same length (column \"" + entry.getKey() + "\" has "
                                + length + ", expected " + expectedLength + ")");
            }
        }

        LinkedHashMap<String, Series> built = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<?>> entry : data.entrySet()) {
            built.put(entry.getKey(), new Series(entry.getKey(), entry.getValue()));
        }
        return new Table(built);
    }

    /**
     * Build a table from untyped input: a {@code List} of row maps or a {@code Map} of column lists.
     *
     * @throws TableConstructionException for any other shape, including {@code null}
     */
    @SuppressWarnings("unchecked")
    public static Table of(Object data) {
        if (data instanceof List<?> rows) {
            for (int i = 0; i < rows.size(); i++) {
                if (!(rows.get(i) instanceof Map<?, ?> row) || !hasStringKeys(row)) {
                    throw new TableConstructionException(
                            "Table: row records must be maps with String keys (row " + i + ")");
                }
            }
            return fromRows((List<? extends Map<String, ?>>) rows);
        }
        if (data instanceof Map<?, ?> map) {
            if (!hasStringKeys(map)) {
                throw new TableConstructionException("Table: column names must be Strings");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getValue() instanceof List)) {
                    throw new TableConstructionException(
                            "Table: all column values must be lists (column \"" + entry.getKey() + "\")");
                }
            }
            return fromColumns((Map<String, ? extends List<?>>) map);
        }
        throw new TableConstructionException("Table: expected a list of row records or a map of columns");
    }

    private static boolean hasStringKeys(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }

    private static void requireColumnNames(Set<String> names) {
        // contains(null) throws on the immutable Map.of key sets
        for (String name : names) {
            if (name == null) {
                throw new TableConstructionException("Table: column names must not be null");
            }
        }
    }

    public int length() {
        return rowCount;
    }

    public int numColumns() {
        return columnNames.size();
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public Shape shape() {
        return new Shape(rowCount, columnNames.size());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Series column(String name) {
        Series series = columns.get(name);
        if (series == null) {
            throw new ColumnNotFoundException(name);
        }
        return series;
    }

    /**
     * @return read-only, ordered view of the columns
     */
    public Map<String, Series> columns() {
        return columns;
    }

    public Table head() {
        return head(TabulaConfiguration.defaults());
    }

    public Table head(TabulaConfiguration configuration) {
        return head(configuration.previewRows());
    }

    public Table head(int n) {
        return mapColumns(series -> series.head(n));
    }

    public Table tail() {
        return tail(TabulaConfiguration.defaults());
    }

    public Table tail(TabulaConfiguration configuration) {
        return tail(configuration.previewRows());
    }

    public Table tail(int n) {
        return mapColumns(series -> series.tail(n));
    }

    private Table mapColumns(Function<Series, Series> fn) {
        LinkedHashMap<String, Series> result = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            result.put(entry.getKey(), fn.apply(entry.getValue()));
        }
        return new Table(result);
    }

    /**
     * @return the row at {@code rowIndex} as a read-only mapping from column name to value
     * @throws IndexOutOfBoundsException if the row is outside {@code [0, length())}
     */
    public Map<String, Value> iloc(int rowIndex) {
        checkRow(rowIndex);
        LinkedHashMap<String, Value> row = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            row.put(entry.getKey(), entry.getValue().values().get(rowIndex));
        }
        return ReadOnlyViews.map(row, "Table row");
    }

    /**
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public Value iloc(int rowIndex, int columnIndex) {
        checkRow(rowIndex);
        if (columnIndex < 0 || columnIndex >= columnNames.size()) {
            throw new IndexOutOfBoundsException(
                    "Column index " + columnIndex + " out of range [0, " + columnNames.size() + ")");
        }
        return columns.get(columnNames.get(columnIndex)).values().get(rowIndex);
    }

    /**
     * @throws IndexOutOfBoundsException if the row is outside {@code [0, length())}
     * @throws ColumnNotFoundException   if there is no such column
     */
    public Value loc(int rowIndex, String columnName) {
        checkRow(rowIndex);
        return column(columnName).values().get(rowIndex);
    }

    private void checkRow(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rowCount) {
            throw new IndexOutOfBoundsException("Row index " + rowIndex + " out of range [0, " + rowCount + ")");
        }
    }

    public OptionalDouble sum(String column) {
        return column(column).sum();
    }

    public Map<String, OptionalDouble> sum() {
        return perColumn(Series::sum);
    }

    public OptionalDouble max(String column) {
        return column(column).max();
    }

    public Map<String, OptionalDouble> max() {
        return perColumn(Series::max);
    }

    public OptionalDouble min(String column) {
        return column(column).min();
    }

    public Map<String, OptionalDouble> min() {
        return perColumn(Series::min);
    }

    public OptionalDouble mean(String column) {
        return column(column).mean();
    }

    public Map<String, OptionalDouble> mean() {
        return perColumn(Series::mean);
    }

    public OptionalDouble median(String column) {
        return column(column).median();
    }

    public Map<String, OptionalDouble> median() {
        return perColumn(Series::median);
    }

    public Optional<Value> mode(String column) {
        return column(column).mode();
    }

    public Map<String, Optional<Value>> mode() {
        return perColumn(Series::mode);
    }

    public Series unique(String column) {
        return column(column).unique();
    }

    public Map<String, Series> unique() {
        return perColumn(Series::unique);
    }

    public Map<Value, Integer> valueCounts(String column) {
        return column(column).valueCounts();
    }

    public Map<Value, Integer> valueCounts(String column, boolean descending) {
        return column(column).valueCounts(descending);
    }

    public Map<String, Map<Value, Integer>> valueCounts() {
        return valueCounts(true);
    }

    public Map<String, Map<Value, Integer>> valueCounts(boolean descending) {
        return perColumn(series -> series.valueCounts(descending));
    }

    public Summary describe(String column) {
        return column(column).describe();
    }

    public TableSummary describe() {
        return new TableSummary(max(), min(), sum(), mean(), median(), mode());
    }

    private <R> Map<String, R> perColumn(Function<Series, R> fn) {
        LinkedHashMap<String, R> result = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            result.put(entry.getKey(), fn.apply(entry.getValue()));
        }
        return ReadOnlyViews.map(result, "column result");
    }

    /**
     * Apply {@code fn} to every column, passing the series and its name.
     *
     * @return read-only mapping from column name to result, in column order
     */
    public <R> Map<String, R> apply(BiFunction<? super Series, ? super String, ? extends R> fn) {
        LinkedHashMap<String, R> result = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            result.put(entry.getKey(), fn.apply(entry.getValue(), entry.getKey()));
        }
        return ReadOnlyViews.map(result, "apply result");
    }

    /**
     * Apply {@code fn} to every row. Each row is handed over as an unnamed series of its values
     * in column order, together with its position.
     *
     * @return read-only list of results, in row order
     */
    public <R> List<R> applyRows(BiFunction<? super Series, ? super Integer, ? extends R> fn) {
        List<R> result = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            List<Value> row = new ArrayList<>(columnNames.size());
            for (Series series : columns.values()) {
                row.add(series.values().get(i));
            }
            result.add(fn.apply(Series.wrap(null, row), i));
        }
        return ReadOnlyViews.list(result, "apply result");
    }

    public TableInfo info() {
        return info(TabulaConfiguration.defaults());
    }

    public TableInfo info(TabulaConfiguration configuration) {
        MemoryEstimator estimator = new MemoryEstimator(configuration);
        MemoryUsage usage = MemoryUsage.ZERO;
        for (Series series : columns.values()) {
            usage = usage.plus(estimator.estimate(series.values()));
        }
        return new TableInfo(rowCount, columnNames.size(), columnNames, usage);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Table other = (Table) obj;
        return columnNames.equals(other.columnNames) && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Table{shape=" + shape() + ", columns=" + columnNames + "}";
    }
}
