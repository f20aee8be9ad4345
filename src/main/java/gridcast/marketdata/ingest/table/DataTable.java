package gridcast.marketdata.ingest.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable in-memory table used by every stage of the transformation pipeline.
 *
 * Structure:
 * - An ordered, duplicate-free list of column names
 * - An ordered list of rows, each an unmodifiable map keyed by column name
 * - Cell values may be null (missing data)
 *
 * Every operation returns a new table; the receiver is never modified.
 * Instances are safe to share between threads.
 */
public final class DataTable {

    private static final DataTable EMPTY = new DataTable(List.of(), List.of());

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Table with no columns and no rows.
     */
    public static DataTable empty() {
        return EMPTY;
    }

    /**
     * Table with the given columns and no rows.
     */
    public static DataTable withColumns(List<String> columns) {
        return builder(columns).build();
    }

    public static DataTable withColumns(String... columns) {
        return withColumns(List.of(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    /**
     * Build a table from row maps. Columns are the union of row keys in first-seen order.
     */
    public static DataTable fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            columns.addAll(row.keySet());
        }
        Builder builder = builder(new ArrayList<>(columns));
        rows.forEach(builder::addRow);
        return builder.build();
    }

    public static boolean isNullOrEmpty(DataTable table) {
        return table == null || table.isEmpty();
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * A table is empty when it has no rows, whatever its columns.
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    /**
     * Values of one column in row order.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<Object> column(String name) {
        requireColumn(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Rename columns. When two columns map to the same new name the first one wins
     * and the later one is dropped.
     */
    public DataTable renameColumns(Function<String, String> renamer) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> taken = new LinkedHashSet<>();
        for (String column : columns) {
            String renamed = renamer.apply(column);
            if (taken.add(renamed)) {
                mapping.put(column, renamed);
            }
        }
        Builder builder = builder(new ArrayList<>(taken));
        for (Map<String, Object> row : rows) {
            Map<String, Object> renamedRow = new LinkedHashMap<>();
            mapping.forEach((from, to) -> renamedRow.put(to, row.get(from)));
            builder.addRow(renamedRow);
        }
        return builder.build();
    }

    /**
     * Replace every value of one column with the result of the mapper.
     */
    public DataTable mapColumn(String name, Function<Object, Object> mapper) {
        requireColumn(name);
        Builder builder = builder(columns);
        for (Map<String, Object> row : rows) {
            Map<String, Object> mapped = new LinkedHashMap<>(row);
            mapped.put(name, mapper.apply(row.get(name)));
            builder.addRow(mapped);
        }
        return builder.build();
    }

    public DataTable filter(Predicate<Map<String, Object>> predicate) {
        Builder builder = builder(columns);
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) {
                builder.addRow(row);
            }
        }
        return builder.build();
    }

    /**
     * Stable sort of the rows.
     */
    public DataTable sorted(Comparator<Map<String, Object>> comparator) {
        List<Map<String, Object>> sortedRows = new ArrayList<>(rows);
        sortedRows.sort(comparator);
        return new DataTable(columns, Collections.unmodifiableList(sortedRows));
    }

    /**
     * Keep only the given columns, in the given order.
     */
    public DataTable select(List<String> selected) {
        selected.forEach(this::requireColumn);
        Builder builder = builder(selected);
        for (Map<String, Object> row : rows) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : selected) {
                projected.put(column, row.get(column));
            }
            builder.addRow(projected);
        }
        return builder.build();
    }

    private void requireColumn(String name) {
        if (!columns.contains(name)) {
            throw new IllegalArgumentException("Column '" + name + "' not found in table with columns " + columns);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataTable)) {
            return false;
        }
        DataTable other = (DataTable) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /**
     * Accumulates rows for a table with a fixed column list.
     * Missing cells in an added row are stored as null.
     */
    public static final class Builder {

        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Set<String> unique = new LinkedHashSet<>(columns);
            if (unique.size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(Map<String, ?> values) {
            for (String key : values.keySet()) {
                if (!columns.contains(key)) {
                    throw new IllegalArgumentException("Unknown column '" + key + "', expected one of " + columns);
                }
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, values.get(column));
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        /**
         * Add a row from positional values matching the column order.
         */
        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                        "Expected " + columns.size() + " values but got " + values.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        public DataTable build() {
            return new DataTable(columns, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }
}
