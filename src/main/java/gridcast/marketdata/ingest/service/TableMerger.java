package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.JoinType;
import gridcast.marketdata.ingest.transformer.NormalizerUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins several tables on a shared timestamp column.
 *
 * Tables are folded left to right. The first table's columns are never renamed;
 * a non-key column of table i (i >= 1) that collides with a column already in the
 * result is renamed to {@code <column>_<suffixes[i-1]>}.
 *
 * The first table is always the anchor, even when it is null or empty: {@code left}
 * and {@code inner} joins against an empty anchor yield no rows. Null or empty tables
 * after the first contribute neither rows nor columns and are skipped.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
@Slf4j
public class TableMerger {

    public DataTable mergeTables(List<DataTable> tables, List<String> suffixes, String timestampColumn,
                                 String joinType) {
        return mergeTables(tables, suffixes, timestampColumn, JoinType.fromIdentifier(joinType));
    }

    /**
     * @param tables          ordered tables to merge
     * @param suffixes        one suffix per table after the first
     * @param timestampColumn join key
     * @param joinType        join semantics applied at each step
     * @return merged table; the anchor itself when every later table is empty
     * @throws IllegalArgumentException if the suffix count is wrong or a non-empty table lacks the key
     */
    public DataTable mergeTables(List<DataTable> tables, List<String> suffixes, String timestampColumn,
                                 JoinType joinType) {
        if (tables == null || tables.isEmpty()) {
            return DataTable.empty();
        }
        log.info("Merging {} tables with {} join", tables.size(), joinType);

        if (suffixes == null || suffixes.size() != tables.size() - 1) {
            log.error("Number of suffixes ({}) must be one less than number of tables ({})",
                    suffixes == null ? 0 : suffixes.size(), tables.size());
            throw new IllegalArgumentException("Incorrect number of suffixes provided: expected "
                    + (tables.size() - 1) + " but got " + (suffixes == null ? 0 : suffixes.size()));
        }

        DataTable result = tables.get(0) == null ? DataTable.empty() : tables.get(0);
        requireKey(result, timestampColumn, 0);
        for (int i = 1; i < tables.size(); i++) {
            DataTable table = tables.get(i);
            if (DataTable.isNullOrEmpty(table)) {
                log.warn("Skipping empty table at index {}", i);
                continue;
            }
            requireKey(table, timestampColumn, i);
            result = join(result, table, timestampColumn, joinType, suffixes.get(i - 1));
        }

        log.info("Merged table has {} rows and {} columns", result.rowCount(), result.columns().size());
        return result;
    }

    private static void requireKey(DataTable table, String timestampColumn, int index) {
        if (!table.isEmpty() && !table.hasColumn(timestampColumn)) {
            log.error("Timestamp column '{}' not found in table at index {}", timestampColumn, index);
            throw new IllegalArgumentException(
                    "Timestamp column '" + timestampColumn + "' missing from table at index " + index);
        }
    }

    private DataTable join(DataTable left, DataTable right, String key, JoinType joinType, String suffix) {
        Map<String, String> rightNames = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>();
        // An empty anchor may come without any columns
        if (!left.hasColumn(key)) {
            columns.add(key);
        }
        columns.addAll(left.columns());
        Set<String> taken = new HashSet<>(left.columns());
        for (String column : right.columns()) {
            if (column.equals(key)) {
                continue;
            }
            String name = taken.contains(column) ? column + "_" + suffix : column;
            if (!taken.add(name)) {
                throw new IllegalArgumentException("Column '" + name + "' still collides after applying suffix '" + suffix + "'");
            }
            rightNames.put(column, name);
            columns.add(name);
        }

        Map<Object, List<Map<String, Object>>> rightByKey = groupByKey(right, key);
        Map<Object, List<Map<String, Object>>> leftByKey = groupByKey(left, key);

        List<Map<String, Object>> joined = new ArrayList<>();
        if (joinType == JoinType.RIGHT) {
            for (Map<String, Object> rightRow : right.rows()) {
                List<Map<String, Object>> matches = leftByKey.get(keyOf(rightRow.get(key)));
                if (matches == null) {
                    joined.add(combine(null, rightRow, key, rightNames));
                } else {
                    matches.forEach(leftRow -> joined.add(combine(leftRow, rightRow, key, rightNames)));
                }
            }
        } else {
            for (Map<String, Object> leftRow : left.rows()) {
                List<Map<String, Object>> matches = rightByKey.get(keyOf(leftRow.get(key)));
                if (matches != null) {
                    matches.forEach(rightRow -> joined.add(combine(leftRow, rightRow, key, rightNames)));
                } else if (joinType != JoinType.INNER) {
                    joined.add(combine(leftRow, null, key, rightNames));
                }
            }
            if (joinType == JoinType.OUTER) {
                for (Map<String, Object> rightRow : right.rows()) {
                    if (!leftByKey.containsKey(keyOf(rightRow.get(key)))) {
                        joined.add(combine(null, rightRow, key, rightNames));
                    }
                }
                // Stable sort keeps left-before-right order within a key
                joined.sort(NormalizerUtils.ascendingBy(List.of(key)));
            }
        }

        DataTable.Builder builder = DataTable.builder(columns);
        joined.forEach(builder::addRow);
        return builder.build();
    }

    private static Map<String, Object> combine(Map<String, Object> leftRow, Map<String, Object> rightRow,
                                               String key, Map<String, String> rightNames) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (leftRow != null) {
            row.putAll(leftRow);
        } else {
            row.put(key, rightRow.get(key));
        }
        if (rightRow != null) {
            rightNames.forEach((column, name) -> row.put(name, rightRow.get(column)));
        }
        return row;
    }

    private static Map<Object, List<Map<String, Object>>> groupByKey(DataTable table, String key) {
        Map<Object, List<Map<String, Object>>> grouped = new LinkedHashMap<>();
        for (Map<String, Object> row : table.rows()) {
            grouped.computeIfAbsent(keyOf(row.get(key)), k -> new ArrayList<>()).add(row);
        }
        return grouped;
    }

    /**
     * Zoned timestamps match on the instant they denote, whatever their zone.
     */
    private static Object keyOf(Object value) {
        return value instanceof ZonedDateTime ? ((ZonedDateTime) value).toInstant() : value;
    }
}
