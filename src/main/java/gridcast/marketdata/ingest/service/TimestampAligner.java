package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.Frequency;
import gridcast.marketdata.ingest.table.GapFill;
import gridcast.marketdata.ingest.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns several independently timestamped tables onto one shared regular grid.
 *
 * The grid starts at the earliest timestamp across all participating tables and
 * steps by the frequency up to the latest one. Each participating table is
 * reindexed onto the grid:
 * - grid points with matching rows keep all of them
 * - grid points without rows get a single row of nulls
 * - rows between grid points are dropped
 *
 * Tables without the timestamp column are passed through unchanged so auxiliary,
 * non-temporal tables can travel in the same call. Null or empty tables come back empty.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
@Slf4j
public class TimestampAligner {

    private final ZoneId referenceZone;

    public TimestampAligner(TransformationConfig config) {
        this.referenceZone = config.getReferenceZone();
    }

    public Map<String, DataTable> alignTimestamps(Map<String, DataTable> tables, String timestampColumn,
                                                  String frequency) {
        return align(tables, timestampColumn, Frequency.parse(frequency), GapFill.NONE);
    }

    public Map<String, DataTable> alignTimestamps(Map<String, DataTable> tables, String timestampColumn,
                                                  String frequency, GapFill gapFill) {
        return align(tables, timestampColumn, Frequency.parse(frequency), gapFill);
    }

    /**
     * @param tables          source name to table, iteration order is preserved in the result
     * @param timestampColumn column holding the timestamps
     * @param frequency       grid frequency
     * @param gapFill         how grid points without data are filled
     * @return source name to aligned table
     */
    public Map<String, DataTable> align(Map<String, DataTable> tables, String timestampColumn,
                                        Frequency frequency, GapFill gapFill) {
        Map<String, DataTable> aligned = new LinkedHashMap<>();
        if (tables == null || tables.isEmpty()) {
            return aligned;
        }
        log.info("Aligning timestamps across {} tables", tables.size());

        ZonedDateTime min = null;
        ZonedDateTime max = null;
        for (DataTable table : tables.values()) {
            if (DataTable.isNullOrEmpty(table) || !table.hasColumn(timestampColumn)) {
                continue;
            }
            for (Object value : table.column(timestampColumn)) {
                if (value == null) {
                    continue;
                }
                ZonedDateTime timestamp = toZoned(value);
                if (min == null || timestamp.isBefore(min)) {
                    min = timestamp;
                }
                if (max == null || timestamp.isAfter(max)) {
                    max = timestamp;
                }
            }
        }

        if (min == null) {
            log.warn("No timestamps found in any table, returning tables unaligned");
            tables.forEach((name, table) -> aligned.put(name, table == null ? DataTable.empty() : table));
            return aligned;
        }

        List<ZonedDateTime> grid = frequency.range(min, max.withZoneSameInstant(min.getZone()));

        for (Map.Entry<String, DataTable> entry : tables.entrySet()) {
            String name = entry.getKey();
            DataTable table = entry.getValue();
            if (table == null) {
                aligned.put(name, DataTable.empty());
            } else if (table.isEmpty()) {
                aligned.put(name, table);
            } else if (!table.hasColumn(timestampColumn)) {
                // Non-temporal tables travel through untouched
                log.debug("Table '{}' has no column '{}', passing it through unaligned", name, timestampColumn);
                aligned.put(name, table);
            } else {
                DataTable reindexed = reindex(name, table, timestampColumn, grid);
                aligned.put(name, gapFill == GapFill.INTERPOLATE
                        ? interpolate(name, reindexed, timestampColumn)
                        : reindexed);
            }
        }

        log.info("Aligned {} tables to {} timestamps", aligned.size(), grid.size());
        return aligned;
    }

    private DataTable reindex(String name, DataTable table, String timestampColumn, List<ZonedDateTime> grid) {
        Map<Instant, List<Map<String, Object>>> rowsByInstant = new HashMap<>();
        for (Map<String, Object> row : table.rows()) {
            Object value = row.get(timestampColumn);
            if (value != null) {
                rowsByInstant.computeIfAbsent(toZoned(value).toInstant(), key -> new ArrayList<>()).add(row);
            }
        }

        DataTable.Builder builder = DataTable.builder(table.columns());
        int matched = 0;
        for (ZonedDateTime point : grid) {
            List<Map<String, Object>> rows = rowsByInstant.get(point.toInstant());
            if (rows == null) {
                builder.addRow(Map.of(timestampColumn, point));
                continue;
            }
            for (Map<String, Object> row : rows) {
                Map<String, Object> out = new LinkedHashMap<>(row);
                out.put(timestampColumn, point);
                builder.addRow(out);
                matched++;
            }
        }

        if (matched < table.rowCount()) {
            log.debug("Table '{}': dropped {} rows without a timestamp on the alignment grid",
                    name, table.rowCount() - matched);
        }
        return builder.build();
    }

    /**
     * Time-weighted linear interpolation for numeric columns, forward fill for the rest.
     * Leading gaps stay null; trailing numeric gaps take the last observed value.
     */
    private DataTable interpolate(String name, DataTable table, String timestampColumn) {
        long distinct = table.column(timestampColumn).stream().distinct().count();
        if (distinct < table.rowCount()) {
            log.warn("Table '{}' has several rows per timestamp, skipping gap interpolation", name);
            return table;
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : table.rows()) {
            rows.add(new LinkedHashMap<>(row));
        }
        for (String column : table.columns()) {
            if (column.equals(timestampColumn)) {
                continue;
            }
            if (isNumeric(table.column(column))) {
                interpolateNumeric(rows, column, timestampColumn);
            } else {
                forwardFill(rows, column);
            }
        }

        DataTable.Builder builder = DataTable.builder(table.columns());
        rows.forEach(builder::addRow);
        return builder.build();
    }

    private static void interpolateNumeric(List<Map<String, Object>> rows, String column, String timestampColumn) {
        int previous = -1;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).get(column) == null) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double startValue = ((Number) rows.get(previous).get(column)).doubleValue();
                double endValue = ((Number) rows.get(i).get(column)).doubleValue();
                long start = epochSecond(rows.get(previous), timestampColumn);
                long span = epochSecond(rows.get(i), timestampColumn) - start;
                for (int j = previous + 1; j < i; j++) {
                    double fraction = (double) (epochSecond(rows.get(j), timestampColumn) - start) / span;
                    rows.get(j).put(column, startValue + (endValue - startValue) * fraction);
                }
            }
            previous = i;
        }
        if (previous >= 0) {
            double lastValue = ((Number) rows.get(previous).get(column)).doubleValue();
            for (int j = previous + 1; j < rows.size(); j++) {
                rows.get(j).put(column, lastValue);
            }
        }
    }

    private static void forwardFill(List<Map<String, Object>> rows, String column) {
        Object last = null;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                row.put(column, last);
            } else {
                last = value;
            }
        }
    }

    private static boolean isNumeric(List<Object> values) {
        boolean sawNumber = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                return false;
            }
            sawNumber = true;
        }
        return sawNumber;
    }

    private static long epochSecond(Map<String, Object> row, String timestampColumn) {
        return ((ZonedDateTime) row.get(timestampColumn)).toEpochSecond();
    }

    private ZonedDateTime toZoned(Object value) {
        return value instanceof ZonedDateTime
                ? (ZonedDateTime) value
                : TimestampParser.toZoned(value, referenceZone);
    }
}
