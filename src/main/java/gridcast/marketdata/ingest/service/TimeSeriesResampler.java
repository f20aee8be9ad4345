package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.table.Aggregation;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.Frequency;
import gridcast.marketdata.ingest.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resamples an irregular time series onto a regular frequency grid.
 *
 * Each output row is one bin between the bins of the earliest and latest input
 * timestamps, inclusive. Bins without input rows are kept with null values so
 * the output always covers the full span.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
@Slf4j
public class TimeSeriesResampler {

    private final ZoneId referenceZone;

    public TimeSeriesResampler(TransformationConfig config) {
        this.referenceZone = config.getReferenceZone();
    }

    /**
     * @param aggregationRules column to aggregation identifier ("mean", "first", ...)
     */
    public DataTable resampleTimeSeries(DataTable table, String timestampColumn, String frequency,
                                        Map<String, String> aggregationRules) {
        Map<String, Aggregation> rules = new LinkedHashMap<>();
        aggregationRules.forEach((column, identifier) -> rules.put(column, Aggregation.fromIdentifier(identifier)));
        return resample(table, timestampColumn, Frequency.parse(frequency), rules);
    }

    /**
     * @param table            input series, may be null or empty
     * @param timestampColumn  column holding the timestamps
     * @param frequency        grid frequency
     * @param aggregationRules ordered column to aggregation mapping; unlisted columns are dropped
     * @return table with the timestamp column followed by the rule columns
     * @throws IllegalArgumentException if the timestamp column or a rule column is missing
     */
    public DataTable resample(DataTable table, String timestampColumn, Frequency frequency,
                              Map<String, Aggregation> aggregationRules) {
        log.info("Resampling time series data to {} frequency", frequency);

        List<String> outputColumns = new ArrayList<>();
        outputColumns.add(timestampColumn);
        outputColumns.addAll(aggregationRules.keySet());

        if (DataTable.isNullOrEmpty(table)) {
            log.warn("Empty table provided for resampling");
            return DataTable.withColumns(outputColumns);
        }

        validateColumns(table, timestampColumn, aggregationRules);

        List<TimedRow> timedRows = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.rows()) {
            Object value = row.get(timestampColumn);
            if (value == null) {
                continue;
            }
            ZonedDateTime timestamp = value instanceof ZonedDateTime
                    ? (ZonedDateTime) value
                    : TimestampParser.toZoned(value, referenceZone);
            timedRows.add(new TimedRow(timestamp, row));
        }
        if (timedRows.size() < table.rowCount()) {
            log.warn("Ignoring {} rows without a timestamp", table.rowCount() - timedRows.size());
        }
        if (timedRows.isEmpty()) {
            return DataTable.withColumns(outputColumns);
        }
        timedRows.sort(Comparator.comparing(timed -> timed.timestamp.toInstant()));

        // Bins follow the zone of the earliest timestamp
        ZoneId gridZone = timedRows.get(0).timestamp.getZone();
        Map<Instant, List<Map<String, Object>>> bins = new HashMap<>();
        for (TimedRow timed : timedRows) {
            Instant bin = frequency.floor(timed.timestamp.withZoneSameInstant(gridZone)).toInstant();
            bins.computeIfAbsent(bin, key -> new ArrayList<>()).add(timed.row);
        }

        ZonedDateTime first = frequency.floor(timedRows.get(0).timestamp);
        ZonedDateTime last = frequency.floor(
                timedRows.get(timedRows.size() - 1).timestamp.withZoneSameInstant(gridZone));

        DataTable.Builder builder = DataTable.builder(outputColumns);
        for (ZonedDateTime point : frequency.range(first, last)) {
            List<Map<String, Object>> binRows = bins.getOrDefault(point.toInstant(), List.of());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(timestampColumn, point);
            aggregationRules.forEach((column, aggregation) -> {
                List<Object> values = new ArrayList<>(binRows.size());
                for (Map<String, Object> row : binRows) {
                    values.add(row.get(column));
                }
                out.put(column, aggregation.apply(values));
            });
            builder.addRow(out);
        }

        DataTable result = builder.build();
        log.info("Resampled table from {} to {} rows", table.rowCount(), result.rowCount());
        return result;
    }

    private static void validateColumns(DataTable table, String timestampColumn,
                                        Map<String, Aggregation> aggregationRules) {
        if (!table.hasColumn(timestampColumn)) {
            throw new IllegalArgumentException("Timestamp column '" + timestampColumn + "' not found in " + table.columns());
        }
        for (String column : aggregationRules.keySet()) {
            if (column.equals(timestampColumn)) {
                throw new IllegalArgumentException("Cannot aggregate the timestamp column '" + timestampColumn + "'");
            }
            if (!table.hasColumn(column)) {
                throw new IllegalArgumentException("Aggregation column '" + column + "' not found in " + table.columns());
            }
        }
    }

    private static final class TimedRow {
        private final ZonedDateTime timestamp;
        private final Map<String, Object> row;

        private TimedRow(ZonedDateTime timestamp, Map<String, Object> row) {
            this.timestamp = timestamp;
            this.row = row;
        }
    }
}
