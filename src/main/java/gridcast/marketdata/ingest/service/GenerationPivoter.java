package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.transformer.NormalizerUtils;
import gridcast.marketdata.ingest.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reshapes long-format generation data (one row per timestamp and fuel type)
 * into wide format with one {@code generation_<fuel_type>} column per fuel.
 *
 * Examples:
 *   (t0, wind, 100), (t0, solar, 50), (t1, wind, 120)
 *   → timestamp | generation_solar | generation_wind
 *     t0        | 50.0             | 100.0
 *     t1        | 0.0              | 120.0
 *
 * Duplicate (timestamp, fuel) pairs are summed; missing combinations are 0.0.
 */
@Service
@Slf4j
public class GenerationPivoter {

    public static final String COLUMN_PREFIX = "generation_";

    private static final String FUEL_TYPE_COLUMN = "fuel_type";
    private static final String VALUE_COLUMN = "generation_mw";
    private static final String REGION_COLUMN = "region";

    private final boolean retainRegion;
    private final ZoneId referenceZone;

    public GenerationPivoter(TransformationConfig config) {
        this.retainRegion = config.getPivot().isRetainRegion();
        this.referenceZone = config.getReferenceZone();
    }

    /**
     * @param table long-format generation table, may be null or empty
     * @return wide-format table sorted by timestamp
     * @throws IllegalArgumentException if the table lacks a timestamp column
     */
    public DataTable pivotGenerationData(DataTable table) {
        log.info("Pivoting generation forecast data");

        if (DataTable.isNullOrEmpty(table)) {
            log.warn("Empty generation table provided for pivot");
            return DataTable.withColumns(NormalizerUtils.TIMESTAMP_COLUMN);
        }
        if (!table.hasColumn(FUEL_TYPE_COLUMN) || !table.hasColumn(VALUE_COLUMN)) {
            log.warn("Cannot pivot generation table without '{}' and '{}' columns, returning it unchanged",
                    FUEL_TYPE_COLUMN, VALUE_COLUMN);
            return table;
        }
        if (!table.hasColumn(NormalizerUtils.TIMESTAMP_COLUMN)) {
            log.error("Cannot pivot generation data without timestamp column");
            throw new IllegalArgumentException("Timestamp column missing from generation table");
        }

        Set<String> fuelTypes = new TreeSet<>();
        Set<Object> regions = new LinkedHashSet<>();
        // Keyed by instant so the output is ordered by time
        Map<Instant, ZonedDateTime> timestamps = new TreeMap<>();
        Map<Instant, Map<String, Double>> sums = new LinkedHashMap<>();

        for (Map<String, Object> row : table.rows()) {
            Object fuel = row.get(FUEL_TYPE_COLUMN);
            Double value = NormalizerUtils.toDouble(row.get(VALUE_COLUMN));
            Object rawTimestamp = row.get(NormalizerUtils.TIMESTAMP_COLUMN);
            if (fuel == null || value == null || rawTimestamp == null) {
                continue;
            }
            ZonedDateTime timestamp = rawTimestamp instanceof ZonedDateTime
                    ? (ZonedDateTime) rawTimestamp
                    : TimestampParser.toZoned(rawTimestamp, referenceZone);
            String fuelType = fuel.toString();
            fuelTypes.add(fuelType);
            if (table.hasColumn(REGION_COLUMN)) {
                regions.add(row.get(REGION_COLUMN));
            }
            timestamps.putIfAbsent(timestamp.toInstant(), timestamp);
            sums.computeIfAbsent(timestamp.toInstant(), key -> new LinkedHashMap<>())
                    .merge(fuelType, value, Double::sum);
        }

        List<String> columns = new ArrayList<>();
        columns.add(NormalizerUtils.TIMESTAMP_COLUMN);
        for (String fuelType : fuelTypes) {
            columns.add(COLUMN_PREFIX + fuelType);
        }
        boolean addRegion = retainRegion && regions.size() == 1;
        if (addRegion) {
            columns.add(REGION_COLUMN);
        }

        DataTable.Builder builder = DataTable.builder(columns);
        for (Map.Entry<Instant, ZonedDateTime> entry : timestamps.entrySet()) {
            Map<String, Double> byFuel = sums.get(entry.getKey());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(NormalizerUtils.TIMESTAMP_COLUMN, entry.getValue());
            for (String fuelType : fuelTypes) {
                row.put(COLUMN_PREFIX + fuelType, byFuel.getOrDefault(fuelType, 0.0));
            }
            if (addRegion) {
                row.put(REGION_COLUMN, regions.iterator().next());
            }
            builder.addRow(row);
        }

        DataTable pivoted = builder.build();
        log.info("Pivoted generation data to {} fuel type columns over {} timestamps",
                fuelTypes.size(), pivoted.rowCount());
        return pivoted;
    }
}
