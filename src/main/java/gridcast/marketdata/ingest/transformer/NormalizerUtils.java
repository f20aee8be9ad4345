package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.exception.DataTransformationException;
import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared normalization steps used by every feed normalizer.
 *
 * Centralizes:
 * - Column name standardization (trim, lower-case, spaces to underscores)
 * - Required column checks
 * - Timestamp parsing and localization
 * - Numeric coercion of value columns
 * - Categorical case folding
 * - Row ordering
 *
 * Failures are raised as DataTransformationException tagged with the feed and step.
 */
@Slf4j
public final class NormalizerUtils {

    public static final String TIMESTAMP_COLUMN = "timestamp";

    public static final String STEP_COLUMN_NORMALIZATION = "column_normalization";
    public static final String STEP_TIMESTAMP_CONVERSION = "timestamp_conversion";
    public static final String STEP_NUMERIC_CONVERSION = "numeric_conversion";

    private NormalizerUtils() {
    }

    /**
     * Examples:
     *   "Load_MW" → "load_mw"
     *   " Fuel Type " → "fuel_type"
     */
    public static String standardizeColumnName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Standardize every column name. A column whose standardized name collides with
     * an earlier column is dropped.
     */
    public static DataTable standardizeColumns(DataTable table, FeedType feedType) {
        DataTable renamed = table.renameColumns(NormalizerUtils::standardizeColumnName);
        if (renamed.columns().size() < table.columns().size()) {
            log.warn("{}: dropped {} column(s) whose names collide after case folding: {}",
                    feedType, table.columns().size() - renamed.columns().size(), table.columns());
        }
        return renamed;
    }

    /**
     * @throws DataTransformationException at step column_normalization naming every missing column
     */
    public static void requireColumns(DataTable table, List<String> required, FeedType feedType) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!table.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            log.error("Required column(s) {} not found in {} data (columns: {})", missing, feedType, table.columns());
            throw new DataTransformationException(feedType.getTag(), STEP_COLUMN_NORMALIZATION,
                    new IllegalArgumentException("Missing required column(s): " + String.join(", ", missing)));
        }
    }

    /**
     * Parse the timestamp column and express it in the reference zone.
     *
     * @throws DataTransformationException at step timestamp_conversion for a null or unparseable cell
     */
    public static DataTable localizeTimestamps(DataTable table, ZoneId zone, FeedType feedType) {
        try {
            return table.mapColumn(TIMESTAMP_COLUMN, value -> TimestampParser.toZoned(value, zone));
        } catch (IllegalArgumentException e) {
            log.error("Failed to convert {} timestamp column: {}", feedType, e.getMessage());
            throw new DataTransformationException(feedType.getTag(), STEP_TIMESTAMP_CONVERSION, e);
        }
    }

    /**
     * Coerce a value column to Double. Unparseable cells become null and their rows are
     * dropped.
     *
     * @throws DataTransformationException at step numeric_conversion when no cell is numeric
     */
    public static DataTable coerceNumeric(DataTable table, String column, FeedType feedType) {
        DataTable coerced = table.mapColumn(column, NormalizerUtils::toDouble);
        DataTable kept = coerced.filter(row -> row.get(column) != null);

        if (kept.isEmpty()) {
            log.error("Column '{}' of {} data has no numeric values", column, feedType);
            throw new DataTransformationException(feedType.getTag(), STEP_NUMERIC_CONVERSION,
                    new IllegalArgumentException("Column '" + column + "' contains no numeric values"));
        }
        if (kept.rowCount() < coerced.rowCount()) {
            log.warn("Dropping {} {} rows with missing or non-numeric {} values",
                    coerced.rowCount() - kept.rowCount(), feedType, column);
        }
        return kept;
    }

    /**
     * Lenient numeric conversion: numbers and numeric strings convert, anything else
     * (including NaN) becomes null.
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        double result;
        if (value instanceof Number) {
            result = ((Number) value).doubleValue();
        } else {
            try {
                result = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isNaN(result) ? null : result;
    }

    public static DataTable upperCase(DataTable table, String column) {
        return table.mapColumn(column, value -> value == null ? null : value.toString().trim().toUpperCase(Locale.ROOT));
    }

    public static DataTable lowerCase(DataTable table, String column) {
        return table.mapColumn(column, value -> value == null ? null : value.toString().trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Ascending comparator over the given columns, nulls last.
     */
    public static Comparator<Map<String, Object>> ascendingBy(List<String> columns) {
        Comparator<Map<String, Object>> comparator = (a, b) -> 0;
        for (String column : columns) {
            comparator = comparator.thenComparing(row -> row.get(column), NormalizerUtils::compareValues);
        }
        return comparator;
    }

    static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        if (a instanceof ZonedDateTime && b instanceof ZonedDateTime) {
            return ((ZonedDateTime) a).compareTo((ZonedDateTime) b);
        }
        if (a instanceof Instant && b instanceof Instant) {
            return ((Instant) a).compareTo((Instant) b);
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        return a.toString().compareTo(b.toString());
    }
}
