package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;

import java.util.List;

/**
 * Normalizes one raw market data feed into its canonical table form.
 *
 * Implementations exist per feed type and are resolved through
 * FieldNormalizationService. A normalized table has:
 * - lower-case column names
 * - a timestamp column localized to the reference timezone
 * - a Double value column
 * - categorical columns in the feed's case convention
 * - rows sorted by timestamp and the feed's secondary key
 *
 * Normalizing an already normalized table returns an equal table.
 */
public interface FeedNormalizer {

    /**
     * Normalize a raw feed table.
     *
     * @param raw the raw table, may be null or empty
     * @return the normalized table, never null; empty input yields an empty table
     *         with the feed's canonical columns
     * @throws gridcast.marketdata.ingest.exception.DataTransformationException
     *         if required columns are missing or timestamp/value columns cannot be converted
     */
    DataTable normalize(DataTable raw);

    FeedType getFeedType();

    /**
     * Columns that must be present after column names are standardized.
     */
    default List<String> getRequiredColumns() {
        return getFeedType().getColumns();
    }

    /**
     * Canonically shaped result for null or empty input.
     */
    default DataTable emptyResult() {
        return DataTable.withColumns(getFeedType().getColumns());
    }
}
