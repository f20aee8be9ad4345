package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalization sequence shared by all feeds:
 * 1. Null or empty input short-circuits to an empty, canonically shaped table
 * 2. Column names standardized
 * 3. Required columns verified
 * 4. Timestamps parsed and localized to the reference zone
 * 5. Value column coerced to Double
 * 6. Categorical columns case-folded (feed specific)
 * 7. Rows filtered (feed specific, e.g. product allow-list)
 * 8. Rows sorted by timestamp, then the feed's secondary key
 */
public abstract class AbstractFeedNormalizer implements FeedNormalizer {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final ZoneId referenceZone;

    protected AbstractFeedNormalizer(ZoneId referenceZone) {
        this.referenceZone = referenceZone;
    }

    @Override
    public DataTable normalize(DataTable raw) {
        FeedType feedType = getFeedType();
        log.info("Normalizing {} data", feedType);

        if (DataTable.isNullOrEmpty(raw)) {
            log.warn("Empty {} table provided", feedType);
            return emptyResult();
        }

        DataTable table = NormalizerUtils.standardizeColumns(raw, feedType);
        NormalizerUtils.requireColumns(table, getRequiredColumns(), feedType);
        table = NormalizerUtils.localizeTimestamps(table, referenceZone, feedType);
        table = NormalizerUtils.coerceNumeric(table, feedType.getValueColumn(), feedType);
        table = normalizeCategoricals(table);
        table = filterRows(table);

        List<String> sortColumns = new ArrayList<>();
        sortColumns.add(NormalizerUtils.TIMESTAMP_COLUMN);
        sortColumns.addAll(getSecondarySortColumns());
        table = table.sorted(NormalizerUtils.ascendingBy(sortColumns));

        log.info("Normalized {} data with {} rows", feedType, table.rowCount());
        return table;
    }

    public ZoneId getReferenceZone() {
        return referenceZone;
    }

    /**
     * Apply the feed's case convention to its categorical columns.
     */
    protected abstract DataTable normalizeCategoricals(DataTable table);

    /**
     * Tie-breakers applied after the timestamp when sorting. Empty keeps input order on ties.
     */
    protected abstract List<String> getSecondarySortColumns();

    /**
     * Drop rows that are not valid for this feed. Keeps every row by default.
     */
    protected DataTable filterRows(DataTable table) {
        return table;
    }
}
