package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;

import java.time.ZoneId;
import java.util.List;

/**
 * Normalizer for load forecast feeds.
 *
 * Required columns: timestamp, load_mw, region.
 * Region is upper-cased. Ties on timestamp keep their input order.
 */
public class LoadForecastNormalizer extends AbstractFeedNormalizer {

    public LoadForecastNormalizer(ZoneId referenceZone) {
        super(referenceZone);
    }

    @Override
    public FeedType getFeedType() {
        return FeedType.LOAD_FORECAST;
    }

    @Override
    protected DataTable normalizeCategoricals(DataTable table) {
        return NormalizerUtils.upperCase(table, "region");
    }

    @Override
    protected List<String> getSecondarySortColumns() {
        return List.of();
    }
}
