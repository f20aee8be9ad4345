package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;

import java.time.ZoneId;
import java.util.List;

/**
 * Normalizer for generation forecast feeds.
 *
 * Required columns: timestamp, fuel_type, generation_mw, region.
 * Fuel type is lower-cased, region upper-cased. Ties on timestamp are ordered by fuel type.
 */
public class GenerationForecastNormalizer extends AbstractFeedNormalizer {

    public GenerationForecastNormalizer(ZoneId referenceZone) {
        super(referenceZone);
    }

    @Override
    public FeedType getFeedType() {
        return FeedType.GENERATION_FORECAST;
    }

    @Override
    protected DataTable normalizeCategoricals(DataTable table) {
        DataTable result = NormalizerUtils.lowerCase(table, "fuel_type");
        return NormalizerUtils.upperCase(result, "region");
    }

    @Override
    protected List<String> getSecondarySortColumns() {
        return List.of("fuel_type");
    }
}
