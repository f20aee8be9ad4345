package gridcast.marketdata.ingest.transformer;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;

import java.time.ZoneId;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalizer for historical price feeds.
 *
 * Required columns: timestamp, product, price, node.
 * Product and node are upper-cased; rows whose product is outside the configured
 * allow-list are dropped. Ties on timestamp are ordered by product.
 */
public class HistoricalPriceNormalizer extends AbstractFeedNormalizer {

    private static final String PRODUCT_COLUMN = "product";

    private final Set<String> allowedProducts;

    /**
     * @param referenceZone   zone timestamps are localized to
     * @param allowedProducts upper-case product allow-list
     */
    public HistoricalPriceNormalizer(ZoneId referenceZone, Set<String> allowedProducts) {
        super(referenceZone);
        this.allowedProducts = Collections.unmodifiableSet(new HashSet<>(allowedProducts));
    }

    @Override
    public FeedType getFeedType() {
        return FeedType.HISTORICAL_PRICE;
    }

    @Override
    protected DataTable normalizeCategoricals(DataTable table) {
        DataTable result = NormalizerUtils.upperCase(table, PRODUCT_COLUMN);
        return NormalizerUtils.upperCase(result, "node");
    }

    @Override
    protected DataTable filterRows(DataTable table) {
        DataTable kept = table.filter(row -> allowedProducts.contains(row.get(PRODUCT_COLUMN)));
        if (kept.rowCount() < table.rowCount()) {
            Set<String> rejected = new TreeSet<>();
            for (Object product : table.column(PRODUCT_COLUMN)) {
                if (!allowedProducts.contains(product)) {
                    rejected.add(String.valueOf(product));
                }
            }
            log.warn("Filtering out {} price rows with invalid products: {}", table.rowCount() - kept.rowCount(), rejected);
        }
        return kept;
    }

    @Override
    protected List<String> getSecondarySortColumns() {
        return List.of(PRODUCT_COLUMN);
    }

    public Set<String> getAllowedProducts() {
        return allowedProducts;
    }
}
