package gridcast.marketdata.ingest.model;

import java.util.List;

/**
 * Closed set of market data feeds handled by the pipeline.
 *
 * The tag doubles as the feed name in transformation errors and as the
 * model type selector when converting between tables and records.
 */
public enum FeedType {

    LOAD_FORECAST("load_forecast", "load_mw", List.of("timestamp", "load_mw", "region")),
    HISTORICAL_PRICE("historical_price", "price", List.of("timestamp", "product", "price", "node")),
    GENERATION_FORECAST("generation_forecast", "generation_mw",
            List.of("timestamp", "fuel_type", "generation_mw", "region"));

    private final String tag;
    private final String valueColumn;
    private final List<String> columns;

    FeedType(String tag, String valueColumn, List<String> columns) {
        this.tag = tag;
        this.valueColumn = valueColumn;
        this.columns = columns;
    }

    /**
     * Resolve a model type tag such as "load_forecast".
     *
     * @throws IllegalArgumentException if the tag does not name a known feed
     */
    public static FeedType fromTag(String tag) {
        for (FeedType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown model type: " + tag);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Numeric column carrying the feed's measurement.
     */
    public String getValueColumn() {
        return valueColumn;
    }

    /**
     * Canonical column order of the normalized table and of the record fields.
     */
    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return tag;
    }
}
