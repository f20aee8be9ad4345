package gridcast.marketdata.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settled market price of one product at one pricing node.
 */
@Value
@Builder
@Jacksonized
public class HistoricalPrice implements MarketDataRecord {

    @JsonProperty("timestamp")
    ZonedDateTime timestamp;

    @JsonProperty("product")
    String product;

    @JsonProperty("price")
    double price;

    @JsonProperty("node")
    String node;

    @Override
    public FeedType feedType() {
        return FeedType.HISTORICAL_PRICE;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("product", product);
        row.put("price", price);
        row.put("node", node);
        return row;
    }
}
