package gridcast.marketdata.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Electricity demand forecast for one region and hour.
 */
@Value
@Builder
@Jacksonized
public class LoadForecast implements MarketDataRecord {

    @JsonProperty("timestamp")
    ZonedDateTime timestamp;

    @JsonProperty("load_mw")
    double loadMw;

    @JsonProperty("region")
    String region;

    @Override
    public FeedType feedType() {
        return FeedType.LOAD_FORECAST;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("load_mw", loadMw);
        row.put("region", region);
        return row;
    }
}
