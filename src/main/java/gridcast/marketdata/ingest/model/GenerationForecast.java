package gridcast.marketdata.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forecast output of one fuel type in one region.
 */
@Value
@Builder
@Jacksonized
public class GenerationForecast implements MarketDataRecord {

    @JsonProperty("timestamp")
    ZonedDateTime timestamp;

    @JsonProperty("fuel_type")
    String fuelType;

    @JsonProperty("generation_mw")
    double generationMw;

    @JsonProperty("region")
    String region;

    @Override
    public FeedType feedType() {
        return FeedType.GENERATION_FORECAST;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("fuel_type", fuelType);
        row.put("generation_mw", generationMw);
        row.put("region", region);
        return row;
    }
}
