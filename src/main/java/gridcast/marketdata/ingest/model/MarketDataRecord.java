package gridcast.marketdata.ingest.model;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Strongly-typed row of one market data feed.
 */
public interface MarketDataRecord {

    ZonedDateTime getTimestamp();

    FeedType feedType();

    /**
     * Column name to value mapping, in the feed's canonical column order.
     */
    Map<String, Object> toRow();
}
