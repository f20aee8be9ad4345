package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.transformer.FeedNormalizer;
import gridcast.marketdata.ingest.transformer.GenerationForecastNormalizer;
import gridcast.marketdata.ingest.transformer.HistoricalPriceNormalizer;
import gridcast.marketdata.ingest.transformer.LoadForecastNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point for per-feed normalization.
 *
 * This service:
 * - Builds one FeedNormalizer per feed type from the injected configuration
 * - Resolves the normalizer for a feed type
 * - Exposes one normalization operation per feed
 *
 * Errors from the normalizers propagate unwrapped (DataTransformationException
 * for validation failures). This service is stateless and can be safely used concurrently.
 */
@Service
@Slf4j
public class FieldNormalizationService {

    private final Map<FeedType, FeedNormalizer> normalizers = new EnumMap<>(FeedType.class);

    public FieldNormalizationService(TransformationConfig config) {
        ZoneId zone = config.getReferenceZone();
        register(new LoadForecastNormalizer(zone));
        register(new HistoricalPriceNormalizer(zone, config.getForecastProductSet()));
        register(new GenerationForecastNormalizer(zone));
        log.info("Initialized feed normalizers for {} (reference zone {})", normalizers.keySet(), zone);
    }

    private void register(FeedNormalizer normalizer) {
        normalizers.put(normalizer.getFeedType(), normalizer);
    }

    /**
     * @param feedType the feed to normalize
     * @return the normalizer for that feed (never null)
     */
    public FeedNormalizer getNormalizer(FeedType feedType) {
        FeedNormalizer normalizer = normalizers.get(feedType);
        if (normalizer == null) {
            throw new IllegalArgumentException("No normalizer registered for feed type: " + feedType);
        }
        return normalizer;
    }

    public DataTable normalize(DataTable raw, FeedType feedType) {
        return getNormalizer(feedType).normalize(raw);
    }

    public DataTable normalizeLoadForecastData(DataTable raw) {
        return normalize(raw, FeedType.LOAD_FORECAST);
    }

    public DataTable normalizeHistoricalPricesData(DataTable raw) {
        return normalize(raw, FeedType.HISTORICAL_PRICE);
    }

    public DataTable normalizeGenerationForecastData(DataTable raw) {
        return normalize(raw, FeedType.GENERATION_FORECAST);
    }
}
