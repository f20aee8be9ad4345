package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.transformer.HistoricalPriceNormalizer;
import gridcast.marketdata.ingest.transformer.LoadForecastNormalizer;
import gridcast.marketdata.ingest.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for FieldNormalizationService
 */
class FieldNormalizationServiceTest {

    private FieldNormalizationService service;

    @BeforeEach
    void setUp() {
        service = new FieldNormalizationService(TestDataFactory.defaultConfig());
    }

    @Test
    void testGetNormalizer_OnePerFeedType() {
        assertInstanceOf(LoadForecastNormalizer.class, service.getNormalizer(FeedType.LOAD_FORECAST));
        for (FeedType feedType : FeedType.values()) {
            assertEquals(feedType, service.getNormalizer(feedType).getFeedType());
        }
    }

    @Test
    void testNormalize_AllFeeds() {
        assertEquals(3, service.normalizeLoadForecastData(TestDataFactory.rawLoadForecast()).rowCount());
        assertEquals(3, service.normalizeHistoricalPricesData(TestDataFactory.rawHistoricalPrices()).rowCount());
        assertEquals(3, service.normalizeGenerationForecastData(TestDataFactory.rawGenerationForecast()).rowCount());
    }

    @Test
    void testNormalize_UsesConfiguredZoneAndProducts() {
        TransformationConfig config = TestDataFactory.defaultConfig();
        config.setReferenceTimezone("UTC");
        config.setForecastProducts(List.of("rtlmp"));
        FieldNormalizationService utcService = new FieldNormalizationService(config);

        DataTable result = utcService.normalize(TestDataFactory.rawHistoricalPrices(), FeedType.HISTORICAL_PRICE);

        assertEquals(List.of("RTLMP"), result.column("product"));
        assertEquals(ZoneId.of("UTC"), ((ZonedDateTime) result.row(0).get("timestamp")).getZone());
        HistoricalPriceNormalizer normalizer =
                (HistoricalPriceNormalizer) utcService.getNormalizer(FeedType.HISTORICAL_PRICE);
        assertEquals(Set.of("RTLMP"), normalizer.getAllowedProducts());
    }
}
