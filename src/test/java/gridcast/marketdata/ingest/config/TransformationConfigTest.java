package gridcast.marketdata.ingest.config;

import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.service.DataTransformationService;
import gridcast.marketdata.ingest.service.FieldNormalizationService;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.GapFill;
import gridcast.marketdata.ingest.table.JoinType;
import gridcast.marketdata.ingest.transformer.HistoricalPriceNormalizer;
import gridcast.marketdata.ingest.util.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies property binding and bean wiring with the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransformationConfigTest {

    @Autowired
    private TransformationConfig config;

    @Autowired
    private FieldNormalizationService normalizationService;

    @Autowired
    private DataTransformationService transformationService;

    @Test
    void testPropertiesBound() {
        assertEquals(ZoneId.of("America/Chicago"), config.getReferenceZone());
        assertEquals(List.of("DALMP", "RTLMP", "REGUP"), config.getForecastProducts());
        assertEquals("H", config.getCombined().getFrequency());
        assertEquals(JoinType.OUTER, config.getCombined().getJoinType());
        assertEquals(GapFill.INTERPOLATE, config.getCombined().getGapFill());
        assertEquals(List.of("price", "gen"), config.getCombined().getSuffixes());
        assertTrue(config.getPivot().isRetainRegion());
    }

    @Test
    void testNormalizersUseBoundProducts() {
        HistoricalPriceNormalizer normalizer =
                (HistoricalPriceNormalizer) normalizationService.getNormalizer(FeedType.HISTORICAL_PRICE);

        assertEquals(Set.of("DALMP", "RTLMP", "REGUP"), normalizer.getAllowedProducts());
    }

    @Test
    void testPipelineWired() {
        DataTable result = transformationService.transformGenerationForecast(TestDataFactory.rawGenerationForecast());

        assertEquals("region", result.columns().get(result.columns().size() - 1));
    }

    @Test
    void testDefaults() {
        TransformationConfig defaults = new TransformationConfig();

        assertEquals(GapFill.NONE, defaults.getCombined().getGapFill());
        assertFalse(defaults.getPivot().isRetainRegion());
        assertTrue(defaults.getForecastProductSet().contains("NSRS"));
    }
}
