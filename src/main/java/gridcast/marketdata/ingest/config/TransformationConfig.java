package gridcast.marketdata.ingest.config;

import gridcast.marketdata.ingest.table.GapFill;
import gridcast.marketdata.ingest.table.JoinType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the market data transformation pipeline.
 *
 * Maps directly to properties in application.properties:
 * - transform.reference-timezone
 * - transform.forecast-products
 * - transform.combined.frequency
 * - transform.combined.join-type
 * - transform.combined.gap-fill
 * - transform.combined.suffixes
 * - transform.pivot.retain-region
 */
@Configuration
@ConfigurationProperties(prefix = "transform")
@Data
public class TransformationConfig {

    /**
     * Zone every normalized timestamp is localized to (transform.reference-timezone)
     */
    private String referenceTimezone = "America/Chicago";

    /**
     * Allow-list of price products kept during normalization (transform.forecast-products).
     * Compared case-insensitively.
     */
    private List<String> forecastProducts = new ArrayList<>(
            List.of("DALMP", "RTLMP", "REGUP", "REGDOWN", "RRS", "NSRS"));

    // ========================================
    // COMBINED DATASET (transform.combined.*)
    // ========================================

    private Combined combined = new Combined();

    @Data
    public static class Combined {
        /** Grid frequency for aligning the three feeds */
        private String frequency = "H";

        /** Join applied when merging the aligned feeds */
        private JoinType joinType = JoinType.OUTER;

        /** Gap handling after alignment */
        private GapFill gapFill = GapFill.NONE;

        /** Suffixes for colliding price and generation columns */
        private List<String> suffixes = new ArrayList<>(List.of("price", "gen"));
    }

    // ========================================
    // PIVOT (transform.pivot.*)
    // ========================================

    private Pivot pivot = new Pivot();

    @Data
    public static class Pivot {
        /**
         * Keep a trailing region column when the generation feed covers a single region.
         * Off by default so every pivoted value column carries the generation_ prefix.
         */
        private boolean retainRegion = false;
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    public ZoneId getReferenceZone() {
        return ZoneId.of(referenceTimezone);
    }

    /**
     * Upper-cased product allow-list for membership checks.
     */
    public Set<String> getForecastProductSet() {
        return forecastProducts.stream()
                .map(product -> product.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
