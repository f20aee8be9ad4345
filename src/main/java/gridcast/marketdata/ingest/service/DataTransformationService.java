package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.exception.DataTransformationException;
import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.model.MarketDataRecord;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.Frequency;
import gridcast.marketdata.ingest.transformer.NormalizerUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Main service for transforming market data feeds for the forecasting engine.
 *
 * Pipelines:
 * - load forecast: normalize
 * - historical prices: normalize
 * - generation forecast: normalize, then pivot fuel types into columns
 * - combined dataset: normalize all three, align to a common grid, merge
 * - model conversion in both directions
 *
 * Every failure surfaces as DataTransformationException tagged with the feed and
 * step; typed failures from the stages are rethrown as-is, anything else is wrapped.
 * This service holds no per-call state and can be safely used concurrently.
 */
@Service
@Slf4j
public class DataTransformationService {

    static final String COMBINED_DATASET = "combined_dataset";
    static final String STEP_TRANSFORMATION = "transformation";
    static final String STEP_PREPARATION = "preparation";
    static final String STEP_MODEL_CONVERSION = "model_conversion";
    static final String STEP_TABLE_CONVERSION = "dataframe_conversion";

    private final FieldNormalizationService normalizationService;
    private final GenerationPivoter generationPivoter;
    private final TimestampAligner timestampAligner;
    private final TableMerger tableMerger;
    private final ModelCodec modelCodec;
    private final TransformationConfig config;

    public DataTransformationService(FieldNormalizationService normalizationService,
                                     GenerationPivoter generationPivoter,
                                     TimestampAligner timestampAligner,
                                     TableMerger tableMerger,
                                     ModelCodec modelCodec,
                                     TransformationConfig config) {
        this.normalizationService = normalizationService;
        this.generationPivoter = generationPivoter;
        this.timestampAligner = timestampAligner;
        this.tableMerger = tableMerger;
        this.modelCodec = modelCodec;
        this.config = config;
    }

    public DataTable transformLoadForecast(DataTable raw) {
        log.info("Starting load forecast transformation");
        return execute(FeedType.LOAD_FORECAST.getTag(), STEP_TRANSFORMATION,
                () -> normalizationService.normalizeLoadForecastData(raw));
    }

    public DataTable transformHistoricalPrices(DataTable raw) {
        log.info("Starting historical price transformation");
        return execute(FeedType.HISTORICAL_PRICE.getTag(), STEP_TRANSFORMATION,
                () -> normalizationService.normalizeHistoricalPricesData(raw));
    }

    public DataTable transformGenerationForecast(DataTable raw) {
        log.info("Starting generation forecast transformation");
        return execute(FeedType.GENERATION_FORECAST.getTag(), STEP_TRANSFORMATION,
                () -> generationPivoter.pivotGenerationData(normalizationService.normalizeGenerationForecastData(raw)));
    }

    /**
     * Build the single table consumed by the forecaster.
     *
     * Load and price inputs are normalized (normalizing twice is harmless). Generation
     * input is normalized and pivoted while it still has a fuel type column, otherwise
     * it is taken as already pivoted and only its column names are standardized. The
     * three tables are aligned on the configured grid and merged with the configured
     * join (outer by default, so partially overlapping ranges keep every timestamp).
     *
     * @return combined table; empty when all three inputs are empty
     */
    public DataTable prepareCombinedDataset(DataTable loadRaw, DataTable priceRaw, DataTable generationRaw) {
        log.info("Preparing combined dataset from all data sources");
        return execute(COMBINED_DATASET, STEP_PREPARATION, () -> {
            DataTable load = normalizationService.normalizeLoadForecastData(loadRaw);
            DataTable price = normalizationService.normalizeHistoricalPricesData(priceRaw);
            DataTable generation = prepareGeneration(generationRaw);

            if (load.isEmpty() && price.isEmpty() && generation.isEmpty()) {
                log.warn("All inputs are empty, returning empty combined dataset");
                return DataTable.empty();
            }

            Map<String, DataTable> tables = new LinkedHashMap<>();
            tables.put("load", load);
            tables.put("price", price);
            tables.put("generation", generation);

            TransformationConfig.Combined combined = config.getCombined();
            Map<String, DataTable> aligned = timestampAligner.align(tables, NormalizerUtils.TIMESTAMP_COLUMN,
                    Frequency.parse(combined.getFrequency()), combined.getGapFill());

            DataTable result = tableMerger.mergeTables(
                    List.of(aligned.get("load"), aligned.get("price"), aligned.get("generation")),
                    combined.getSuffixes(), NormalizerUtils.TIMESTAMP_COLUMN, combined.getJoinType());

            log.info("Combined dataset prepared with {} rows and {} columns",
                    result.rowCount(), result.columns().size());
            return result;
        });
    }

    public List<MarketDataRecord> convertToModels(DataTable table, String modelType) {
        log.info("Converting table to {} models", modelType);
        return execute(modelType, STEP_MODEL_CONVERSION, () -> modelCodec.dataTableToModels(table, modelType));
    }

    public DataTable convertFromModels(List<? extends MarketDataRecord> models, String modelType) {
        log.info("Converting {} models to table", modelType);
        return execute(modelType, STEP_TABLE_CONVERSION, () -> modelCodec.modelsToDataTable(models, modelType));
    }

    private DataTable prepareGeneration(DataTable raw) {
        if (DataTable.isNullOrEmpty(raw)) {
            return normalizationService.normalizeGenerationForecastData(raw);
        }
        boolean longFormat = raw.columns().stream()
                .map(NormalizerUtils::standardizeColumnName)
                .anyMatch("fuel_type"::equals);
        if (!longFormat) {
            log.debug("Generation input has no fuel_type column, treating it as already pivoted");
            return NormalizerUtils.standardizeColumns(raw, FeedType.GENERATION_FORECAST);
        }
        return generationPivoter.pivotGenerationData(normalizationService.normalizeGenerationForecastData(raw));
    }

    private <T> T execute(String feedName, String step, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataTransformationException e) {
            log.error("Failed to transform {} data: {}", feedName, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to transform {} data during {}: {}", feedName, step, e.getMessage(), e);
            throw new DataTransformationException(feedName, step, e);
        }
    }
}
