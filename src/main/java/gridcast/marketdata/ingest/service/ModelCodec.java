package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.model.FeedType;
import gridcast.marketdata.ingest.model.GenerationForecast;
import gridcast.marketdata.ingest.model.HistoricalPrice;
import gridcast.marketdata.ingest.model.LoadForecast;
import gridcast.marketdata.ingest.model.MarketDataRecord;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.transformer.NormalizerUtils;
import gridcast.marketdata.ingest.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Converts between typed market data records and their table form.
 *
 * The model type tag ("load_forecast", "historical_price", "generation_forecast")
 * selects the record variant. An unknown tag is a caller error and raises
 * IllegalArgumentException.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
@Slf4j
public class ModelCodec {

    private final ZoneId referenceZone;

    public ModelCodec(TransformationConfig config) {
        this.referenceZone = config.getReferenceZone();
    }

    public DataTable modelsToDataTable(List<? extends MarketDataRecord> models, String modelType) {
        return modelsToDataTable(models, FeedType.fromTag(modelType));
    }

    /**
     * One row per record, columns in the variant's field order.
     *
     * @throws IllegalArgumentException if a record is not of the requested variant
     */
    public DataTable modelsToDataTable(List<? extends MarketDataRecord> models, FeedType feedType) {
        int count = models == null ? 0 : models.size();
        log.info("Converting {} {} models to table", count, feedType);

        DataTable.Builder builder = DataTable.builder(feedType.getColumns());
        if (count == 0) {
            return builder.build();
        }

        for (MarketDataRecord model : models) {
            if (model == null || model.feedType() != feedType) {
                throw new IllegalArgumentException("Expected " + feedType + " model but got "
                        + (model == null ? "null" : model.feedType()));
            }
            builder.addRow(model.toRow());
        }

        DataTable table = builder.build();
        log.info("Created table with {} rows from {} models", table.rowCount(), feedType);
        return table;
    }

    public List<MarketDataRecord> dataTableToModels(DataTable table, String modelType) {
        return dataTableToModels(table, FeedType.fromTag(modelType));
    }

    /**
     * One record per row. Rows whose values cannot build a record are skipped.
     *
     * @throws IllegalArgumentException if the table lacks a column of the variant
     */
    public List<MarketDataRecord> dataTableToModels(DataTable table, FeedType feedType) {
        if (DataTable.isNullOrEmpty(table)) {
            log.info("Converting empty table to {} models", feedType);
            return Collections.emptyList();
        }
        log.info("Converting table with {} rows to {} models", table.rowCount(), feedType);

        for (String column : feedType.getColumns()) {
            if (!table.hasColumn(column)) {
                throw new IllegalArgumentException(
                        "Column '" + column + "' required for " + feedType + " models not found in " + table.columns());
            }
        }

        List<MarketDataRecord> models = new ArrayList<>(table.rowCount());
        int rowIndex = 0;
        for (Map<String, Object> row : table.rows()) {
            try {
                models.add(toModel(row, feedType));
            } catch (IllegalArgumentException e) {
                log.warn("Failed to create {} model from row {}: {}", feedType, rowIndex, e.getMessage());
            }
            rowIndex++;
        }

        log.info("Created {} {} models from table", models.size(), feedType);
        return models;
    }

    private MarketDataRecord toModel(Map<String, Object> row, FeedType feedType) {
        Object rawTimestamp = row.get("timestamp");
        // Zoned values are kept as-is so records round-trip exactly
        ZonedDateTime timestamp = rawTimestamp instanceof ZonedDateTime
                ? (ZonedDateTime) rawTimestamp
                : TimestampParser.toZoned(rawTimestamp, referenceZone);
        switch (feedType) {
            case LOAD_FORECAST:
                return LoadForecast.builder()
                        .timestamp(timestamp)
                        .loadMw(requireNumber(row, "load_mw"))
                        .region(asString(row.get("region")))
                        .build();
            case HISTORICAL_PRICE:
                return HistoricalPrice.builder()
                        .timestamp(timestamp)
                        .product(asString(row.get("product")))
                        .price(requireNumber(row, "price"))
                        .node(asString(row.get("node")))
                        .build();
            case GENERATION_FORECAST:
                return GenerationForecast.builder()
                        .timestamp(timestamp)
                        .fuelType(asString(row.get("fuel_type")))
                        .generationMw(requireNumber(row, "generation_mw"))
                        .region(asString(row.get("region")))
                        .build();
            default:
                throw new IllegalArgumentException("Unknown model type: " + feedType);
        }
    }

    private static double requireNumber(Map<String, Object> row, String column) {
        Object cell = row.get(column);
        // Numeric cells, NaN included, are taken as they are
        if (cell instanceof Number) {
            return ((Number) cell).doubleValue();
        }
        Double value = NormalizerUtils.toDouble(cell);
        if (value == null) {
            throw new IllegalArgumentException("Value of '" + column + "' is not numeric: " + row.get(column));
        }
        return value;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
