package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.model.GenerationForecast;
import gridcast.marketdata.ingest.model.HistoricalPrice;
import gridcast.marketdata.ingest.model.LoadForecast;
import gridcast.marketdata.ingest.model.MarketDataRecord;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static gridcast.marketdata.ingest.util.TestDataFactory.cst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test class for ModelCodec
 */
class ModelCodecTest {

    private ModelCodec codec;
    private List<LoadForecast> loadForecasts;

    @BeforeEach
    void setUp() {
        codec = new ModelCodec(TestDataFactory.defaultConfig());
        loadForecasts = List.of(
                LoadForecast.builder().timestamp(cst(2023, 1, 1, 0)).loadMw(35000.5).region("ERCOT").build(),
                LoadForecast.builder().timestamp(cst(2023, 1, 1, 1)).loadMw(34000.2).region("ERCOT").build());
    }

    // ========== Models to Table Tests ==========

    @Test
    void testModelsToDataTable_ColumnsInFieldOrder() {
        DataTable table = codec.modelsToDataTable(loadForecasts, "load_forecast");

        assertThat(table.columns()).containsExactly("timestamp", "load_mw", "region");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.row(0)).containsEntry("load_mw", 35000.5).containsEntry("region", "ERCOT");
    }

    @Test
    void testModelsToDataTable_EmptyList() {
        DataTable table = codec.modelsToDataTable(List.of(), "historical_price");

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.columns()).containsExactly("timestamp", "product", "price", "node");
    }

    @Test
    void testModelsToDataTable_WrongVariant() {
        assertThatThrownBy(() -> codec.modelsToDataTable(loadForecasts, "historical_price"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testModelsToDataTable_UnknownType() {
        assertThatThrownBy(() -> codec.modelsToDataTable(loadForecasts, "weather"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown model type: weather");
    }

    // ========== Table to Models Tests ==========

    @Test
    void testRoundTrip_LoadForecast() {
        List<MarketDataRecord> models = codec.dataTableToModels(
                codec.modelsToDataTable(loadForecasts, "load_forecast"), "load_forecast");

        assertThat(models).containsExactlyElementsOf(loadForecasts);
    }

    @Test
    void testRoundTrip_HistoricalPriceAndGeneration() {
        List<HistoricalPrice> prices = List.of(HistoricalPrice.builder()
                .timestamp(cst(2023, 1, 1, 0)).product("DALMP").price(42.15).node("HB_NORTH").build());
        List<GenerationForecast> generation = List.of(GenerationForecast.builder()
                .timestamp(cst(2023, 1, 1, 0)).fuelType("wind").generationMw(12450.3).region("ERCOT").build());

        assertThat(codec.dataTableToModels(codec.modelsToDataTable(prices, "historical_price"), "historical_price"))
                .containsExactlyElementsOf(prices);
        assertThat(codec.dataTableToModels(codec.modelsToDataTable(generation, "generation_forecast"), "generation_forecast"))
                .containsExactlyElementsOf(generation);
    }

    @Test
    void testRoundTrip_NaNValueKept() {
        List<HistoricalPrice> prices = List.of(
                HistoricalPrice.builder().timestamp(cst(2023, 1, 1, 0)).product("DALMP").price(42.15).node("HB_NORTH").build(),
                HistoricalPrice.builder().timestamp(cst(2023, 1, 1, 1)).product("DALMP").price(Double.NaN).node("HB_NORTH").build());

        DataTable table = codec.modelsToDataTable(prices, "historical_price");
        List<MarketDataRecord> restored = codec.dataTableToModels(table, "historical_price");

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(restored).containsExactlyElementsOf(prices);
        assertThat(((HistoricalPrice) restored.get(1)).getPrice()).isNaN();
    }

    @Test
    void testDataTableToModels_StringCellsConverted() {
        DataTable table = DataTable.builder("timestamp", "load_mw", "region")
                .addRow("2023-01-01 05:00:00", "33500.8", "ERCOT")
                .build();

        List<MarketDataRecord> models = codec.dataTableToModels(table, "load_forecast");

        assertThat(models).hasSize(1);
        LoadForecast forecast = (LoadForecast) models.get(0);
        assertThat(forecast.getTimestamp()).isEqualTo(cst(2023, 1, 1, 5));
        assertThat(forecast.getLoadMw()).isEqualTo(33500.8);
    }

    @Test
    void testDataTableToModels_InvalidRowsSkipped() {
        DataTable table = DataTable.builder("timestamp", "load_mw", "region")
                .addRow(cst(2023, 1, 1, 0), 1.0, "ERCOT")
                .addRow(cst(2023, 1, 1, 1), null, "ERCOT")
                .addRow("garbage", 3.0, "ERCOT")
                .build();

        assertThat(codec.dataTableToModels(table, "load_forecast")).hasSize(1);
    }

    @Test
    void testDataTableToModels_EmptyAndMissingColumn() {
        assertThat(codec.dataTableToModels(DataTable.empty(), "load_forecast")).isEmpty();
        assertThat(codec.dataTableToModels(null, "load_forecast")).isEmpty();

        DataTable noRegion = DataTable.builder("timestamp", "load_mw").addRow(cst(2023, 1, 1, 0), 1.0).build();
        assertThatThrownBy(() -> codec.dataTableToModels(noRegion, "load_forecast"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("region");
    }
}
