package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.config.TransformationConfig;
import gridcast.marketdata.ingest.exception.DataTransformationException;
import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.JoinType;
import gridcast.marketdata.ingest.util.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Verifies how DataTransformationService surfaces failures from its collaborators.
 */
@ExtendWith(MockitoExtension.class)
class DataTransformationServiceErrorHandlingTest {

    @Mock
    private FieldNormalizationService normalizationService;

    @Mock
    private GenerationPivoter generationPivoter;

    @Mock
    private TimestampAligner timestampAligner;

    @Mock
    private TableMerger tableMerger;

    @Mock
    private ModelCodec modelCodec;

    @Mock
    private TransformationConfig config;

    @InjectMocks
    private DataTransformationService service;

    @Test
    void testUnexpectedFailure_WrappedWithFeedAndStep() {
        // Given
        DataTable raw = TestDataFactory.rawLoadForecast();
        when(normalizationService.normalizeLoadForecastData(raw)).thenThrow(new IllegalStateException("boom"));

        // When
        DataTransformationException exception = assertThrows(DataTransformationException.class,
                () -> service.transformLoadForecast(raw));

        // Then
        assertEquals("load_forecast", exception.getFeedName());
        assertEquals(DataTransformationService.STEP_TRANSFORMATION, exception.getTransformationStep());
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals("Data transformation failed for source load_forecast during transformation: boom",
                exception.getMessage());
    }

    @Test
    void testTypedFailure_RethrownUnchanged() {
        // Given
        DataTransformationException original =
                new DataTransformationException("generation_forecast", "numeric_conversion");
        when(normalizationService.normalizeGenerationForecastData(any())).thenThrow(original);

        // When
        DataTransformationException exception = assertThrows(DataTransformationException.class,
                () -> service.transformGenerationForecast(TestDataFactory.rawGenerationForecast()));

        // Then
        assertSame(original, exception);
        verifyNoInteractions(generationPivoter);
    }

    @Test
    void testCombinedDataset_AlignmentFailureTaggedAsCombined() {
        // Given
        TransformationConfig.Combined combined = new TransformationConfig.Combined();
        when(config.getCombined()).thenReturn(combined);
        when(normalizationService.normalizeLoadForecastData(any())).thenReturn(TestDataFactory.rawLoadForecast());
        when(normalizationService.normalizeHistoricalPricesData(any())).thenReturn(DataTable.empty());
        when(normalizationService.normalizeGenerationForecastData(any())).thenReturn(DataTable.empty());
        when(timestampAligner.align(any(), eq("timestamp"), any(), any()))
                .thenThrow(new IllegalArgumentException("bad grid"));

        // When
        DataTransformationException exception = assertThrows(DataTransformationException.class,
                () -> service.prepareCombinedDataset(DataTable.empty(), DataTable.empty(), null));

        // Then
        assertEquals(DataTransformationService.COMBINED_DATASET, exception.getFeedName());
        assertEquals(DataTransformationService.STEP_PREPARATION, exception.getTransformationStep());
        verify(tableMerger, never()).mergeTables(any(), any(), anyString(), any(JoinType.class));
    }

    @Test
    void testModelConversion_DelegatesToCodec() {
        // Given
        DataTable table = DataTable.withColumns("timestamp", "load_mw", "region");
        when(modelCodec.dataTableToModels(table, "load_forecast")).thenReturn(List.of());

        // When / Then
        assertTrue(service.convertToModels(table, "load_forecast").isEmpty());
        verify(modelCodec).dataTableToModels(table, "load_forecast");
        verifyNoMoreInteractions(modelCodec);
    }
}
