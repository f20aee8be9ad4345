package gridcast.marketdata.ingest.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataTransformationExceptionTest {

    @Test
    void testMessageWithoutCause() {
        DataTransformationException exception = new DataTransformationException("load_forecast", "column_normalization");

        assertEquals("Data transformation failed for source load_forecast during column_normalization",
                exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    void testMessageIncludesCause() {
        IllegalArgumentException cause = new IllegalArgumentException("Missing required column(s): region");

        DataTransformationException exception =
                new DataTransformationException("load_forecast", "column_normalization", cause);

        assertEquals("load_forecast", exception.getFeedName());
        assertEquals("column_normalization", exception.getTransformationStep());
        assertSame(cause, exception.getCause());
        assertTrue(exception.getMessage().endsWith(": Missing required column(s): region"));
    }
}
