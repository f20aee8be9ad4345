package gridcast.marketdata.ingest.exception;

/**
 * Exception thrown when a transformation stage fails for a feed.
 *
 * Carries the feed (or source) name and the failing step so callers can
 * report which input broke and where, e.g. "load_forecast" during
 * "column_normalization".
 */
public class DataTransformationException extends RuntimeException {

    private final String feedName;
    private final String transformationStep;

    public DataTransformationException(String feedName, String transformationStep) {
        this(feedName, transformationStep, null);
    }

    public DataTransformationException(String feedName, String transformationStep, Throwable cause) {
        super(buildMessage(feedName, transformationStep, cause), cause);
        this.feedName = feedName;
        this.transformationStep = transformationStep;
    }

    public String getFeedName() {
        return feedName;
    }

    public String getTransformationStep() {
        return transformationStep;
    }

    private static String buildMessage(String feedName, String transformationStep, Throwable cause) {
        String message = "Data transformation failed for source " + feedName + " during " + transformationStep;
        if (cause != null && cause.getMessage() != null) {
            message += ": " + cause.getMessage();
        }
        return message;
    }
}
