package gridcast.marketdata.ingest.table;

/**
 * How grid points without source data are filled after alignment.
 */
public enum GapFill {

    /** Leave gaps as null values. */
    NONE,

    /**
     * Interpolate numeric columns linearly in time and carry the last value forward
     * past the final observation. Other columns are forward-filled.
     */
    INTERPOLATE
}
