package gridcast.marketdata.ingest.table;

import java.util.Locale;

/**
 * Relational join semantics used when merging tables on a key column.
 */
public enum JoinType {

    /** Keep keys present on both sides. */
    INNER,
    /** Keep the union of keys, filling the missing side with nulls. */
    OUTER,
    /** Keep every row of the left side. */
    LEFT,
    /** Keep every row of the right side. */
    RIGHT;

    public static JoinType fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Join type cannot be empty");
        }
        try {
            return valueOf(identifier.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown join type: '" + identifier
                    + "'. Expected one of inner, outer, left, right", e);
        }
    }
}
