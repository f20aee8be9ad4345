package gridcast.marketdata.ingest.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-column aggregation applied to the values falling into one resampling bin.
 *
 * Null values are ignored. A bin without any non-null value aggregates to null,
 * except COUNT which yields 0.
 */
public enum Aggregation {

    MEAN,
    SUM,
    MIN,
    MAX,
    FIRST,
    LAST,
    MEDIAN,
    COUNT;

    /**
     * Resolve an identifier such as "mean" or "first" (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown identifiers
     */
    public static Aggregation fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Aggregation identifier cannot be empty");
        }
        try {
            return valueOf(identifier.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation: '" + identifier + "'", e);
        }
    }

    public Object apply(List<Object> values) {
        List<Object> present = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                present.add(value);
            }
        }
        if (this == COUNT) {
            return (long) present.size();
        }
        if (present.isEmpty()) {
            return null;
        }
        switch (this) {
            case FIRST:
                return present.get(0);
            case LAST:
                return present.get(present.size() - 1);
            default:
                return numeric(toDoubles(present));
        }
    }

    private Double numeric(List<Double> numbers) {
        switch (this) {
            case SUM:
                return numbers.stream().mapToDouble(Double::doubleValue).sum();
            case MEAN:
                return numbers.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
            case MIN:
                return Collections.min(numbers);
            case MAX:
                return Collections.max(numbers);
            case MEDIAN:
                List<Double> sorted = new ArrayList<>(numbers);
                Collections.sort(sorted);
                int mid = sorted.size() / 2;
                return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
            default:
                throw new IllegalStateException("Not a numeric aggregation: " + this);
        }
    }

    private List<Double> toDoubles(List<Object> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException(
                        "Cannot apply " + name().toLowerCase(Locale.ROOT) + " to non-numeric value: "
                                + Objects.toString(value));
            }
            numbers.add(((Number) value).doubleValue());
        }
        return numbers;
    }
}
