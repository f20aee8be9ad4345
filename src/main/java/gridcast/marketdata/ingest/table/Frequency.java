package gridcast.marketdata.ingest.table;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regular sampling frequency for resampling and alignment.
 *
 * Accepts frequency aliases with an optional multiplier:
 * "S" (seconds), "T" or "min" (minutes), "H" (hours), "D" (days).
 * Examples: "H", "15min", "2H", "D".
 *
 * Sub-day bins are anchored at local midnight of the timestamp's zone and
 * stepped along the instant timeline. Day bins follow calendar days.
 */
public final class Frequency {

    private static final Pattern ALIAS = Pattern.compile("^\\s*(\\d*)\\s*(min|[sStThHdD])\\s*$");

    public static final Frequency HOURLY = new Frequency(1, ChronoUnit.HOURS);
    public static final Frequency DAILY = new Frequency(1, ChronoUnit.DAYS);

    private final long amount;
    private final ChronoUnit unit;

    private Frequency(long amount, ChronoUnit unit) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Frequency multiplier must be positive: " + amount);
        }
        this.amount = amount;
        this.unit = unit;
    }

    public static Frequency of(long amount, ChronoUnit unit) {
        if (unit != ChronoUnit.SECONDS && unit != ChronoUnit.MINUTES
                && unit != ChronoUnit.HOURS && unit != ChronoUnit.DAYS) {
            throw new IllegalArgumentException("Unsupported frequency unit: " + unit);
        }
        return new Frequency(amount, unit);
    }

    /**
     * Parse a frequency alias such as "H", "15min" or "D".
     *
     * @throws IllegalArgumentException if the alias is not recognised
     */
    public static Frequency parse(String alias) {
        if (alias == null) {
            throw new IllegalArgumentException("Frequency cannot be null");
        }
        Matcher matcher = ALIAS.matcher(alias);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unsupported frequency: '" + alias + "'");
        }
        long amount = matcher.group(1).isEmpty() ? 1 : Long.parseLong(matcher.group(1));
        String code = matcher.group(2).toLowerCase(Locale.ROOT);
        switch (code) {
            case "s":
                return of(amount, ChronoUnit.SECONDS);
            case "t":
            case "min":
                return of(amount, ChronoUnit.MINUTES);
            case "h":
                return of(amount, ChronoUnit.HOURS);
            case "d":
                return of(amount, ChronoUnit.DAYS);
            default:
                throw new IllegalArgumentException("Unsupported frequency: '" + alias + "'");
        }
    }

    /**
     * Start of the bin containing the given timestamp.
     */
    public ZonedDateTime floor(ZonedDateTime timestamp) {
        ZonedDateTime startOfDay = timestamp.truncatedTo(ChronoUnit.DAYS);
        if (unit == ChronoUnit.DAYS) {
            if (amount == 1) {
                return startOfDay;
            }
            long epochDay = startOfDay.toLocalDate().toEpochDay();
            return startOfDay.minusDays(Math.floorMod(epochDay, amount));
        }
        long stepSeconds = step().getSeconds();
        long elapsed = Duration.between(startOfDay, timestamp).getSeconds();
        return startOfDay.plusSeconds(elapsed - Math.floorMod(elapsed, stepSeconds));
    }

    /**
     * Next grid point after the given one.
     */
    public ZonedDateTime next(ZonedDateTime timestamp) {
        if (unit == ChronoUnit.DAYS) {
            return timestamp.plusDays(amount);
        }
        return timestamp.plus(step());
    }

    /**
     * Grid points from start stepping forward while not after end.
     */
    public List<ZonedDateTime> range(ZonedDateTime start, ZonedDateTime end) {
        List<ZonedDateTime> points = new ArrayList<>();
        for (ZonedDateTime point = start; !point.isAfter(end); point = next(point)) {
            points.add(point);
        }
        return points;
    }

    private Duration step() {
        return Duration.of(amount, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frequency)) {
            return false;
        }
        Frequency other = (Frequency) o;
        return amount == other.amount && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }

    @Override
    public String toString() {
        return amount + " " + unit.name().toLowerCase(Locale.ROOT);
    }
}
